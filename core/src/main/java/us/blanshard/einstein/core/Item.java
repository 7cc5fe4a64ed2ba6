/*
Copyright 2016 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.einstein.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * One value of a {@link Category}.  Items are ordered by category and then by
 * their place within the category, which gives clues a stable canonical order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Item implements Comparable<Item> {

  /** The name of the category this item belongs to. */
  public final String category;

  /** The item's own name. */
  public final String name;

  /** The index of the category within its board. */
  public final int categoryIndex;

  /** The index of this item within its category. */
  public final int index;

  Item(String category, String name, int categoryIndex, int index) {
    this.category = checkNotNull(category);
    this.name = checkNotNull(name);
    this.categoryIndex = categoryIndex;
    this.index = index;
  }

  @Override public int compareTo(Item that) {
    if (this.categoryIndex != that.categoryIndex)
      return this.categoryIndex - that.categoryIndex;
    return this.index - that.index;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Item)) return false;
    Item that = (Item) o;
    return this.categoryIndex == that.categoryIndex
        && this.index == that.index
        && this.name.equals(that.name)
        && this.category.equals(that.category);
  }

  @Override public int hashCode() {
    return Objects.hashCode(categoryIndex, index, name);
  }

  @Override public String toString() {
    return category + ":" + name;
  }
}
