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

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A named axis of a puzzle, such as "profession", with its items in order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Category implements Iterable<Item> {

  public final String name;

  /** The index of this category within its board. */
  public final int index;

  private final ImmutableList<Item> items;

  Category(String name, int index, List<String> itemNames) {
    this.name = name;
    this.index = index;
    ImmutableList.Builder<Item> builder = ImmutableList.builder();
    int i = 0;
    for (String itemName : itemNames)
      builder.add(new Item(name, itemName, index, i++));
    this.items = builder.build();
  }

  public ImmutableList<Item> items() {
    return items;
  }

  public Item get(int index) {
    return items.get(index);
  }

  public int size() {
    return items.size();
  }

  /** Returns the item with the given name, or null. */
  @Nullable public Item find(String itemName) {
    for (Item item : items)
      if (item.name.equals(itemName))
        return item;
    return null;
  }

  @Override public Iterator<Item> iterator() {
    return items.iterator();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Category)) return false;
    Category that = (Category) o;
    return this.index == that.index
        && this.name.equals(that.name)
        && this.items.equals(that.items);
  }

  @Override public int hashCode() {
    return name.hashCode() * 31 + items.hashCode();
  }

  @Override public String toString() {
    return name + items;
  }
}
