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
package us.blanshard.einstein.clue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * An item is at a given position.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Positional extends Fact {
  public final int position;
  public final Item item;

  public Positional(int position, Item item) {
    super(Type.POSITIONAL);
    checkArgument(position >= 1, "Bad position %s", position);
    this.position = position;
    this.item = checkNotNull(item);
  }

  @Override public boolean isTrueOf(Solution solution) {
    return solution.position(item) == position;
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.of(item);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Positional that = (Positional) o;
    return this.position == that.position && this.item.equals(that.item);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, position, item);
  }

  @Override public String toString() {
    return item + "@" + position;
  }
}
