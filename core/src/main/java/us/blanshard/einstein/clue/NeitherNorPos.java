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

import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;

import javax.annotation.concurrent.Immutable;

/**
 * None of a small set of items is at the given position.
 */
@Immutable
public final class NeitherNorPos extends Clue {
  private final ImmutableSortedSet<Item> items;
  public final int position;

  public NeitherNorPos(Collection<Item> items, int position) {
    super(Type.NEITHER_NOR_POS);
    this.items = ImmutableSortedSet.copyOf(items);
    this.position = position;
    checkArgument(this.items.size() >= 2, "Need at least two items: %s", items);
    checkArgument(position >= 1, "Bad position %s", position);
  }

  @Override public boolean isTrueOf(Solution solution) {
    for (Item item : items)
      if (solution.position(item) == position)
        return false;
    return true;
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return items;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    NeitherNorPos that = (NeitherNorPos) o;
    return this.position == that.position && this.items.equals(that.items);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, items, position);
  }

  @Override public String toString() {
    return items + "!@" + position;
  }
}
