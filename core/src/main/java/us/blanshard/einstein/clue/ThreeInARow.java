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

import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * Three items occupy three consecutive positions, in no particular order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ThreeInARow extends Clue {
  private final ImmutableSortedSet<Item> items;

  public ThreeInARow(Item a, Item b, Item c) {
    super(Type.THREE_IN_A_ROW);
    this.items = ImmutableSortedSet.of(a, b, c);
    checkArgument(items.size() == 3, "Need three distinct items: %s, %s, %s", a, b, c);
  }

  @Override public boolean isTrueOf(Solution solution) {
    int[] pos = new int[3];
    int i = 0;
    for (Item item : items)
      pos[i++] = solution.position(item);
    return solution.board.geometry.isRun(pos[0], pos[1], pos[2], solution.board.size);
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return items;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return this.items.equals(((ThreeInARow) o).items);
  }

  @Override public int hashCode() {
    return items.hashCode() * 17 + type.ordinal();
  }

  @Override public String toString() {
    return "run" + items;
  }
}
