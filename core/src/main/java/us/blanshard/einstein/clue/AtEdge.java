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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * An item is at one end of the numbering: position 1 or position N.
 */
@Immutable
public final class AtEdge extends Clue {
  public final Item item;

  public AtEdge(Item item) {
    super(Type.AT_EDGE);
    this.item = checkNotNull(item);
  }

  @Override public boolean isTrueOf(Solution solution) {
    return solution.board.isEdge(solution.position(item));
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.of(item);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return this.item.equals(((AtEdge) o).item);
  }

  @Override public int hashCode() {
    return item.hashCode() * 17 + type.ordinal();
  }

  @Override public String toString() {
    return item + "@edge";
  }
}
