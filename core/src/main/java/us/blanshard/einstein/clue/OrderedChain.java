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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * Three items appear in increasing order of position, not necessarily next to
 * each other.  Only meaningful for linear boards.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class OrderedChain extends Clue {
  private final ImmutableList<Item> items;

  public OrderedChain(Item first, Item second, Item third) {
    super(Type.ORDERED_CHAIN);
    this.items = ImmutableList.of(first, second, third);
    checkArgument(ImmutableSortedSet.copyOf(items).size() == 3,
        "Need three distinct items: %s", items);
  }

  /** The items, earliest position first. */
  public ImmutableList<Item> chain() {
    return items;
  }

  @Override public boolean isTrueOf(Solution solution) {
    int p1 = solution.position(items.get(0));
    int p2 = solution.position(items.get(1));
    int p3 = solution.position(items.get(2));
    return p1 < p2 && p2 < p3;
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.copyOf(items);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return this.items.equals(((OrderedChain) o).items);
  }

  @Override public int hashCode() {
    return items.hashCode() * 17 + type.ordinal();
  }

  @Override public String toString() {
    return items.get(0) + " < " + items.get(1) + " < " + items.get(2);
  }
}
