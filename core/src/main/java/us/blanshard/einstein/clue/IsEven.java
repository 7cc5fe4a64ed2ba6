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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * An item's position is even, or odd.
 */
@Immutable
public final class IsEven extends Clue {
  public final Item item;
  public final boolean even;

  public IsEven(Item item, boolean even) {
    super(Type.IS_EVEN);
    this.item = checkNotNull(item);
    this.even = even;
  }

  @Override public boolean isTrueOf(Solution solution) {
    return (solution.position(item) % 2 == 0) == even;
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.of(item);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    IsEven that = (IsEven) o;
    return this.even == that.even && this.item.equals(that.item);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, item, even);
  }

  @Override public String toString() {
    return item + (even ? "@even" : "@odd");
  }
}
