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
import com.google.common.collect.Ordering;

import javax.annotation.concurrent.Immutable;

/**
 * Two items of different categories are at the same position.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class DirectLink extends Fact {
  public final Item first;
  public final Item second;

  public DirectLink(Item a, Item b) {
    super(Type.DIRECT_LINK);
    checkArgument(a.categoryIndex != b.categoryIndex, "Same category: %s, %s", a, b);
    this.first = Ordering.natural().min(a, b);
    this.second = Ordering.natural().max(a, b);
  }

  @Override public boolean isTrueOf(Solution solution) {
    return solution.position(first) == solution.position(second);
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.of(first, second);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    DirectLink that = (DirectLink) o;
    return this.first.equals(that.first) && this.second.equals(that.second);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, first, second);
  }

  @Override public String toString() {
    return first + " = " + second;
  }
}
