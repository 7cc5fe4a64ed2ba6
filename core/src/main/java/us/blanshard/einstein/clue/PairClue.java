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

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;

import java.util.EnumSet;

import javax.annotation.concurrent.Immutable;

/**
 * A symmetric relation between the positions of two items of different
 * categories: they are apart, adjacent, farther apart than some distance, or
 * their positions sum to some total.  Adjacency and distance follow the
 * board's geometry.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class PairClue extends Clue {
  private static final EnumSet<Type> TYPES = EnumSet.of(
      Type.NEGATIVE_DIRECT_LINK, Type.RELATIVE_POS, Type.DISTANCE_GREATER_THAN, Type.SUM_EQUALS);

  public final Item first;
  public final Item second;

  /** The distance threshold or the sum; zero for the other types. */
  public final int amount;

  private PairClue(Type type, Item a, Item b, int amount) {
    super(type);
    checkArgument(TYPES.contains(type), "Not a pair type: %s", type);
    checkArgument(a.categoryIndex != b.categoryIndex, "Same category: %s, %s", a, b);
    this.first = Ordering.natural().min(a, b);
    this.second = Ordering.natural().max(a, b);
    this.amount = amount;
  }

  /** The two items are never at the same position. */
  public static PairClue apart(Item a, Item b) {
    return new PairClue(Type.NEGATIVE_DIRECT_LINK, a, b, 0);
  }

  /** The two items are at neighboring positions. */
  public static PairClue adjacent(Item a, Item b) {
    return new PairClue(Type.RELATIVE_POS, a, b, 0);
  }

  /** The two items are more than the given number of steps apart. */
  public static PairClue fartherThan(Item a, Item b, int threshold) {
    checkArgument(threshold >= 1, "Bad threshold %s", threshold);
    return new PairClue(Type.DISTANCE_GREATER_THAN, a, b, threshold);
  }

  /** The positions of the two items add up to the given total. */
  public static PairClue sumEquals(Item a, Item b, int total) {
    return new PairClue(Type.SUM_EQUALS, a, b, total);
  }

  @Override public boolean isTrueOf(Solution solution) {
    Board board = solution.board;
    int pos1 = solution.position(first);
    int pos2 = solution.position(second);
    switch (type) {
      case NEGATIVE_DIRECT_LINK:
        return pos1 != pos2;
      case RELATIVE_POS:
        return board.isAdjacent(pos1, pos2);
      case DISTANCE_GREATER_THAN:
        return board.distance(pos1, pos2) > amount;
      case SUM_EQUALS:
        return pos1 + pos2 == amount;
      default:
        throw new UnsupportedClueException(this);
    }
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.of(first, second);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    PairClue that = (PairClue) o;
    return this.type == that.type
        && this.amount == that.amount
        && this.first.equals(that.first)
        && this.second.equals(that.second);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, first, second, amount);
  }

  @Override public String toString() {
    return type + "(" + first + ", " + second + (amount == 0 ? ")" : ", " + amount + ")");
  }
}
