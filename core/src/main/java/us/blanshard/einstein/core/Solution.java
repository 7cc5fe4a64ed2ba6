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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An assignment of every item of a board to a position, one item of each
 * category per position.  Immutable; the nested Builder is the mutable
 * version, and refuses to build anything that is not a bijection per category.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Solution {

  public final Board board;

  // positions[categoryIndex][itemIndex] is the 1-based position of the item.
  private final int[][] positions;

  // itemIndexes[categoryIndex][position - 1] is the index of the item there.
  private final int[][] itemIndexes;

  private Solution(Board board, int[][] positions) {
    this.board = board;
    this.positions = positions;
    this.itemIndexes = new int[positions.length][board.size];
    for (int c = 0; c < positions.length; ++c)
      for (int i = 0; i < board.size; ++i)
        itemIndexes[c][positions[c][i] - 1] = i;
  }

  /**
   * Generates a solution by shuffling each category's items onto the positions
   * using the given source of randomness.
   */
  public static Solution random(Board board, Random random) {
    Builder builder = builder(board);
    for (Category category : board.categories()) {
      List<Item> items = Lists.newArrayList(category.items());
      Collections.shuffle(items, random);
      for (int i = 0; i < items.size(); ++i)
        builder.put(items.get(i), i + 1);
    }
    return builder.build();
  }

  public static Builder builder(Board board) {
    return new Builder(board);
  }

  /** Returns the position of the given item. */
  public int position(Item item) {
    return positions[item.categoryIndex][item.index];
  }

  /** Returns the item of the given category at the given position. */
  public Item itemAt(Category category, int position) {
    return category.get(itemIndexes[category.index][position - 1]);
  }

  /** Returns the item of the given category that shares the given item's position. */
  public Item partner(Item item, Category category) {
    return itemAt(category, position(item));
  }

  @NotThreadSafe
  public static final class Builder {
    private final Board board;
    private final int[][] positions;

    private Builder(Board board) {
      this.board = board;
      this.positions = new int[board.categories().size()][board.size];
    }

    public Builder put(Item item, int position) {
      checkArgument(position >= 1 && position <= board.size, "Bad position %s", position);
      checkArgument(board.categoryOf(item).items().contains(item), "Not on this board: %s", item);
      positions[item.categoryIndex][item.index] = position;
      return this;
    }

    public Solution build() {
      for (int c = 0; c < positions.length; ++c) {
        boolean[] seen = new boolean[board.size + 1];
        for (int i = 0; i < board.size; ++i) {
          int pos = positions[c][i];
          checkState(pos > 0, "Unplaced item %s", board.category(c).get(i));
          checkState(!seen[pos], "Two items of %s at %s", board.category(c).name, pos);
          seen[pos] = true;
        }
      }
      int[][] copy = new int[positions.length][];
      for (int c = 0; c < positions.length; ++c)
        copy[c] = positions[c].clone();
      return new Solution(board, copy);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Solution)) return false;
    Solution that = (Solution) o;
    return this.board.equals(that.board) && Arrays.deepEquals(this.positions, that.positions);
  }

  @Override public int hashCode() {
    return Arrays.deepHashCode(positions);
  }

  /**
   * Renders the solution as a table with one row per position and one column
   * per category.
   */
  @Override public String toString() {
    int[] widths = new int[board.categories().size()];
    for (Category category : board.categories()) {
      int width = category.name.length();
      for (Item item : category)
        width = Math.max(width, item.name.length());
      widths[category.index] = width;
    }
    int posWidth = Integer.toString(board.size).length();
    StringBuilder sb = new StringBuilder();
    sb.append(Strings.repeat(" ", posWidth));
    for (Category category : board.categories())
      sb.append("  ").append(Strings.padEnd(category.name, widths[category.index], ' '));
    sb.append('\n');
    for (int pos = 1; pos <= board.size; ++pos) {
      sb.append(Strings.padStart(Integer.toString(pos), posWidth, ' '));
      for (Category category : board.categories()) {
        String name = itemAt(category, pos).name;
        sb.append("  ").append(Strings.padEnd(name, widths[category.index], ' '));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
