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
package us.blanshard.einstein.gen;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.Assignment;
import us.blanshard.einstein.solver.IntVar;
import us.blanshard.einstein.solver.Model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * A constraint model for a board: one variable per item, ranging over the
 * positions, and an all-different constraint per category.  Clues add further
 * constraints to the model.
 *
 * @author Luke Blanshard
 */
public final class PuzzleModel {
  public final Board board;
  public final Model model;
  public final ImmutableMap<Item, IntVar> vars;

  private PuzzleModel(Board board, Model model, ImmutableMap<Item, IntVar> vars) {
    this.board = board;
    this.model = model;
    this.vars = vars;
  }

  public static PuzzleModel create(Board board) {
    Model model = new Model();
    ImmutableMap.Builder<Item, IntVar> builder = ImmutableMap.builder();
    for (Category category : board.categories()) {
      List<IntVar> vars = Lists.newArrayList();
      for (Item item : category) {
        IntVar var = model.newIntVar(1, board.size, category.name + "_" + item.name);
        builder.put(item, var);
        vars.add(var);
      }
      model.addAllDifferent(vars);
    }
    return new PuzzleModel(board, model, builder.build());
  }

  public IntVar var(Item item) {
    return checkNotNull(vars.get(item), "Not on this board: %s", item);
  }

  /** Converts a solution of the model to a solution of the board. */
  public Solution toSolution(Assignment assignment) {
    Solution.Builder builder = Solution.builder(board);
    for (Item item : board.items())
      builder.put(item, assignment.get(vars.get(item)));
    return builder.build();
  }
}
