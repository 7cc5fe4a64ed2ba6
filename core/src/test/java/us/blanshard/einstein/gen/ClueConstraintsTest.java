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

import static org.junit.Assert.assertEquals;

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.ClueCatalog;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Boards;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.Domains;
import us.blanshard.einstein.theme.Theme;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Checks that every clue's constraints accept exactly the solutions the clue
 * is true of: pinning every item to a solution's positions must leave the
 * model consistent precisely when the clue holds in that solution.
 */
@RunWith(Parameterized.class)
public class ClueConstraintsTest {
  private final Board board;

  @Parameters public static Collection<Object[]> getParams() {
    return Arrays.asList(new Object[][]{
        { 4, 3, Geometry.LINEAR },
        { 5, 3, Geometry.CIRCULAR },
        { 6, 2, Geometry.LINEAR },
      });
  }

  public ClueConstraintsTest(int size, int numCategories, Geometry geometry) {
    this.board = Boards.of(size, numCategories, geometry);
  }

  @Test public void constraintsMatchTruth() {
    Random random = new Random(11);
    EinsteinPuzzle definition = new EinsteinPuzzle(board, Theme.plain(), random);
    Solution truth = definition.generateSolution();
    List<Solution> others = Arrays.asList(
        truth, definition.generateSolution(), definition.generateSolution(),
        definition.generateSolution());
    for (Clue clue : ClueCatalog.build(truth, random).all()) {
      for (Solution other : others) {
        PuzzleModel model = definition.createModelAndVariables();
        for (Item item : board.items())
          definition.addClueConstraint(model.model, model.vars,
              new Positional(other.position(item), item));
        definition.addClueConstraint(model.model, model.vars, clue);
        boolean consistent = Domains.initial(model.model) != null;
        assertEquals(clue.toString(), clue.isTrueOf(other), consistent);
      }
    }
  }

  @Test public void modelHasOneVariablePerItem() {
    PuzzleModel model = PuzzleModel.create(board);
    assertEquals(board.items().size(), model.model.getVars().size());
    assertEquals(board.categories().size(), model.model.getConstraints().size());
    Item item = board.items().get(1);
    assertEquals(board.size, model.var(item).hi);
    assertEquals(1, model.var(item).lo);
  }
}
