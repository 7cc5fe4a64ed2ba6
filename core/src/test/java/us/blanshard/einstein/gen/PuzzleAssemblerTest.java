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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.DirectLink;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Boards;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.Solver;
import us.blanshard.einstein.theme.Theme;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.Random;

public class PuzzleAssemblerTest {
  private final Board board = Boards.of(4, 2, Geometry.LINEAR);
  private final Solution solution = Boards.solution(board, new int[] {1, 2, 3, 4}, new int[] {2, 4, 1, 3});
  private final EinsteinPuzzle definition = new EinsteinPuzzle(board, Theme.plain(), new Random(3));

  private Positional at(int position, String name) {
    return new Positional(position, Boards.item(board, name));
  }

  private DirectLink link(String a, String b) {
    return new DirectLink(Boards.item(board, a), Boards.item(board, b));
  }

  /** Everything but the order of Name3 and Name4. */
  private List<Clue> almostUnique() {
    return Lists.<Clue>newArrayList(
        at(1, "Name1"), at(2, "Name2"),
        link("Name1", "Color3"), link("Name2", "Color1"),
        link("Name3", "Color4"), link("Name4", "Color2"));
  }

  @Test public void solveCounts() {
    assertEquals(2, definition.createModelAndVariables().model.getConstraints().size());
    PuzzleAssembler assembler = new PuzzleAssembler(definition, new Random(1));
    assertEquals(576, assembler.solve(Collections.<Clue>emptyList(), 1000).numSolutions);
    assertEquals(144, assembler.solve(definition.getAnchors(solution), 1000).numSolutions);
    assertEquals(2, assembler.solve(almostUnique(), 1000).numSolutions);
  }

  @Test public void assembleAddsDistinguishingClue() {
    PuzzleAssembler assembler = new PuzzleAssembler(definition, new Random(1));
    List<Clue> core = almostUnique();
    PuzzleAssembler.Assembly assembly = assembler.assemble(core, solution);

    assertEquals(2, assembly.iterations);
    assertEquals(core.size() + 1, assembly.clues.size());
    assertEquals(core, assembly.clues.subList(0, core.size()));
    Clue added = assembly.clues.get(core.size());
    assertEquals(Clue.Type.POSITIONAL, added.type);
    assertTrue(added.isTrueOf(solution));
    assertTrue(assembly.totalSteps >= assembly.numSteps);
    assertTrue(assembler.isUniquelySolvedBy(assembly.clues, solution));
    assertFalse(assembler.isUniquelySolvedBy(core, solution));
  }

  @Test public void uniqueCoreTakesOneRound() {
    PuzzleAssembler assembler = new PuzzleAssembler(definition, new Random(1));
    List<Clue> core = almostUnique();
    core.add(at(3, "Name3"));
    PuzzleAssembler.Assembly assembly = assembler.assemble(core, solution);
    assertEquals(1, assembly.iterations);
    assertEquals(core, assembly.clues);
  }

  @Test public void iterationBound() {
    PuzzleAssembler assembler = new PuzzleAssembler(
        definition, new Random(1), 1, Solver.DEFAULT_TIMEOUT_MILLIS);
    try {
      assembler.assemble(almostUnique(), solution);
      fail();
    } catch (AmbiguousPuzzleException expected) {}
  }

  @Test public void contradictoryClues() {
    PuzzleAssembler assembler = new PuzzleAssembler(definition, new Random(1));
    List<Clue> core = almostUnique();
    core.add(at(2, "Name1"));
    try {
      assembler.assemble(core, solution);
      fail();
    } catch (AmbiguousPuzzleException expected) {}
    assertFalse(assembler.isUniquelySolvedBy(core, solution));
  }

  @Test public void cluesForAnotherSolution() {
    PuzzleAssembler assembler = new PuzzleAssembler(definition, new Random(1));
    List<Clue> core = almostUnique();
    core.add(at(4, "Name3"));
    try {
      assembler.assemble(core, solution);
      fail();
    } catch (AmbiguousPuzzleException expected) {}
  }

  @Test public void fullPipeline() {
    for (Geometry geometry : Geometry.values()) {
      for (Difficulty difficulty : Difficulty.values()) {
        Random random = new Random(17);
        EinsteinPuzzle puzzle = new EinsteinPuzzle(
            Boards.of(5, 4, geometry), Theme.plain(), difficulty, 2000, random);
        PuzzleAssembler assembler = new PuzzleAssembler(puzzle, random);
        Solution truth = puzzle.generateSolution();
        CoreDesign design = puzzle.designCorePuzzle(truth);
        assertTrue(design.core.containsAll(design.anchors));

        PuzzleAssembler.Assembly assembly = assembler.assemble(design.core, truth);
        String context = geometry + " " + difficulty;
        assertEquals(context, design.core, assembly.clues.subList(0, design.core.size()));
        for (Clue clue : assembly.clues)
          assertTrue(context + " " + clue, clue.isTrueOf(truth));
        assertTrue(context, assembler.isUniquelySolvedBy(assembly.clues, truth));
        assertEquals(context, ImmutableSet.copyOf(assembly.clues).size(), assembly.clues.size());
      }
    }
  }
}
