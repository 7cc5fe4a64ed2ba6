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

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.CluePool;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.IntVar;
import us.blanshard.einstein.solver.Model;

import java.util.List;
import java.util.Map;

/**
 * The operations a kind of logic puzzle supplies to the generator.  The
 * generator drives them in order: make a solution, design a starter core of
 * clues from it, solve and disambiguate until one solution remains, then
 * audit the clues and phrase them.
 *
 * @author Luke Blanshard
 */
public interface PuzzleDefinition {

  /** Makes a random solution. */
  Solution generateSolution();

  /** Builds the pool of clues that are true of the given solution. */
  CluePool generateCluePool(Solution solution);

  /**
   * Builds a clue pool for the solution and picks a starter core from it,
   * returning the core and the clues left over.
   */
  CoreDesign designCorePuzzle(Solution solution);

  /** Makes a model with one variable per item and no clues. */
  PuzzleModel createModelAndVariables();

  /**
   * Adds the constraints expressing the given clue to the model.  Throws
   * {@link us.blanshard.einstein.clue.UnsupportedClueException} for clues it
   * can't translate.
   */
  void addClueConstraint(Model model, Map<Item, IntVar> vars, Clue clue);

  /**
   * Looks for the question whose answer takes the longest chain of clues to
   * reach.  Never throws for a shallow puzzle: the result says whether the
   * depth reached {@code minPathLen}.
   */
  AuditResult qualityAuditAndSelectQuestion(List<Clue> clues, Solution solution, int minPathLen);

  /** Phrases the given clue as a sentence. */
  String formatClue(Clue clue);

  /**
   * Given two different solutions of the current clues, returns a clue that
   * is true of {@code trueSolution} and rules out at least one of them.
   */
  Positional findDifferenceAndCreateClue(Solution a, Solution b, Solution trueSolution);
}
