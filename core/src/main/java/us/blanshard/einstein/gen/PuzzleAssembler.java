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
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.Assignment;
import us.blanshard.einstein.solver.Solver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.concurrent.Immutable;

/**
 * Grows a starter core of clues until it has exactly one solution.  Each round
 * solves the clues for at most two solutions; while two turn up, a positional
 * clue that tells them apart is added.  The clue set only grows.
 *
 * @author Luke Blanshard
 */
public final class PuzzleAssembler {
  private static final Logger logger = Logger.getLogger(PuzzleAssembler.class.getName());

  public static final int DEFAULT_MAX_ITERATIONS = 50;

  /**
   * A clue set with a single solution, and what it took to get there.
   */
  @Immutable
  public static final class Assembly {
    public final ImmutableList<Clue> clues;

    /** The number of rounds of solving. */
    public final int iterations;

    /** The solver steps taken by the last, unique, solve. */
    public final int numSteps;

    /** The solver steps taken over all rounds. */
    public final int totalSteps;

    Assembly(List<Clue> clues, int iterations, int numSteps, int totalSteps) {
      this.clues = ImmutableList.copyOf(clues);
      this.iterations = iterations;
      this.numSteps = numSteps;
      this.totalSteps = totalSteps;
    }
  }

  private final PuzzleDefinition definition;
  private final Random random;
  private final int maxIterations;
  private final long timeoutMillis;

  public PuzzleAssembler(PuzzleDefinition definition, Random random) {
    this(definition, random, DEFAULT_MAX_ITERATIONS, Solver.DEFAULT_TIMEOUT_MILLIS);
  }

  public PuzzleAssembler(PuzzleDefinition definition, Random random, int maxIterations, long timeoutMillis) {
    this.definition = definition;
    this.random = random;
    this.maxIterations = maxIterations;
    this.timeoutMillis = timeoutMillis;
  }

  /**
   * Solves the given clues, stopping after {@code limit} solutions or when the
   * time limit passes.
   */
  public Solver.Result solve(Iterable<? extends Clue> clues, int limit) {
    return Solver.solve(buildModel(clues).model, limit, random, timeoutMillis);
  }

  private PuzzleModel buildModel(Iterable<? extends Clue> clues) {
    PuzzleModel model = definition.createModelAndVariables();
    for (Clue clue : clues)
      definition.addClueConstraint(model.model, model.vars, clue);
    return model;
  }

  /**
   * Adds clues to the given core until its only solution is the given one.
   * Throws {@link AmbiguousPuzzleException} if that doesn't happen within the
   * iteration bound, if the solver times out, or if the clues rule out the
   * solution.
   */
  public Assembly assemble(List<? extends Clue> core, Solution solution) {
    Set<Clue> clues = Sets.newLinkedHashSet(core);
    int totalSteps = 0;
    for (int iteration = 1; iteration <= maxIterations; ++iteration) {
      PuzzleModel model = buildModel(clues);
      Solver.Result result = Solver.solve(model.model, 2, random, timeoutMillis);
      totalSteps += result.numSteps;
      logger.fine("Round " + iteration + " with " + clues.size() + " clues: " + result);

      if (result.timedOut)
        throw new AmbiguousPuzzleException("Solver timed out after " + timeoutMillis + "ms with "
            + clues.size() + " clues");
      if (result.numSolutions == 0) {
        logger.severe("Clues rule out the solution: " + clues);
        throw new AmbiguousPuzzleException("No solution for " + clues.size() + " clues");
      }

      Solution first = model.toSolution(result.solutions.get(0));
      if (result.numSolutions == 1) {
        if (!first.equals(solution))
          throw new AmbiguousPuzzleException("Clues pin down a different solution:\n" + first);
        logger.info("Unique after " + iteration + " rounds with " + clues.size() + " clues");
        return new Assembly(ImmutableList.copyOf(clues), iteration, result.numSteps, totalSteps);
      }

      Assignment other = result.solutions.get(1);
      Clue added = definition.findDifferenceAndCreateClue(first, model.toSolution(other), solution);
      clues.add(added);
      logger.fine("Added " + added);
    }
    throw new AmbiguousPuzzleException(
        "Still ambiguous after " + maxIterations + " rounds with " + clues.size() + " clues");
  }

  /** Tells whether the given clues determine exactly the given solution. */
  public boolean isUniquelySolvedBy(Iterable<? extends Clue> clues, Solution solution) {
    PuzzleModel model = buildModel(clues);
    Solver.Result result = Solver.solve(model.model, 2, random, timeoutMillis);
    if (!result.isUnique()) return false;
    for (Item item : solution.board.items())
      if (result.getSolution().get(model.var(item)) != solution.position(item))
        return false;
    return true;
  }
}
