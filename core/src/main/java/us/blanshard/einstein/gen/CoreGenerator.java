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
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.theme.Theme;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Runs whole generations: picks a board from the theme, then for each attempt
 * makes a fresh solution, designs a core, makes it unique and audits it.  A
 * generation that ends ambiguous or too shallow is retried, up to the
 * configured number of attempts.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class CoreGenerator {
  private static final Logger logger = Logger.getLogger(CoreGenerator.class.getName());

  public static final int DEFAULT_MAX_RETRIES = 5;

  private final Theme theme;
  private final GeneratorOptions options;
  private final Random random;

  public CoreGenerator(Theme theme, GeneratorOptions options) {
    this(theme, options, options.seed == null ? new Random() : new Random(options.seed));
  }

  public CoreGenerator(Theme theme, GeneratorOptions options, Random random) {
    this.theme = theme;
    this.options = options;
    this.random = random;
  }

  /**
   * Generates a puzzle.  If no attempt passes the audit, returns the deepest
   * unique puzzle found, marked as not passing.  Throws {@link
   * AmbiguousPuzzleException} if no attempt produced a unique puzzle with a
   * question at all.
   */
  public Puzzle generate() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Board board = theme.select(random, options.size, options.numCategories, options.geometry);
    EinsteinPuzzle definition = new EinsteinPuzzle(
        board, theme, options.difficulty, options.catalogCap, random);
    PuzzleAssembler assembler = new PuzzleAssembler(
        definition, random, options.maxIterations, options.timeoutMillis);

    Puzzle deepest = null;
    AmbiguousPuzzleException lastFailure = null;
    for (int attempt = 1; attempt <= options.maxRetries; ++attempt) {
      Solution solution = definition.generateSolution();
      CoreDesign design = definition.designCorePuzzle(solution);

      PuzzleAssembler.Assembly assembly;
      try {
        assembly = assembler.assemble(design.core, solution);
      } catch (AmbiguousPuzzleException e) {
        logger.log(Level.WARNING, "Attempt " + attempt + " was ambiguous", e);
        lastFailure = e;
        continue;
      }

      AuditResult audit = definition.qualityAuditAndSelectQuestion(
          assembly.clues, solution, options.minPathLen);
      Puzzle puzzle = makePuzzle(assembly, solution, design, audit);
      if (audit.passed()) {
        logger.info("Generated " + puzzle + " in " + attempt + " attempts, " + stopwatch);
        return puzzle;
      }
      logger.warning("Attempt " + attempt + " too shallow: " + audit);
      if (puzzle != null && (deepest == null || audit.pathLength() > deepest.question.pathLength))
        deepest = puzzle;
    }

    if (deepest != null) {
      logger.warning("Settling for " + deepest + " after " + options.maxRetries + " attempts");
      return deepest;
    }
    throw new AmbiguousPuzzleException(
        "No puzzle after " + options.maxRetries + " attempts", lastFailure);
  }

  @Nullable private Puzzle makePuzzle(
      PuzzleAssembler.Assembly assembly, Solution solution, CoreDesign design, AuditResult audit) {
    if (audit.question == null) return null;
    Set<Clue> used = Sets.newHashSet(assembly.clues);
    List<Clue> remaining = Lists.newArrayList();
    for (Clue clue : design.remaining)
      if (!used.contains(clue))
        remaining.add(clue);
    return new Puzzle(theme, assembly.clues, solution, audit.question, remaining,
        options.difficulty, audit.passed(), assembly.numSteps);
  }
}
