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
package us.blanshard.einstein.tools;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.gen.AmbiguousPuzzleException;
import us.blanshard.einstein.gen.CoreGenerator;
import us.blanshard.einstein.gen.GeneratorOptions;
import us.blanshard.einstein.gen.Puzzle;
import us.blanshard.einstein.theme.Theme;
import us.blanshard.einstein.theme.Themes;

import com.google.common.base.Stopwatch;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.io.IOException;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import javax.annotation.Nullable;

/**
 * Generates many puzzles in parallel and spits out statistics about them: how
 * long they took, how many clues and solver steps they needed, how deep their
 * questions are, and the strength mix of their clues.  Arguments are {@code
 * key=value} pairs: any generator option, plus {@code count}, {@code threads}
 * and {@code themes}.  The {@code seed} option seeds the whole run.
 *
 * @author Luke Blanshard
 */
public class GenStats {

  /** What one generation produced. */
  static class Outcome {
    final long seed;
    @Nullable final Puzzle puzzle;
    final long millis;

    Outcome(long seed, @Nullable Puzzle puzzle, long millis) {
      this.seed = seed;
      this.puzzle = puzzle;
      this.millis = millis;
    }
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    ToolArgs parsed;
    GeneratorOptions options;
    int count;
    int threads;
    try {
      parsed = ToolArgs.parse(args, "count", "threads", "themes");
      options = parsed.options().build();
      count = parsed.getInt("count", 20);
      threads = parsed.getInt("threads", Runtime.getRuntime().availableProcessors());
    } catch (ConfigurationException e) {
      System.err.println(e.getMessage());
      exitWithUsage();
      return;  // Convince the compiler.
    }
    ToolArgs.configureLogging();

    Theme theme = Themes.load(parsed.getFile("themes"), options.themeName);
    long seed = options.seed == null ? System.currentTimeMillis() : options.seed;
    System.out.printf("Generating %d puzzles from seed %#x: %s%n", count, seed, options);

    List<Outcome> outcomes = generate(theme, options, count, seed, threads);

    System.out.println("Seed\tMillis\tClues\tSteps\tPath\tPassed");
    DescriptiveStatistics millis = new DescriptiveStatistics();
    DescriptiveStatistics clues = new DescriptiveStatistics();
    DescriptiveStatistics steps = new DescriptiveStatistics();
    DescriptiveStatistics paths = new DescriptiveStatistics();
    Multiset<Integer> strengths = HashMultiset.create();
    int failures = 0;
    int shallow = 0;
    for (Outcome outcome : outcomes) {
      millis.addValue(outcome.millis);
      Puzzle puzzle = outcome.puzzle;
      if (puzzle == null) {
        ++failures;
        System.out.printf("%#x\t%d\tfailed%n", outcome.seed, outcome.millis);
        continue;
      }
      if (!puzzle.auditPassed) ++shallow;
      clues.addValue(puzzle.clues.size());
      steps.addValue(puzzle.numSteps);
      paths.addValue(puzzle.question.pathLength);
      strengths.addAll(puzzle.strengths());
      System.out.printf("%#x\t%d\t%d\t%d\t%d\t%s%n", outcome.seed, outcome.millis,
          puzzle.clues.size(), puzzle.numSteps, puzzle.question.pathLength, puzzle.auditPassed);
    }

    System.out.println();
    printStats("Millis", millis);
    printStats("Clues", clues);
    printStats("Solver steps", steps);
    printStats("Path length", paths);
    int total = strengths.size();
    for (int strength = 1; strength <= 3; ++strength)
      System.out.printf("Strength %d clues: %d (%.1f%%)%n", strength, strengths.count(strength),
          total == 0 ? 0.0 : 100.0 * strengths.count(strength) / total);
    System.out.printf("Failed: %d, shallow: %d, of %d%n", failures, shallow, outcomes.size());
  }

  private static void exitWithUsage() {
    System.err.println("Usage: GenStats [key=value]...");
    System.err.println("  keys: " + GeneratorOptions.KEYS + ", count, threads, themes");
    System.exit(1);
  }

  /**
   * Runs the generations on a pool of threads, each with its own seed, and
   * returns their outcomes in seed order.
   */
  static List<Outcome> generate(final Theme theme, GeneratorOptions options, int count,
      long seed, int threads) throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
    try {
      Random random = new Random(seed);
      List<Future<Outcome>> futures = Lists.newArrayList();
      for (int i = 0; i < count; ++i) {
        final long genSeed = random.nextLong();
        final GeneratorOptions genOptions = options.toBuilder().setSeed(genSeed).build();
        futures.add(executor.submit(new Callable<Outcome>() {
          @Override public Outcome call() {
            Stopwatch stopwatch = Stopwatch.createStarted();
            Puzzle puzzle;
            try {
              puzzle = new CoreGenerator(theme, genOptions).generate();
            } catch (AmbiguousPuzzleException e) {
              puzzle = null;
            }
            return new Outcome(genSeed, puzzle, stopwatch.elapsed(MILLISECONDS));
          }
        }));
      }
      List<Outcome> outcomes = Lists.newArrayList();
      for (Future<Outcome> future : futures) {
        try {
          outcomes.add(future.get());
        } catch (ExecutionException e) {
          throw new IllegalStateException("Generation failed", e.getCause());
        }
      }
      return outcomes;
    } finally {
      executor.shutdown();
    }
  }

  private static void printStats(String name, DescriptiveStatistics stats) {
    if (stats.getN() == 0) return;
    System.out.printf("%-14s mean %8.1f  sd %8.1f  min %6.0f  median %6.0f  max %6.0f%n",
        name, stats.getMean(), stats.getStandardDeviation(), stats.getMin(),
        stats.getPercentile(50), stats.getMax());
  }
}
