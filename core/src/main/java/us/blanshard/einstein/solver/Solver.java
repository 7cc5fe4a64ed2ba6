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
package us.blanshard.einstein.solver;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A depth-first, randomized, worklist-based solver for {@link Model}s.  This
 * is an Iterable: its iterator returns the solutions of the model, if any,
 * until it runs out or its time limit passes.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Solver implements Iterable<Assignment> {

  public static final long DEFAULT_TIMEOUT_MILLIS = 10000;

  /**
   * Searches for up to {@code maxSolutions} solutions to the given model,
   * returns a summary of the result.
   */
  public static Result solve(Model model, int maxSolutions, Random random) {
    return solve(model, maxSolutions, random, DEFAULT_TIMEOUT_MILLIS);
  }

  /**
   * Searches for up to {@code maxSolutions} solutions to the given model,
   * giving up after the given number of milliseconds.
   */
  public static Result solve(Model model, int maxSolutions, Random random, long timeoutMillis) {
    return new Solver(model, random, timeoutMillis).result(maxSolutions);
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public final class Result {
    public final int numSolutions;  // At most maxSolutions
    public final ImmutableList<Assignment> solutions;
    public final int numSteps;
    public final boolean timedOut;  // True if the search stopped early

    Result(int maxSolutions) {
      Iter iter = iterator();
      List<Assignment> found = Lists.newArrayList();
      while (found.size() < maxSolutions && iter.hasNext())
        found.add(iter.next());
      this.numSolutions = found.size();
      this.solutions = ImmutableList.copyOf(found);
      this.numSteps = iter.getStepCount();
      this.timedOut = iter.isTimedOut();
    }

    /** Tells whether exactly one solution was found and the search finished. */
    public boolean isUnique() {
      return numSolutions == 1 && !timedOut;
    }

    @Nullable public Assignment getSolution() {
      return solutions.isEmpty() ? null : solutions.get(0);
    }

    @Override public String toString() {
      return "Result{solutions=" + numSolutions + ", steps=" + numSteps
          + (timedOut ? ", timed out}" : "}");
    }
  }

  private final Random random;
  private final long timeoutMillis;
  @Nullable private final Domains startDomains;
  private final IntVar[] vars;

  public Solver(Model model, Random random, long timeoutMillis) {
    this.random = random;
    this.timeoutMillis = timeoutMillis;
    Domains domains = this.startDomains = Domains.initial(model);
    List<IntVar> open = Lists.newArrayList();
    if (domains != null) {
      for (IntVar var : model.getVars())
        if (domains.size(var) > 1)
          open.add(var);
    }
    this.vars = open.toArray(new IntVar[open.size()]);
  }

  @Override public Iter iterator() {
    return new Iter(new Worklist());
  }

  public Result result(int maxSolutions) {
    return new Result(maxSolutions);
  }

  public final class Iter implements Iterator<Assignment> {
    private boolean nextComputed;
    private Assignment next;
    private int stepCount;
    private boolean timedOut;
    private final Worklist worklist;
    private final Stopwatch stopwatch = Stopwatch.createStarted();

    private Iter(Worklist worklist) {
      this.next = worklist.getFound();
      this.nextComputed = next != null;
      this.worklist = worklist;
    }

    /**
     * Returns the number of steps taken to do the work done so far.
     */
    public int getStepCount() {
      return stepCount;
    }

    /**
     * Tells whether the iterator gave up because it ran out of time.
     */
    public boolean isTimedOut() {
      return timedOut;
    }

    @Override public boolean hasNext() {
      if (!nextComputed) {
        next = computeNext();
        nextComputed = true;
      }
      return next != null;
    }

    @Override public Assignment next() {
      if (!hasNext()) throw new NoSuchElementException();
      nextComputed = false;
      return next;
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }

    @Nullable private Assignment computeNext() {
      while (!worklist.isComplete()) {
        if (stopwatch.elapsed(TimeUnit.MILLISECONDS) > timeoutMillis) {
          timedOut = true;
          return null;
        }
        stepCount += worklist.run(1000);
        if (worklist.getFound() != null)
          return worklist.getFound();
      }
      return null;
    }
  }

  /**
   * A depth-first searcher for solutions that can be run for a set number of
   * steps, instead of indefinitely.
   */
  final class Worklist {
    @Nullable private Assignment found;
    private final ArrayDeque<WorkItem> worklist = new ArrayDeque<WorkItem>();
    private final IntVar[] order;

    Worklist() {
      this.order = vars.clone();
      if (startDomains != null) {
        Collections.shuffle(Arrays.asList(order), random);
        if (!pushNextItems(startDomains))
          found = startDomains.toAssignment();
      }
    }

    @Nullable Assignment getFound() {
      return found;
    }

    boolean isComplete() {
      return worklist.isEmpty();
    }

    /**
     * Runs through the remaining work, but taking not more than the given
     * number of steps.  Returns the number of steps taken in this pass.
     */
    int run(int maxSteps) {
      found = null;
      int count = 0;
      while (!worklist.isEmpty() && count++ < maxSteps) {
        WorkItem item = worklist.removeFirst();
        Domains.Builder builder = item.domains.toBuilder();
        if (builder.assign(item.var, item.value)) {
          Domains domains = builder.build();
          if (!pushNextItems(domains)) {
            found = domains.toAssignment();
            break;
          }
        }
      }
      return count;
    }

    /** Returns true if there is more work to do. */
    private boolean pushNextItems(Domains domains) {
      WorkItem[] items = chooseNextItems(domains);
      if (items == null) return false;  // Every variable is fixed.

      // Push all possibilities onto the stack in random order.
      for (int last = items.length; last-- > 0; ) {
        int index = random.nextInt(last + 1);
        worklist.addFirst(items[index]);
        if (index != last) items[index] = items[last];
      }
      return true;
    }

    /**
     * Chooses one of the variables with the fewest remaining values, at
     * random, and returns one work item per value, or null if every variable
     * is fixed.
     */
    @Nullable private WorkItem[] chooseNextItems(Domains domains) {
      int size = Integer.MAX_VALUE;
      int count = 0;
      IntVar current = null;
      for (IntVar var : order) {
        int possible = domains.size(var);
        if (possible < 2 || possible > size) continue;
        if (possible < size) {
          count = 0;
          size = possible;
        }
        if (size == 2)
          return makeItems(domains, var);
        if (random.nextInt(++count) == 0)
          current = var;
      }
      if (count == 0) return null;
      return makeItems(domains, current);
    }
  }

  private static WorkItem[] makeItems(Domains domains, IntVar var) {
    List<Integer> values = domains.values(var);
    WorkItem[] answer = new WorkItem[values.size()];
    int i = 0;
    for (int value : values)
      answer[i++] = new WorkItem(domains, var, value);
    return answer;
  }

  private static class WorkItem {
    final Domains domains;
    final IntVar var;
    final int value;

    WorkItem(Domains domains, IntVar var, int value) {
      this.domains = domains;
      this.var = var;
      this.value = value;
    }
  }
}
