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

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.theme.Theme;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A finished puzzle: the clues to show, their single solution, the question
 * to ask, and how it was made.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {
  public final Theme theme;
  public final ImmutableList<Clue> clues;
  public final Solution solution;
  public final Question question;

  /** Pool clues the puzzle does not use. */
  public final ImmutableList<Clue> remaining;

  public final Difficulty difficulty;

  /** Whether the question's path length reached the requested minimum. */
  public final boolean auditPassed;

  /** The solver steps it took to show the clues have one solution. */
  public final int numSteps;

  public Puzzle(Theme theme, List<Clue> clues, Solution solution, Question question,
      List<Clue> remaining, Difficulty difficulty, boolean auditPassed, int numSteps) {
    this.theme = checkNotNull(theme);
    this.clues = ImmutableList.copyOf(clues);
    this.solution = checkNotNull(solution);
    this.question = checkNotNull(question);
    this.remaining = ImmutableList.copyOf(remaining);
    this.difficulty = checkNotNull(difficulty);
    this.auditPassed = auditPassed;
    this.numSteps = numSteps;
  }

  public int size() {
    return solution.board.size;
  }

  public Geometry geometry() {
    return solution.board.geometry;
  }

  /** Counts the puzzle's clues by strength, 1 through 3. */
  public ImmutableMultiset<Integer> strengths() {
    ImmutableMultiset.Builder<Integer> builder = ImmutableMultiset.builder();
    for (Clue clue : clues)
      builder.add(clue.type.strength);
    return builder.build();
  }

  @Override public String toString() {
    return theme.name + " " + size() + "x" + size() + " " + difficulty + ": "
        + clues.size() + " clues, " + question;
  }
}
