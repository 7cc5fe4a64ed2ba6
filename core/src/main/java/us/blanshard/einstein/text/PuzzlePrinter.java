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
package us.blanshard.einstein.text;

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.gen.Puzzle;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * Lays out a whole puzzle for reading: the scenario, the numbered clues in
 * sorted order, the question, and below a separator the answer line a checker
 * looks for and the solution table.
 *
 * @author Luke Blanshard
 */
public final class PuzzlePrinter {
  public static final String SEPARATOR = Strings.repeat("=", 40);

  private final ClueFormatter formatter;

  public PuzzlePrinter(ClueFormatter formatter) {
    this.formatter = formatter;
  }

  /** Returns the clue sentences, sorted. */
  public ImmutableList<String> clueSentences(List<Clue> clues) {
    List<String> sentences = Lists.newArrayList();
    for (Clue clue : clues)
      sentences.add(formatter.formatClue(clue));
    return ImmutableList.copyOf(Ordering.natural().sortedCopy(sentences));
  }

  public void print(Puzzle puzzle, PrintWriter out) {
    out.println();
    out.printf("Scenario: %s%n", puzzle.theme.scenario);
    out.println();
    out.printf("Clues (%d):%n", puzzle.clues.size());
    out.println();
    int number = 0;
    for (String sentence : clueSentences(puzzle.clues))
      out.printf("%d. %s%n", ++number, sentence);
    out.println();
    out.println(SEPARATOR);
    out.println();
    out.printf("Question: %s%n", formatter.formatQuestion(puzzle.question));
    out.println();
    out.println(SEPARATOR);
    out.println();
    out.println(formatter.formatAnswer(puzzle.question));
    out.println();
    out.print(puzzle.solution);
    out.flush();
  }

  public String render(Puzzle puzzle) {
    StringWriter writer = new StringWriter();
    print(puzzle, new PrintWriter(writer));
    return writer.toString();
  }
}
