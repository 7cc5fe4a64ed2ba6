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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.DirectLink;
import us.blanshard.einstein.clue.PairClue;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Boards;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.gen.Difficulty;
import us.blanshard.einstein.gen.Puzzle;
import us.blanshard.einstein.gen.Question;
import us.blanshard.einstein.theme.Theme;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;

public class PuzzleFilesTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final Board board = Boards.of(3, 2, Geometry.LINEAR);
  private final Solution solution = Boards.solution(board, new int[] {1, 2, 3}, new int[] {3, 1, 2});
  private final ClueFormatter formatter = new ClueFormatter(Theme.plain());
  private Puzzle puzzle;

  private Item item(String name) {
    return Boards.item(board, name);
  }

  @Before public void setUp() {
    ImmutableList<Clue> clues = ImmutableList.of(
        new Positional(1, item("Name1")),
        new Positional(2, item("Name2")),
        new DirectLink(item("Name1"), item("Color2")),
        PairClue.adjacent(item("Name2"), item("Color1")));
    Question question = new Question(item("Name3"), board.category(1), item("Color1"), 2);
    puzzle = new Puzzle(Theme.plain(), clues, solution, question,
        ImmutableList.<Clue>of(), Difficulty.MEDIUM, false, 7);
  }

  @Test public void fileNames() {
    PuzzleFiles files = new PuzzleFiles(new File("out"));
    assertEquals(new File("out/puzzles/4x4.txt"), files.puzzleFile(4));
    assertEquals(new File("out/solutions/10x10_solution.txt"), files.solutionFile(10));
  }

  @Test public void writeAndReadBack() throws IOException {
    PuzzleFiles files = new PuzzleFiles(folder.getRoot());
    files.write(puzzle, formatter);
    assertTrue(files.puzzleFile(3).isFile());

    PuzzleFiles.PuzzleText text = files.readPuzzle(3);
    assertEquals(new PuzzlePrinter(formatter).clueSentences(puzzle.clues), text.clues);
    assertEquals("What is the color of the name 'Name3'?", text.question);
    assertEquals("Color1", files.readAnswer(3));

    String solutionText = Files.asCharSource(files.solutionFile(3), Charsets.UTF_8).read();
    assertTrue(solutionText.endsWith(solution.toString()));
  }

  @Test public void writeReplacesSameSize() throws IOException {
    PuzzleFiles files = new PuzzleFiles(folder.getRoot());
    files.write(puzzle, formatter);
    Puzzle other = new Puzzle(Theme.plain(), puzzle.clues.subList(0, 2), solution,
        new Question(item("Color1"), board.category(0), item("Name3"), 1),
        ImmutableList.<Clue>of(), Difficulty.EASY, true, 1);
    files.write(other, formatter);
    assertEquals(2, files.readPuzzle(3).clues.size());
    assertEquals("Name3", files.readAnswer(3));
  }

  @Test public void writeFailuresAreReported() throws IOException {
    File blocker = new File(folder.getRoot(), PuzzleFiles.PUZZLES_DIR);
    Files.asCharSink(blocker, Charsets.UTF_8).write("not a directory");
    try {
      new PuzzleFiles(folder.getRoot()).write(puzzle, formatter);
      fail();
    } catch (IOException expected) {}

    PrintWriter out = new PrintWriter(new Writer() {
      @Override public void write(char[] buf, int off, int len) throws IOException {
        throw new IOException("disk full");
      }
      @Override public void flush() {}
      @Override public void close() {}
    });
    out.println("lost");
    try {
      PuzzleFiles.close(out, new File("lost.txt"));
      fail();
    } catch (IOException expected) {
      assertTrue(expected.getMessage().contains("lost.txt"));
    }
  }

  @Test public void readToleratesBlankLinesAndLongQuestions() throws IOException {
    File file = folder.newFile("handmade.txt");
    Files.asCharSink(file, Charsets.UTF_8).write(
        "First clue.\n\n  Second clue.  \n===============\nWhat is\nthe answer?\n\n");
    PuzzleFiles.PuzzleText text = PuzzleFiles.read(file);
    assertEquals(ImmutableList.of("First clue.", "Second clue."), text.clues);
    assertEquals("What is the answer?", text.question);
  }

  @Test public void readNeedsSeparator() throws IOException {
    File file = folder.newFile("broken.txt");
    Files.asCharSink(file, Charsets.UTF_8).write("A clue.\n=====\nA question?\n");
    try {
      PuzzleFiles.read(file);
      fail();
    } catch (IOException expected) {}
  }

  @Test public void separators() {
    assertTrue(PuzzleFiles.isSeparator("=========="));
    assertTrue(PuzzleFiles.isSeparator(PuzzlePrinter.SEPARATOR));
    assertFalse(PuzzleFiles.isSeparator("========="));
    assertFalse(PuzzleFiles.isSeparator("=====-====="));
  }

  @Test public void printerLayout() {
    String text = new PuzzlePrinter(formatter).render(puzzle);
    assertTrue(text.contains("Clues (4):"));
    assertTrue(text.contains("1. The name 'Name1' is in position #1."));
    assertTrue(text.contains("Question: What is the color of the name 'Name3'?"));
    assertTrue(text.contains(ClueFormatter.ANSWER_PREFIX + "Color1"));
    assertTrue(text.indexOf("Question:") < text.indexOf(ClueFormatter.ANSWER_PREFIX));
    assertTrue(text.endsWith(solution.toString()));
  }
}
