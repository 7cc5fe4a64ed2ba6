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

import us.blanshard.einstein.gen.Puzzle;

import com.google.common.base.CharMatcher;
import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * Reads and writes the files that carry a puzzle to a solver and its answer to
 * a checker.  The puzzle file holds one clue sentence per line, a separator of
 * at least ten '=' characters, then the question.  The solution file holds the
 * answer, then the solution table.  Both are named by the puzzle's size:
 * {@code puzzles/4x4.txt} and {@code solutions/4x4_solution.txt}.
 *
 * @author Luke Blanshard
 */
public final class PuzzleFiles {
  public static final String PUZZLES_DIR = "puzzles";
  public static final String SOLUTIONS_DIR = "solutions";

  private static final int MIN_SEPARATOR = 10;

  /**
   * The text of a puzzle file: the clue sentences and the question.
   */
  @Immutable
  public static final class PuzzleText {
    public final ImmutableList<String> clues;
    public final String question;

    public PuzzleText(List<String> clues, String question) {
      this.clues = ImmutableList.copyOf(clues);
      this.question = question;
    }
  }

  private final File root;

  /** Makes an instance that puts its files below the given directory. */
  public PuzzleFiles(File root) {
    this.root = root;
  }

  public File puzzleFile(int size) {
    return new File(new File(root, PUZZLES_DIR), size + "x" + size + ".txt");
  }

  public File solutionFile(int size) {
    return new File(new File(root, SOLUTIONS_DIR), size + "x" + size + "_solution.txt");
  }

  /**
   * Writes the puzzle and solution files for the given puzzle, replacing any
   * of the same size.
   */
  public void write(Puzzle puzzle, ClueFormatter formatter) throws IOException {
    File file = puzzleFile(puzzle.size());
    PrintWriter out = open(file);
    try {
      for (String sentence : new PuzzlePrinter(formatter).clueSentences(puzzle.clues))
        out.println(sentence);
      out.println(PuzzlePrinter.SEPARATOR);
      out.println(formatter.formatQuestion(puzzle.question));
    } finally {
      close(out, file);
    }

    file = solutionFile(puzzle.size());
    out = open(file);
    try {
      out.println(puzzle.question.answer.name);
      out.println();
      out.print(puzzle.solution);
    } finally {
      close(out, file);
    }
  }

  /** Reads back the puzzle file of the given size. */
  public PuzzleText readPuzzle(int size) throws IOException {
    return read(puzzleFile(size));
  }

  /** Reads back the expected answer from the solution file of the given size. */
  public String readAnswer(int size) throws IOException {
    BufferedReader in = reader(solutionFile(size));
    try {
      String line = in.readLine();
      if (line == null)
        throw new IOException("Empty solution file " + solutionFile(size));
      return line.trim();
    } finally {
      in.close();
    }
  }

  /**
   * Parses a puzzle file.  Blank lines are ignored; every line after the
   * separator belongs to the question.
   */
  public static PuzzleText read(File file) throws IOException {
    BufferedReader in = reader(file);
    try {
      List<String> clues = Lists.newArrayList();
      List<String> question = Lists.newArrayList();
      boolean separated = false;
      for (String line; (line = in.readLine()) != null; ) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) continue;
        if (!separated && isSeparator(trimmed))
          separated = true;
        else
          (separated ? question : clues).add(trimmed);
      }
      if (!separated)
        throw new IOException("No separator line in " + file);
      return new PuzzleText(clues, Joiner.on(' ').join(question));
    } finally {
      in.close();
    }
  }

  static boolean isSeparator(String line) {
    return line.length() >= MIN_SEPARATOR && CharMatcher.is('=').matchesAllOf(line);
  }

  private static PrintWriter open(File file) throws IOException {
    File dir = file.getParentFile();
    if (dir != null && !dir.isDirectory() && !dir.mkdirs())
      throw new IOException("Can't make directory " + dir);
    return new PrintWriter(new OutputStreamWriter(new FileOutputStream(file), Charsets.UTF_8));
  }

  /**
   * Closes the writer, throwing if anything written to it was lost; {@link
   * PrintWriter} only records its failures.
   */
  static void close(PrintWriter out, File file) throws IOException {
    boolean failed = out.checkError();
    out.close();
    if (failed)
      throw new IOException("Failed writing " + file);
  }

  private static BufferedReader reader(File file) throws IOException {
    return new BufferedReader(new InputStreamReader(new FileInputStream(file), Charsets.UTF_8));
  }
}
