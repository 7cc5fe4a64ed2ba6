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

import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.gen.CoreGenerator;
import us.blanshard.einstein.gen.GeneratorOptions;
import us.blanshard.einstein.gen.Puzzle;
import us.blanshard.einstein.text.ClueFormatter;
import us.blanshard.einstein.text.PuzzleFiles;
import us.blanshard.einstein.text.PuzzlePrinter;
import us.blanshard.einstein.theme.Theme;
import us.blanshard.einstein.theme.Themes;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * Generates puzzles and writes their puzzle and solution files.  Arguments are
 * {@code key=value} pairs: any generator option, plus {@code out} (the
 * directory to write below, default "."), {@code themes} (a json file of
 * themes, default the built-in ones) and {@code sizes} (a comma-separated list
 * of sizes to generate, default the {@code size} option).
 *
 * @author Luke Blanshard
 */
public class GeneratePuzzles {
  public static void main(String[] args) throws IOException {
    ToolArgs parsed;
    GeneratorOptions base;
    try {
      parsed = ToolArgs.parse(args, "out", "themes", "sizes");
      base = parsed.options().build();
    } catch (ConfigurationException e) {
      System.err.println(e.getMessage());
      exitWithUsage();
      return;  // Convince the compiler.
    }
    ToolArgs.configureLogging();

    Theme theme = Themes.load(parsed.getFile("themes"), base.themeName);
    PuzzleFiles files = new PuzzleFiles(new File(parsed.get("out", ".")));
    String sizes = parsed.get("sizes", Integer.toString(base.size));
    generate(theme, base, sizes, files, new PrintWriter(System.out));
  }

  /**
   * Generates one puzzle per size in the comma-separated list, printing each
   * and writing its files.  Returns the puzzles in order.
   */
  static List<Puzzle> generate(Theme theme, GeneratorOptions base, String sizes,
      PuzzleFiles files, PrintWriter out) throws IOException {
    ClueFormatter formatter = new ClueFormatter(theme);
    List<Puzzle> puzzles = Lists.newArrayList();
    for (String size : Splitter.on(',').trimResults().omitEmptyStrings().split(sizes)) {
      GeneratorOptions options = base.toBuilder().set("size", size).build();
      Puzzle puzzle = new CoreGenerator(theme, options).generate();
      new PuzzlePrinter(formatter).print(puzzle, out);
      files.write(puzzle, formatter);
      out.printf("%nWrote %s and %s%n", files.puzzleFile(puzzle.size()),
          files.solutionFile(puzzle.size()));
      out.flush();
      puzzles.add(puzzle);
    }
    return puzzles;
  }

  private static void exitWithUsage() {
    System.err.println("Usage: GeneratePuzzles [key=value]...");
    System.err.println("  keys: " + GeneratorOptions.KEYS + ", out, themes, sizes");
    System.exit(1);
  }
}
