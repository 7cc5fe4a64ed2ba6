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
import us.blanshard.einstein.clue.ClueCatalog;
import us.blanshard.einstein.clue.CluePool;
import us.blanshard.einstein.clue.PairClue;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;
import us.blanshard.einstein.solver.IntVar;
import us.blanshard.einstein.solver.Model;
import us.blanshard.einstein.text.ClueFormatter;
import us.blanshard.einstein.theme.Theme;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The classic logic-grid puzzle: items of several categories spread over a row
 * or ring of positions, one of each category per position.
 *
 * @author Luke Blanshard
 */
public class EinsteinPuzzle implements PuzzleDefinition {
  private static final Logger logger = Logger.getLogger(EinsteinPuzzle.class.getName());

  /** Kinds the core gets one clue of, when the pool has any. */
  public static final ImmutableList<Clue.Type> EXOTIC_TYPES = ImmutableList.of(
      Clue.Type.IF_NOT_THEN_NOT, Clue.Type.THREE_IN_A_ROW, Clue.Type.ORDERED_CHAIN,
      Clue.Type.AT_EDGE, Clue.Type.SUM_EQUALS, Clue.Type.EITHER_OR,
      Clue.Type.IF_AND_ONLY_IF, Clue.Type.NEITHER_NOR_POS);

  /** Kinds the core's padding is drawn from. */
  public static final ImmutableList<Clue.Type> COMPLEX_TYPES = ImmutableList.of(
      Clue.Type.IF_THEN, Clue.Type.RELATIVE_POS, Clue.Type.NEGATIVE_DIRECT_LINK,
      Clue.Type.IS_EVEN, Clue.Type.DISTANCE_GREATER_THAN);

  private final Board board;
  private final Difficulty difficulty;
  private final int catalogCap;
  private final Random random;
  private final ClueConstraints constraints;
  private final ClueFormatter formatter;

  public EinsteinPuzzle(Board board, Theme theme, Difficulty difficulty, int catalogCap, Random random) {
    this.board = board;
    this.difficulty = difficulty;
    this.catalogCap = catalogCap;
    this.random = random;
    this.constraints = new ClueConstraints(board);
    this.formatter = new ClueFormatter(theme);
  }

  public EinsteinPuzzle(Board board, Theme theme, Random random) {
    this(board, theme, Difficulty.MEDIUM, ClueCatalog.DEFAULT_CAP, random);
  }

  @Override public Solution generateSolution() {
    return Solution.random(board, random);
  }

  @Override public CluePool generateCluePool(Solution solution) {
    return ClueCatalog.build(solution, random, catalogCap);
  }

  /**
   * Returns the clues every core starts with: the item of the first category
   * at position 1 and, on a ring, which item of the second category sits next
   * to it.
   */
  public List<Clue> getAnchors(Solution solution) {
    List<Clue> anchors = Lists.newArrayList();
    Item first = solution.itemAt(board.category(0), 1);
    anchors.add(new Positional(1, first));
    if (board.geometry == Geometry.CIRCULAR)
      anchors.add(PairClue.adjacent(first, solution.itemAt(board.category(1), 2)));
    return anchors;
  }

  @Override public CoreDesign designCorePuzzle(Solution solution) {
    CluePool pool = generateCluePool(solution);
    List<Clue> anchors = getAnchors(solution);
    Set<Clue> core = Sets.newLinkedHashSet(anchors);

    for (Clue.Type type : EXOTIC_TYPES) {
      List<Clue> clues = pool.get(type);
      if (!clues.isEmpty())
        core.add(clues.get(random.nextInt(clues.size())));
    }

    List<Clue> complex = Lists.newArrayList();
    for (Clue.Type type : COMPLEX_TYPES)
      complex.addAll(pool.get(type));
    Collections.shuffle(complex, random);
    int quota = (3 * board.size + 1) / 2;
    for (int i = 0, added = 0; i < complex.size() && added < quota; ++i)
      if (core.add(complex.get(i)))
        ++added;

    List<Clue> remaining = Lists.newArrayList();
    for (Clue clue : pool.all())
      if (!core.contains(clue))
        remaining.add(clue);
    Collections.shuffle(remaining, random);

    List<Clue> coreList = Lists.newArrayList(core);
    difficulty.reshape(coreList, Sets.newHashSet(anchors), remaining, board.size);
    logger.info("Core of " + coreList.size() + " clues for " + difficulty + ", pool of " + pool.size());
    return new CoreDesign(anchors, coreList, remaining);
  }

  @Override public PuzzleModel createModelAndVariables() {
    return PuzzleModel.create(board);
  }

  @Override public void addClueConstraint(Model model, Map<Item, IntVar> vars, Clue clue) {
    constraints.add(model, vars, clue);
  }

  @Override public AuditResult qualityAuditAndSelectQuestion(
      List<Clue> clues, Solution solution, int minPathLen) {
    return new DifficultyAuditor(random).audit(clues, solution, minPathLen);
  }

  @Override public String formatClue(Clue clue) {
    return formatter.formatClue(clue);
  }

  @Override public Positional findDifferenceAndCreateClue(Solution a, Solution b, Solution trueSolution) {
    List<Item> items = Lists.newArrayList(board.items());
    Collections.shuffle(items, random);
    for (Item item : items) {
      if (a.position(item) != b.position(item))
        return new Positional(trueSolution.position(item), item);
    }
    throw new IllegalArgumentException("The solutions are the same:\n" + a);
  }
}
