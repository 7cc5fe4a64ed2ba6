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
package us.blanshard.einstein.clue;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Builds the pool of every clue we might show for a given solution.  All clues
 * produced are true of the solution.  Pairwise and structural clues are
 * enumerated from the solution directly; connectives and exclusions are
 * sampled, using the given source of randomness, {@code size * categories}
 * times per kind.
 *
 * <p> The pool stops growing once it reaches its cap, so very large boards
 * cannot run away with memory.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class ClueCatalog {
  private static final Logger logger = Logger.getLogger(ClueCatalog.class.getName());

  /** The default limit on the number of clues in a pool. */
  public static final int DEFAULT_CAP = 20000;

  private final Solution solution;
  private final Board board;
  private final Random random;
  private final int cap;
  private final int samples;
  private final Set<Clue> clues = Sets.newLinkedHashSet();
  private boolean capped;

  private ClueCatalog(Solution solution, Random random, int cap) {
    checkArgument(cap > 0, "Bad cap %s", cap);
    this.solution = solution;
    this.board = solution.board;
    this.random = random;
    this.cap = cap;
    this.samples = board.size * board.categories().size();
  }

  /** Builds the clue pool for the given solution with the default cap. */
  public static CluePool build(Solution solution, Random random) {
    return build(solution, random, DEFAULT_CAP);
  }

  /** Builds the clue pool for the given solution, with at most cap clues. */
  public static CluePool build(Solution solution, Random random, int cap) {
    ClueCatalog catalog = new ClueCatalog(solution, random, cap);
    catalog.addItemClues();
    catalog.addPairClues();
    catalog.addRuns();
    catalog.addChains();
    catalog.addConnectives();
    catalog.addExclusions();
    CluePool pool = new CluePool(catalog.clues);
    logger.fine("Clue pool: " + pool);
    return pool;
  }

  /**
   * Adds the given clue if it is true of the solution and there is room.
   * Returns true if the pool grew.
   */
  private boolean add(Clue clue) {
    if (!clue.isTrueOf(solution)) return false;
    if (clues.size() >= cap) {
      if (!capped) {
        logger.warning("Clue pool reached its cap of " + cap + "; skipping the rest");
        capped = true;
      }
      return false;
    }
    return clues.add(clue);
  }

  private void addItemClues() {
    for (Item item : board.items()) {
      int pos = solution.position(item);
      add(new Positional(pos, item));
      if (board.isEdge(pos))
        add(new AtEdge(item));
      add(new IsEven(item, pos % 2 == 0));
    }
  }

  private void addPairClues() {
    ImmutableList<Item> items = board.items();
    for (int i = 0; i < items.size(); ++i) {
      Item a = items.get(i);
      int pos1 = solution.position(a);
      for (int j = i + 1; j < items.size(); ++j) {
        Item b = items.get(j);
        if (a.categoryIndex == b.categoryIndex) continue;
        int pos2 = solution.position(b);
        if (pos1 == pos2) add(new DirectLink(a, b));
        else add(PairClue.apart(a, b));
        int distance = board.distance(pos1, pos2);
        if (distance == 1) add(PairClue.adjacent(a, b));
        if (distance >= 2) add(PairClue.fartherThan(a, b, distance - 1));
        add(PairClue.sumEquals(a, b, pos1 + pos2));
      }
    }
  }

  /** Every run of three consecutive positions, with every choice of categories. */
  private void addRuns() {
    if (board.size < 3) return;
    int lastStart = board.geometry == Geometry.CIRCULAR ? board.size : board.size - 2;
    List<Category> cats = board.categories();
    for (int start = 1; start <= lastStart; ++start) {
      int p2 = board.geometry.offset(start, 1, board.size);
      int p3 = board.geometry.offset(start, 2, board.size);
      for (Category c1 : cats)
        for (Category c2 : cats)
          for (Category c3 : cats)
            add(new ThreeInARow(
                solution.itemAt(c1, start), solution.itemAt(c2, p2), solution.itemAt(c3, p3)));
    }
  }

  /** Ordered triples of positions, one category per slot. */
  private void addChains() {
    if (board.size < 3 || board.geometry != Geometry.LINEAR) return;
    List<Category> cats = board.categories();
    for (int p1 = 1; p1 <= board.size; ++p1)
      for (int p2 = p1 + 1; p2 <= board.size; ++p2)
        for (int p3 = p2 + 1; p3 <= board.size; ++p3)
          for (Category c1 : cats) {
            Category c2 = cats.get(random.nextInt(cats.size()));
            Category c3 = cats.get(random.nextInt(cats.size()));
            add(new OrderedChain(
                solution.itemAt(c1, p1), solution.itemAt(c2, p2), solution.itemAt(c3, p3)));
          }
  }

  private void addConnectives() {
    List<Fact> trueFacts = Lists.newArrayList();
    List<Fact> falseFacts = Lists.newArrayList();
    for (Item item : board.items()) {
      for (int pos = 1; pos <= board.size; ++pos) {
        Positional fact = new Positional(pos, item);
        (fact.isTrueOf(solution) ? trueFacts : falseFacts).add(fact);
      }
    }
    ImmutableList<Item> items = board.items();
    for (int i = 0; i < items.size(); ++i)
      for (int j = i + 1; j < items.size(); ++j)
        if (items.get(i).categoryIndex != items.get(j).categoryIndex) {
          DirectLink fact = new DirectLink(items.get(i), items.get(j));
          (fact.isTrueOf(solution) ? trueFacts : falseFacts).add(fact);
        }

    for (int n = 0; n < samples; ++n) {
      Fact p = pick(trueFacts);
      Fact q = pick(trueFacts);
      if (!p.equals(q)) add(new Connective(Clue.Type.IF_THEN, p, q));
    }

    // "If not P then not Q" reads naturally when P and Q are both false.
    List<Fact> falsePositionals = Lists.newArrayList();
    for (Fact fact : falseFacts)
      if (fact.type == Clue.Type.POSITIONAL)
        falsePositionals.add(fact);
    for (int n = 0; n < samples; ++n) {
      Fact p = pick(falsePositionals);
      Fact q = pick(falsePositionals);
      if (!p.equals(q)) add(new Connective(Clue.Type.IF_NOT_THEN_NOT, p, q));
    }

    for (int n = 0; n < samples; ++n) {
      Fact p = pick(trueFacts);
      Fact q = pick(falseFacts);
      add(new Connective(Clue.Type.EITHER_OR, p, q));
    }

    for (int n = 0; n < samples; ++n) {
      List<Fact> facts = random.nextBoolean() ? trueFacts : falseFacts;
      Fact p = pick(facts);
      Fact q = pick(facts);
      if (!p.equals(q)) add(new Connective(Clue.Type.IF_AND_ONLY_IF, p, q));
    }
  }

  /** Two or three items, none of them at some position. */
  private void addExclusions() {
    for (int n = 0; n < samples; ++n) {
      int pos = 1 + random.nextInt(board.size);
      List<Item> candidates = Lists.newArrayList();
      for (Item item : board.items())
        if (solution.position(item) != pos)
          candidates.add(item);
      Collections.shuffle(candidates, random);
      int count = Math.min(2 + random.nextInt(2), candidates.size());
      add(new NeitherNorPos(candidates.subList(0, count), pos));
    }
  }

  private Fact pick(List<Fact> facts) {
    return facts.get(random.nextInt(facts.size()));
  }
}
