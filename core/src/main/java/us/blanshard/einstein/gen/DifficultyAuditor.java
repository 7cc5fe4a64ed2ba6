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
import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Chooses the question that is hardest to answer from a set of clues: the one
 * whose subject and answer are farthest apart in the clues' co-occurrence
 * graph.  Candidates are shuffled first, so ties go to a random one.
 *
 * @author Luke Blanshard
 */
public final class DifficultyAuditor {
  private static final Logger logger = Logger.getLogger(DifficultyAuditor.class.getName());

  /** The default minimum path length for a question. */
  public static final int DEFAULT_MIN_PATH_LEN = 3;

  private final Random random;

  public DifficultyAuditor(Random random) {
    this.random = random;
  }

  public AuditResult audit(List<? extends Clue> clues, Solution solution, int minPathLen) {
    CooccurrenceGraph graph = CooccurrenceGraph.of(clues);
    Board board = solution.board;

    List<Item[]> candidates = Lists.newArrayList();
    for (Category subjects : board.categories())
      for (Category attributes : board.categories()) {
        if (subjects == attributes) continue;
        for (Item subject : subjects)
          candidates.add(new Item[] {subject, solution.partner(subject, attributes)});
      }
    Collections.shuffle(candidates, random);

    Question best = null;
    for (Item[] candidate : candidates) {
      int length = graph.distance(candidate[0], candidate[1]);
      if (length > 0 && (best == null || length > best.pathLength)) {
        best = new Question(
            candidate[0], board.categoryOf(candidate[1]), candidate[1], length);
      }
    }

    AuditResult result = new AuditResult(best, minPathLen);
    if (result.passed())
      logger.info("Audit passed with path length " + result.pathLength());
    else
      logger.info("Audit failed: longest path " + result.pathLength() + " < " + minPathLen);
    return result;
  }
}
