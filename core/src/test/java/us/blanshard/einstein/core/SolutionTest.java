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
package us.blanshard.einstein.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Random;
import java.util.Set;

public class SolutionTest {
  private final Board board = Boards.of(5, 4, Geometry.LINEAR);

  @Test public void randomIsBijection() {
    Solution solution = Solution.random(board, new Random(7));
    for (Category category : board.categories()) {
      Set<Integer> positions = Sets.newHashSet();
      for (Item item : category)
        positions.add(solution.position(item));
      assertEquals(board.size, positions.size());
      for (int pos = 1; pos <= board.size; ++pos)
        assertEquals(pos, solution.position(solution.itemAt(category, pos)));
    }
  }

  @Test public void sameSeedSameSolution() {
    assertEquals(Solution.random(board, new Random(42)), Solution.random(board, new Random(42)));
  }

  @Test public void partner() {
    Board small = Boards.of(3, 2, Geometry.LINEAR);
    Solution solution = Boards.solution(small, new int[] {1, 2, 3}, new int[] {3, 1, 2});
    assertEquals(Boards.item(small, "Color2"),
        solution.partner(Boards.item(small, "Name1"), small.category(1)));
    assertEquals(Boards.item(small, "Name3"),
        solution.partner(Boards.item(small, "Color1"), small.category(0)));
  }

  @Test public void builderRejectsCollisions() {
    Board small = Boards.of(2, 2, Geometry.LINEAR);
    try {
      Boards.solution(small, new int[] {1, 1}, new int[] {1, 2});
      fail();
    } catch (IllegalStateException expected) {}
    try {
      Boards.solution(small, new int[] {1, 2});
      fail();
    } catch (IllegalStateException expected) {}
  }

  @Test public void table() {
    Board small = Boards.of(2, 2, Geometry.LINEAR);
    String table = Boards.solution(small, new int[] {2, 1}, new int[] {1, 2}).toString();
    assertTrue(table, table.contains("Name"));
    assertTrue(table, table.contains("1  Name2  Color1"));
    assertTrue(table, table.contains("2  Name1  Color2"));
  }
}
