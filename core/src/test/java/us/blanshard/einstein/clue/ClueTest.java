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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Boards;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

public class ClueTest {
  // Name1..4 at 1..4; Color1..4 at 2, 4, 1, 3.
  private final Board board = Boards.of(4, 2, Geometry.LINEAR);
  private final Solution solution =
      Boards.solution(board, new int[] {1, 2, 3, 4}, new int[] {2, 4, 1, 3});
  private final Item n1 = item("Name1");
  private final Item n2 = item("Name2");
  private final Item n3 = item("Name3");
  private final Item n4 = item("Name4");
  private final Item c1 = item("Color1");
  private final Item c2 = item("Color2");
  private final Item c3 = item("Color3");

  private Item item(String name) {
    return Boards.item(board, name);
  }

  @Test public void symmetricPayloadsAreCanonical() {
    assertEquals(new DirectLink(n1, c3), new DirectLink(c3, n1));
    assertEquals(PairClue.adjacent(n1, c1), PairClue.adjacent(c1, n1));
    assertEquals(PairClue.sumEquals(n2, c3, 3), PairClue.sumEquals(c3, n2, 3));
    assertEquals(new ThreeInARow(n1, n2, c1), new ThreeInARow(c1, n1, n2));
    assertEquals(new NeitherNorPos(ImmutableList.of(n2, c1), 1),
                 new NeitherNorPos(ImmutableList.of(c1, n2), 1));
    Fact p = new Positional(1, n1);
    Fact q = new DirectLink(n2, c2);
    assertEquals(new Connective(Clue.Type.EITHER_OR, p, q), new Connective(Clue.Type.EITHER_OR, q, p));
    assertEquals(new Connective(Clue.Type.IF_AND_ONLY_IF, p, q),
                 new Connective(Clue.Type.IF_AND_ONLY_IF, q, p));
    assertNotEquals(new Connective(Clue.Type.IF_THEN, p, q), new Connective(Clue.Type.IF_THEN, q, p));
    assertNotEquals(PairClue.apart(n1, c1), PairClue.adjacent(n1, c1));
    assertNotEquals(new OrderedChain(n1, n2, c1), new OrderedChain(n2, n1, c1));
  }

  @Test public void truth() {
    assertTrue(new Positional(1, n1).isTrueOf(solution));
    assertFalse(new Positional(2, n1).isTrueOf(solution));
    assertTrue(new DirectLink(n1, c3).isTrueOf(solution));
    assertTrue(PairClue.apart(n1, c1).isTrueOf(solution));
    assertTrue(PairClue.adjacent(n1, c1).isTrueOf(solution));
    assertTrue(PairClue.fartherThan(n1, c2, 2).isTrueOf(solution));
    assertFalse(PairClue.fartherThan(n1, c2, 3).isTrueOf(solution));
    assertTrue(PairClue.sumEquals(n2, c2, 6).isTrueOf(solution));
    assertTrue(new AtEdge(c2).isTrueOf(solution));
    assertFalse(new AtEdge(c1).isTrueOf(solution));
    assertTrue(new IsEven(c1, true).isTrueOf(solution));
    assertTrue(new IsEven(n1, false).isTrueOf(solution));
    assertTrue(new ThreeInARow(c3, n2, n3).isTrueOf(solution));
    assertFalse(new ThreeInARow(c3, n4, c1).isTrueOf(solution));
    assertTrue(new OrderedChain(c3, n2, c2).isTrueOf(solution));
    assertFalse(new OrderedChain(n2, c3, c2).isTrueOf(solution));
    assertTrue(new NeitherNorPos(ImmutableList.of(n2, c1), 1).isTrueOf(solution));
    assertFalse(new NeitherNorPos(ImmutableList.of(n1, c1), 1).isTrueOf(solution));
  }

  @Test public void connectives() {
    Fact t1 = new Positional(1, n1);
    Fact t2 = new DirectLink(n2, c1);
    Fact f1 = new Positional(3, n1);
    Fact f2 = new Positional(4, n2);
    assertTrue(new Connective(Clue.Type.IF_THEN, t1, t2).isTrueOf(solution));
    assertFalse(new Connective(Clue.Type.IF_THEN, t1, f1).isTrueOf(solution));
    assertTrue(new Connective(Clue.Type.IF_THEN, f1, t1).isTrueOf(solution));
    // If not P then not Q fails only when P is false and Q is true.
    assertTrue(new Connective(Clue.Type.IF_NOT_THEN_NOT, f1, f2).isTrueOf(solution));
    assertFalse(new Connective(Clue.Type.IF_NOT_THEN_NOT, f1, t1).isTrueOf(solution));
    assertTrue(new Connective(Clue.Type.EITHER_OR, t1, f1).isTrueOf(solution));
    assertFalse(new Connective(Clue.Type.EITHER_OR, t1, t2).isTrueOf(solution));
    assertTrue(new Connective(Clue.Type.IF_AND_ONLY_IF, f1, f2).isTrueOf(solution));
    assertFalse(new Connective(Clue.Type.IF_AND_ONLY_IF, t1, f2).isTrueOf(solution));
  }

  @Test public void items() {
    Connective c = new Connective(Clue.Type.IF_THEN, new DirectLink(c2, n1), new Positional(2, n2));
    assertEquals(ImmutableList.of(n1, n2, c2), c.getItems().asList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void linkWithinCategory() {
    new DirectLink(n1, n2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void connectiveNeedsTwoFacts() {
    Fact p = new Positional(1, n1);
    new Connective(Clue.Type.IF_THEN, p, new Positional(1, n1));
  }

  @Test public void strengths() {
    assertEquals(3, Clue.Type.IF_THEN.strength);
    assertEquals(3, Clue.Type.RELATIVE_POS.strength);
    assertEquals(2, Clue.Type.DIRECT_LINK.strength);
    assertEquals(1, Clue.Type.POSITIONAL.strength);
    assertTrue(Clue.Type.DIRECT_LINK.isFact());
    assertTrue(Clue.Type.EITHER_OR.isConnective());
    assertFalse(Clue.Type.NEITHER_NOR_POS.isConnective());
  }
}
