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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import us.blanshard.einstein.clue.AtEdge;
import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.DirectLink;
import us.blanshard.einstein.clue.IsEven;
import us.blanshard.einstein.clue.PairClue;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Boards;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

public class DifficultyTest {
  private final Board board = Boards.of(4, 3, Geometry.LINEAR);

  private Clue anchor;
  private List<Clue> core;
  private List<Clue> remaining;
  private Set<Clue> all;

  private Item item(String name) {
    return Boards.item(board, name);
  }

  @Before public void setUp() {
    anchor = new Positional(1, item("Name1"));
    core = Lists.<Clue>newArrayList(
        anchor,
        new IsEven(item("Color2"), true),
        new DirectLink(item("Name2"), item("Pet3")),
        PairClue.sumEquals(item("Name3"), item("Color4"), 5),
        new AtEdge(item("Pet4")),
        PairClue.adjacent(item("Name4"), item("Pet1")));
    remaining = Lists.<Clue>newArrayList(
        PairClue.apart(item("Name1"), item("Pet2")),
        new Positional(3, item("Color3")),
        new IsEven(item("Pet1"), false),
        new DirectLink(item("Color1"), item("Pet2")),
        PairClue.fartherThan(item("Name2"), item("Color3"), 2));
    all = Sets.newHashSet(core);
    all.addAll(remaining);
  }

  private void reshape(Difficulty difficulty) {
    difficulty.reshape(core, ImmutableSet.of(anchor), remaining, board.size);
    assertTrue(core.contains(anchor));
    assertEquals(all.size(), core.size() + remaining.size());
    Set<Clue> union = Sets.newHashSet(core);
    union.addAll(remaining);
    assertEquals(all, union);
  }

  @Test public void classic() {
    reshape(Difficulty.CLASSIC);
    // Three classic clues remain and the pool only has two more.
    assertEquals(5, core.size());
    for (Clue clue : core)
      assertTrue(clue.toString(), clue.type == Clue.Type.POSITIONAL
          || clue.type == Clue.Type.DIRECT_LINK || clue.type == Clue.Type.RELATIVE_POS);
  }

  @Test public void easy() {
    reshape(Difficulty.EASY);
    // Half of the six clues go back, from the end.
    assertEquals(3, core.size());
    assertEquals(anchor, core.get(0));
    assertTrue(remaining.contains(new AtEdge(item("Pet4"))));
    assertEquals(PairClue.adjacent(item("Name4"), item("Pet1")), remaining.get(remaining.size() - 1));
  }

  @Test public void easySkipsAnchors() {
    Clue second = new Positional(2, item("Name2"));
    core = Lists.newArrayList(anchor, new IsEven(item("Color2"), true), second);
    Difficulty.EASY.reshape(core, ImmutableSet.of(anchor, second), remaining, board.size);
    assertEquals(Lists.newArrayList(anchor, second), core);
    assertEquals(new IsEven(item("Color2"), true), remaining.get(remaining.size() - 1));

    core = Lists.newArrayList(anchor, second);
    Difficulty.EASY.reshape(core, ImmutableSet.of(anchor, second), remaining, board.size);
    assertEquals(2, core.size());

    core = Lists.newArrayList(anchor);
    Difficulty.EASY.reshape(core, ImmutableSet.<Clue>of(), remaining, board.size);
    assertEquals(1, core.size());
  }

  @Test public void medium() {
    List<Clue> before = Lists.newArrayList(core);
    reshape(Difficulty.MEDIUM);
    assertEquals(before, core);
  }

  @Test public void hard() {
    Clue first = remaining.get(0);
    reshape(Difficulty.HARD);
    assertEquals(8, core.size());
    assertTrue(core.contains(first));
  }

  @Test public void expert() {
    reshape(Difficulty.EXPERT);
    assertEquals(10, core.size());
    assertEquals(1, remaining.size());
  }

  @Test public void expertWithSmallPool() {
    remaining.subList(1, remaining.size()).clear();
    all = Sets.newHashSet(core);
    all.addAll(remaining);
    reshape(Difficulty.EXPERT);
    assertEquals(7, core.size());
    assertTrue(remaining.isEmpty());
  }
}
