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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.junit.Test;

import java.util.List;
import java.util.Map;

public class BoardTest {

  @Test public void basics() {
    Board board = Boards.of(4, 3, Geometry.LINEAR);
    assertEquals(4, board.size);
    assertEquals(3, board.categories().size());
    assertEquals(12, board.items().size());
    Item pet2 = Boards.item(board, "Pet2");
    assertSame(board.category(2), board.categoryOf(pet2));
    assertEquals(1, pet2.index);
    assertSame(board.category(1), board.findCategory("Color"));
    assertNull(board.findCategory("Drink"));
    assertEquals(pet2, board.category(2).find("Pet2"));
    assertNull(board.category(2).find("Pet9"));
  }

  @Test public void itemOrder() {
    Board board = Boards.of(3, 2, Geometry.LINEAR);
    Item name3 = Boards.item(board, "Name3");
    Item color1 = Boards.item(board, "Color1");
    assertEquals(true, name3.compareTo(color1) < 0);
    assertEquals(true, color1.compareTo(name3) > 0);
    assertEquals(0, name3.compareTo(Boards.item(board, "Name3")));
  }

  @Test public void edgesAndDistances() {
    Board linear = Boards.of(5, 2, Geometry.LINEAR);
    assertEquals(true, linear.isEdge(1));
    assertEquals(true, linear.isEdge(5));
    assertEquals(false, linear.isEdge(3));
    assertEquals(4, linear.distance(1, 5));
    assertEquals(false, linear.isAdjacent(1, 5));

    Board circular = Boards.of(5, 2, Geometry.CIRCULAR);
    assertEquals(1, circular.distance(1, 5));
    assertEquals(true, circular.isAdjacent(1, 5));
    assertEquals(2, circular.distance(2, 5));
  }

  @Test(expected = ConfigurationException.class)
  public void sizeTooSmall() {
    Boards.of(1, 2, Geometry.LINEAR);
  }

  @Test(expected = ConfigurationException.class)
  public void oneCategory() {
    Boards.of(3, 1, Geometry.LINEAR);
  }

  @Test(expected = ConfigurationException.class)
  public void wrongItemCount() {
    Map<String, List<String>> categories = Maps.newLinkedHashMap();
    categories.put("Name", ImmutableList.of("a", "b", "c"));
    categories.put("Color", ImmutableList.of("red", "green"));
    Board.of(3, Geometry.LINEAR, categories);
  }

  @Test(expected = ConfigurationException.class)
  public void duplicateItems() {
    Board.of(2, Geometry.LINEAR, ImmutableMap.of(
        "Name", ImmutableList.of("a", "b"),
        "Color", ImmutableList.of("red", "red")));
  }
}
