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
import us.blanshard.einstein.core.Item;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Map;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * An undirected graph over items, with an edge between every two items some
 * clue mentions together.  The distance between two items approximates how
 * many clues must be combined to relate them.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class CooccurrenceGraph {
  private final SetMultimap<Item, Item> edges = LinkedHashMultimap.create();

  /** Builds the graph of the given clues. */
  public static CooccurrenceGraph of(Iterable<? extends Clue> clues) {
    CooccurrenceGraph graph = new CooccurrenceGraph();
    for (Clue clue : clues)
      graph.connectAll(clue.getItems());
    return graph;
  }

  /** Adds an edge between every two of the given items. */
  public void connectAll(Collection<Item> items) {
    ImmutableList<Item> list = ImmutableList.copyOf(items);
    for (int i = 0; i < list.size(); ++i)
      for (int j = i + 1; j < list.size(); ++j)
        connect(list.get(i), list.get(j));
  }

  public void connect(Item a, Item b) {
    if (a.equals(b)) return;
    edges.put(a, b);
    edges.put(b, a);
  }

  public ImmutableSet<Item> neighbors(Item item) {
    return ImmutableSet.copyOf(edges.get(item));
  }

  public ImmutableSet<Item> nodes() {
    return ImmutableSet.copyOf(edges.keySet());
  }

  /**
   * Returns the number of edges on a shortest path between the two items, or
   * -1 if there is no path.
   */
  public int distance(Item from, Item to) {
    if (from.equals(to)) return 0;
    Map<Item, Integer> depths = Maps.newHashMap();
    ArrayDeque<Item> queue = new ArrayDeque<Item>();
    depths.put(from, 0);
    queue.add(from);
    while (!queue.isEmpty()) {
      Item current = queue.removeFirst();
      int depth = depths.get(current);
      for (Item next : edges.get(current)) {
        if (depths.containsKey(next)) continue;
        if (next.equals(to)) return depth + 1;
        depths.put(next, depth + 1);
        queue.addLast(next);
      }
    }
    return -1;
  }

  @Override public String toString() {
    return edges.toString();
  }
}
