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

/**
 * How the positions of a puzzle are arranged: in a row, or around a table.
 *
 * @author Luke Blanshard
 */
public enum Geometry {

  /** Positions 1 through N in a row; 1 and N are the ends. */
  LINEAR {
    @Override public int distance(int pos1, int pos2, int size) {
      return Math.abs(pos1 - pos2);
    }
    @Override public boolean isRun(int pos1, int pos2, int pos3, int size) {
      if (pos1 == pos2 || pos2 == pos3 || pos1 == pos3) return false;
      int max = Math.max(pos1, Math.max(pos2, pos3));
      int min = Math.min(pos1, Math.min(pos2, pos3));
      return max - min == 2;
    }
  },

  /** Positions 1 through N around a circle, so N is next to 1. */
  CIRCULAR {
    @Override public int distance(int pos1, int pos2, int size) {
      int d = Math.abs(pos1 - pos2);
      return Math.min(d, size - d);
    }
    @Override public boolean isRun(int pos1, int pos2, int pos3, int size) {
      if (pos1 == pos2 || pos2 == pos3 || pos1 == pos3) return false;
      // Some one of the three must have the other two as its two neighbors.
      return isMiddle(pos1, pos2, pos3, size)
          || isMiddle(pos2, pos1, pos3, size)
          || isMiddle(pos3, pos1, pos2, size);
    }

    private boolean isMiddle(int middle, int a, int b, int size) {
      return distance(middle, a, size) == 1 && distance(middle, b, size) == 1;
    }
  };

  /**
   * Returns the number of steps between the two positions, which lie in the
   * range 1..size.
   */
  public abstract int distance(int pos1, int pos2, int size);

  /**
   * Tells whether the three positions are distinct and form a run of three
   * consecutive positions, in any order.
   */
  public abstract boolean isRun(int pos1, int pos2, int pos3, int size);

  /** Tells whether the two positions are next to each other. */
  public boolean isAdjacent(int pos1, int pos2, int size) {
    return distance(pos1, pos2, size) == 1;
  }

  /**
   * Returns the position the given number of steps after the given one, or 0
   * if a linear row runs out first.
   */
  public int offset(int pos, int steps, int size) {
    int answer = pos + steps;
    if (this == CIRCULAR)
      return ((answer - 1) % size + size) % size + 1;
    return answer >= 1 && answer <= size ? answer : 0;
  }
}
