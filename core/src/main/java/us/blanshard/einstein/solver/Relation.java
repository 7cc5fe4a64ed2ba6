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
package us.blanshard.einstein.solver;

/**
 * The relations a {@link RelationConstraint} can impose on one, two or three
 * variables.  Each relation may use a constant {@code k} and a ring size
 * {@code n}; relations that don't need them ignore them.  Boolean variables
 * are 0 for false and 1 for true.
 *
 * @author Luke Blanshard
 */
public enum Relation {

  /** x == k */
  EQUALS_CONST(1) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] == k; }
  },

  /** x != k */
  NOT_EQUALS_CONST(1) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] != k; }
  },

  /** x == 1 or x == n */
  AT_END(1) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] == 1 || v[0] == n; }
  },

  /** x mod 2 == k */
  PARITY(1) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] % 2 == k; }
  },

  /** x == y */
  EQUALS(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] == v[1]; }
  },

  /** x != y */
  NOT_EQUALS(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] != v[1]; }
  },

  /** x &lt; y */
  LESS_THAN(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] < v[1]; }
  },

  /** |x - y| == k */
  DISTANCE_EQUALS(2) {
    @Override public boolean holds(int[] v, int k, int n) { return Math.abs(v[0] - v[1]) == k; }
  },

  /** |x - y| &gt; k */
  DISTANCE_GREATER(2) {
    @Override public boolean holds(int[] v, int k, int n) { return Math.abs(v[0] - v[1]) > k; }
  },

  /** The distance between x and y around a ring of n positions is k. */
  RING_DISTANCE_EQUALS(2) {
    @Override public boolean holds(int[] v, int k, int n) { return ringDistance(v[0], v[1], n) == k; }
  },

  /** The distance between x and y around a ring of n positions exceeds k. */
  RING_DISTANCE_GREATER(2) {
    @Override public boolean holds(int[] v, int k, int n) { return ringDistance(v[0], v[1], n) > k; }
  },

  /** x + y == k */
  SUM_EQUALS(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] + v[1] == k; }
  },

  /** Boolean x implies boolean y. */
  IMPLIES(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] == 0 || v[1] == 1; }
  },

  /** Exactly one of booleans x and y. */
  XOR(2) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] != v[1]; }
  },

  /** Boolean b is true exactly when x == k. */
  REIFIED_EQUALS_CONST(2) {
    @Override public boolean holds(int[] v, int k, int n) { return (v[0] == 1) == (v[1] == k); }
  },

  /** Boolean b is true exactly when x == y. */
  REIFIED_EQUALS(3) {
    @Override public boolean holds(int[] v, int k, int n) { return (v[0] == 1) == (v[1] == v[2]); }
  },

  /** x &lt; y &lt; z */
  CHAIN(3) {
    @Override public boolean holds(int[] v, int k, int n) { return v[0] < v[1] && v[1] < v[2]; }
  },

  /** x, y and z are distinct and consecutive, in any order. */
  RUN(3) {
    @Override public boolean holds(int[] v, int k, int n) {
      if (v[0] == v[1] || v[1] == v[2] || v[0] == v[2]) return false;
      int max = Math.max(v[0], Math.max(v[1], v[2]));
      int min = Math.min(v[0], Math.min(v[1], v[2]));
      return max - min == 2;
    }
  },

  /** x, y and z are distinct and consecutive around a ring of n positions. */
  RING_RUN(3) {
    @Override public boolean holds(int[] v, int k, int n) {
      if (v[0] == v[1] || v[1] == v[2] || v[0] == v[2]) return false;
      for (int i = 0; i < 3; ++i) {
        int middle = v[i];
        if (ringDistance(middle, v[(i + 1) % 3], n) == 1
            && ringDistance(middle, v[(i + 2) % 3], n) == 1)
          return true;
      }
      return false;
    }
  };

  /** The number of variables the relation constrains. */
  public final int arity;

  private Relation(int arity) {
    this.arity = arity;
  }

  /** Tells whether the relation holds for the given values. */
  public abstract boolean holds(int[] values, int k, int n);

  static int ringDistance(int a, int b, int n) {
    int d = Math.abs(a - b);
    return Math.min(d, n - d);
  }
}
