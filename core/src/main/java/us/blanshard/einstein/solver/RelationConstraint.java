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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;

/**
 * Imposes a {@link Relation} on one to three variables.  Propagation keeps
 * every remaining value supported: for each value of each variable there must
 * be values in the other variables' domains that satisfy the relation.
 */
final class RelationConstraint extends Constraint {
  final Relation relation;
  final int k;
  final int n;

  RelationConstraint(Relation relation, int k, int n, IntVar... vars) {
    super(ImmutableList.copyOf(vars));
    checkArgument(vars.length == relation.arity,
        "%s takes %s variables, got %s", relation, relation.arity, Arrays.toString(vars));
    this.relation = relation;
    this.k = k;
    this.n = n;
  }

  @Override boolean propagate(Domains.Builder domains) {
    int arity = vars.size();
    long[] bits = new long[arity];
    for (int i = 0; i < arity; ++i)
      bits[i] = domains.getBits(vars.get(i));
    int[] values = new int[arity];
    for (int i = 0; i < arity; ++i) {
      long supported = 0;
      for (long rest = bits[i]; rest != 0; rest &= rest - 1) {
        values[i] = Long.numberOfTrailingZeros(rest);
        if (isSupported(bits, values, i, 0))
          supported |= 1L << values[i];
      }
      if (supported != bits[i]) {
        if (!domains.restrict(vars.get(i), supported))
          return false;
        bits[i] = supported;
      }
    }
    return true;
  }

  /**
   * Tells whether the values fixed so far can be extended to a tuple
   * satisfying the relation, filling in the variables other than {@code
   * fixed} from position {@code next} onward.
   */
  private boolean isSupported(long[] bits, int[] values, int fixed, int next) {
    if (next == bits.length)
      return relation.holds(values, k, n);
    if (next == fixed)
      return isSupported(bits, values, fixed, next + 1);
    for (long rest = bits[next]; rest != 0; rest &= rest - 1) {
      values[next] = Long.numberOfTrailingZeros(rest);
      if (isSupported(bits, values, fixed, next + 1))
        return true;
    }
    return false;
  }

  @Override public String toString() {
    return relation + vars.toString() + (k == 0 ? "" : " k=" + k);
  }
}
