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

import com.google.common.collect.ImmutableList;

/**
 * Requires its variables to take pairwise distinct values.  Propagates the way
 * a Sudoku player does: a variable with a single value removes it from the
 * others, and when the variables must use up every available value, a value
 * only one variable can take is forced onto that variable.
 */
final class AllDifferent extends Constraint {

  AllDifferent(ImmutableList<IntVar> vars) {
    super(vars);
  }

  @Override boolean propagate(Domains.Builder domains) {
    int count = vars.size();
    for (IntVar var : vars) {
      long bits = domains.getBits(var);
      if (Long.bitCount(bits) == 1) {
        for (IntVar other : vars)
          if (other != var && !domains.restrict(other, ~bits))
            return false;
      }
    }

    long union = 0;
    for (IntVar var : vars)
      union |= domains.getBits(var);
    int available = Long.bitCount(union);
    if (available < count)
      return false;

    if (available == count) {
      for (long rest = union; rest != 0; rest &= rest - 1) {
        long bit = Long.lowestOneBit(rest);
        IntVar only = null;
        int holders = 0;
        for (IntVar var : vars) {
          if ((domains.getBits(var) & bit) != 0) {
            only = var;
            ++holders;
          }
        }
        if (holders == 0)
          return false;
        if (holders == 1 && !domains.restrict(only, bit))
          return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "AllDifferent" + vars;
  }
}
