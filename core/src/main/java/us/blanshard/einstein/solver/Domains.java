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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The remaining possible values of every variable in a model, each held as a
 * bit-set in a long.  Immutable: use a {@link Builder} to narrow them.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Domains {
  private final Model model;
  private final long[] bits;

  private Domains(Model model, long[] bits) {
    this.model = model;
    this.bits = bits;
  }

  /**
   * Returns the full domains of the model's variables narrowed by every
   * constraint, or null if the constraints can't all be met.
   */
  @Nullable public static Domains initial(Model model) {
    long[] bits = new long[model.numVars()];
    for (int i = 0; i < bits.length; ++i)
      bits[i] = model.var(i).fullDomain();
    Builder builder = new Builder(model, bits);
    for (int i = 0; i < model.numConstraints(); ++i)
      builder.enqueue(model.constraint(i));
    return builder.propagate() ? builder.build() : null;
  }

  public Builder toBuilder() {
    return new Builder(model, bits.clone());
  }

  long getBits(IntVar var) {
    return bits[var.index];
  }

  /** The number of values still possible for the given variable. */
  public int size(IntVar var) {
    return Long.bitCount(bits[var.index]);
  }

  public boolean contains(IntVar var, int value) {
    return value >= 0 && value <= Model.MAX_VALUE && (bits[var.index] & (1L << value)) != 0;
  }

  /** The possible values of the given variable, in increasing order. */
  public List<Integer> values(IntVar var) {
    List<Integer> answer = Lists.newArrayList();
    for (long rest = bits[var.index]; rest != 0; rest &= rest - 1)
      answer.add(Long.numberOfTrailingZeros(rest));
    return answer;
  }

  /** Tells whether every variable has exactly one value left. */
  public boolean isComplete() {
    for (long b : bits)
      if (Long.bitCount(b) != 1) return false;
    return true;
  }

  /** Converts complete domains to an assignment. */
  public Assignment toAssignment() {
    int[] values = new int[bits.length];
    for (int i = 0; i < bits.length; ++i) {
      if (Long.bitCount(bits[i]) != 1)
        throw new IllegalStateException("Variable " + model.var(i) + " is not fixed");
      values[i] = Long.numberOfTrailingZeros(bits[i]);
    }
    return new Assignment(values);
  }

  @Override public String toString() {
    List<String> parts = Lists.newArrayList();
    for (int i = 0; i < bits.length; ++i)
      parts.add(model.var(i) + "=" + values(model.var(i)));
    return Joiner.on(", ").join(parts);
  }

  /**
   * Narrows domains and propagates the consequences through the model's
   * constraints.  Once any domain empties, the builder stays inconsistent.
   */
  @NotThreadSafe
  public static final class Builder {
    private final Model model;
    private final long[] bits;
    private final ArrayDeque<Constraint> queue = new ArrayDeque<Constraint>();
    private final boolean[] queued;
    private boolean consistent = true;

    private Builder(Model model, long[] bits) {
      this.model = model;
      this.bits = bits;
      this.queued = new boolean[model.numConstraints()];
    }

    long getBits(IntVar var) {
      return bits[var.index];
    }

    /**
     * Keeps only the values of the given variable found in {@code mask},
     * scheduling the variable's constraints if anything changed.  Returns
     * false if no value remains.
     */
    boolean restrict(IntVar var, long mask) {
      long old = bits[var.index];
      long narrowed = old & mask;
      if (narrowed == old) return consistent;
      bits[var.index] = narrowed;
      if (narrowed == 0) return consistent = false;
      for (Constraint c : model.watchers(var))
        enqueue(c);
      return consistent;
    }

    void enqueue(Constraint c) {
      if (!queued[c.index]) {
        queued[c.index] = true;
        queue.addLast(c);
      }
    }

    /**
     * Fixes the given variable to the given value and propagates.  Returns
     * false if that leads to a contradiction.
     */
    public boolean assign(IntVar var, int value) {
      if (value < 0 || value > Model.MAX_VALUE) return consistent = false;
      return restrict(var, 1L << value) && propagate();
    }

    /**
     * Removes the given value from the variable's domain and propagates.
     */
    public boolean eliminate(IntVar var, int value) {
      if (value < 0 || value > Model.MAX_VALUE) return consistent;
      return restrict(var, ~(1L << value)) && propagate();
    }

    /** Runs scheduled constraints until nothing changes. */
    public boolean propagate() {
      while (consistent && !queue.isEmpty()) {
        Constraint c = queue.removeFirst();
        queued[c.index] = false;
        if (!c.propagate(this))
          consistent = false;
      }
      if (!consistent) {
        queue.clear();
        Arrays.fill(queued, false);
      }
      return consistent;
    }

    public Domains build() {
      return new Domains(model, bits.clone());
    }
  }
}
