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
import com.google.common.collect.Lists;

import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A finite-domain constraint model: a set of small integer variables and the
 * constraints among them.  Build one up, then hand it to the {@link Solver}.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Model {
  /** Values are held as bits of a long, so they must stay below this. */
  public static final int MAX_VALUE = 62;

  private final List<IntVar> vars = Lists.newArrayList();
  private final List<Constraint> constraints = Lists.newArrayList();
  private final List<List<Constraint>> watchers = Lists.newArrayList();

  public IntVar newIntVar(int lo, int hi, String name) {
    checkArgument(0 <= lo && lo <= hi && hi <= MAX_VALUE, "Bad range %s..%s", lo, hi);
    IntVar var = new IntVar(vars.size(), lo, hi, name);
    vars.add(var);
    watchers.add(Lists.<Constraint>newArrayList());
    return var;
  }

  public IntVar newBoolVar(String name) {
    return newIntVar(0, 1, name);
  }

  /** Requires the given variables to take pairwise distinct values. */
  public Constraint addAllDifferent(List<IntVar> vars) {
    return add(new AllDifferent(ImmutableList.copyOf(vars)));
  }

  public Constraint addRelation(Relation relation, IntVar... vars) {
    return addRelation(relation, 0, 0, vars);
  }

  public Constraint addRelation(Relation relation, int k, IntVar... vars) {
    return addRelation(relation, k, 0, vars);
  }

  public Constraint addRelation(Relation relation, int k, int n, IntVar... vars) {
    return add(new RelationConstraint(relation, k, n, vars));
  }

  /** Makes boolean {@code b} true exactly when {@code x == value}. */
  public Constraint addReification(IntVar b, IntVar x, int value) {
    return addRelation(Relation.REIFIED_EQUALS_CONST, value, b, x);
  }

  /** Makes boolean {@code b} true exactly when {@code x == y}. */
  public Constraint addReification(IntVar b, IntVar x, IntVar y) {
    return addRelation(Relation.REIFIED_EQUALS, b, x, y);
  }

  /** Boolean {@code p} implies boolean {@code q}. */
  public Constraint addImplication(IntVar p, IntVar q) {
    return addRelation(Relation.IMPLIES, p, q);
  }

  private Constraint add(Constraint constraint) {
    for (IntVar var : constraint.vars)
      checkArgument(var.index < vars.size() && vars.get(var.index) == var,
          "Variable %s belongs to another model", var);
    constraint.index = constraints.size();
    constraints.add(constraint);
    for (IntVar var : constraint.vars)
      watchers.get(var.index).add(constraint);
    return constraint;
  }

  public ImmutableList<IntVar> getVars() {
    return ImmutableList.copyOf(vars);
  }

  public ImmutableList<Constraint> getConstraints() {
    return ImmutableList.copyOf(constraints);
  }

  int numVars() {
    return vars.size();
  }

  int numConstraints() {
    return constraints.size();
  }

  IntVar var(int index) {
    return vars.get(index);
  }

  Constraint constraint(int index) {
    return constraints.get(index);
  }

  List<Constraint> watchers(IntVar var) {
    return watchers.get(var.index);
  }
}
