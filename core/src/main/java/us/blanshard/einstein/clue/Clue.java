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

import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.collect.ImmutableSortedSet;

import java.util.EnumSet;

/**
 * A statement about a puzzle's solution.  Each kind of clue has its own
 * subclass carrying its parameters; clues are values, compared by kind and
 * parameters, with symmetric parameters put in a canonical order when the clue
 * is constructed.
 *
 * <p> A clue is sound for a solution when {@link #isTrueOf} says so.
 *
 * @author Luke Blanshard
 */
public abstract class Clue {

  /**
   * All the kinds of clue we know how to generate, solve and phrase.
   */
  public enum Type {
    POSITIONAL(1),
    DIRECT_LINK(2),
    NEGATIVE_DIRECT_LINK(1),
    RELATIVE_POS(3),
    DISTANCE_GREATER_THAN(1),
    AT_EDGE(1),
    IS_EVEN(1),
    SUM_EQUALS(2),
    THREE_IN_A_ROW(2),
    ORDERED_CHAIN(3),
    IF_THEN(3),
    IF_NOT_THEN_NOT(3),
    EITHER_OR(2),
    IF_AND_ONLY_IF(3),
    NEITHER_NOR_POS(1);

    private static final EnumSet<Type> FACTS = EnumSet.of(POSITIONAL, DIRECT_LINK);
    private static final EnumSet<Type> CONNECTIVES =
        EnumSet.of(IF_THEN, IF_NOT_THEN_NOT, EITHER_OR, IF_AND_ONLY_IF);

    /**
     * How much a clue of this type narrows the search, from 1 (weak or very
     * specific) to 3 (strong structural or conditional links).
     */
    public final int strength;

    private Type(int strength) {
      this.strength = strength;
    }

    /** Tells whether clues of this type may appear inside connectives. */
    public boolean isFact() {
      return FACTS.contains(this);
    }

    /** Tells whether this type joins two facts with a logical connective. */
    public boolean isConnective() {
      return CONNECTIVES.contains(this);
    }
  }

  public final Type type;

  protected Clue(Type type) {
    this.type = type;
  }

  /** Tells whether this clue holds in the given solution. */
  public abstract boolean isTrueOf(Solution solution);

  /** Returns all the items this clue mentions, including within sub-facts. */
  public abstract ImmutableSortedSet<Item> getItems();
}
