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

import us.blanshard.einstein.clue.AtEdge;
import us.blanshard.einstein.clue.Clue;
import us.blanshard.einstein.clue.Connective;
import us.blanshard.einstein.clue.DirectLink;
import us.blanshard.einstein.clue.Fact;
import us.blanshard.einstein.clue.IsEven;
import us.blanshard.einstein.clue.NeitherNorPos;
import us.blanshard.einstein.clue.OrderedChain;
import us.blanshard.einstein.clue.PairClue;
import us.blanshard.einstein.clue.Positional;
import us.blanshard.einstein.clue.ThreeInARow;
import us.blanshard.einstein.clue.UnsupportedClueException;
import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.solver.IntVar;
import us.blanshard.einstein.solver.Model;
import us.blanshard.einstein.solver.Relation;

import com.google.common.collect.ImmutableList;

import java.util.Map;

/**
 * Translates clues into constraints on the item variables of a model.
 * Connectives get a boolean variable per side, bound to that side's fact, and
 * a constraint between the booleans.
 *
 * @author Luke Blanshard
 */
final class ClueConstraints {
  private final Board board;
  private final boolean circular;

  ClueConstraints(Board board) {
    this.board = board;
    this.circular = board.geometry == Geometry.CIRCULAR;
  }

  void add(Model model, Map<Item, IntVar> vars, Clue clue) {
    switch (clue.type) {
      case POSITIONAL: {
        Positional c = (Positional) clue;
        model.addRelation(Relation.EQUALS_CONST, c.position, var(vars, c.item));
        break;
      }
      case DIRECT_LINK: {
        DirectLink c = (DirectLink) clue;
        model.addRelation(Relation.EQUALS, var(vars, c.first), var(vars, c.second));
        break;
      }
      case NEGATIVE_DIRECT_LINK: {
        PairClue c = (PairClue) clue;
        model.addRelation(Relation.NOT_EQUALS, var(vars, c.first), var(vars, c.second));
        break;
      }
      case RELATIVE_POS: {
        PairClue c = (PairClue) clue;
        model.addRelation(circular ? Relation.RING_DISTANCE_EQUALS : Relation.DISTANCE_EQUALS,
            1, board.size, var(vars, c.first), var(vars, c.second));
        break;
      }
      case DISTANCE_GREATER_THAN: {
        PairClue c = (PairClue) clue;
        model.addRelation(circular ? Relation.RING_DISTANCE_GREATER : Relation.DISTANCE_GREATER,
            c.amount, board.size, var(vars, c.first), var(vars, c.second));
        break;
      }
      case SUM_EQUALS: {
        PairClue c = (PairClue) clue;
        model.addRelation(Relation.SUM_EQUALS, c.amount, var(vars, c.first), var(vars, c.second));
        break;
      }
      case AT_EDGE: {
        AtEdge c = (AtEdge) clue;
        model.addRelation(Relation.AT_END, 0, board.size, var(vars, c.item));
        break;
      }
      case IS_EVEN: {
        IsEven c = (IsEven) clue;
        model.addRelation(Relation.PARITY, c.even ? 0 : 1, var(vars, c.item));
        break;
      }
      case THREE_IN_A_ROW: {
        ImmutableList<Item> items = ((ThreeInARow) clue).getItems().asList();
        model.addRelation(circular ? Relation.RING_RUN : Relation.RUN, 0, board.size,
            var(vars, items.get(0)), var(vars, items.get(1)), var(vars, items.get(2)));
        break;
      }
      case ORDERED_CHAIN: {
        ImmutableList<Item> items = ((OrderedChain) clue).chain();
        model.addRelation(Relation.CHAIN,
            var(vars, items.get(0)), var(vars, items.get(1)), var(vars, items.get(2)));
        break;
      }
      case IF_THEN: {
        Connective c = (Connective) clue;
        model.addImplication(reify(model, vars, c.p), reify(model, vars, c.q));
        break;
      }
      case IF_NOT_THEN_NOT: {
        // Not P implies not Q: the contrapositive is Q implies P.
        Connective c = (Connective) clue;
        IntVar p = reify(model, vars, c.p);
        IntVar q = reify(model, vars, c.q);
        model.addImplication(q, p);
        break;
      }
      case EITHER_OR: {
        Connective c = (Connective) clue;
        model.addRelation(Relation.XOR, reify(model, vars, c.p), reify(model, vars, c.q));
        break;
      }
      case IF_AND_ONLY_IF: {
        Connective c = (Connective) clue;
        model.addRelation(Relation.EQUALS, reify(model, vars, c.p), reify(model, vars, c.q));
        break;
      }
      case NEITHER_NOR_POS: {
        NeitherNorPos c = (NeitherNorPos) clue;
        for (Item item : c.getItems())
          model.addRelation(Relation.NOT_EQUALS_CONST, c.position, var(vars, item));
        break;
      }
      default:
        throw new UnsupportedClueException(clue);
    }
  }

  /** Returns a new boolean variable that is true exactly when the fact holds. */
  private IntVar reify(Model model, Map<Item, IntVar> vars, Fact fact) {
    IntVar b = model.newBoolVar("[" + fact + "]");
    switch (fact.type) {
      case POSITIONAL: {
        Positional f = (Positional) fact;
        model.addReification(b, var(vars, f.item), f.position);
        break;
      }
      case DIRECT_LINK: {
        DirectLink f = (DirectLink) fact;
        model.addReification(b, var(vars, f.first), var(vars, f.second));
        break;
      }
      default:
        throw new UnsupportedClueException(fact);
    }
    return b;
  }

  private static IntVar var(Map<Item, IntVar> vars, Item item) {
    IntVar var = vars.get(item);
    if (var == null)
      throw new IllegalArgumentException("No variable for " + item);
    return var;
  }
}
