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
package us.blanshard.einstein.text;

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
import us.blanshard.einstein.clue.UnsupportedClueException;
import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.gen.Question;
import us.blanshard.einstein.theme.Theme;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * Phrases clues and questions as English sentences, using a theme's labels:
 * an item reads as "the pet 'parrot'", a position as "house #3".
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ClueFormatter {
  public static final String ANSWER_PREFIX = "Answer for check: ";

  private final Theme theme;

  public ClueFormatter(Theme theme) {
    this.theme = theme;
  }

  /**
   * Returns a sentence stating the given clue.  Throws {@link
   * UnsupportedClueException} for a kind it doesn't know how to phrase.
   */
  public String formatClue(Clue clue) {
    switch (clue.type) {
      case POSITIONAL: {
        Positional c = (Positional) clue;
        return sentence(describe(c.item) + " is in " + position(c.position));
      }
      case DIRECT_LINK: {
        DirectLink c = (DirectLink) clue;
        return sentence(describe(c.first) + " is in the same " + theme.position
            + " as " + describe(c.second));
      }
      case NEGATIVE_DIRECT_LINK: {
        PairClue c = (PairClue) clue;
        return sentence(describe(c.first) + " is not in the same " + theme.position
            + " as " + describe(c.second));
      }
      case RELATIVE_POS: {
        PairClue c = (PairClue) clue;
        return sentence(describe(c.first) + " and " + describe(c.second)
            + " are in neighboring " + theme.positions);
      }
      case DISTANCE_GREATER_THAN: {
        PairClue c = (PairClue) clue;
        return sentence(describe(c.first) + " and " + describe(c.second)
            + " are more than " + theme.countPositions(c.amount) + " apart");
      }
      case AT_EDGE: {
        AtEdge c = (AtEdge) clue;
        return sentence(describe(c.item) + " is in the first or the last " + theme.position);
      }
      case IS_EVEN: {
        IsEven c = (IsEven) clue;
        return sentence(describe(c.item) + " is in an " + (c.even ? "even" : "odd")
            + "-numbered " + theme.position);
      }
      case SUM_EQUALS: {
        PairClue c = (PairClue) clue;
        return sentence("The " + theme.position + " numbers of " + describe(c.first)
            + " and " + describe(c.second) + " add up to " + c.amount);
      }
      case THREE_IN_A_ROW:
        return sentence(list(clue.getItems().asList())
            + " are in three consecutive " + theme.positions + ", in some order");
      case ORDERED_CHAIN: {
        ImmutableList<Item> chain = ((OrderedChain) clue).chain();
        return sentence(describe(chain.get(0)) + " is in a lower-numbered " + theme.position
            + " than " + describe(chain.get(1)) + ", which is in a lower-numbered "
            + theme.position + " than " + describe(chain.get(2)));
      }
      case IF_THEN: {
        Connective c = (Connective) clue;
        return sentence("If " + formatFact(c.p, false) + ", then " + formatFact(c.q, false));
      }
      case IF_NOT_THEN_NOT: {
        Connective c = (Connective) clue;
        return sentence("If " + formatFact(c.p, true) + ", then " + formatFact(c.q, true));
      }
      case EITHER_OR: {
        Connective c = (Connective) clue;
        return sentence("Either " + formatFact(c.p, false) + ", or " + formatFact(c.q, false)
            + ", but not both");
      }
      case IF_AND_ONLY_IF: {
        Connective c = (Connective) clue;
        return sentence(formatFact(c.p, false) + " if and only if " + formatFact(c.q, false));
      }
      case NEITHER_NOR_POS: {
        NeitherNorPos c = (NeitherNorPos) clue;
        List<Item> items = c.getItems().asList();
        if (items.size() == 2)
          return sentence("Neither " + describe(items.get(0)) + " nor " + describe(items.get(1))
              + " is in " + position(c.position));
        return sentence("None of " + list(items) + " is in " + position(c.position));
      }
      default:
        throw new UnsupportedClueException(clue);
    }
  }

  /** Phrases a simple fact as a clause, optionally negated. */
  public String formatFact(Fact fact, boolean negated) {
    String not = negated ? " not" : "";
    switch (fact.type) {
      case POSITIONAL: {
        Positional f = (Positional) fact;
        return describe(f.item) + " is" + not + " in " + position(f.position);
      }
      case DIRECT_LINK: {
        DirectLink f = (DirectLink) fact;
        return describe(f.first) + " is" + not + " in the same " + theme.position
            + " as " + describe(f.second);
      }
      default:
        throw new UnsupportedClueException(fact);
    }
  }

  public String formatQuestion(Question question) {
    return "What is the " + theme.label(question.attribute) + " of "
        + describe(question.subject) + "?";
  }

  /** The hidden line a checker looks for, naming the answer. */
  public String formatAnswer(Question question) {
    return ANSWER_PREFIX + question.answer.name;
  }

  /** Names an item with its category's label: the pet 'parrot'. */
  public String describe(Item item) {
    return "the " + theme.label(item) + " '" + item.name + "'";
  }

  private String position(int position) {
    return theme.position + " #" + position;
  }

  private String list(List<Item> items) {
    List<String> names = Lists.newArrayList();
    for (Item item : items)
      names.add(describe(item));
    String last = names.remove(names.size() - 1);
    return Joiner.on(", ").join(names) + " and " + last;
  }

  private static String sentence(String text) {
    return Character.toUpperCase(text.charAt(0)) + text.substring(1) + ".";
  }
}
