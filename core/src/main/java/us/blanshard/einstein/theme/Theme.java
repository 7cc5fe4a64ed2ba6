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
package us.blanshard.einstein.theme;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.core.Board;
import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.ConfigurationException;
import us.blanshard.einstein.core.Geometry;
import us.blanshard.einstein.core.Item;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * The story a puzzle is told in: a scenario, the word for a position, and a
 * pool of categories with more items than any one puzzle needs.  Themes supply
 * the labels the clue formatter uses.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Theme {

  /**
   * One category of a theme.  The label is the noun used for its items in
   * sentences, as in "the pet 'dog'".
   */
  @Immutable
  public static final class Topic {
    public final String name;
    public final String label;
    public final ImmutableList<String> items;

    public Topic(String name, String label, List<String> items) {
      this.name = checkNotNull(name);
      this.label = checkNotNull(label);
      this.items = ImmutableList.copyOf(items);
    }

    @Override public String toString() {
      return name + items;
    }
  }

  public final String name;
  public final String scenario;

  /** The word for one position, such as "house". */
  public final String position;

  /** The plural of {@link #position}. */
  public final String positions;

  private final ImmutableList<Topic> topics;

  /**
   * Throws {@link ConfigurationException} if two topics share a name.
   */
  public Theme(String name, String scenario, String position, String positions, List<Topic> topics) {
    Set<String> names = Sets.newHashSet();
    for (Topic topic : topics)
      if (!names.add(topic.name))
        throw new ConfigurationException("Theme " + name + " has two categories named " + topic.name);
    this.name = checkNotNull(name);
    this.scenario = checkNotNull(scenario);
    this.position = checkNotNull(position);
    this.positions = checkNotNull(positions);
    this.topics = ImmutableList.copyOf(topics);
  }

  /**
   * Returns a theme with no categories of its own, whose labels are the
   * lower-cased category names.
   */
  public static Theme plain() {
    return new Theme("plain", "", "position", "positions", ImmutableList.<Topic>of());
  }

  public ImmutableList<Topic> topics() {
    return topics;
  }

  /**
   * Returns the sentence label for the given category of a board made from
   * this theme, falling back to the lower-cased category name.
   */
  public String label(Category category) {
    for (Topic topic : topics)
      if (topic.name.equals(category.name))
        return topic.label;
    return category.name.toLowerCase();
  }

  /** Returns the label for the given item's category. */
  public String label(Item item) {
    for (Topic topic : topics)
      if (topic.name.equals(item.category))
        return topic.label;
    return item.category.toLowerCase();
  }

  /** Returns "1 house" or "3 houses", as appropriate. */
  public String countPositions(int count) {
    return count + " " + (count == 1 ? position : positions);
  }

  /**
   * Chooses {@code numCategories} of this theme's categories at random, keeping
   * the first one (the category the scenario is about), and {@code size} items
   * of each, and makes a board of them.  Categories and items keep their theme
   * order.  Throws {@link ConfigurationException} if the theme is too small.
   */
  public Board select(Random random, int size, int numCategories, Geometry geometry) {
    if (numCategories < 2 || numCategories > topics.size())
      throw new ConfigurationException(String.format(
          "Theme %s has %d categories, can't choose %d", name, topics.size(), numCategories));
    List<Integer> others = Lists.newArrayList();
    for (int i = 1; i < topics.size(); ++i)
      others.add(i);
    Collections.shuffle(others, random);
    List<Integer> chosen = Lists.newArrayList(others.subList(0, numCategories - 1));
    chosen.add(0);
    chosen = Ordering.natural().sortedCopy(chosen);

    Map<String, List<String>> categories = Maps.newLinkedHashMap();
    for (int index : chosen) {
      Topic topic = topics.get(index);
      if (topic.items.size() < size)
        throw new ConfigurationException(String.format(
            "Category %s of theme %s has %d items, need %d",
            topic.name, name, topic.items.size(), size));
      List<Integer> indexes = Lists.newArrayList();
      for (int i = 0; i < topic.items.size(); ++i)
        indexes.add(i);
      Collections.shuffle(indexes, random);
      List<String> items = Lists.newArrayList();
      for (int i : Ordering.natural().sortedCopy(indexes.subList(0, size)))
        items.add(topic.items.get(i));
      if (categories.put(topic.name, items) != null)
        throw new ConfigurationException("Theme " + name + " repeats category " + topic.name);
    }
    return Board.of(size, geometry, categories);
  }

  @Override public String toString() {
    return name + topics;
  }
}
