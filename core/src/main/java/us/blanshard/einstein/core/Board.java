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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The vocabulary of one puzzle: its categories, their items, the number of
 * positions and how the positions are arranged.  Every category has exactly
 * as many items as there are positions.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Board {

  /** The largest number of positions we support. */
  public static final int MAX_SIZE = 32;

  /** The number of positions, also the number of items per category. */
  public final int size;

  public final Geometry geometry;

  private final ImmutableList<Category> categories;
  private final ImmutableList<Item> items;

  private Board(int size, Geometry geometry, ImmutableList<Category> categories) {
    this.size = size;
    this.geometry = geometry;
    this.categories = categories;
    ImmutableList.Builder<Item> builder = ImmutableList.builder();
    for (Category category : categories)
      builder.addAll(category.items());
    this.items = builder.build();
  }

  /**
   * Creates a board from category names mapped to their items, in the map's
   * iteration order.  Throws {@link ConfigurationException} if the size is out
   * of range, there are fewer than two categories, or any category does not
   * have exactly {@code size} distinct items.
   */
  public static Board of(int size, Geometry geometry, Map<String, ? extends List<String>> categories) {
    checkNotNull(geometry);
    if (size < 2 || size > MAX_SIZE)
      throw new ConfigurationException("Size must be in 2.." + MAX_SIZE + ", got " + size);
    if (categories.size() < 2)
      throw new ConfigurationException("Need at least 2 categories, got " + categories.size());
    ImmutableList.Builder<Category> builder = ImmutableList.builder();
    int index = 0;
    for (Map.Entry<String, ? extends List<String>> entry : categories.entrySet()) {
      List<String> itemNames = entry.getValue();
      Set<String> distinct = Sets.newHashSet(itemNames);
      if (itemNames.size() != size || distinct.size() != size) {
        throw new ConfigurationException(String.format(
            "Category %s needs %d distinct items, got %s", entry.getKey(), size, itemNames));
      }
      builder.add(new Category(entry.getKey(), index++, itemNames));
    }
    return new Board(size, geometry, builder.build());
  }

  public ImmutableList<Category> categories() {
    return categories;
  }

  public Category category(int index) {
    return categories.get(index);
  }

  /** Returns the category with the given name, or null. */
  @Nullable public Category findCategory(String name) {
    for (Category category : categories)
      if (category.name.equals(name))
        return category;
    return null;
  }

  /** Returns the category the given item belongs to. */
  public Category categoryOf(Item item) {
    return categories.get(item.categoryIndex);
  }

  /** All items of all categories, category by category. */
  public ImmutableList<Item> items() {
    return items;
  }

  public int distance(int pos1, int pos2) {
    return geometry.distance(pos1, pos2, size);
  }

  public boolean isAdjacent(int pos1, int pos2) {
    return geometry.isAdjacent(pos1, pos2, size);
  }

  public boolean isEdge(int pos) {
    return pos == 1 || pos == size;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Board)) return false;
    Board that = (Board) o;
    return this.size == that.size
        && this.geometry == that.geometry
        && this.categories.equals(that.categories);
  }

  @Override public int hashCode() {
    return categories.hashCode() * 31 + size;
  }

  @Override public String toString() {
    return size + "x" + categories.size() + " " + geometry + " " + categories;
  }
}
