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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;

import javax.annotation.concurrent.Immutable;

/**
 * A deduplicated collection of clues grouped by type, in the order they were
 * generated.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class CluePool {
  private final ImmutableSet<Clue> clues;
  private final ImmutableListMultimap<Clue.Type, Clue> byType;

  public CluePool(Collection<? extends Clue> clues) {
    this.clues = ImmutableSet.copyOf(clues);
    ImmutableListMultimap.Builder<Clue.Type, Clue> builder = ImmutableListMultimap.builder();
    for (Clue clue : this.clues)
      builder.put(clue.type, clue);
    this.byType = builder.build();
  }

  /** Returns the clues of the given type, possibly none. */
  public ImmutableList<Clue> get(Clue.Type type) {
    return byType.get(type);
  }

  public ImmutableSet<Clue> all() {
    return clues;
  }

  public boolean contains(Clue clue) {
    return clues.contains(clue);
  }

  public int size() {
    return clues.size();
  }

  /** The types that have at least one clue. */
  public ImmutableSet<Clue.Type> types() {
    return byType.keySet();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Clue.Type type : byType.keySet())
      sb.append(type).append('=').append(byType.get(type).size()).append(' ');
    return sb.toString().trim();
  }
}
