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

import us.blanshard.einstein.clue.Clue;

import com.google.common.collect.Lists;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

/**
 * How much a starter core is reshaped before uniqueness is enforced.  Each
 * level moves clues between the core and the shuffled remaining pool; anchors
 * always stay in the core.
 *
 * @author Luke Blanshard
 */
public enum Difficulty {

  /** Only positions, links and neighbors, as in the original riddle. */
  CLASSIC {
    @Override void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size) {
      int target = core.size();
      for (Iterator<Clue> it = core.iterator(); it.hasNext(); ) {
        Clue clue = it.next();
        if (!anchors.contains(clue) && !CLASSIC_TYPES.contains(clue.type)) {
          it.remove();
          remaining.add(clue);
        }
      }
      for (Iterator<Clue> it = remaining.iterator(); it.hasNext() && core.size() < target; ) {
        Clue clue = it.next();
        if (CLASSIC_TYPES.contains(clue.type)) {
          it.remove();
          core.add(clue);
        }
      }
    }
  },

  /**
   * Returns half the core, at least one clue, to the pool, taken from the end
   * of the core and skipping anchors.  A core of one clue is left alone.
   */
  EASY {
    @Override void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size) {
      int count = Math.max(1, core.size() / 2);
      if (core.size() <= count) return;
      List<Clue> dropped = Lists.newArrayList();
      for (ListIterator<Clue> it = core.listIterator(core.size()); it.hasPrevious() && count > 0; ) {
        Clue clue = it.previous();
        if (!anchors.contains(clue)) {
          it.remove();
          dropped.add(0, clue);
          --count;
        }
      }
      remaining.addAll(dropped);
    }
  },

  MEDIUM {
    @Override void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size) {}
  },

  /** Adds half a row's worth of pool clues. */
  HARD {
    @Override void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size) {
      moveFront(remaining, core, Math.max(1, size / 2));
    }
  },

  /** Adds a row's worth of pool clues. */
  EXPERT {
    @Override void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size) {
      moveFront(remaining, core, Math.max(2, size));
    }
  };

  private static final EnumSet<Clue.Type> CLASSIC_TYPES =
      EnumSet.of(Clue.Type.POSITIONAL, Clue.Type.DIRECT_LINK, Clue.Type.RELATIVE_POS);

  /**
   * Moves clues between the core and the remaining pool.  The remaining pool
   * is expected to be in random order already.
   */
  abstract void reshape(List<Clue> core, Set<Clue> anchors, List<Clue> remaining, int size);

  private static void moveFront(List<Clue> from, List<Clue> to, int count) {
    List<Clue> moved = from.subList(0, Math.min(count, from.size()));
    to.addAll(moved);
    moved.clear();
  }
}
