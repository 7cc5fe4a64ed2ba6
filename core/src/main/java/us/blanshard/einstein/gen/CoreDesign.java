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

import com.google.common.collect.ImmutableList;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A starter set of clues for a puzzle, before uniqueness is enforced, and the
 * pool clues it didn't use.
 */
@Immutable
public final class CoreDesign {
  public final ImmutableList<Clue> anchors;
  public final ImmutableList<Clue> core;
  public final ImmutableList<Clue> remaining;

  public CoreDesign(List<Clue> anchors, List<Clue> core, List<Clue> remaining) {
    this.anchors = ImmutableList.copyOf(anchors);
    this.core = ImmutableList.copyOf(core);
    this.remaining = ImmutableList.copyOf(remaining);
  }

  @Override public String toString() {
    return "CoreDesign{core=" + core.size() + ", remaining=" + remaining.size() + "}";
  }
}
