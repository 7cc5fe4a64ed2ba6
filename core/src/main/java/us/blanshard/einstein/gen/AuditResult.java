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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The outcome of auditing a clue set: the deepest question found, if any, and
 * whether it is deep enough.
 */
@Immutable
public final class AuditResult {

  /** The deepest question found, or null if no answer is reachable at all. */
  @Nullable public final Question question;

  public final int minPathLen;

  AuditResult(@Nullable Question question, int minPathLen) {
    this.question = question;
    this.minPathLen = minPathLen;
  }

  /** The path length of the chosen question, or -1 if there is none. */
  public int pathLength() {
    return question == null ? -1 : question.pathLength;
  }

  /** Tells whether the deepest question reaches the minimum path length. */
  public boolean passed() {
    return question != null && question.pathLength >= minPathLen;
  }

  @Override public String toString() {
    return (passed() ? "passed: " : "failed: ") + question;
  }
}
