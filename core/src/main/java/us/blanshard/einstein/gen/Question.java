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

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.einstein.core.Category;
import us.blanshard.einstein.core.Item;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A question to ask about a puzzle: which item of the attribute category
 * shares a position with the subject item.
 */
@Immutable
public final class Question {
  public final Item subject;
  public final Category attribute;
  public final Item answer;

  /** The number of co-occurrence steps from the subject to the answer. */
  public final int pathLength;

  public Question(Item subject, Category attribute, Item answer, int pathLength) {
    checkArgument(answer.categoryIndex == attribute.index, "%s is not in %s", answer, attribute.name);
    checkArgument(subject.categoryIndex != attribute.index, "Asking %s about its own category", subject);
    this.subject = subject;
    this.attribute = attribute;
    this.answer = answer;
    this.pathLength = pathLength;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Question)) return false;
    Question that = (Question) o;
    return this.pathLength == that.pathLength
        && this.subject.equals(that.subject)
        && this.attribute.equals(that.attribute)
        && this.answer.equals(that.answer);
  }

  @Override public int hashCode() {
    return Objects.hashCode(subject, attribute.name, answer, pathLength);
  }

  @Override public String toString() {
    return subject + " -> " + attribute.name + " = " + answer.name + " (" + pathLength + ")";
  }
}
