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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.einstein.core.Item;
import us.blanshard.einstein.core.Solution;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * Two facts joined by a logical connective.  The connective is given by the
 * clue's type:
 *
 * <ul>
 * <li> IF_THEN: if P then Q.
 * <li> IF_NOT_THEN_NOT: if not P then not Q, which is the same as Q implies P.
 * <li> EITHER_OR: exactly one of P and Q.
 * <li> IF_AND_ONLY_IF: P and Q are both true or both false.
 * </ul>
 *
 * <p> The last two are symmetric, so their facts are kept in canonical order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Connective extends Clue {
  public final Fact p;
  public final Fact q;

  public Connective(Type type, Fact p, Fact q) {
    super(type);
    checkArgument(type.isConnective(), "Not a connective: %s", type);
    checkNotNull(q);
    checkArgument(!p.equals(q), "Same fact on both sides: %s", p);
    if ((type == Type.EITHER_OR || type == Type.IF_AND_ONLY_IF) && p.compareTo(q) > 0) {
      this.p = q;
      this.q = p;
    } else {
      this.p = p;
      this.q = q;
    }
  }

  @Override public boolean isTrueOf(Solution solution) {
    boolean a = p.isTrueOf(solution);
    boolean b = q.isTrueOf(solution);
    switch (type) {
      case IF_THEN:
        return !a || b;
      case IF_NOT_THEN_NOT:
        return a || !b;
      case EITHER_OR:
        return a != b;
      case IF_AND_ONLY_IF:
        return a == b;
      default:
        throw new UnsupportedClueException(this);
    }
  }

  @Override public ImmutableSortedSet<Item> getItems() {
    return ImmutableSortedSet.<Item>naturalOrder().addAll(p.getItems()).addAll(q.getItems()).build();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Connective that = (Connective) o;
    return this.type == that.type && this.p.equals(that.p) && this.q.equals(that.q);
  }

  @Override public int hashCode() {
    return Objects.hashCode(type, p, q);
  }

  @Override public String toString() {
    return type + "(" + p + ", " + q + ")";
  }
}
