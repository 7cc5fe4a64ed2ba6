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
package us.blanshard.einstein.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.concurrent.Immutable;

/**
 * A variable of a {@link Model}, ranging over the integers lo..hi.  Boolean
 * variables range over 0..1.
 */
@Immutable
public final class IntVar {

  /** The variable's index within its model. */
  public final int index;
  public final int lo;
  public final int hi;
  public final String name;

  IntVar(int index, int lo, int hi, String name) {
    this.index = index;
    this.lo = lo;
    this.hi = hi;
    this.name = checkNotNull(name);
  }

  /** The bit-set of all values in lo..hi. */
  long fullDomain() {
    long answer = 0;
    for (int v = lo; v <= hi; ++v)
      answer |= 1L << v;
    return answer;
  }

  @Override public String toString() {
    return name;
  }
}
