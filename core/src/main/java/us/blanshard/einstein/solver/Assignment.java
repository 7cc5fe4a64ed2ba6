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

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;

/**
 * A complete assignment of values to the variables of a {@link Model}: one
 * solution found by the {@link Solver}.
 */
@Immutable
public final class Assignment {
  private final int[] values;

  Assignment(int[] values) {
    this.values = values;
  }

  public int get(IntVar var) {
    return values[var.index];
  }

  public int size() {
    return values.length;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Assignment)) return false;
    return Arrays.equals(this.values, ((Assignment) o).values);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override public String toString() {
    return Arrays.toString(values);
  }
}
