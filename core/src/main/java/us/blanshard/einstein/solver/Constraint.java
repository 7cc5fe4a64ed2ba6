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

import com.google.common.collect.ImmutableList;

/**
 * A restriction on the values of some of a model's variables.  Constraints
 * narrow variable domains; the search relies on them to reject every complete
 * assignment that violates them.
 *
 * @author Luke Blanshard
 */
public abstract class Constraint {

  /** The variables this constraint watches. */
  public final ImmutableList<IntVar> vars;

  /** The constraint's index within its model, set when it is added. */
  int index = -1;

  protected Constraint(ImmutableList<IntVar> vars) {
    this.vars = vars;
  }

  /**
   * Removes values from the domains of this constraint's variables that cannot
   * be part of any assignment satisfying it.  Returns false if some domain
   * becomes empty.
   */
  abstract boolean propagate(Domains.Builder domains);
}
