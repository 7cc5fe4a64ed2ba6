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

import com.google.common.collect.ComparisonChain;

/**
 * A simple clue that can stand on its own or be one side of a {@link
 * Connective}: either a {@link Positional} or a {@link DirectLink}.  Facts
 * have a total order so symmetric connectives can be made canonical.
 */
public abstract class Fact extends Clue implements Comparable<Fact> {

  protected Fact(Type type) {
    super(type);
  }

  @Override public int compareTo(Fact that) {
    if (this.type != that.type)
      return this.type.compareTo(that.type);
    ComparisonChain chain = ComparisonChain.start();
    if (this.type == Type.POSITIONAL) {
      Positional a = (Positional) this;
      Positional b = (Positional) that;
      chain = chain.compare(a.position, b.position).compare(a.item, b.item);
    } else {
      DirectLink a = (DirectLink) this;
      DirectLink b = (DirectLink) that;
      chain = chain.compare(a.first, b.first).compare(a.second, b.second);
    }
    return chain.result();
  }
}
