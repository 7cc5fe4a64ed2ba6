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

/**
 * Thrown when a clue reaches code that has no translation for its kind.  This
 * is always a bug: the catalog only emits kinds the rest of the system
 * handles.
 */
public class UnsupportedClueException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public UnsupportedClueException(Clue clue) {
    super("Unsupported clue: " + clue.type + " " + clue);
  }
}
