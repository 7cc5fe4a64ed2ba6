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

/**
 * Thrown when a clue set can't be brought to a single solution within the
 * assembler's bounds.  Callers may retry with a fresh solution.
 */
public class AmbiguousPuzzleException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public AmbiguousPuzzleException(String message) {
    super(message);
  }

  public AmbiguousPuzzleException(String message, Throwable cause) {
    super(message, cause);
  }
}
