// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lockstep.json;

/**
 * A read-only view over some binding data as JSON.
 *
 * Templates only need three things from a value: its text (for scalars), its length and
 * elements (for sequences), and its members by name (for the objects holding the bindings).
 * Operations that don't apply to a view's {@link Type} throw
 * {@link UnsupportedOperationException}.
 *
 * @author kalman
 *
 */
public interface JsonView {

  enum Type {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT
  }

  Type getType();

  boolean isNull();

  /**
   * The natural display form of the value: no locale formatting, no padding. Applies to every
   * type other than NULL and ARRAY.
   */
  String asText();

  // Operations over arrays.
  int asArrayLength();
  JsonView asArrayGet(int index);

  /**
   * The member called |name| of an OBJECT, or null if there is no such member. A member that
   * exists but holds null is returned as a view of type NULL.
   */
  JsonView get(String name);
}
