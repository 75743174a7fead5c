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
 * {@link JsonView} where nothing is supported; subclasses override what their type allows.
 */
public abstract class JsonViewImpl implements JsonView {

  @Override
  public boolean isNull() {
    return false;
  }

  @Override
  public String asText() {
    throw unsupported("asText");
  }

  @Override
  public int asArrayLength() {
    throw unsupported("asArrayLength");
  }

  @Override
  public JsonView asArrayGet(int index) {
    throw unsupported("asArrayGet");
  }

  @Override
  public JsonView get(String name) {
    throw unsupported("get");
  }

  private UnsupportedOperationException unsupported(String operation) {
    return new UnsupportedOperationException(operation + " is not supported by " + getType());
  }

}
