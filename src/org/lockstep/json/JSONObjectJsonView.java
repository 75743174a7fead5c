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

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A JSON view of a parsed JSON document.
 *
 * @author kalman
 *
 */
public class JSONObjectJsonView extends JsonViewImpl {

  private static class JSONArrayJsonView extends JsonViewImpl {
    private final JSONArray array;

    private JSONArrayJsonView(JSONArray array) {
      this.array = array;
    }

    @Override
    public Type getType() {
      return Type.ARRAY;
    }

    @Override
    public int asArrayLength() {
      return array.length();
    }

    @Override
    public JsonView asArrayGet(int index) {
      if (index < 0 || index >= array.length())
        throw new IndexOutOfBoundsException(index + " out of " + array.length());
      return wrap(array.opt(index));
    }

    @Override
    public String toString() {
      return array.toString();
    }
  }

  private final JSONObject json;

  public JSONObjectJsonView(JSONObject json) {
    this.json = json;
  }

  /**
   * Parses |text| as a JSON object.
   *
   * @throws org.json.JSONException if |text| isn't a JSON object.
   */
  public static JSONObjectJsonView parse(String text) {
    return new JSONObjectJsonView(new JSONObject(text));
  }

  /**
   * Views any value found inside a JSON document.
   */
  public static JsonView wrap(Object item) {
    if (item instanceof JSONObject)
      return new JSONObjectJsonView((JSONObject) item);
    else if (item instanceof JSONArray)
      return new JSONArrayJsonView((JSONArray) item);
    else if (item == null || item == JSONObject.NULL)
      return new PojoJsonView(null);
    else
      return new PojoJsonView(item);
  }

  @Override
  public Type getType() {
    return Type.OBJECT;
  }

  @Override
  public String asText() {
    return json.toString();
  }

  @Override
  public JsonView get(String name) {
    if (!json.has(name))
      return null;
    return wrap(json.opt(name));
  }

  @Override
  public String toString() {
    return json.toString();
  }

}
