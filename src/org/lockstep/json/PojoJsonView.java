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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A JSON view over an immutable Java object.
 *
 * Booleans, numbers, strings, characters and enums are scalars; arrays (primitive ones too) and
 * collections are arrays; maps and everything else are objects, whose members are map entries
 * or public fields respectively.
 */
public class PojoJsonView implements JsonView {

  private final Object pojo;
  private final Type type;

  // Sets and the like have an iteration order but no positional access; copied once.
  private final List<?> elements;

  public PojoJsonView(Object pojo) {
    this.pojo = pojo;
    this.type = typeOf(pojo);
    if (pojo instanceof List)
      this.elements = (List<?>) pojo;
    else if (pojo instanceof Collection)
      this.elements = new ArrayList<Object>((Collection<?>) pojo);
    else
      this.elements = null;
  }

  private static Type typeOf(Object pojo) {
    if (pojo == null)
      return Type.NULL;
    Class<?> clazz = pojo.getClass();
    if (Boolean.class.isAssignableFrom(clazz))
      return Type.BOOLEAN;
    if (Number.class.isAssignableFrom(clazz))
      return Type.NUMBER;
    if (String.class.isAssignableFrom(clazz) ||
        Character.class.isAssignableFrom(clazz) ||
        Enum.class.isAssignableFrom(clazz))
      return Type.STRING;
    if (clazz.isArray() || Collection.class.isAssignableFrom(clazz))
      return Type.ARRAY;
    return Type.OBJECT;
  }

  @Override
  public Type getType() {
    return type;
  }

  @Override
  public boolean isNull() {
    return type == Type.NULL;
  }

  @Override
  public String asText() {
    if (type == Type.NULL || type == Type.ARRAY)
      throw new UnsupportedOperationException("Unexpected type " + type + ", expected a scalar");
    return String.valueOf(pojo);
  }

  @Override
  public int asArrayLength() {
    checkIsType(Type.ARRAY);
    if (pojo.getClass().isArray())
      return Array.getLength(pojo);
    return elements.size();
  }

  @Override
  public JsonView asArrayGet(int index) {
    checkIsType(Type.ARRAY);
    if (pojo.getClass().isArray())
      return new PojoJsonView(Array.get(pojo, index));
    return new PojoJsonView(elements.get(index));
  }

  @Override
  public JsonView get(String name) {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) pojo;
      if (!map.containsKey(name))
        return null;
      return new PojoJsonView(map.get(name));
    }

    Field field;
    try {
      field = pojo.getClass().getField(name);
    } catch (NoSuchFieldException e) {
      return null;
    }
    if (Modifier.isStatic(field.getModifiers()))
      return null;
    try {
      return new PojoJsonView(field.get(pojo));
    } catch (IllegalAccessException e) {
      throw new UnsupportedOperationException(e);
    }
  }

  private void checkIsType(Type t) {
    if (type != t)
      throw new UnsupportedOperationException("Unexpected type " + type + ", expected " + t);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (o == null || o.getClass() != getClass())
      return false;
    PojoJsonView other = (PojoJsonView) o;
    if (pojo == null)
      return other.pojo == null;
    else
      return pojo.equals(other.pojo);
  }

  @Override
  public int hashCode() {
    return pojo == null ? 0 : pojo.hashCode();
  }

  @Override
  public String toString() {
    return pojo + "";
  }

}
