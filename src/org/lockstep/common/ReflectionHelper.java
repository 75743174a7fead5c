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

package org.lockstep.common;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Reflection utilities.
 */
public class ReflectionHelper {

  private ReflectionHelper() {}

  public static abstract class FieldVisitor {
    protected enum Control { CONTINUE, BREAK }

    private Object returnValue = null;

    protected abstract Control visit(Field field, Object value);

    protected Control breakAndReturn(Object value) {
      returnValue = value;
      return Control.BREAK;
    }
  }

  /**
   * Whether |field| is part of the value of its object, i.e. public, non-static and not
   * {@link Transient}.
   */
  public static boolean isValueField(Field field) {
    return !Modifier.isStatic(field.getModifiers()) && field.getAnnotation(Transient.class) == null;
  }

  /**
   * Visits each value field of |obj| until the visitor breaks, returning whatever value the
   * visitor broke with (or null).
   */
  public static Object forEach(Object obj, FieldVisitor visitor) {
    for (Field field : obj.getClass().getFields()) {
      if (!isValueField(field))
        continue;

      Object fieldValue;
      try {
        fieldValue = field.get(obj);
      } catch (IllegalAccessException e) {
        throw new IllegalArgumentException(e);
      }

      if (visitor.visit(field, fieldValue) == FieldVisitor.Control.BREAK)
        break;
    }

    return visitor.returnValue;
  }

}
