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
import java.util.Arrays;

/**
 * Base class for value types: equals/hashCode/toString are generated by reflection over the
 * public non-static fields, skipping those marked {@link Transient}.
 *
 * Subclasses must be public (or nested public) so that their fields can be read from here.
 */
public abstract class Struct {

  @Override
  public final boolean equals(final Object other) {
    if (this == other)
      return true;
    if (other == null || getClass() != other.getClass())
      return false;

    Boolean result = (Boolean) ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      public Control visit(Field field, Object value) {
        Object otherValue;
        try {
          otherValue = field.get(other);
        } catch (IllegalAccessException e) {
          throw new IllegalArgumentException(e);
        }
        if (value == null)
          return otherValue == null ? Control.CONTINUE : breakAndReturn(false);
        if (field.getType().isArray())
          return Arrays.deepEquals(new Object[] {value}, new Object[] {otherValue}) ?
              Control.CONTINUE : breakAndReturn(false);
        return value.equals(otherValue) ? Control.CONTINUE : breakAndReturn(false);
      }
    });

    return result == null;
  }

  @Override
  public final int hashCode() {
    final int prime = 31;
    final int[] result = {1};
    ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        result[0] *= prime;
        if (value != null) {
          if (field.getType().isArray())
            result[0] += Arrays.deepHashCode(new Object[] {value});
          else
            result[0] += value.hashCode();
        }
        return Control.CONTINUE;
      }
    });
    return result[0];
  }

  @Override
  public final String toString() {
    final StringBuilder buf = new StringBuilder(getClass().getSimpleName() + "{ ");
    ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      private boolean needsComma = false;

      @Override
      protected Control visit(Field field, Object value) {
        if (needsComma)
          buf.append(", ");
        needsComma = true;
        buf.append(field.getName()).append(": ");

        if (value == null)
          buf.append("(null)");
        else if (field.getType().isArray())
          buf.append(arrayToString(value));
        else
          buf.append(value);
        return Control.CONTINUE;
      }
    });
    return buf.append(" }").toString();
  }

  // Wrapping in an Object[] lets Arrays deal with primitive arrays too.
  private static String arrayToString(Object array) {
    String wrapped = Arrays.deepToString(new Object[] {array});
    return wrapped.substring(1, wrapped.length() - 1);
  }
}
