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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.AbstractCollection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.lockstep.json.JsonView.Type;

public class PojoJsonViewTest {

  public static class EmptyObject {
  }

  public static class TestObject {
    public static final String CONSTANT = "constant";

    public boolean boolean1 = false;
    public Boolean boolean2 = true;

    public int number1 = 0;
    public Integer number2 = 42;
    public double number3 = 0;
    public Double number4 = 42.42;
    public long number5 = 0;
    public Long number6 = 42L;

    public String string1 = "";
    public String string2 = "hello world";
    public char char1 = 'c';

    public List<TestObject> array1 = new ArrayList<TestObject>();
    public TestObject[] array2 = new TestObject[1];
    public int[] array3 = {1, 2, 3};

    public Map<String, TestObject> object1 = new HashMap<String, TestObject>();
    public TestObject object2 = null;

    String hidden = "hidden";
  }

  private TestObject test;

  @Before
  public void setUp() {
    test = new TestObject();
    test.array2[0] = new TestObject();
    test.object1.put("key1", new TestObject());
    test.object1.put("key2", null);
  }

  @Test
  public void emptyObject() {
    JsonView json = new PojoJsonView(new EmptyObject());

    assertEquals(Type.OBJECT, json.getType());
    assertFalse(json.isNull());
    assertNull(json.get("anything"));
  }

  @Test
  public void types() {
    JsonView json = new PojoJsonView(test);
    assertEquals(Type.OBJECT, json.getType());

    assertEquals(Type.BOOLEAN, json.get("boolean1").getType());
    assertEquals(Type.BOOLEAN, json.get("boolean2").getType());
    for (int i = 1; i <= 6; i++)
      assertEquals(Type.NUMBER, json.get("number" + i).getType());
    assertEquals(Type.STRING, json.get("string1").getType());
    assertEquals(Type.STRING, json.get("char1").getType());
    assertEquals(Type.STRING, new PojoJsonView(Type.NULL).getType());
    assertEquals(Type.ARRAY, json.get("array1").getType());
    assertEquals(Type.ARRAY, json.get("array2").getType());
    assertEquals(Type.ARRAY, json.get("array3").getType());
    assertEquals(Type.OBJECT, json.get("object1").getType());
    assertEquals(Type.NULL, json.get("object2").getType());
    assertTrue(json.get("object2").isNull());
  }

  @Test
  public void scalars() {
    JsonView json = new PojoJsonView(test);
    assertEquals("false", json.get("boolean1").asText());
    assertEquals("42", json.get("number2").asText());
    assertEquals("42.42", json.get("number4").asText());
    assertEquals("42", json.get("number6").asText());
    assertEquals("hello world", json.get("string2").asText());
    assertEquals("c", json.get("char1").asText());
    assertEquals("NULL", new PojoJsonView(Type.NULL).asText());
  }

  @Test
  public void arrays() {
    JsonView json = new PojoJsonView(test);
    assertEquals(0, json.get("array1").asArrayLength());
    assertEquals(1, json.get("array2").asArrayLength());
    assertEquals(Type.OBJECT, json.get("array2").asArrayGet(0).getType());

    JsonView array3 = json.get("array3");
    assertEquals(3, array3.asArrayLength());
    assertEquals("2", array3.asArrayGet(1).asText());

    JsonView set = new PojoJsonView(new LinkedHashSet<String>(asList("b", "a")));
    assertEquals(2, set.asArrayLength());
    assertEquals("a", set.asArrayGet(1).asText());
  }

  public static class CountingCollection extends AbstractCollection<Integer> {
    private final List<Integer> items;
    public int iterations = 0;

    public CountingCollection(Integer... items) {
      this.items = asList(items);
    }

    @Override
    public Iterator<Integer> iterator() {
      iterations++;
      return items.iterator();
    }

    @Override
    public int size() {
      return items.size();
    }
  }

  @Test
  public void collectionsAreCopiedOnce() {
    CountingCollection collection = new CountingCollection(3, 1, 2);
    JsonView json = new PojoJsonView(collection);

    assertEquals(3, json.asArrayLength());
    for (int i = 0; i < 10; i++) {
      assertEquals("3", json.asArrayGet(0).asText());
      assertEquals("2", json.asArrayGet(2).asText());
    }
    assertEquals(1, collection.iterations);
  }

  @Test
  public void get() {
    JsonView json = new PojoJsonView(test);
    assertEquals("", json.get("string1").asText());
    assertEquals("", json.get("object1").get("key1").get("string1").asText());
    assertEquals("hello world", json.get("object1").get("key1").get("string2").asText());
    assertTrue(json.get("object1").get("key2").isNull());
    assertNull(json.get("object1").get("key3"));
    assertNull(json.get("asdasd"));
    assertNull(json.get("hidden"));
    assertNull(json.get("CONSTANT"));
  }

  @Test
  public void wrongType() {
    JsonView json = new PojoJsonView(test);
    try {
      json.asArrayLength();
      fail();
    } catch (UnsupportedOperationException expected) {}
    try {
      json.get("array3").asText();
      fail();
    } catch (UnsupportedOperationException expected) {}
    try {
      json.get("string1").get("length");
      fail();
    } catch (UnsupportedOperationException expected) {}
    try {
      new PojoJsonView(null).asText();
      fail();
    } catch (UnsupportedOperationException expected) {}
  }

  @Test
  public void equality() {
    assertEquals(new PojoJsonView("a"), new PojoJsonView("a"));
    assertEquals(new PojoJsonView(null), new PojoJsonView(null));
    assertFalse(new PojoJsonView("a").equals(new PojoJsonView(null)));
    assertEquals(new PojoJsonView(1).hashCode(), new PojoJsonView(1).hashCode());
  }

}
