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

package org.lockstep.template;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class ParseExceptionTemplateTest {

  @Test
  public void invalidName() {
    expectParseException("hello $1foo");
    expectParseException("hello ${1foo}");
    expectParseException("hello ${foo:1bar}");
    expectParseException("hello $ foo");
    expectParseException("hello @-foo");
    expectParseException("hello ${foo|bar}");
    expectParseException("hello ${}");
  }

  @Test
  public void unterminatedBraces() {
    expectParseException("hello ${foo");
    expectParseException("hello ${foo:bar");
    expectParseException("hello ${foo:bar baz");
  }

  @Test
  public void unterminatedGroup() {
    expectParseException("$(unterminated");
    expectParseException("$(");
    expectParseException("$($xs (unbalanced)*");
    expectParseException("$($xs $($ys)*");
  }

  @Test
  public void missingRepeat() {
    expectParseException("$($xs)");
    expectParseException("$($xs),");
    expectParseException("$($xs),,");
    expectParseException("$($xs)(, )");
    expectParseException("$($xs)(, )x");
    expectParseException("$($xs)(, ");
  }

  @Test
  public void danglingSpecialCharacters() {
    expectParseException("hello $");
    expectParseException("hello @");
    expectParseException("hello \\");
    expectParseException("$(\\");
  }

  @Test
  public void hiddenGroup() {
    expectParseException("@($xs)*");
  }

  @Test
  public void position() {
    try {
      new Template("one\ntwo $(three $four");
      fail();
    } catch (Template.ParseException expected) {
      assertEquals(2, expected.line);
      assertEquals(6, expected.column);
      assertTrue(expected.getMessage(), expected.getMessage().endsWith("(line 2, column 6)"));
    }

    try {
      new Template("${foo|bar}");
      fail();
    } catch (Template.ParseException expected) {
      assertEquals(1, expected.line);
      assertEquals(6, expected.column);
    }
  }

  @Test
  public void tooDeeplyNested() {
    Options options = Options.builder().maxNestingDepth(2).build();
    new Template("$($($xs)*)*", options);
    try {
      new Template("$($($($xs)*)*)*", options);
      fail();
    } catch (Template.TooDeeplyNestedException expected) {}
  }

  @Test
  public void pathologicalNesting() {
    StringBuilder source = new StringBuilder();
    for (int i = 0; i < 100000; i++)
      source.append("$(");
    try {
      new Template(source.toString());
      fail();
    } catch (Template.TooDeeplyNestedException expected) {}
  }

  private static void expectParseException(String template) {
    try {
      new Template(template);
      fail(template);
    } catch (Template.ParseException expected) {}
  }
}
