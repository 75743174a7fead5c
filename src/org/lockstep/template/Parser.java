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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lockstep.template.Template.ParseException;

/**
 * Recursive descent parser from (already unescaped) template text to {@link Node}s.
 *
 * <pre>
 * template     := (literal | '\' CHAR | '@' variable_ref | '$' binding)*
 * binding      := group | variable_ref
 * group        := '(' template ')' separator
 * separator    := '*' | CHAR '*' | '(' STRING ')' '*'
 * variable_ref := ident | '{' ident (':' ident)? '}'
 * ident        := (alpha | '_') (alnum | '_')*
 * </pre>
 *
 * Inside a group, parentheses must balance: an unescaped '(' opens a nesting level of literal
 * text, and the ')' that closes the group is the first unescaped one at level 0.
 */
final class Parser {

  private static final int ESCAPE = '\\';
  private static final int HIDDEN = '@';
  private static final int BINDING = '$';
  private static final int OPEN = '(';
  private static final int CLOSE = ')';
  private static final int REPEAT = '*';
  private static final int OPEN_BRACE = '{';
  private static final int CLOSE_BRACE = '}';
  private static final int ALIAS = ':';

  /** Position of a code point in the source, 1-based. */
  private static class Position {
    final int line;
    final int column;

    Position(int line, int column) {
      this.line = line;
      this.column = column;
    }
  }

  /** Cursor over the code points of the source, with one code point of lookahead. */
  private static class Cursor {
    private final int[] codePoints;
    private int index = 0;
    private int line = 1;
    private int column = 1;

    Cursor(String source) {
      this.codePoints = source.codePoints().toArray();
    }

    boolean hasNext() {
      return index < codePoints.length;
    }

    /** The next code point, or -1 at the end of the source. */
    int peek() {
      return hasNext() ? codePoints[index] : -1;
    }

    /** Consumes and returns the next code point, or -1 at the end of the source. */
    int next() {
      if (!hasNext())
        return -1;
      int c = codePoints[index++];
      if (c == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
      return c;
    }

    Position position() {
      return new Position(line, column);
    }
  }

  private final Cursor cursor;
  private final Options options;

  private Parser(String source, Options options) {
    this.cursor = new Cursor(source);
    this.options = options;
  }

  /**
   * Parses |source| into its top-level nodes.
   *
   * @throws ParseException if |source| is malformed.
   * @throws Template.TooDeeplyNestedException if groups nest deeper than the options allow.
   */
  static List<Node> parse(String source, Options options) {
    Parser parser = new Parser(source, options);
    return Collections.unmodifiableList(parser.parseSequence(0, null));
  }

  /**
   * Parses nodes up to the end of the source or, within the group opened at |groupStart|, up
   * to the ')' closing it (which is consumed).
   */
  private List<Node> parseSequence(int depth, Position groupStart) {
    List<Node> nodes = new ArrayList<Node>();
    StringBuilder literal = new StringBuilder();
    int parentheses = 0;

    while (cursor.hasNext()) {
      Position position = cursor.position();
      int c = cursor.next();

      if (c == ESCAPE) {
        if (!cursor.hasNext())
          throw error("Expected a character to escape after '\\'", position);
        literal.appendCodePoint(cursor.next());
      } else if (c == HIDDEN) {
        flush(literal, nodes);
        nodes.add(parseHiddenVariable(position));
      } else if (c == BINDING) {
        flush(literal, nodes);
        nodes.add(parseBinding(depth, position));
      } else if (groupStart != null && c == OPEN) {
        parentheses++;
        literal.appendCodePoint(c);
      } else if (groupStart != null && c == CLOSE) {
        if (parentheses == 0) {
          flush(literal, nodes);
          return nodes;
        }
        parentheses--;
        literal.appendCodePoint(c);
      } else {
        literal.appendCodePoint(c);
      }
    }

    if (groupStart != null)
      throw error("Unterminated repetition group, expected ')'", groupStart);
    flush(literal, nodes);
    return nodes;
  }

  private static void flush(StringBuilder literal, List<Node> nodes) {
    if (literal.length() == 0)
      return;
    nodes.add(new Node.Literal(literal.toString()));
    literal.setLength(0);
  }

  /**
   * After '$': either a group or a variable.
   */
  private Node parseBinding(int depth, Position start) {
    if (!cursor.hasNext())
      throw error("Expected a variable or a repetition group after '$'", start);
    if (cursor.peek() == OPEN)
      return parseGroup(depth + 1);
    String[] names = parseVariableNames();
    return new Node.Variable(names[0], names[1]);
  }

  /**
   * After '@': a variable only.
   */
  private Node parseHiddenVariable(Position start) {
    if (!cursor.hasNext())
      throw error("Expected a variable after '@'", start);
    if (cursor.peek() == OPEN)
      throw error("Repetition groups can't be hidden, use '$(' instead of '@('", start);
    String[] names = parseVariableNames();
    return new Node.HiddenVariable(names[0], names[1]);
  }

  private Node parseGroup(int depth) {
    Position start = cursor.position();
    if (depth > options.maxNestingDepth) {
      throw new Template.TooDeeplyNestedException(
          describe("Repetition groups are nested more than " + options.maxNestingDepth + " deep",
              start));
    }
    advanceOver(OPEN, "'('");
    List<Node> children = parseSequence(depth, start);
    return new Node.Group(children, parseSeparator());
  }

  /**
   * Right after the ')' of a group: "*", "C*" or "(STRING)*".
   */
  private String parseSeparator() {
    Position position = cursor.position();
    int c = cursor.next();
    if (c == -1)
      throw error("Expected a separator or '*' after repetition group", position);
    if (c == REPEAT)
      return null;

    String separator;
    if (c == OPEN) {
      StringBuilder buf = new StringBuilder();
      while (cursor.hasNext() && cursor.peek() != CLOSE)
        buf.appendCodePoint(cursor.next());
      if (!cursor.hasNext())
        throw error("Unterminated separator, expected ')'", position);
      cursor.next();
      separator = buf.toString();
    } else {
      separator = new String(Character.toChars(c));
    }

    if (cursor.peek() != REPEAT)
      throw error("Expected '*' after repetition group separator", cursor.position());
    cursor.next();
    return separator;
  }

  /**
   * "name", "{name}" or "{name:alias}"; returns {name, alias} with a null alias if there is
   * none.
   */
  private String[] parseVariableNames() {
    if (cursor.peek() != OPEN_BRACE)
      return new String[] {parseIdentifier(), null};

    cursor.next();
    String name = parseIdentifier();
    Position position = cursor.position();
    int c = cursor.next();
    if (c == CLOSE_BRACE)
      return new String[] {name, null};
    if (c != ALIAS)
      throw error("Expected ':' or '}'", position);

    String alias = parseIdentifier();
    advanceOver(CLOSE_BRACE, "'}'");
    return new String[] {name, alias};
  }

  private String parseIdentifier() {
    Position position = cursor.position();
    int start = cursor.peek();
    if (!(Character.isLetter(start) || start == '_'))
      throw error("Expected identifier", position);

    StringBuilder ident = new StringBuilder();
    ident.appendCodePoint(cursor.next());
    while (Character.isLetterOrDigit(cursor.peek()) || cursor.peek() == '_')
      ident.appendCodePoint(cursor.next());
    return ident.toString();
  }

  private void advanceOver(int expected, String description) {
    Position position = cursor.position();
    if (cursor.next() != expected)
      throw error("Expected " + description, position);
  }

  private static ParseException error(String message, Position position) {
    return new ParseException(message, position.line, position.column);
  }

  private static String describe(String message, Position position) {
    return message + " (line " + position.line + ", column " + position.column + ")";
  }
}
