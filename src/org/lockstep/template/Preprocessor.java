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

/**
 * Transformations of raw template source applied once, before parsing.
 */
public final class Preprocessor {

  private Preprocessor() {}

  /**
   * Decodes the escape sequences \\, \n, \r, \t and \xHH (two hex digits, giving the character
   * with that code). Anything else, including a trailing '\' or a \x without two hex digits,
   * is left exactly as it is.
   */
  public static String unescape(String raw) {
    StringBuilder buf = new StringBuilder(raw.length());
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i++);
      if (c != '\\' || i == raw.length()) {
        buf.append(c);
        continue;
      }

      char next = raw.charAt(i++);
      switch (next) {
        case '\\': buf.append('\\'); break;
        case 'n': buf.append('\n'); break;
        case 'r': buf.append('\r'); break;
        case 't': buf.append('\t'); break;
        case 'x': {
          int end = Math.min(i + 2, raw.length());
          String hex = raw.substring(i, end);
          if (hex.length() == 2 && isHexDigit(hex.charAt(0)) && isHexDigit(hex.charAt(1)))
            buf.append((char) Integer.parseInt(hex, 16));
          else
            buf.append("\\x").append(hex);
          i = end;
          break;
        }
        default: buf.append('\\').append(next);
      }
    }
    return buf.toString();
  }

  private static boolean isHexDigit(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  /**
   * Removes the indentation common to all non-blank lines: the shortest run of leading
   * whitespace among them is stripped from the start of every line longer than it. Blank lines
   * don't count towards the shortest run, and line breaks are kept as they are.
   */
  public static String unindent(String raw) {
    String[] lines = raw.split("\n", -1);
    int indent = indentLevel(lines);

    StringBuilder buf = new StringBuilder(raw.length());
    for (int n = 0; n < lines.length; n++) {
      String line = lines[n];
      buf.append(line.length() > indent ? line.substring(indent) : line);
      if (n < lines.length - 1)
        buf.append('\n');
    }
    return buf.toString();
  }

  private static int indentLevel(String[] lines) {
    int minIndent = Integer.MAX_VALUE;
    for (String line : lines) {
      if (isBlank(line))
        continue;
      int indent = 0;
      while (indent < line.length() && Character.isWhitespace(line.charAt(indent)))
        indent++;
      minIndent = Math.min(minIndent, indent);
      if (minIndent == 0)
        break;
    }
    return minIndent;
  }

  private static boolean isBlank(String line) {
    for (int i = 0; i < line.length(); i++) {
      if (!Character.isWhitespace(line.charAt(i)))
        return false;
    }
    return true;
  }
}
