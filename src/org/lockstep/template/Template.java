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
import java.util.List;

import org.json.JSONObject;
import org.lockstep.json.JSONObjectJsonView;
import org.lockstep.json.JsonView;
import org.lockstep.json.PojoJsonView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A "lockstep" template: literal text with variables and repetition groups which iterate over
 * several sequences at once.
 *   * $foo renders the variable foo; ${foo} is the same, for when an identifier character
 *     follows.
 *   * ${foo:bar} renders foo and binds its value to bar for the rest of the scope.
 *   * @foo, @{foo:bar} are "hidden": they look foo up (and maybe bind it) but render nothing.
 *     Inside a group that's how a sequence can drive the iteration without being rendered.
 *   * $( ... )* repeats its contents once per element of every sequence referenced directly
 *     inside, in lockstep, stopping at the shortest. Within the group each of those names
 *     refers to the current element.
 *   * $( ... ),* and $( ... )(, )* insert a character or a string between iterations.
 *   * \ escapes the next character, e.g. \$ or an unbalanced \( inside a group.
 *
 * For example, "$($names: $ages)(, )*" with names [Alice, Bob] and ages [30, 40] renders
 * "Alice: 30, Bob: 40".
 *
 * A template is immutable once parsed, so it can be rendered from several threads at once.
 */
public class Template {

  private static final Logger log = LoggerFactory.getLogger(Template.class);

  /**
   * Base class of everything thrown for a bad template or bad bindings.
   */
  public static class TemplateException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TemplateException(String message) {
      super(message);
    }
  }

  /**
   * Thrown if parsing {@link Template#source} fails.
   */
  public static class ParseException extends TemplateException {
    private static final long serialVersionUID = 1L;

    public final int line;
    public final int column;

    public ParseException(String error, int line, int column) {
      super(error + " (line " + line + ", column " + column + ")");
      this.line = line;
      this.column = column;
    }
  }

  /**
   * Thrown if the bindings don't fit the template: a variable that isn't bound or is null, a
   * sequence where text is expected or the other way around.
   */
  public static class RenderException extends TemplateException {
    private static final long serialVersionUID = 1L;

    public RenderException(String error) {
      super(error);
    }
  }

  /**
   * Thrown if repetition groups nest deeper than {@link Options#maxNestingDepth}.
   */
  public static class TooDeeplyNestedException extends TemplateException {
    private static final long serialVersionUID = 1L;

    public TooDeeplyNestedException(String error) {
      super(error);
    }
  }

  /** Source of the template, as parsed. */
  public final String source;

  private final Options options;
  private final List<Node> nodes;

  /**
   * Parses a template from already unescaped text.
   */
  public Template(String source) throws ParseException {
    this(source, Options.DEFAULT);
  }

  public Template(String source, Options options) throws ParseException {
    this.source = source;
    this.options = options;
    this.nodes = Parser.parse(source, options);
    log.debug("Parsed template of {} characters into {} nodes", source.length(), nodes.size());
  }

  /**
   * Parses a template from raw source, decoding its escape sequences first.
   */
  public static Template fromSource(String raw) throws ParseException {
    return fromSource(raw, Options.DEFAULT);
  }

  public static Template fromSource(String raw, Options options) throws ParseException {
    return new Template(Preprocessor.unescape(raw), options);
  }

  /**
   * Parses a template from raw multi-line source, removing its common indentation and then
   * decoding its escape sequences.
   */
  public static Template fromIndentedSource(String raw) throws ParseException {
    return fromIndentedSource(raw, Options.DEFAULT);
  }

  public static Template fromIndentedSource(String raw, Options options) throws ParseException {
    return fromSource(Preprocessor.unindent(raw), options);
  }

  /**
   * Parses already unescaped text into nodes.
   */
  public static List<Node> compile(String source) throws ParseException {
    return Parser.parse(source, Options.DEFAULT);
  }

  public List<Node> getNodes() {
    return nodes;
  }

  public Options getOptions() {
    return options;
  }

  /**
   * Renders the template with variables taken from some number of contexts, searched in order.
   * A context is a {@link JsonView}, a {@link JSONObject}, a {@link java.util.Map} or any object
   * with public fields.
   *
   * @throws RenderException if the contexts don't bind what the template needs.
   * @throws TooDeeplyNestedException if the template nests too deeply.
   */
  public String render(Object... contexts) {
    return render(nodes, options, contexts);
  }

  /**
   * Renders nodes which need not come from the parser.
   */
  public static String render(List<Node> nodes, Options options, Object... contexts) {
    List<JsonView> globalContexts = new ArrayList<JsonView>(contexts.length);
    for (Object context : contexts) {
      if (context instanceof JsonView)
        globalContexts.add((JsonView) context);
      else if (context instanceof JSONObject)
        globalContexts.add(new JSONObjectJsonView((JSONObject) context));
      else
        globalContexts.add(new PojoJsonView(context));
    }

    RenderState renderState = new RenderState(options, globalContexts);
    for (Node node : nodes)
      node.render(renderState);
    return renderState.text.toString();
  }

  @Override
  public String toString() {
    return source;
  }
}
