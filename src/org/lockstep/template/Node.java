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

import org.lockstep.common.Struct;
import org.lockstep.common.Transient;
import org.lockstep.json.JsonView;

/**
 * A node of a parsed template. Nodes are immutable, compare structurally, and render
 * themselves into a {@link RenderState}.
 */
public abstract class Node extends Struct {

  /**
   * The alias which binds nothing: {@code @{foo:_}} only takes part in iteration.
   */
  public static final String DISCARD = "_";

  Node() {}

  abstract void render(RenderState renderState);

  /**
   * Text emitted verbatim.
   */
  public static final class Literal extends Node {
    public final String text;

    public Literal(String text) {
      if (text == null)
        throw new NullPointerException("text");
      this.text = text;
    }

    @Override
    void render(RenderState renderState) {
      renderState.text.append(text);
    }
  }

  /**
   * A reference to a binding by name, optionally re-binding its value to an alias for the rest
   * of the enclosing scope.
   */
  public static abstract class Reference extends Node {
    public final String name;
    public final String alias;

    Reference(String name, String alias) {
      if (name == null)
        throw new NullPointerException("name");
      this.name = name;
      this.alias = alias;
    }

    boolean bindsAlias() {
      return alias != null && !alias.equals(DISCARD);
    }

    void bindAlias(RenderState renderState, JsonView value) {
      if (bindsAlias())
        renderState.scope = renderState.scope.bind(alias, value);
    }
  }

  /**
   * {@code $foo}, {@code ${foo}}, {@code ${foo:bar}}
   */
  public static final class Variable extends Reference {
    public Variable(String name, String alias) {
      super(name, alias);
    }

    public Variable(String name) {
      this(name, null);
    }

    @Override
    void render(RenderState renderState) {
      JsonView value = renderState.scope.resolve(name);
      renderState.appendScalar(name, value);
      bindAlias(renderState, value);
    }
  }

  /**
   * {@code @foo}, {@code @{foo}}, {@code @{foo:bar}}, {@code @{foo:_}}
   */
  public static final class HiddenVariable extends Reference {
    public HiddenVariable(String name, String alias) {
      super(name, alias);
    }

    public HiddenVariable(String name) {
      this(name, null);
    }

    @Override
    void render(RenderState renderState) {
      JsonView value = renderState.scope.resolve(name);
      if (value.isNull())
        throw new Template.RenderException("Variable '" + name + "' is null");
      bindAlias(renderState, value);
    }
  }

  /**
   * {@code $( ... )*}, {@code $( ... ),*}, {@code $( ... )(, )*}
   */
  public static final class Group extends Node {
    public final List<Node> children;

    /** Inserted between iterations; null for none. */
    public final String separator;

    @Transient
    public final List<Lane> lanes;

    public Group(List<? extends Node> children, String separator) {
      this.children = Collections.unmodifiableList(new ArrayList<Node>(children));
      this.separator = separator;
      this.lanes = Lane.of(this.children);
    }

    public Group(List<? extends Node> children) {
      this(children, null);
    }

    @Override
    void render(RenderState renderState) {
      if (lanes.isEmpty())
        throw new Template.RenderException(
            "Repetition group " + this + " doesn't reference any variable to iterate over");

      renderState.enterGroup();
      Scope outer = renderState.scope;

      List<JsonView> sequences = new ArrayList<JsonView>(lanes.size());
      for (Lane lane : lanes)
        sequences.add(renderState.resolveSequence(lane.name));
      int length = renderState.zipLength(lanes, sequences);

      for (int i = 0; i < length; i++) {
        renderState.scope = outer.push(lanes, sequences, i);
        for (Node child : children)
          child.render(renderState);
        if (separator != null && i < length - 1)
          renderState.text.append(separator);
      }

      renderState.scope = outer;
      renderState.exitGroup();
    }
  }
}
