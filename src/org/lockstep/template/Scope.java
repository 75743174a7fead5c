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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lockstep.json.JsonView;

/**
 * An immutable layer of bindings. Each layer maps variable names to the key their current value
 * is bound under (the aliases) and keys to values; lookups fall through to the parent layer and
 * finally to the global contexts the template was rendered with.
 */
final class Scope {

  private final Scope parent;
  private final Map<String, String> aliases;
  private final Map<String, JsonView> values;
  private final List<JsonView> globalContexts;

  private Scope(
      Scope parent,
      Map<String, String> aliases,
      Map<String, JsonView> values,
      List<JsonView> globalContexts) {
    this.parent = parent;
    this.aliases = aliases;
    this.values = values;
    this.globalContexts = globalContexts;
  }

  static Scope root(List<JsonView> globalContexts) {
    return new Scope(
        null,
        Collections.<String, String>emptyMap(),
        Collections.<String, JsonView>emptyMap(),
        globalContexts);
  }

  /**
   * A child scope for iteration |index| of a group: each lane's name is aliased to its key, and
   * its key bound to the element at |index| of the corresponding sequence.
   */
  Scope push(List<Lane> lanes, List<JsonView> sequences, int index) {
    Map<String, String> laneAliases = new HashMap<String, String>();
    Map<String, JsonView> laneValues = new HashMap<String, JsonView>();
    for (int i = 0; i < lanes.size(); i++) {
      Lane lane = lanes.get(i);
      laneAliases.put(lane.name, lane.key);
      laneValues.put(lane.key, sequences.get(i).asArrayGet(index));
    }
    return new Scope(this, laneAliases, laneValues, globalContexts);
  }

  /**
   * A child scope where |name| is bound to |value|.
   */
  Scope bind(String name, JsonView value) {
    return new Scope(
        this,
        Collections.<String, String>emptyMap(),
        Collections.singletonMap(name, value),
        globalContexts);
  }

  /**
   * Resolves |name| from the innermost layer outwards. The first layer that either binds
   * |name| directly or aliases it decides: an alias redirects the rest of the lookup, from that
   * layer outwards, to its key. Failing that, |name| is looked up in the global contexts.
   *
   * @throws Template.RenderException if nothing is bound to |name|.
   */
  JsonView resolve(String name) {
    String key = name;
    boolean aliased = false;
    for (Scope scope = this; scope != null; scope = scope.parent) {
      if (!aliased) {
        String alias = scope.aliases.get(name);
        if (alias != null && !scope.values.containsKey(name)) {
          key = alias;
          aliased = true;
        }
      }
      JsonView value = scope.values.get(key);
      if (value != null)
        return value;
    }

    for (JsonView context : globalContexts) {
      if (context.getType() != JsonView.Type.OBJECT)
        continue;
      JsonView value = context.get(key);
      if (value != null)
        return value;
    }

    throw new Template.RenderException("Couldn't resolve variable '" + name + "'");
  }
}
