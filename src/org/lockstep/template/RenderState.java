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

import org.lockstep.json.JsonView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state of a single render: the text so far, the innermost {@link Scope}, and how deeply
 * groups are nested at the current position.
 */
final class RenderState {

  private static final Logger log = LoggerFactory.getLogger(RenderState.class);

  final Options options;
  final StringBuilder text = new StringBuilder();
  Scope scope;

  private int depth = 0;

  RenderState(Options options, List<JsonView> globalContexts) {
    this.options = options;
    this.scope = Scope.root(globalContexts);
  }

  void enterGroup() {
    if (++depth > options.maxNestingDepth) {
      throw new Template.TooDeeplyNestedException(
          "Repetition groups are nested more than " + options.maxNestingDepth + " deep");
    }
  }

  void exitGroup() {
    depth--;
  }

  /**
   * Appends the text of the scalar |value| of variable |name|.
   */
  void appendScalar(String name, JsonView value) {
    switch (value.getType()) {
      case NULL:
        throw new Template.RenderException("Variable '" + name + "' is null");
      case ARRAY:
        throw new Template.RenderException(
            "Variable '" + name + "' is a sequence; it can only be used inside a repetition group");
      default:
        text.append(value.asText());
    }
  }

  /**
   * Resolves the variable |name| of a lane, which must be a sequence.
   */
  JsonView resolveSequence(String name) {
    JsonView value = scope.resolve(name);
    if (value.getType() != JsonView.Type.ARRAY) {
      throw new Template.RenderException(
          "Variable '" + name + "' is iterated by a repetition group but is " + value.getType() +
          ", not a sequence");
    }
    return value;
  }

  /**
   * The number of times a group iterates over |sequences|: the length of the shortest one, or
   * under {@link LanePolicy#STRICT} their common length.
   */
  int zipLength(List<Lane> lanes, List<JsonView> sequences) {
    int min = Integer.MAX_VALUE;
    int max = 0;
    for (JsonView sequence : sequences) {
      int length = sequence.asArrayLength();
      min = Math.min(min, length);
      max = Math.max(max, length);
    }

    if (min != max) {
      if (options.lanePolicy == LanePolicy.STRICT) {
        throw new Template.RenderException(
            "Variables " + names(lanes) + " iterated together have different lengths " +
            lengths(sequences));
      }
      if (log.isDebugEnabled()) {
        log.debug("Variables {} have lengths {}, iterating {} times", names(lanes),
            lengths(sequences), min);
      }
    }
    return min;
  }

  private static List<String> names(List<Lane> lanes) {
    List<String> names = new ArrayList<String>(lanes.size());
    for (Lane lane : lanes)
      names.add(lane.name);
    return names;
  }

  private static List<Integer> lengths(List<JsonView> sequences) {
    List<Integer> lengths = new ArrayList<Integer>(sequences.size());
    for (JsonView sequence : sequences)
      lengths.add(sequence.asArrayLength());
    return lengths;
  }
}
