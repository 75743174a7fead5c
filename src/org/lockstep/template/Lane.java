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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.lockstep.common.Struct;

/**
 * One sequence iterated by a {@link Node.Group}: the variable named {@link #name}, whose current
 * element is bound under {@link #key} for each iteration.
 */
public final class Lane extends Struct {

  /** Prefix of generated keys; no identifier can start with it. */
  private static final String GENERATED_KEY_PREFIX = "$";

  public final String name;

  /**
   * The name the element is bound under: the explicit alias, or a generated one that no
   * template can refer to directly.
   */
  public final String key;

  public Lane(String name, String alias) {
    this.name = name;
    if (alias == null || alias.equals(Node.DISCARD))
      this.key = GENERATED_KEY_PREFIX + name;
    else
      this.key = alias;
  }

  /**
   * The lanes of a group with the given direct children, in order of first reference. Nested
   * groups don't contribute. A name is only a lane the first time it's referenced, and not at
   * all if an earlier child already bound it as an alias.
   */
  static List<Lane> of(List<Node> children) {
    List<Lane> lanes = new ArrayList<Lane>();
    Set<String> seen = new HashSet<String>();
    Set<String> aliases = new HashSet<String>();

    for (Node child : children) {
      if (!(child instanceof Node.Reference))
        continue;
      Node.Reference reference = (Node.Reference) child;

      if (!aliases.contains(reference.name) && seen.add(reference.name))
        lanes.add(new Lane(reference.name, reference.alias));
      if (reference.bindsAlias())
        aliases.add(reference.alias);
    }

    return Collections.unmodifiableList(lanes);
  }
}
