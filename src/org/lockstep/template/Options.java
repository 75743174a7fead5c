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

import java.util.Locale;
import java.util.Properties;

import org.lockstep.common.Struct;

/**
 * Options for parsing and rendering {@link Template}s.
 */
public final class Options extends Struct {

  public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

  public static final String MAX_NESTING_DEPTH_PROPERTY = "lockstep.maxNestingDepth";
  public static final String LANE_POLICY_PROPERTY = "lockstep.lanePolicy";

  public static final Options DEFAULT = builder().build();

  /** How deeply repetition groups may nest, in parsing and in rendering. */
  public final int maxNestingDepth;

  /** What to do with sequences of different lengths in the same group. */
  public final LanePolicy lanePolicy;

  private Options(int maxNestingDepth, LanePolicy lanePolicy) {
    this.maxNestingDepth = maxNestingDepth;
    this.lanePolicy = lanePolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads options from {@link #MAX_NESTING_DEPTH_PROPERTY} and {@link #LANE_POLICY_PROPERTY};
   * properties that aren't set keep their defaults.
   *
   * @throws IllegalArgumentException if a property is set to something invalid.
   */
  public static Options fromProperties(Properties properties) {
    Builder builder = builder();

    String maxNestingDepth = properties.getProperty(MAX_NESTING_DEPTH_PROPERTY);
    if (maxNestingDepth != null) {
      try {
        builder.maxNestingDepth(Integer.parseInt(maxNestingDepth.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            MAX_NESTING_DEPTH_PROPERTY + " is not a number: " + maxNestingDepth, e);
      }
    }

    String lanePolicy = properties.getProperty(LANE_POLICY_PROPERTY);
    if (lanePolicy != null) {
      try {
        builder.lanePolicy(LanePolicy.valueOf(lanePolicy.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            LANE_POLICY_PROPERTY + " is not one of TRUNCATE, STRICT: " + lanePolicy, e);
      }
    }

    return builder.build();
  }

  public static final class Builder {
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
    private LanePolicy lanePolicy = LanePolicy.TRUNCATE;

    private Builder() {}

    public Builder maxNestingDepth(int maxNestingDepth) {
      if (maxNestingDepth < 1)
        throw new IllegalArgumentException("maxNestingDepth must be at least 1: " + maxNestingDepth);
      this.maxNestingDepth = maxNestingDepth;
      return this;
    }

    public Builder lanePolicy(LanePolicy lanePolicy) {
      if (lanePolicy == null)
        throw new NullPointerException("lanePolicy");
      this.lanePolicy = lanePolicy;
      return this;
    }

    public Options build() {
      return new Options(maxNestingDepth, lanePolicy);
    }
  }
}
