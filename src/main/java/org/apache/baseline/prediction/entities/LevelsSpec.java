/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.baseline.prediction.entities;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * How far from the predicted reference value the warning and critical levels lie.
 */
public final class LevelsSpec {

  /**
   * Unit of the configured distances.
   */
  public enum Type {
    /**
     * Distances are absolute values in the metric's unit.
     */
    ABSOLUTE("absolute"),

    /**
     * Distances are percentages of the reference value.
     */
    RELATIVE("relative"),

    /**
     * Distances are multiples of the standard deviation at the reference point.
     */
    STDEV("stdev");

    private final String name;

    Type(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public static Type forName(String name) {
      for (Type type : values()) {
        if (type.name.equals(name)) {
          return type;
        }
      }
      throw new IllegalArgumentException("Unknown levels type " + name);
    }
  }

  private final Type type;
  private final Thresholds thresholds;

  public LevelsSpec(Type type, Thresholds thresholds) {
    this.type = requireNonNull(type);
    this.thresholds = requireNonNull(thresholds);
  }

  public static LevelsSpec of(Type type, double warn, double crit) {
    return new LevelsSpec(type, new Thresholds(warn, crit));
  }

  public Type getType() {
    return type;
  }

  public Thresholds getThresholds() {
    return thresholds;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof LevelsSpec)) {
      return false;
    }

    LevelsSpec other = (LevelsSpec) o;
    return type == other.type && thresholds.equals(other.thresholds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, thresholds);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type.getName())
        .add("thresholds", thresholds)
        .toString();
  }
}
