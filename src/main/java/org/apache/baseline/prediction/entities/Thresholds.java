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

/**
 * A warning and a critical threshold.
 */
public final class Thresholds {
  private final double warn;
  private final double crit;

  public Thresholds(double warn, double crit) {
    this.warn = warn;
    this.crit = crit;
  }

  public double getWarn() {
    return warn;
  }

  public double getCrit() {
    return crit;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Thresholds)) {
      return false;
    }

    Thresholds other = (Thresholds) o;
    return Double.compare(warn, other.warn) == 0 && Double.compare(crit, other.crit) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(warn, crit);
  }

  @Override
  public String toString() {
    return "(" + warn + ", " + crit + ")";
  }
}
