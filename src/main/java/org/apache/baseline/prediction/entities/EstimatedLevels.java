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
import java.util.Optional;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Levels derived from a prediction. Each level is absent when it is not configured or cannot be
 * derived from the available history.
 */
public final class EstimatedLevels {
  public static final EstimatedLevels NONE = new EstimatedLevels(
      Optional.empty(),
      Optional.empty(),
      Optional.empty(),
      Optional.empty());

  private final Optional<Double> upperWarn;
  private final Optional<Double> upperCrit;
  private final Optional<Double> lowerWarn;
  private final Optional<Double> lowerCrit;

  public EstimatedLevels(
      Optional<Double> upperWarn,
      Optional<Double> upperCrit,
      Optional<Double> lowerWarn,
      Optional<Double> lowerCrit) {

    this.upperWarn = requireNonNull(upperWarn);
    this.upperCrit = requireNonNull(upperCrit);
    this.lowerWarn = requireNonNull(lowerWarn);
    this.lowerCrit = requireNonNull(lowerCrit);
  }

  public Optional<Double> getUpperWarn() {
    return upperWarn;
  }

  public Optional<Double> getUpperCrit() {
    return upperCrit;
  }

  public Optional<Double> getLowerWarn() {
    return lowerWarn;
  }

  public Optional<Double> getLowerCrit() {
    return lowerCrit;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EstimatedLevels)) {
      return false;
    }

    EstimatedLevels other = (EstimatedLevels) o;
    return upperWarn.equals(other.upperWarn)
        && upperCrit.equals(other.upperCrit)
        && lowerWarn.equals(other.lowerWarn)
        && lowerCrit.equals(other.lowerCrit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(upperWarn, upperCrit, lowerWarn, lowerCrit);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("upperWarn", upperWarn.orElse(null))
        .add("upperCrit", upperCrit.orElse(null))
        .add("lowerWarn", lowerWarn.orElse(null))
        .add("lowerCrit", lowerCrit.orElse(null))
        .toString();
  }
}
