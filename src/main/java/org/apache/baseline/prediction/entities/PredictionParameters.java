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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import org.apache.baseline.prediction.period.PredictionPeriod;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * User configuration of a predictive levels check.
 */
public final class PredictionParameters {
  private final PredictionPeriod period;
  private final int horizon;
  private final Optional<LevelsSpec> levelsUpper;
  private final Optional<Thresholds> levelsUpperMin;
  private final Optional<LevelsSpec> levelsLower;

  private PredictionParameters(Builder builder) {
    this.period = requireNonNull(builder.period);
    checkArgument(builder.horizon > 0, "Horizon must be positive, got %s", builder.horizon);
    this.horizon = builder.horizon;
    this.levelsUpper = Optional.ofNullable(builder.levelsUpper);
    this.levelsUpperMin = Optional.ofNullable(builder.levelsUpperMin);
    this.levelsLower = Optional.ofNullable(builder.levelsLower);
  }

  public static Builder builder(PredictionPeriod period, int horizon) {
    return new Builder(period, horizon);
  }

  public PredictionPeriod getPeriod() {
    return period;
  }

  /**
   * How far back history is considered, in days.
   */
  public int getHorizon() {
    return horizon;
  }

  public long getHorizonSeconds() {
    return horizon * 86400L;
  }

  public Optional<LevelsSpec> getLevelsUpper() {
    return levelsUpper;
  }

  /**
   * Floor applied to the estimated upper levels.
   */
  public Optional<Thresholds> getLevelsUpperMin() {
    return levelsUpperMin;
  }

  public Optional<LevelsSpec> getLevelsLower() {
    return levelsLower;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PredictionParameters)) {
      return false;
    }

    PredictionParameters other = (PredictionParameters) o;
    return period == other.period
        && horizon == other.horizon
        && levelsUpper.equals(other.levelsUpper)
        && levelsUpperMin.equals(other.levelsUpperMin)
        && levelsLower.equals(other.levelsLower);
  }

  @Override
  public int hashCode() {
    return Objects.hash(period, horizon, levelsUpper, levelsUpperMin, levelsLower);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("period", period)
        .add("horizon", horizon)
        .add("levelsUpper", levelsUpper.orElse(null))
        .add("levelsUpperMin", levelsUpperMin.orElse(null))
        .add("levelsLower", levelsLower.orElse(null))
        .toString();
  }

  public static final class Builder {
    private final PredictionPeriod period;
    private final int horizon;
    private LevelsSpec levelsUpper;
    private Thresholds levelsUpperMin;
    private LevelsSpec levelsLower;

    private Builder(PredictionPeriod period, int horizon) {
      this.period = period;
      this.horizon = horizon;
    }

    public Builder setLevelsUpper(@Nullable LevelsSpec levelsUpper) {
      this.levelsUpper = levelsUpper;
      return this;
    }

    public Builder setLevelsUpperMin(@Nullable Thresholds levelsUpperMin) {
      this.levelsUpperMin = levelsUpperMin;
      return this;
    }

    public Builder setLevelsLower(@Nullable LevelsSpec levelsLower) {
      this.levelsLower = levelsLower;
      return this;
    }

    public PredictionParameters build() {
      return new PredictionParameters(this);
    }
  }
}
