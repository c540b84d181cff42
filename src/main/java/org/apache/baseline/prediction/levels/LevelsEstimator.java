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
package org.apache.baseline.prediction.levels;

import java.util.Optional;

import org.apache.baseline.prediction.entities.EstimatedLevels;
import org.apache.baseline.prediction.entities.LevelsSpec;
import org.apache.baseline.prediction.entities.PredictionParameters;
import org.apache.baseline.prediction.entities.Thresholds;

import static java.util.Objects.requireNonNull;

/**
 * Derives warning and critical levels from a predicted reference value.
 */
public final class LevelsEstimator {

  private LevelsEstimator() {
    // Utility class.
  }

  /**
   * A pair of levels in one direction.
   */
  private static final class Pair {
    static final Pair NONE = new Pair(Optional.empty(), Optional.empty());

    final Optional<Double> warn;
    final Optional<Double> crit;

    Pair(Optional<Double> warn, Optional<Double> crit) {
      this.warn = warn;
      this.crit = crit;
    }

    Pair floor(Thresholds min) {
      return new Pair(
          warn.map(value -> Math.max(min.getWarn(), value)),
          crit.map(value -> Math.max(min.getCrit(), value)));
    }
  }

  /**
   * Estimates levels around a reference value.
   * <p>
   * No levels are estimated without a reference, and a reference of zero counts as none.
   *
   * @param reference Predicted average at the current point.
   * @param stdev Predicted standard deviation at the current point.
   * @param params Configured levels.
   * @param levelsFactor Scale applied to absolute levels.
   * @return The estimated levels.
   */
  public static EstimatedLevels estimateLevels(
      Optional<Double> reference,
      Optional<Double> stdev,
      PredictionParameters params,
      double levelsFactor) {

    requireNonNull(stdev);
    requireNonNull(params);
    if (!reference.isPresent() || reference.get() == 0.0) {
      return EstimatedLevels.NONE;
    }

    double ref = reference.get();
    Pair upper = params.getLevelsUpper()
        .map(levels -> levelsFrom(levels, 1, ref, stdev, levelsFactor))
        .orElse(Pair.NONE);
    Pair lower = params.getLevelsLower()
        .map(levels -> levelsFrom(levels, -1, ref, stdev, levelsFactor))
        .orElse(Pair.NONE);
    if (params.getLevelsUpperMin().isPresent()) {
      upper = upper.floor(params.getLevelsUpperMin().get());
    }

    return new EstimatedLevels(upper.warn, upper.crit, lower.warn, lower.crit);
  }

  private static Pair levelsFrom(
      LevelsSpec levels,
      int sign,
      double reference,
      Optional<Double> stdev,
      double levelsFactor) {

    double deviation;
    switch (levels.getType()) {
      case ABSOLUTE:
        deviation = levelsFactor;
        break;
      case RELATIVE:
        deviation = reference / 100.0;
        break;
      case STDEV:
        if (!stdev.isPresent()) {
          return Pair.NONE;
        }
        deviation = stdev.get();
        break;
      default:
        throw new IllegalArgumentException("Unhandled levels type " + levels.getType());
    }

    Thresholds thresholds = levels.getThresholds();
    return new Pair(
        Optional.of(reference + sign * thresholds.getWarn() * deviation),
        Optional.of(reference + sign * thresholds.getCrit() * deviation));
  }
}
