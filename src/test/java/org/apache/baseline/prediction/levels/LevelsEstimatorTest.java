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
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class LevelsEstimatorTest {

  private static final PredictionParameters NO_LEVELS =
      PredictionParameters.builder(PredictionPeriod.WDAY, 28).build();

  private static PredictionParameters.Builder params() {
    return PredictionParameters.builder(PredictionPeriod.WDAY, 28);
  }

  private static EstimatedLevels levels(
      Double upperWarn,
      Double upperCrit,
      Double lowerWarn,
      Double lowerCrit) {

    return new EstimatedLevels(
        Optional.ofNullable(upperWarn),
        Optional.ofNullable(upperCrit),
        Optional.ofNullable(lowerWarn),
        Optional.ofNullable(lowerCrit));
  }

  @Test
  public void testNoReference() {
    PredictionParameters absolute = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 2, 4))
        .build();
    assertEquals(
        EstimatedLevels.NONE,
        LevelsEstimator.estimateLevels(Optional.empty(), Optional.of(1.0), absolute, 1.0));
    assertEquals(
        EstimatedLevels.NONE,
        LevelsEstimator.estimateLevels(Optional.of(0.0), Optional.of(1.0), absolute, 1.0));
  }

  @Test
  public void testNoLevelsConfigured() {
    assertEquals(
        EstimatedLevels.NONE,
        LevelsEstimator.estimateLevels(Optional.of(10.0), Optional.of(1.0), NO_LEVELS, 1.0));
  }

  @Test
  public void testAbsolute() {
    PredictionParameters absolute = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 2, 4))
        .setLevelsLower(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 1, 3))
        .build();
    assertEquals(
        levels(13.0, 16.0, 8.5, 5.5),
        LevelsEstimator.estimateLevels(Optional.of(10.0), Optional.empty(), absolute, 1.5));
  }

  @Test
  public void testRelative() {
    PredictionParameters relative = params()
        .setLevelsLower(LevelsSpec.of(LevelsSpec.Type.RELATIVE, 10, 20))
        .build();
    assertEquals(
        levels(null, null, 45.0, 40.0),
        LevelsEstimator.estimateLevels(Optional.of(50.0), Optional.empty(), relative, 1.0));
  }

  @Test
  public void testStdev() {
    PredictionParameters stdev = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.STDEV, 2, 3))
        .build();
    assertEquals(
        levels(13.0, 14.5, null, null),
        LevelsEstimator.estimateLevels(Optional.of(10.0), Optional.of(1.5), stdev, 1.0));
  }

  @Test
  public void testStdevWithoutDeviation() {
    PredictionParameters stdev = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.STDEV, 2, 3))
        .setLevelsLower(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 1, 2))
        .build();
    assertEquals(
        levels(null, null, 9.0, 8.0),
        LevelsEstimator.estimateLevels(Optional.of(10.0), Optional.empty(), stdev, 1.0));
  }

  @Test
  public void testUpperMinimum() {
    PredictionParameters floored = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 2, 4))
        .setLevelsUpperMin(new Thresholds(14, 15))
        .build();
    assertEquals(
        levels(14.0, 18.0, null, null),
        LevelsEstimator.estimateLevels(Optional.of(10.0), Optional.empty(), floored, 2.0));
  }

  @Test
  public void testNegativeReference() {
    PredictionParameters relative = params()
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.RELATIVE, 50, 100))
        .build();
    assertEquals(
        levels(-15.0, -20.0, null, null),
        LevelsEstimator.estimateLevels(Optional.of(-10.0), Optional.empty(), relative, 1.0));
  }
}
