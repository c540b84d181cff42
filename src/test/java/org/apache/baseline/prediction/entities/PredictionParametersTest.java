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

import java.util.Optional;

import org.apache.baseline.prediction.period.PredictionPeriod;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class PredictionParametersTest {

  @Test
  public void testDefaults() {
    PredictionParameters params = PredictionParameters.builder(PredictionPeriod.WDAY, 90).build();
    assertEquals(PredictionPeriod.WDAY, params.getPeriod());
    assertEquals(90L * 86400, params.getHorizonSeconds());
    assertEquals(Optional.empty(), params.getLevelsUpper());
    assertEquals(Optional.empty(), params.getLevelsUpperMin());
    assertEquals(Optional.empty(), params.getLevelsLower());
  }

  @Test
  public void testEquality() {
    PredictionParameters params = PredictionParameters.builder(PredictionPeriod.HOUR, 7)
        .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.RELATIVE, 10, 20))
        .build();
    assertEquals(
        params,
        PredictionParameters.builder(PredictionPeriod.HOUR, 7)
            .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.RELATIVE, 10, 20))
            .build());
    assertNotEquals(
        params,
        PredictionParameters.builder(PredictionPeriod.HOUR, 7)
            .setLevelsUpper(LevelsSpec.of(LevelsSpec.Type.ABSOLUTE, 10, 20))
            .build());
    assertNotEquals(params, PredictionParameters.builder(PredictionPeriod.HOUR, 8).build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveHorizon() {
    PredictionParameters.builder(PredictionPeriod.WDAY, 0).build();
  }

  @Test
  public void testLevelsTypeNames() {
    for (LevelsSpec.Type type : LevelsSpec.Type.values()) {
      assertEquals(type, LevelsSpec.Type.forName(type.getName()));
    }
  }
}
