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
package org.apache.baseline.prediction.config;

import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

import com.beust.jcommander.ParameterException;

import org.apache.baseline.prediction.config.converters.TimeAmountConverter;
import org.apache.baseline.prediction.config.converters.ZoneIdConverter;
import org.apache.baseline.prediction.config.types.TimeAmount;
import org.apache.baseline.prediction.config.validators.PositiveAmount;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ConvertersTest {

  private final TimeAmountConverter timeAmount = new TimeAmountConverter("-timeout");
  private final ZoneIdConverter zoneId = new ZoneIdConverter("-zone");

  @Test
  public void testTimeAmount() {
    assertEquals(new TimeAmount(30, TimeUnit.SECONDS), timeAmount.convert("30secs"));
    assertEquals(new TimeAmount(5, TimeUnit.MILLISECONDS), timeAmount.convert("5ms"));
    assertEquals(new TimeAmount(2, TimeUnit.DAYS), timeAmount.convert("2days"));
  }

  @Test
  public void testTimeAmountRendering() {
    assertEquals("30secs", new TimeAmount(30, TimeUnit.SECONDS).toString());
    assertEquals(30000, new TimeAmount(30, TimeUnit.SECONDS).as(TimeUnit.MILLISECONDS));
  }

  @Test(expected = ParameterException.class)
  public void testTimeAmountUnknownUnit() {
    timeAmount.convert("3weeks");
  }

  @Test(expected = ParameterException.class)
  public void testTimeAmountMalformed() {
    timeAmount.convert("secs30");
  }

  @Test
  public void testZoneId() {
    assertEquals(ZoneId.of("Europe/Berlin"), zoneId.convert("Europe/Berlin"));
    assertEquals(ZoneId.of("UTC"), zoneId.convert("UTC"));
  }

  @Test(expected = ParameterException.class)
  public void testUnknownZone() {
    zoneId.convert("Mars/Olympus_Mons");
  }

  @Test
  public void testPositiveAmount() {
    new PositiveAmount().validate("-timeout", new TimeAmount(1, TimeUnit.NANOSECONDS));
  }

  @Test(expected = ParameterException.class)
  public void testZeroAmount() {
    new PositiveAmount().validate("-timeout", new TimeAmount(0, TimeUnit.HOURS));
  }
}
