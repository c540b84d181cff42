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
package org.apache.baseline.prediction.period;

import java.time.ZoneId;
import java.time.ZoneOffset;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TimeSlicesTest {

  private static final long DAY = 86400L;

  // Tuesday, 2024-01-02 12:00:00 UTC.
  private static final long TUESDAY_NOON = 1704196800L;
  private static final long TUESDAY_START = 1704153600L;

  // Tuesday, 2024-04-02 10:00:00 UTC, two days after the spring daylight saving switch in Berlin.
  private static final long TUESDAY_AFTER_DST = 1712052000L;

  private static final Timegroup TUESDAY = Timegroup.of("tuesday");

  private final TimeSlices slices = new TimeSlices(ZoneOffset.UTC);

  @Test
  public void testWeekdayHorizon() {
    ImmutableList<Range<Long>> windows =
        slices.collect(TUESDAY_NOON, 14 * DAY, PredictionPeriod.WDAY, TUESDAY);
    assertEquals(
        ImmutableList.of(
            Range.closedOpen(TUESDAY_START, TUESDAY_START + DAY),
            Range.closedOpen(TUESDAY_START - 7 * DAY, TUESDAY_START - 6 * DAY)),
        windows);
  }

  @Test
  public void testOtherTimegroup() {
    ImmutableList<Range<Long>> windows =
        slices.collect(TUESDAY_NOON, 14 * DAY, PredictionPeriod.WDAY, Timegroup.of("friday"));
    assertEquals(2, windows.size());
    assertEquals(TUESDAY_START - 4 * DAY, (long) windows.get(0).lowerEndpoint());
    assertEquals(TUESDAY_START - 11 * DAY, (long) windows.get(1).lowerEndpoint());
  }

  @Test
  public void testHorizonExclusive() {
    // The bucket exactly one week back lies on the horizon and is excluded.
    assertEquals(1, slices.collect(TUESDAY_NOON, 7 * DAY, PredictionPeriod.WDAY, TUESDAY).size());
  }

  @Test
  public void testShortHorizon() {
    assertEquals(
        ImmutableList.of(),
        slices.collect(TUESDAY_NOON, 0, PredictionPeriod.WDAY, TUESDAY));
    assertEquals(
        ImmutableList.of(),
        slices.collect(TUESDAY_NOON, DAY, PredictionPeriod.WDAY, Timegroup.of("monday")));
  }

  @Test
  public void testEveryHour() {
    ImmutableList<Range<Long>> windows =
        slices.collect(TUESDAY_NOON + 60, DAY, PredictionPeriod.MINUTE, Timegroup.of("everyhour"));
    assertEquals(24, windows.size());
    assertEquals(Range.closedOpen(TUESDAY_NOON, TUESDAY_NOON + 3600), windows.get(0));
    assertEquals(
        Range.closedOpen(TUESDAY_NOON - 23 * 3600, TUESDAY_NOON - 22 * 3600),
        windows.get(23));
  }

  @Test
  public void testDaylightSavingSwitch() {
    TimeSlices berlin = new TimeSlices(ZoneId.of("Europe/Berlin"));
    ImmutableList<Range<Long>> windows =
        berlin.collect(TUESDAY_AFTER_DST, 14 * DAY, PredictionPeriod.WDAY, TUESDAY);
    assertEquals(2, windows.size());

    // Local midnight moves by the hour gained, buckets keep their nominal width.
    long recent = windows.get(0).lowerEndpoint();
    long previous = windows.get(1).lowerEndpoint();
    assertEquals(TUESDAY_AFTER_DST - 12 * 3600, recent);
    assertEquals(7 * DAY - 3600, recent - previous);
    assertEquals(DAY, windows.get(1).upperEndpoint() - previous);
  }

  @Test
  public void testRelativeTime() {
    TimegroupSlice slice = slices.relativeTime(TUESDAY_NOON, PredictionPeriod.WDAY);
    assertEquals(TUESDAY, slice.getTimegroup());
    assertEquals(TUESDAY_START, slice.getFrom());
  }
}
