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

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Local time helpers for bucketing epoch timestamps.
 * <p>
 * The zone offset is evaluated at the bucketed timestamp itself. Across a daylight saving switch
 * two neighbouring buckets therefore use different offsets, and days around the switch are
 * treated unfairly. All buckets still have the nominal width.
 */
public final class LocalTimes {

  private LocalTimes() {
    // Utility class.
  }

  /**
   * Offset of a zone from UTC at a point in time, daylight saving shift included.
   *
   * @param timestamp Epoch seconds.
   * @param zone Zone to evaluate.
   * @return Offset in seconds, positive east of UTC.
   */
  public static int utcOffset(long timestamp, ZoneId zone) {
    return zone.getRules().getOffset(Instant.ofEpochSecond(timestamp)).getTotalSeconds();
  }

  /**
   * If local time is partitioned into {@code span} second buckets, how far {@code timestamp} is
   * from the start of its bucket.
   *
   * @param timestamp Epoch seconds.
   * @param span Bucket width in seconds.
   * @param zone Zone whose local time is partitioned.
   * @return Seconds since the bucket start.
   */
  public static long offsetInBucket(long timestamp, long span, ZoneId zone) {
    return Math.floorMod(timestamp + utcOffset(timestamp, zone), span);
  }

  static ZonedDateTime localTime(long timestamp, ZoneId zone) {
    return Instant.ofEpochSecond(timestamp).atZone(zone);
  }
}
