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
import java.time.format.TextStyle;
import java.util.Locale;

import com.google.common.collect.Range;

/**
 * Recurring periods predictions are computed for.
 * <p>
 * Each period defines the width of one bucket, how a timestamp maps onto a {@link Timegroup} and
 * for how many buckets a computed prediction stays valid.
 */
public enum PredictionPeriod {
  /**
   * One bucket per weekday, seven distinct timegroups.
   */
  WDAY("wday", 86400, 7) {
    @Override
    Timegroup timegroup(long timestamp, ZoneId zone) {
      return Timegroup.of(LocalTimes.localTime(timestamp, zone)
          .getDayOfWeek()
          .getDisplayName(TextStyle.FULL, Locale.ENGLISH)
          .toLowerCase(Locale.ENGLISH));
    }
  },

  /**
   * One bucket per day of month.
   */
  DAY("day", 86400, 28) {
    @Override
    Timegroup timegroup(long timestamp, ZoneId zone) {
      return Timegroup.of(
          Integer.toString(LocalTimes.localTime(timestamp, zone).getDayOfMonth()));
    }
  },

  /**
   * Every day shares the same hourly profile.
   */
  HOUR("hour", 86400, 1) {
    @Override
    Timegroup timegroup(long timestamp, ZoneId zone) {
      return EVERYDAY;
    }
  },

  /**
   * Every hour shares the same per-minute profile.
   */
  MINUTE("minute", 3600, 24) {
    @Override
    Timegroup timegroup(long timestamp, ZoneId zone) {
      return EVERYHOUR;
    }
  };

  private static final Timegroup EVERYDAY = Timegroup.of("everyday");
  private static final Timegroup EVERYHOUR = Timegroup.of("everyhour");

  private final String name;
  private final long slice;
  private final int validCycles;

  PredictionPeriod(String name, long slice, int validCycles) {
    this.name = name;
    this.slice = slice;
    this.validCycles = validCycles;
  }

  abstract Timegroup timegroup(long timestamp, ZoneId zone);

  public String getName() {
    return name;
  }

  /**
   * Width of one bucket in seconds.
   */
  public long getSlice() {
    return slice;
  }

  /**
   * Number of buckets in one full cycle of timegroups, also the number of buckets a computed
   * prediction remains valid for.
   */
  public int getValidCycles() {
    return validCycles;
  }

  /**
   * Maps a timestamp onto its bucket.
   *
   * @param timestamp Epoch seconds.
   * @param zone Zone whose local time defines bucket boundaries.
   * @return Timegroup and bounds of the bucket containing {@code timestamp}.
   */
  public TimegroupSlice groupBy(long timestamp, ZoneId zone) {
    long offset = LocalTimes.offsetInBucket(timestamp, slice, zone);
    long from = timestamp - offset;
    return new TimegroupSlice(
        timegroup(timestamp, zone),
        Range.closedOpen(from, from + slice),
        offset);
  }

  /**
   * Looks up a period by its configuration name.
   *
   * @param name Period name, e.g. {@code wday}.
   * @return The matching period.
   */
  public static PredictionPeriod forName(String name) {
    for (PredictionPeriod period : values()) {
      if (period.name.equals(name)) {
        return period;
      }
    }
    throw new IllegalArgumentException("Unknown prediction period " + name);
  }

  @Override
  public String toString() {
    return name;
  }
}
