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

import javax.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Partitions history into the buckets sharing a timegroup.
 */
public class TimeSlices {
  private final ZoneId zone;

  @Inject
  public TimeSlices(ZoneId zone) {
    this.zone = requireNonNull(zone);
  }

  public ZoneId getZone() {
    return zone;
  }

  /**
   * Maps a timestamp onto its bucket in the configured zone.
   *
   * @param timestamp Epoch seconds.
   * @param period Period defining the buckets.
   * @return The bucket containing {@code timestamp}.
   */
  public TimegroupSlice relativeTime(long timestamp, PredictionPeriod period) {
    return period.groupBy(timestamp, zone);
  }

  /**
   * Collects all buckets of a timegroup back into the past until the horizon is reached.
   * <p>
   * Bucket starts are determined independently for every step back, so a daylight saving switch
   * within the horizon shifts the buckets on either side of it rather than resizing them.
   *
   * @param now Epoch seconds to start walking back from.
   * @param horizon How far back to look, in seconds.
   * @param period Period defining the buckets.
   * @param timegroup Timegroup to collect.
   * @return Bucket ranges, most recent first.
   */
  public ImmutableList<Range<Long>> collect(
      long now,
      long horizon,
      PredictionPeriod period,
      Timegroup timegroup) {

    checkArgument(horizon >= 0, "Negative horizon %s", horizon);
    requireNonNull(timegroup);

    long absoluteBegin = now - horizon;
    ImmutableList.Builder<Range<Long>> slices = ImmutableList.builder();
    for (long begin = now; begin > absoluteBegin; begin -= period.getSlice()) {
      TimegroupSlice slice = relativeTime(begin, period);
      if (slice.getTimegroup().equals(timegroup)) {
        slices.add(slice.getRange());
      }
    }
    return slices.build();
  }
}
