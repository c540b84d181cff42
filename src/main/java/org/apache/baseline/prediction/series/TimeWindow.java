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
package org.apache.baseline.prediction.series;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import static java.math.RoundingMode.CEILING;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Describes the half-open interval {@code [start, end)} sampled every {@code step} seconds.
 * <p>
 * A window is used both to describe a fetched series and as the target grid of a resampling.
 */
public final class TimeWindow {
  private final long start;
  private final long end;
  private final long step;

  public TimeWindow(long start, long end, long step) {
    checkArgument(step >= 0, "Negative step %s", step);
    this.start = start;
    this.end = end;
    this.step = step;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long getStep() {
    return step;
  }

  /**
   * Number of samples a series over this window carries.
   *
   * @return {@code ceil((end - start) / step)}, or zero for an empty window or a zero step.
   */
  public int size() {
    if (step == 0 || end <= start) {
      return 0;
    }
    return Math.toIntExact(LongMath.divide(end - start, step, CEILING));
  }

  /**
   * Timestamps of the samples over this window. Every sample marks the end of its interval, so the
   * first timestamp is {@code start + step} and {@code start} itself has no sample.
   *
   * @return Sample timestamps in ascending order.
   */
  public ImmutableList<Long> timestamps() {
    ImmutableList.Builder<Long> timestamps = ImmutableList.builder();
    if (step > 0) {
      for (long t = start; t < end; t += step) {
        timestamps.add(t + step);
      }
    }
    return timestamps.build();
  }

  /**
   * Moves this window back in time, keeping its width and step.
   *
   * @param seconds Distance to move by.
   * @return The shifted window.
   */
  public TimeWindow shiftBack(long seconds) {
    return new TimeWindow(start - seconds, end - seconds, step);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeWindow)) {
      return false;
    }

    TimeWindow other = (TimeWindow) o;
    return start == other.start
        && end == other.end
        && step == other.step;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, step);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start)
        .add("end", end)
        .add("step", step)
        .toString();
  }
}
