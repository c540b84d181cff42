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

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Range;

import static java.util.Objects.requireNonNull;

/**
 * The bucket a timestamp falls into.
 */
public final class TimegroupSlice {
  private final Timegroup timegroup;
  private final Range<Long> range;
  private final long offset;

  TimegroupSlice(Timegroup timegroup, Range<Long> range, long offset) {
    this.timegroup = requireNonNull(timegroup);
    this.range = requireNonNull(range);
    this.offset = offset;
  }

  public Timegroup getTimegroup() {
    return timegroup;
  }

  /**
   * Bucket bounds, from the first second in the bucket to the first second after it.
   */
  public Range<Long> getRange() {
    return range;
  }

  public long getFrom() {
    return range.lowerEndpoint();
  }

  public long getUntil() {
    return range.upperEndpoint();
  }

  /**
   * Seconds between the bucket start and the grouped timestamp.
   */
  public long getOffset() {
    return offset;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimegroupSlice)) {
      return false;
    }

    TimegroupSlice other = (TimegroupSlice) o;
    return timegroup.equals(other.timegroup)
        && range.equals(other.range)
        && offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hash(timegroup, range, offset);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timegroup", timegroup)
        .add("range", range)
        .add("offset", offset)
        .toString();
  }
}
