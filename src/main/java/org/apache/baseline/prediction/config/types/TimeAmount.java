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
package org.apache.baseline.prediction.config.types;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableBiMap;

import static java.util.Objects.requireNonNull;

/**
 * An amount of time as given on the command line, e.g. {@code 30secs}.
 */
public class TimeAmount {
  /**
   * Unit suffixes accepted on the command line.
   */
  public static final ImmutableBiMap<String, TimeUnit> UNITS =
      ImmutableBiMap.<String, TimeUnit>builder()
          .put("ns", TimeUnit.NANOSECONDS)
          .put("us", TimeUnit.MICROSECONDS)
          .put("ms", TimeUnit.MILLISECONDS)
          .put("secs", TimeUnit.SECONDS)
          .put("mins", TimeUnit.MINUTES)
          .put("hrs", TimeUnit.HOURS)
          .put("days", TimeUnit.DAYS)
          .build();

  private final long value;
  private final TimeUnit unit;

  public TimeAmount(long value, TimeUnit unit) {
    this.value = value;
    this.unit = requireNonNull(unit);
  }

  public long as(TimeUnit targetUnit) {
    return targetUnit.convert(value, unit);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeAmount)) {
      return false;
    }

    TimeAmount other = (TimeAmount) o;
    return as(TimeUnit.NANOSECONDS) == other.as(TimeUnit.NANOSECONDS);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(as(TimeUnit.NANOSECONDS));
  }

  @Override
  public String toString() {
    return value + UNITS.inverse().get(unit);
  }
}
