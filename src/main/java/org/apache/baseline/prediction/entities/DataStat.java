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

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Statistical summary of all historic samples at one relative point in time.
 */
public final class DataStat {
  private final double average;
  private final double min;
  private final double max;
  private final Optional<Double> stdev;

  public DataStat(double average, double min, double max, Optional<Double> stdev) {
    this.average = average;
    this.min = min;
    this.max = max;
    this.stdev = requireNonNull(stdev);
  }

  public double getAverage() {
    return average;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  /**
   * Sample standard deviation, absent when only a single sample was available.
   */
  public Optional<Double> getStdev() {
    return stdev;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DataStat)) {
      return false;
    }

    DataStat other = (DataStat) o;
    return Double.compare(average, other.average) == 0
        && Double.compare(min, other.min) == 0
        && Double.compare(max, other.max) == 0
        && stdev.equals(other.stdev);
  }

  @Override
  public int hashCode() {
    return Objects.hash(average, min, max, stdev);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("average", average)
        .add("min", min)
        .add("max", max)
        .add("stdev", stdev.orElse(null))
        .toString();
  }
}
