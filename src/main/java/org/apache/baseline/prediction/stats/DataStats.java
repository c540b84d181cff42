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
package org.apache.baseline.prediction.stats;

import java.util.List;
import java.util.Optional;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.math.Stats;

import org.apache.baseline.prediction.entities.DataStat;

/**
 * Statistically summarizes aligned history slices point by point.
 */
public final class DataStats {

  private DataStats() {
    // Utility class.
  }

  /**
   * Summarizes every time column across all slices. Only as many columns as the shortest slice
   * has are summarized.
   *
   * @param slices Aligned slices, all on the same grid.
   * @return One summary per column, absent where no slice has a sample.
   */
  public static ImmutableList<Optional<DataStat>> summarize(
      List<? extends List<Optional<Double>>> slices) {

    if (slices.isEmpty()) {
      return ImmutableList.of();
    }

    int columns = Integer.MAX_VALUE;
    for (List<Optional<Double>> slice : slices) {
      columns = Math.min(columns, slice.size());
    }

    ImmutableList.Builder<Optional<DataStat>> descriptors = ImmutableList.builder();
    for (int column = 0; column < columns; column++) {
      List<Double> pointLine = Lists.newArrayListWithCapacity(slices.size());
      for (List<Optional<Double>> slice : slices) {
        slice.get(column).ifPresent(pointLine::add);
      }
      descriptors.add(describe(pointLine));
    }
    return descriptors.build();
  }

  private static Optional<DataStat> describe(List<Double> pointLine) {
    if (pointLine.isEmpty()) {
      return Optional.empty();
    }

    double average = Stats.meanOf(pointLine);
    return Optional.of(new DataStat(
        average,
        Ordering.natural().min(pointLine),
        Ordering.natural().max(pointLine),
        stdDev(pointLine, average)));
  }

  /**
   * Unbiased sample standard deviation.
   * <p>
   * The absolute value keeps floating point cancellation from producing a negative variance.
   *
   * @param pointLine Samples.
   * @param average Mean of the samples.
   * @return The standard deviation, absent for a single sample.
   */
  @VisibleForTesting
  static Optional<Double> stdDev(List<Double> pointLine, double average) {
    int samples = pointLine.size();
    if (samples == 1) {
      return Optional.empty();
    }

    double sumOfSquares = 0;
    for (double point : pointLine) {
      sumOfSquares += point * point;
    }
    return Optional.of(
        Math.sqrt(Math.abs(sumOfSquares - average * average * samples) / (samples - 1)));
  }
}
