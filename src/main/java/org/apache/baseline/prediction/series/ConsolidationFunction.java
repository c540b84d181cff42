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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.math.Stats;

/**
 * Reductions applied when several samples fall into one coarser interval, imitating the RRD
 * consolidation functions.
 */
public enum ConsolidationFunction {
  AVERAGE("average") {
    @Override
    double reduce(List<Double> values) {
      return Stats.meanOf(values);
    }
  },

  MAX("max") {
    @Override
    double reduce(List<Double> values) {
      return Ordering.natural().max(values);
    }
  },

  MIN("min") {
    @Override
    double reduce(List<Double> values) {
      return Ordering.natural().min(values);
    }
  };

  private final String name;

  ConsolidationFunction(String name) {
    this.name = name;
  }

  /**
   * Reduces a non-empty list of present values.
   */
  abstract double reduce(List<Double> values);

  public String getName() {
    return name;
  }

  /**
   * Aggregates a group of samples, dropping absent ones first.
   *
   * @param samples Samples to aggregate.
   * @return The aggregate, or absent if no sample in the group is present.
   */
  public Optional<Double> aggregate(Iterable<Optional<Double>> samples) {
    List<Double> present = FluentIterable.from(samples)
        .filter(Optional::isPresent)
        .transform(Optional::get)
        .toList();
    if (present.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(reduce(present));
  }

  /**
   * Looks up a consolidation function by its case-insensitive name.
   *
   * @param name Function name, {@code null} selects {@link #MAX}.
   * @return The matching function.
   * @throws InvalidAggregationException If no function carries the name.
   */
  public static ConsolidationFunction forName(@Nullable String name) {
    if (name == null) {
      return MAX;
    }

    String normalized = name.toLowerCase(Locale.ENGLISH);
    for (ConsolidationFunction function : values()) {
      if (function.name.equals(normalized)) {
        return function;
      }
    }
    throw new InvalidAggregationException(String.format(
        "Invalid aggregation function %s, only %s allowed",
        name,
        FluentIterable.from(ImmutableList.copyOf(values()))
            .transform(ConsolidationFunction::getName)
            .join(Joiner.on(", "))));
  }

  @Override
  public String toString() {
    return name;
  }
}
