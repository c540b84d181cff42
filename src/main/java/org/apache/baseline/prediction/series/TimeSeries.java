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

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An evenly spaced series of samples as returned by the historic data source.
 * <p>
 * The series describes the interval {@code [start, end)}. Every sample is valid for the
 * measurement interval {@code [timestamp - step, timestamp)}, which means it sits at the end of its
 * interval and {@code start} has no sample of its own. Absent samples are kept as
 * {@link Optional#empty()}.
 */
public final class TimeSeries implements Iterable<Optional<Double>> {
  private final TimeWindow window;
  private final ImmutableList<Optional<Double>> values;

  public TimeSeries(List<Optional<Double>> values, TimeWindow window) {
    this(values, window, DoubleUnaryOperator.identity());
  }

  /**
   * Creates a series over a window.
   *
   * @param values Samples, one per window timestamp.
   * @param window Window the samples cover.
   * @param conversion Conversion applied to every present sample, e.g. to account for user
   *     specific units.
   */
  public TimeSeries(
      List<Optional<Double>> values,
      TimeWindow window,
      DoubleUnaryOperator conversion) {

    this.window = requireNonNull(window);
    requireNonNull(conversion);
    if (window.getStep() > 0) {
      checkArgument(values.size() == window.size(),
          "%s samples do not match %s", values.size(), window);
    }
    this.values = ImmutableList.copyOf(
        Lists.transform(values, value -> value.map(conversion::applyAsDouble)));
  }

  /**
   * Creates a series from the flat RRD layout {@code [start, end, step, value...]}.
   *
   * @param data Flat series data, absent samples are {@code null}.
   * @return The parsed series.
   */
  public static TimeSeries fromRrdData(List<Double> data) {
    checkArgument(data.size() >= 3, "Missing time window in %s", data);
    checkArgument(data.get(0) != null && data.get(1) != null && data.get(2) != null,
        "Incomplete time window in %s", data);

    TimeWindow window = new TimeWindow(
        data.get(0).longValue(),
        data.get(1).longValue(),
        data.get(2).longValue());
    return new TimeSeries(fromNullable(data.subList(3, data.size())), window);
  }

  /**
   * Wraps a list of samples where {@code null} marks a missing sample.
   *
   * @param values Nullable samples.
   * @return Samples with explicit absence.
   */
  public static ImmutableList<Optional<Double>> fromNullable(List<Double> values) {
    ImmutableList.Builder<Optional<Double>> wrapped = ImmutableList.builder();
    for (@Nullable Double value : values) {
      wrapped.add(Optional.ofNullable(value));
    }
    return wrapped.build();
  }

  public TimeWindow getWindow() {
    return window;
  }

  public ImmutableList<Optional<Double>> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public Optional<Double> get(int index) {
    return values.get(index);
  }

  /**
   * Pairs every sample with the timestamp it is valid for.
   *
   * @return Timestamp and sample pairs in ascending time order.
   */
  public ImmutableList<TimedValue> timedValues() {
    ImmutableList.Builder<TimedValue> pairs = ImmutableList.builder();
    Iterator<Long> timestamps = window.timestamps().iterator();
    Iterator<Optional<Double>> samples = values.iterator();
    while (timestamps.hasNext() && samples.hasNext()) {
      pairs.add(new TimedValue(timestamps.next(), samples.next()));
    }
    return pairs.build();
  }

  /**
   * Upsamples this series onto a finer grid by backward filling. Every target slot takes the
   * first sample whose interval ends at or after the target timestamp, so a coarse sample is
   * repeated across all finer slots it covers.
   *
   * @param target Grid to fill.
   * @return One sample per timestamp of {@code target}.
   * @throws IllegalArgumentException If {@code target} is not covered by this series.
   */
  public ImmutableList<Optional<Double>> bfillUpsample(TimeWindow target) {
    if (target.equals(window)) {
      return values;
    }
    checkArgument(target.getStep() > 0, "Cannot upsample onto %s", target);
    checkArgument(target.getStart() >= window.getStart(),
        "%s is not covered by %s", target, window);

    ImmutableList<Long> sourceTimes = window.timestamps();
    ImmutableList.Builder<Optional<Double>> upsampled = ImmutableList.builder();
    int i = 0;
    for (long t = target.getStart(); t < target.getEnd(); t += target.getStep()) {
      checkCovered(i, sourceTimes.size(), target);
      if (t >= sourceTimes.get(i)) {
        i++;
        checkCovered(i, sourceTimes.size(), target);
      }
      upsampled.add(values.get(i));
    }
    return upsampled.build();
  }

  private void checkCovered(int index, int sourceSize, TimeWindow target) {
    checkArgument(index < sourceSize && index < values.size(),
        "%s is not covered by %s", target, window);
  }

  /**
   * Downsamples this series onto a coarser grid, reducing each group of samples with a
   * consolidation function. Target slots that receive no samples are absent.
   *
   * @param target Coarser grid.
   * @param function Reduction applied to each group.
   * @return One sample per timestamp of {@code target}.
   * @throws IllegalArgumentException If a sample lies past the last slot of {@code target}.
   */
  public ImmutableList<Optional<Double>> downsample(
      TimeWindow target,
      ConsolidationFunction function) {

    if (target.equals(window)) {
      return values;
    }

    ImmutableList<Long> desiredTimes = target.timestamps();
    List<Optional<Double>> downsampled = Lists.newArrayList();
    List<Optional<Double>> group = Lists.newArrayList();
    int i = 0;
    for (TimedValue pair : timedValues()) {
      checkArgument(i < desiredTimes.size(), "Sample at %s is outside of %s", pair.time, target);
      if (pair.time > desiredTimes.get(i)) {
        downsampled.add(function.aggregate(group));
        group = Lists.newArrayList();
        i++;
        checkArgument(i < desiredTimes.size(),
            "Sample at %s is outside of %s", pair.time, target);
      }
      group.add(pair.value);
    }

    int missing = desiredTimes.size() - downsampled.size();
    if (missing > 0) {
      downsampled.add(function.aggregate(group));
      for (int j = 1; j < missing; j++) {
        downsampled.add(Optional.empty());
      }
    }
    return ImmutableList.copyOf(downsampled);
  }

  @Override
  public Iterator<Optional<Double>> iterator() {
    return values.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeSeries)) {
      return false;
    }

    TimeSeries other = (TimeSeries) o;
    return window.equals(other.window) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return 31 * window.hashCode() + values.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("values", values)
        .add("window", window)
        .toString();
  }

  /**
   * A sample together with the timestamp closing its interval.
   */
  public static final class TimedValue {
    private final long time;
    private final Optional<Double> value;

    TimedValue(long time, Optional<Double> value) {
      this.time = time;
      this.value = requireNonNull(value);
    }

    public long getTime() {
      return time;
    }

    public Optional<Double> getValue() {
      return value;
    }

    @Override
    public String toString() {
      return time + "=" + value;
    }
  }
}
