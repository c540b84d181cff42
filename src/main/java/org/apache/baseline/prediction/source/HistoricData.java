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
package org.apache.baseline.prediction.source;

import java.util.List;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.apache.baseline.prediction.series.TimeSeries;
import org.apache.baseline.prediction.series.TimeWindow;

import static java.util.Objects.requireNonNull;

/**
 * Raw history as returned by a {@link HistoricDataSource}.
 */
public final class HistoricData {
  private final ImmutableList<Optional<Double>> values;
  private final TimeWindow window;

  public HistoricData(List<Optional<Double>> values, TimeWindow window) {
    this.values = ImmutableList.copyOf(values);
    this.window = requireNonNull(window);
  }

  public ImmutableList<Optional<Double>> getValues() {
    return values;
  }

  public TimeWindow getWindow() {
    return window;
  }

  /**
   * Interprets the samples as a series over the returned window.
   *
   * @return The series.
   * @throws IllegalArgumentException If the sample count does not fit the window.
   */
  public TimeSeries toSeries() {
    return new TimeSeries(values, window);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("window", window)
        .add("values", values.size())
        .toString();
  }
}
