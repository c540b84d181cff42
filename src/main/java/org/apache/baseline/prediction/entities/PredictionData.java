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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.apache.baseline.prediction.series.TimeWindow;

import static java.util.Objects.requireNonNull;

/**
 * Per-timepoint statistics of one computed prediction.
 */
public final class PredictionData {
  private final ImmutableList<Optional<DataStat>> points;
  private final TimeWindow window;

  /**
   * Creates prediction data.
   *
   * @param points One summary per grid timestamp, absent where no history was available.
   * @param window Grid the points were aligned to, the window of the most recent history slice.
   */
  public PredictionData(List<Optional<DataStat>> points, TimeWindow window) {
    this.points = ImmutableList.copyOf(points);
    this.window = requireNonNull(window);
  }

  public ImmutableList<Optional<DataStat>> getPoints() {
    return points;
  }

  public int getNumPoints() {
    return points.size();
  }

  public TimeWindow getWindow() {
    return window;
  }

  public long getStep() {
    return window.getStep();
  }

  /**
   * Looks up the point a bucket offset falls onto.
   *
   * @param offset Seconds since the start of the bucket.
   * @return The point, absent if there is none or it lies outside of the data.
   */
  public Optional<DataStat> pointAt(long offset) {
    if (offset < 0 || window.getStep() == 0) {
      return Optional.empty();
    }
    long index = offset / window.getStep();
    return index < points.size() ? points.get((int) index) : Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PredictionData)) {
      return false;
    }

    PredictionData other = (PredictionData) o;
    return points.equals(other.points) && window.equals(other.window);
  }

  @Override
  public int hashCode() {
    return Objects.hash(points, window);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("window", window)
        .add("numPoints", points.size())
        .toString();
  }
}
