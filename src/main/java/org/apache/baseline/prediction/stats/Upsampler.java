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
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import org.apache.baseline.prediction.series.TimeSeries;
import org.apache.baseline.prediction.series.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Aligns history slices of differing resolution onto one grid.
 * <p>
 * The resolution of historic data degrades with its age, so the most recent slice is assumed to
 * carry the finest resolution and every slice is upsampled onto its grid.
 */
public final class Upsampler {
  private static final Logger LOG = LoggerFactory.getLogger(Upsampler.class);

  private Upsampler() {
    // Utility class.
  }

  /**
   * Upsamples all slices onto the grid of the first one.
   *
   * @param slices History slices, most recent first.
   * @return The common grid and the aligned samples of every slice.
   * @throws IllegalArgumentException If there are no slices, or a slice does not cover its share
   *     of the grid.
   */
  public static AlignedSlices upsample(List<HistorySlice> slices) {
    checkArgument(!slices.isEmpty(), "No history slices to align");

    TimeWindow window = slices.get(0).getSeries().getWindow();
    ImmutableList.Builder<ImmutableList<Optional<Double>>> aligned = ImmutableList.builder();
    for (HistorySlice slice : slices) {
      TimeWindow own = slice.getSeries().getWindow();
      if (own.getStep() < window.getStep()) {
        LOG.warn("History slice {} has a finer resolution than the most recent grid {}",
            own, window);
      }
      aligned.add(slice.getSeries().bfillUpsample(window.shiftBack(slice.getShift())));
    }
    return new AlignedSlices(window, aligned.build());
  }

  /**
   * Fetched history of one bucket, together with its distance from the most recent bucket.
   */
  public static final class HistorySlice {
    private final TimeSeries series;
    private final long shift;

    public HistorySlice(TimeSeries series, long shift) {
      this.series = requireNonNull(series);
      this.shift = shift;
    }

    public TimeSeries getSeries() {
      return series;
    }

    /**
     * Seconds this slice lies before the most recent one.
     */
    public long getShift() {
      return shift;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof HistorySlice)) {
        return false;
      }

      HistorySlice other = (HistorySlice) o;
      return series.equals(other.series) && shift == other.shift;
    }

    @Override
    public int hashCode() {
      return Objects.hash(series, shift);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("series", series)
          .add("shift", shift)
          .toString();
    }
  }

  /**
   * History slices aligned onto a common grid.
   */
  public static final class AlignedSlices {
    private final TimeWindow window;
    private final ImmutableList<ImmutableList<Optional<Double>>> slices;

    AlignedSlices(TimeWindow window, ImmutableList<ImmutableList<Optional<Double>>> slices) {
      this.window = requireNonNull(window);
      this.slices = requireNonNull(slices);
    }

    public TimeWindow getWindow() {
      return window;
    }

    public ImmutableList<ImmutableList<Optional<Double>>> getSlices() {
      return slices;
    }
  }
}
