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

import com.google.common.base.MoreObjects;
import com.google.common.collect.Range;

import org.apache.baseline.prediction.period.Timegroup;
import org.apache.baseline.prediction.series.ConsolidationFunction;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Metadata describing how and when a prediction was computed.
 */
public final class PredictionInfo {
  private final Timegroup name;
  private final long time;
  private final Range<Long> range;
  private final ConsolidationFunction cf;
  private final String dsname;
  private final long slice;
  private final PredictionParameters params;

  /**
   * Creates prediction metadata.
   *
   * @param name Timegroup the prediction is for.
   * @param time Epoch seconds the prediction was computed at.
   * @param range Bucket containing {@code time}.
   * @param cf Consolidation function the history is fetched with.
   * @param dsname Metric name.
   * @param slice Bucket width in seconds.
   * @param params Parameters the prediction was computed with.
   */
  public PredictionInfo(
      Timegroup name,
      long time,
      Range<Long> range,
      ConsolidationFunction cf,
      String dsname,
      long slice,
      PredictionParameters params) {

    this.name = requireNonNull(name);
    this.time = time;
    this.range = requireNonNull(range);
    checkArgument(range.hasLowerBound() && range.hasUpperBound(), "Unbounded range %s", range);
    this.cf = requireNonNull(cf);
    this.dsname = requireNonNull(dsname);
    this.slice = slice;
    this.params = requireNonNull(params);
  }

  public Timegroup getName() {
    return name;
  }

  public long getTime() {
    return time;
  }

  public Range<Long> getRange() {
    return range;
  }

  public ConsolidationFunction getCf() {
    return cf;
  }

  public String getDsname() {
    return dsname;
  }

  public long getSlice() {
    return slice;
  }

  public PredictionParameters getParams() {
    return params;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PredictionInfo)) {
      return false;
    }

    PredictionInfo other = (PredictionInfo) o;
    return name.equals(other.name)
        && time == other.time
        && range.equals(other.range)
        && cf == other.cf
        && dsname.equals(other.dsname)
        && slice == other.slice
        && params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, time, range, cf, dsname, slice, params);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("time", time)
        .add("range", range)
        .add("cf", cf)
        .add("dsname", dsname)
        .add("slice", slice)
        .add("params", params)
        .toString();
  }
}
