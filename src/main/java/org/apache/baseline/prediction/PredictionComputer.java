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
package org.apache.baseline.prediction;

import java.util.List;

import javax.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.apache.baseline.prediction.period.TimeSlices;
import org.apache.baseline.prediction.series.TimeSeries;
import org.apache.baseline.prediction.source.DataUnavailableException;
import org.apache.baseline.prediction.source.HistoricData;
import org.apache.baseline.prediction.source.HistoricDataSource;
import org.apache.baseline.prediction.stats.DataStats;
import org.apache.baseline.prediction.stats.Upsampler;
import org.apache.baseline.prediction.stats.Upsampler.AlignedSlices;
import org.apache.baseline.prediction.stats.Upsampler.HistorySlice;
import org.apache.baseline.prediction.storage.PredictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Computes the prediction of a timegroup from the history of all buckets sharing it.
 */
public class PredictionComputer {
  private static final Logger LOG = LoggerFactory.getLogger(PredictionComputer.class);

  private final HistoricDataSource dataSource;
  private final TimeSlices timeSlices;

  @Inject
  public PredictionComputer(HistoricDataSource dataSource, TimeSlices timeSlices) {
    this.dataSource = requireNonNull(dataSource);
    this.timeSlices = requireNonNull(timeSlices);
  }

  /**
   * Recomputes and stores the prediction described by {@code info}.
   * <p>
   * Any stored prediction for the timegroup is removed first. The new one is only saved once its
   * statistics are complete, so a failed computation leaves no artifact behind.
   *
   * @param store Store of the predicted metric.
   * @param info Metadata of the prediction to compute, its name selects the timegroup.
   * @param now Epoch seconds to compute the prediction at.
   * @param period Period the timegroup belongs to.
   * @return The computed statistics.
   * @throws DataUnavailableException If history of any bucket cannot be fetched.
   */
  public PredictionData computePrediction(
      PredictionStore store,
      PredictionInfo info,
      long now,
      PredictionPeriod period) throws DataUnavailableException {

    MetricKey key = store.getKey();
    LOG.debug("Calculating prediction data for time group {} of {}", info.getName(), key);
    store.remove(info.getName());

    ImmutableList<Range<Long>> windows = timeSlices.collect(
        now,
        info.getParams().getHorizonSeconds(),
        period,
        info.getName());
    checkArgument(!windows.isEmpty(),
        "No %s bucket within a horizon of %s days", info.getName(), info.getParams().getHorizon());

    long fromTime = windows.get(0).lowerEndpoint();
    ImmutableList.Builder<HistorySlice> slices = ImmutableList.builder();
    for (Range<Long> window : windows) {
      HistoricData history = dataSource.fetch(
          key,
          info.getCf(),
          window.lowerEndpoint(),
          window.upperEndpoint());
      slices.add(new HistorySlice(toSeries(key, history), fromTime - window.lowerEndpoint()));
    }

    PredictionData data = calculate(slices.build());
    store.save(info, data);
    LOG.debug("Computed {} points for time group {} of {} from {} buckets",
        data.getNumPoints(), info.getName(), key, windows.size());
    return data;
  }

  private static TimeSeries toSeries(
      MetricKey key,
      HistoricData history) throws DataUnavailableException {

    try {
      return history.toSeries();
    } catch (IllegalArgumentException e) {
      throw new DataUnavailableException("Malformed history of " + key + ": " + history, e);
    }
  }

  static PredictionData calculate(List<HistorySlice> slices) {
    AlignedSlices aligned = Upsampler.upsample(slices);
    return new PredictionData(DataStats.summarize(aligned.getSlices()), aligned.getWindow());
  }
}
