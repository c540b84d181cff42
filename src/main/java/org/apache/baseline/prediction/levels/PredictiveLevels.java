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
package org.apache.baseline.prediction.levels;

import java.util.Objects;
import java.util.Optional;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;

import org.apache.baseline.common.util.Clock;
import org.apache.baseline.prediction.PredictionComputer;
import org.apache.baseline.prediction.entities.DataStat;
import org.apache.baseline.prediction.entities.EstimatedLevels;
import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.entities.PredictionParameters;
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.apache.baseline.prediction.period.TimeSlices;
import org.apache.baseline.prediction.period.TimegroupSlice;
import org.apache.baseline.prediction.series.ConsolidationFunction;
import org.apache.baseline.prediction.source.DataUnavailableException;
import org.apache.baseline.prediction.storage.CorruptArtifactException;
import org.apache.baseline.prediction.storage.PredictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Looks up the levels a metric should currently be checked against, recomputing the prediction
 * of the current timegroup when the stored one is missing or outdated.
 */
public class PredictiveLevels {
  private static final Logger LOG = LoggerFactory.getLogger(PredictiveLevels.class);

  private final Clock clock;
  private final PredictionStore.Factory storeFactory;
  private final PredictionComputer computer;
  private final TimeSlices timeSlices;

  @Inject
  public PredictiveLevels(
      Clock clock,
      PredictionStore.Factory storeFactory,
      PredictionComputer computer,
      TimeSlices timeSlices) {

    this.clock = requireNonNull(clock);
    this.storeFactory = requireNonNull(storeFactory);
    this.computer = requireNonNull(computer);
    this.timeSlices = requireNonNull(timeSlices);
  }

  /**
   * Reference value and levels of a metric at the current time.
   */
  public static final class Result {
    private final Optional<Double> reference;
    private final EstimatedLevels levels;

    public Result(Optional<Double> reference, EstimatedLevels levels) {
      this.reference = requireNonNull(reference);
      this.levels = requireNonNull(levels);
    }

    /**
     * Predicted average at the current point, absent when no history covers it.
     */
    public Optional<Double> getReference() {
      return reference;
    }

    public EstimatedLevels getLevels() {
      return levels;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Result)) {
        return false;
      }

      Result other = (Result) o;
      return reference.equals(other.reference) && levels.equals(other.levels);
    }

    @Override
    public int hashCode() {
      return Objects.hash(reference, levels);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("reference", reference.orElse(null))
          .add("levels", levels)
          .toString();
    }
  }

  /**
   * Gets the current reference value and levels of a metric.
   *
   * @param key Metric to look up.
   * @param cf Consolidation function the history is fetched with.
   * @param params Prediction and levels configuration.
   * @param levelsFactor Scale applied to absolute levels.
   * @return The reference value and levels.
   * @throws DataUnavailableException If the prediction had to be recomputed and history could not
   *     be fetched.
   */
  public Result getLevels(
      MetricKey key,
      ConsolidationFunction cf,
      PredictionParameters params,
      double levelsFactor) throws DataUnavailableException {

    long now = clock.nowSeconds();
    PredictionPeriod period = params.getPeriod();
    TimegroupSlice current = timeSlices.relativeTime(now, period);
    PredictionStore store = storeFactory.forMetric(key);

    Optional<PredictionData> data = Optional.empty();
    if (isUpToDate(loadInfo(store, current), current, now, cf, params)) {
      data = loadData(store, current);
    }
    if (!data.isPresent()) {
      PredictionInfo info = new PredictionInfo(
          current.getTimegroup(),
          now,
          current.getRange(),
          cf,
          key.getMetricName(),
          period.getSlice(),
          params);
      data = Optional.of(computer.computePrediction(store, info, now, period));
    }

    Optional<DataStat> point = data.get().pointAt(current.getOffset());
    Optional<Double> reference = point.map(DataStat::getAverage);
    Optional<Double> stdev = point.flatMap(DataStat::getStdev);
    return new Result(
        reference,
        LevelsEstimator.estimateLevels(reference, stdev, params, levelsFactor));
  }

  private static Optional<PredictionInfo> loadInfo(PredictionStore store, TimegroupSlice current) {
    try {
      return store.getInfo(current.getTimegroup());
    } catch (CorruptArtifactException e) {
      LOG.warn("Discarding unreadable prediction of " + store.getKey(), e);
      return Optional.empty();
    }
  }

  private static Optional<PredictionData> loadData(PredictionStore store, TimegroupSlice current) {
    try {
      return store.getData(current.getTimegroup());
    } catch (CorruptArtifactException e) {
      LOG.warn("Discarding unreadable prediction of " + store.getKey(), e);
      return Optional.empty();
    }
  }

  @VisibleForTesting
  static boolean isUpToDate(
      Optional<PredictionInfo> info,
      TimegroupSlice current,
      long now,
      ConsolidationFunction cf,
      PredictionParameters params) {

    if (!info.isPresent()) {
      return false;
    }

    PredictionInfo stored = info.get();
    PredictionPeriod period = params.getPeriod();
    if (!stored.getName().equals(current.getTimegroup())) {
      return false;
    }
    if (stored.getTime() < now - period.getValidCycles() * period.getSlice()) {
      LOG.debug("Prediction for {} outdated", stored.getName());
      return false;
    }
    if (!stored.getParams().equals(params) || stored.getCf() != cf) {
      LOG.debug("Prediction parameters for {} have changed", stored.getName());
      return false;
    }
    return true;
  }
}
