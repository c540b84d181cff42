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
package org.apache.baseline.prediction.storage;

import java.util.Optional;

import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.period.Timegroup;

/**
 * Persists the computed predictions of one metric, one artifact per timegroup. An artifact
 * consists of the prediction metadata and its statistics.
 */
public interface PredictionStore {

  /**
   * Metric this store holds predictions for.
   *
   * @return The metric key.
   */
  MetricKey getKey();

  /**
   * Stores an artifact, replacing whatever was stored for the same timegroup.
   *
   * @param info Prediction metadata, its name selects the timegroup.
   * @param data Prediction statistics.
   * @throws PredictionStoreException If the artifact could not be written.
   */
  void save(PredictionInfo info, PredictionData data);

  /**
   * Deletes the artifact of a timegroup. Deleting a missing artifact is a no-op.
   *
   * @param timegroup Timegroup to delete.
   * @throws PredictionStoreException If an existing file could not be deleted.
   */
  void remove(Timegroup timegroup);

  /**
   * Reads the metadata of a timegroup's artifact.
   *
   * @param timegroup Timegroup to read.
   * @return The metadata, absent if none is stored.
   * @throws CorruptArtifactException If the stored metadata cannot be decoded.
   */
  Optional<PredictionInfo> getInfo(Timegroup timegroup);

  /**
   * Reads the statistics of a timegroup's artifact.
   *
   * @param timegroup Timegroup to read.
   * @return The statistics, absent if none are stored.
   * @throws CorruptArtifactException If the stored statistics cannot be decoded.
   */
  Optional<PredictionData> getData(Timegroup timegroup);

  /**
   * Provides the store of a metric.
   */
  interface Factory {
    PredictionStore forMetric(MetricKey key);
  }
}
