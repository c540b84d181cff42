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

import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.series.ConsolidationFunction;

/**
 * Remote monitoring datastore holding the raw history of metrics.
 */
public interface HistoricDataSource {

  /**
   * Fetches the history of a metric over a time range.
   *
   * @param key Metric to fetch.
   * @param cf Consolidation function the datastore applies to archived samples.
   * @param fromTime First second of the range, in epoch seconds.
   * @param untilTime First second after the range, in epoch seconds.
   * @return Evenly spaced samples together with the window they cover. The window may be aligned
   *     differently than the requested range.
   * @throws DataUnavailableException If the datastore cannot be reached or has no such metric.
   */
  HistoricData fetch(MetricKey key, ConsolidationFunction cf, long fromTime, long untilTime)
      throws DataUnavailableException;
}
