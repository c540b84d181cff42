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

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Identifies the metric of one monitored service, the unit predictions are stored for.
 */
public final class MetricKey {
  private final String hostName;
  private final String serviceDescription;
  private final String metricName;

  public MetricKey(String hostName, String serviceDescription, String metricName) {
    this.hostName = requireNonNull(hostName);
    this.serviceDescription = requireNonNull(serviceDescription);
    this.metricName = requireNonNull(metricName);
    checkArgument(!hostName.isEmpty(), "Empty host name");
    checkArgument(!metricName.isEmpty(), "Empty metric name");
  }

  public String getHostName() {
    return hostName;
  }

  public String getServiceDescription() {
    return serviceDescription;
  }

  public String getMetricName() {
    return metricName;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof MetricKey)) {
      return false;
    }

    MetricKey other = (MetricKey) o;
    return hostName.equals(other.hostName)
        && serviceDescription.equals(other.serviceDescription)
        && metricName.equals(other.metricName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hostName, serviceDescription, metricName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("host", hostName)
        .add("service", serviceDescription)
        .add("metric", metricName)
        .toString();
  }
}
