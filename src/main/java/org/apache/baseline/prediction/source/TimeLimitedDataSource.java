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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.apache.baseline.prediction.config.types.TimeAmount;
import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.series.ConsolidationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decorates a data source, giving up on fetches that do not complete in time.
 */
public class TimeLimitedDataSource implements HistoricDataSource {
  private static final Logger LOG = LoggerFactory.getLogger(TimeLimitedDataSource.class);

  private final HistoricDataSource delegate;
  private final TimeLimiter limiter;
  private final long timeoutMs;

  public TimeLimitedDataSource(
      HistoricDataSource delegate,
      ExecutorService executor,
      TimeAmount timeout) {

    this.delegate = requireNonNull(delegate);
    this.limiter = SimpleTimeLimiter.create(executor);
    this.timeoutMs = timeout.as(TimeUnit.MILLISECONDS);
  }

  @Override
  public HistoricData fetch(
      MetricKey key,
      ConsolidationFunction cf,
      long fromTime,
      long untilTime) throws DataUnavailableException {

    try {
      return limiter.callWithTimeout(
          () -> delegate.fetch(key, cf, fromTime, untilTime),
          timeoutMs,
          TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.warn("Fetching history of {} timed out after {} ms", key, timeoutMs);
      throw new DataUnavailableException(
          String.format("Timed out fetching history of %s after %d ms", key, timeoutMs), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DataUnavailableException("Interrupted while fetching history of " + key, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof DataUnavailableException) {
        throw (DataUnavailableException) e.getCause();
      }
      throw new DataUnavailableException("Failed to fetch history of " + key, e.getCause());
    } catch (UncheckedExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }
}
