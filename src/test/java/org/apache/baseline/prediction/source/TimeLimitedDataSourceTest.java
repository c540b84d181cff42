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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;

import org.apache.baseline.prediction.config.types.TimeAmount;
import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.series.ConsolidationFunction;
import org.apache.baseline.prediction.series.TimeWindow;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TimeLimitedDataSourceTest {

  private static final MetricKey KEY = new MetricKey("web01", "CPU load", "load1");
  private static final HistoricData HISTORY =
      new HistoricData(ImmutableList.of(), new TimeWindow(0, 0, 0));
  private static final TimeAmount TIMEOUT = new TimeAmount(200, TimeUnit.MILLISECONDS);

  private ExecutorService executor;
  private CountDownLatch release;

  @Before
  public void setUp() {
    executor = Executors.newCachedThreadPool();
    release = new CountDownLatch(1);
  }

  @After
  public void tearDown() {
    release.countDown();
    executor.shutdownNow();
  }

  private HistoricData fetch(HistoricDataSource delegate) throws DataUnavailableException {
    return new TimeLimitedDataSource(delegate, executor, TIMEOUT)
        .fetch(KEY, ConsolidationFunction.MAX, 0, 86400);
  }

  @Test
  public void testFetch() throws Exception {
    assertSame(HISTORY, fetch((key, cf, from, until) -> {
      assertEquals(KEY, key);
      assertEquals(ConsolidationFunction.MAX, cf);
      assertEquals(0, from);
      assertEquals(86400, until);
      return HISTORY;
    }));
  }

  @Test
  public void testTimeout() {
    try {
      fetch((key, cf, from, until) -> {
        try {
          release.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return HISTORY;
      });
      fail();
    } catch (DataUnavailableException e) {
      assertTrue(e.getMessage().contains("Timed out"));
    }
  }

  @Test
  public void testUnavailablePassesThrough() {
    DataUnavailableException failure = new DataUnavailableException("No such metric");
    try {
      fetch((key, cf, from, until) -> {
        throw failure;
      });
      fail();
    } catch (DataUnavailableException e) {
      assertSame(failure, e);
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testRuntimeFailurePassesThrough() throws Exception {
    fetch((key, cf, from, until) -> {
      throw new IllegalStateException("Broken source");
    });
  }
}
