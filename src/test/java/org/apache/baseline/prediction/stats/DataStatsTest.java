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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import org.apache.baseline.prediction.entities.DataStat;
import org.apache.baseline.prediction.series.TimeSeries;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class DataStatsTest {

  private static final double EPSILON = 1e-9;

  private static List<Optional<Double>> slice(Double... values) {
    return TimeSeries.fromNullable(Arrays.asList(values));
  }

  @Test
  public void testStdDev() {
    assertEquals(Math.sqrt(2), DataStats.stdDev(ImmutableList.of(2.0, 4.0), 3.0).get(), EPSILON);
  }

  @Test
  public void testStdDevSingleSample() {
    assertEquals(Optional.empty(), DataStats.stdDev(ImmutableList.of(5.0), 5.0));
  }

  @Test
  public void testStdDevConstant() {
    assertEquals(0.0, DataStats.stdDev(ImmutableList.of(0.1, 0.1, 0.1), 0.1).get(), 1e-6);
  }

  @Test
  public void testSummarize() {
    ImmutableList<Optional<DataStat>> stats = DataStats.summarize(ImmutableList.of(
        slice(10.0, 10.0, 12.0),
        slice(10.0, 12.0, 12.0),
        slice(12.0, 12.0, 12.0)));

    assertEquals(3, stats.size());
    double[] averages = {32.0 / 3, 34.0 / 3, 12.0};
    double[] mins = {10.0, 10.0, 12.0};
    for (int i = 0; i < 3; i++) {
      DataStat stat = stats.get(i).get();
      assertEquals(averages[i], stat.getAverage(), EPSILON);
      assertEquals(mins[i], stat.getMin(), EPSILON);
      assertEquals(12.0, stat.getMax(), EPSILON);
    }
    assertEquals(10.67, stats.get(0).get().getAverage(), 0.005);
    assertEquals(11.33, stats.get(1).get().getAverage(), 0.005);
    assertEquals(0.0, stats.get(2).get().getStdev().get(), 1e-6);
  }

  @Test
  public void testSummarizeAbsentSamples() {
    ImmutableList<Optional<DataStat>> stats = DataStats.summarize(ImmutableList.of(
        slice(null, 2.0, null),
        slice(null, 4.0, 7.0)));

    assertEquals(Optional.empty(), stats.get(0));
    assertEquals(
        Optional.of(new DataStat(3.0, 2.0, 4.0, Optional.of(Math.sqrt(2)))),
        stats.get(1));
    DataStat single = stats.get(2).get();
    assertEquals(7.0, single.getAverage(), EPSILON);
    assertFalse(single.getStdev().isPresent());
  }

  @Test
  public void testShortestSliceBoundsColumns() {
    assertEquals(2, DataStats.summarize(ImmutableList.of(
        slice(1.0, 2.0, 3.0),
        slice(1.0, 2.0))).size());
  }

  @Test
  public void testNoSlices() {
    assertEquals(ImmutableList.of(), DataStats.summarize(ImmutableList.of()));
  }
}
