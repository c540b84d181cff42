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
package org.apache.baseline.prediction.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.inject.Guice;

import org.apache.baseline.common.util.testing.FakeClock;
import org.apache.baseline.prediction.PredictionModule;
import org.apache.baseline.prediction.entities.DataStat;
import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.entities.PredictionParameters;
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.apache.baseline.prediction.period.TimeSlices;
import org.apache.baseline.prediction.period.Timegroup;
import org.apache.baseline.prediction.series.ConsolidationFunction;
import org.apache.baseline.prediction.series.TimeWindow;
import org.apache.baseline.prediction.storage.FilePredictionStore.FileStoreFactory;
import org.apache.baseline.prediction.storage.PredictionCodec;
import org.apache.baseline.prediction.storage.PredictionStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.UTF_8;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class PredictionMainTest {

  // Tuesday, 2024-01-02 12:00:00 UTC.
  private static final long NOW = 1704196800L;
  private static final long TUESDAY_START = 1704153600L;

  private static final MetricKey KEY = new MetricKey("web01", "CPU load", "load1");
  private static final PredictionInfo INFO = new PredictionInfo(
      Timegroup.of("tuesday"),
      NOW,
      Range.closedOpen(TUESDAY_START, TUESDAY_START + 86400),
      ConsolidationFunction.MAX,
      "load1",
      86400,
      PredictionParameters.builder(PredictionPeriod.WDAY, 28).build());
  private static final PredictionData DATA = new PredictionData(
      ImmutableList.of(Optional.of(new DataStat(1.0, 1.0, 1.0, Optional.empty()))),
      new TimeWindow(TUESDAY_START, TUESDAY_START + 86400, 86400));

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private Path baseDir;
  private PredictionCodec codec;
  private PredictionStore.Factory storeFactory;
  private PredictionMain main;
  private ByteArrayOutputStream output;

  @Before
  public void setUp() throws IOException {
    baseDir = temporaryFolder.newFolder().toPath();
    codec = new PredictionCodec();
    storeFactory = new FileStoreFactory(baseDir, codec);
    FakeClock clock = new FakeClock();
    clock.setNowSeconds(NOW);
    main = new PredictionMain(clock, new TimeSlices(ZoneOffset.UTC), storeFactory, codec);
    output = new ByteArrayOutputStream();
  }

  private static PredictionMain.Options options(String timegroup) {
    PredictionMain.Options options = new PredictionMain.Options();
    options.host = KEY.getHostName();
    options.service = KEY.getServiceDescription();
    options.metric = KEY.getMetricName();
    options.timegroup = timegroup;
    return options;
  }

  private int run(PredictionMain.Options options) {
    return main.run(options, new PrintStream(output, true));
  }

  private String printed() {
    return new String(output.toByteArray(), UTF_8);
  }

  @Test
  public void testPrintsStoredPrediction() {
    storeFactory.forMetric(KEY).save(INFO, DATA);

    assertEquals(PredictionMain.EXIT_OK, run(options("tuesday")));
    assertTrue(printed().contains(codec.serializeInfo(INFO)));
    assertTrue(printed().contains(codec.serializeData(DATA)));
  }

  @Test
  public void testDefaultsToCurrentTimegroup() {
    storeFactory.forMetric(KEY).save(INFO, DATA);

    assertEquals(PredictionMain.EXIT_OK, run(options(null)));
    assertTrue(printed().contains(codec.serializeInfo(INFO)));
  }

  @Test
  public void testMissingPrediction() {
    assertEquals(PredictionMain.EXIT_NOT_FOUND, run(options("monday")));
    assertTrue(printed().contains("No prediction stored for monday"));
  }

  @Test
  public void testCorruptPrediction() throws IOException {
    PredictionStore store = storeFactory.forMetric(KEY);
    store.save(INFO, DATA);
    Path info = baseDir.resolve("web01").resolve("CPU_load").resolve("load1")
        .resolve("tuesday.info");
    Files.write(info, "not json".getBytes(UTF_8));

    assertEquals(PredictionMain.EXIT_ERROR, run(options("tuesday")));
  }

  @Test
  public void testInjectorWiring() {
    PredictionModule.Options options = new PredictionModule.Options();
    options.predictionDir = baseDir.toFile();
    options.timezone = ZoneOffset.UTC;

    assertNotNull(Guice.createInjector(new PredictionMain.InspectorModule(options))
        .getInstance(PredictionMain.class));
  }
}
