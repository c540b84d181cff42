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

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Optional;

import javax.inject.Inject;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Provides;

import org.apache.baseline.common.util.Clock;
import org.apache.baseline.prediction.PredictionModule;
import org.apache.baseline.prediction.config.CliOptions;
import org.apache.baseline.prediction.config.CommandLine;
import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.apache.baseline.prediction.period.TimeSlices;
import org.apache.baseline.prediction.period.Timegroup;
import org.apache.baseline.prediction.storage.FilePredictionStore.FileStoreFactory;
import org.apache.baseline.prediction.storage.FilePredictionStore.PredictionDir;
import org.apache.baseline.prediction.storage.PredictionCodec;
import org.apache.baseline.prediction.storage.PredictionStore;
import org.apache.baseline.prediction.storage.PredictionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Prints the stored prediction of a metric's timegroup. Predictions are only read, so no source of
 * historic data is needed.
 */
public class PredictionMain {
  private static final Logger LOG = LoggerFactory.getLogger(PredictionMain.class);

  @VisibleForTesting
  static final int EXIT_OK = 0;
  @VisibleForTesting
  static final int EXIT_NOT_FOUND = 1;
  @VisibleForTesting
  static final int EXIT_ERROR = 2;

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-host", required = true, description = "Host of the metric to inspect.")
    public String host;

    @Parameter(names = "-service",
        required = true,
        description = "Service description of the metric to inspect.")
    public String service;

    @Parameter(names = "-metric", required = true, description = "Name of the metric to inspect.")
    public String metric;

    @Parameter(names = "-timegroup",
        description = "Timegroup to inspect. Defaults to the timegroup the current time falls in.")
    public String timegroup;

    @Parameter(names = "-period",
        description = "Period used to find the current timegroup when -timegroup is not given.")
    public PredictionPeriod period = PredictionPeriod.WDAY;
  }

  static class InspectorModule extends AbstractModule {
    private final PredictionModule.Options options;

    InspectorModule(PredictionModule.Options options) {
      this.options = requireNonNull(options);
    }

    @Override
    protected void configure() {
      bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
      bind(ZoneId.class).toInstance(options.timezone);
      bind(PredictionStore.Factory.class).to(FileStoreFactory.class);
    }

    @Provides
    @PredictionDir
    Path providePredictionDir() {
      return PredictionModule.preparePredictionDir(options.predictionDir);
    }
  }

  private final Clock clock;
  private final TimeSlices timeSlices;
  private final PredictionStore.Factory storeFactory;
  private final PredictionCodec codec;

  @Inject
  PredictionMain(
      Clock clock,
      TimeSlices timeSlices,
      PredictionStore.Factory storeFactory,
      PredictionCodec codec) {

    this.clock = requireNonNull(clock);
    this.timeSlices = requireNonNull(timeSlices);
    this.storeFactory = requireNonNull(storeFactory);
    this.codec = requireNonNull(codec);
  }

  @VisibleForTesting
  int run(Options options, PrintStream out) {
    MetricKey key = new MetricKey(options.host, options.service, options.metric);
    Timegroup timegroup = options.timegroup == null
        ? timeSlices.relativeTime(clock.nowSeconds(), options.period).getTimegroup()
        : Timegroup.of(options.timegroup);
    PredictionStore store = storeFactory.forMetric(key);

    try {
      Optional<PredictionInfo> info = store.getInfo(timegroup);
      Optional<PredictionData> data = store.getData(timegroup);
      if (!info.isPresent() && !data.isPresent()) {
        out.println("No prediction stored for " + timegroup + " of " + key);
        return EXIT_NOT_FOUND;
      }

      out.println(info.map(codec::serializeInfo).orElse("No prediction info stored"));
      out.println(data.map(codec::serializeData).orElse("No prediction data stored"));
      return EXIT_OK;
    } catch (PredictionStoreException e) {
      LOG.error("Failed to read prediction " + timegroup + " of " + key, e);
      return EXIT_ERROR;
    }
  }

  public static void main(String... args) {
    CliOptions options = CommandLine.parseOptions(args);
    PredictionMain main = Guice.createInjector(new InspectorModule(options.prediction))
        .getInstance(PredictionMain.class);
    System.exit(main.run(options.main, System.out));
  }
}
