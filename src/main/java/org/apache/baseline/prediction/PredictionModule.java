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

import java.io.File;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import javax.inject.Qualifier;
import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

import org.apache.baseline.common.util.Clock;
import org.apache.baseline.prediction.config.types.TimeAmount;
import org.apache.baseline.prediction.config.validators.PositiveAmount;
import org.apache.baseline.prediction.levels.PredictiveLevels;
import org.apache.baseline.prediction.period.TimeSlices;
import org.apache.baseline.prediction.source.HistoricDataSource;
import org.apache.baseline.prediction.source.TimeLimitedDataSource;
import org.apache.baseline.prediction.storage.FilePredictionStore.FileStoreFactory;
import org.apache.baseline.prediction.storage.FilePredictionStore.PredictionDir;
import org.apache.baseline.prediction.storage.PredictionCodec;
import org.apache.baseline.prediction.storage.PredictionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Binds the prediction engine. The embedding application supplies the source of historic data,
 * which is decorated with a fetch timeout.
 */
public class PredictionModule extends AbstractModule {
  private static final Logger LOG = LoggerFactory.getLogger(PredictionModule.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-prediction_dir",
        required = true,
        description = "Directory to store predictions under. Will be created if it does not exist.")
    public File predictionDir;

    @Parameter(names = "-prediction_timezone",
        description = "Time zone buckets are aligned to. Defaults to the system time zone.")
    public ZoneId timezone = ZoneId.systemDefault();

    @Parameter(names = "-historic_fetch_timeout",
        validateValueWith = PositiveAmount.class,
        description = "Maximum time to wait for history of one bucket to be fetched.")
    public TimeAmount historicFetchTimeout = new TimeAmount(30, TimeUnit.SECONDS);
  }

  /**
   * Binding annotation for the undecorated source of historic data.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  @interface RawSource { }

  private final Options options;
  private final Class<? extends HistoricDataSource> dataSource;

  public PredictionModule(Options options, Class<? extends HistoricDataSource> dataSource) {
    this.options = requireNonNull(options);
    this.dataSource = requireNonNull(dataSource);
  }

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(ZoneId.class).toInstance(options.timezone);
    bind(TimeSlices.class).in(Singleton.class);
    bind(PredictionCodec.class).in(Singleton.class);
    bind(PredictionStore.Factory.class).to(FileStoreFactory.class);
    bind(FileStoreFactory.class).in(Singleton.class);

    bind(HistoricDataSource.class).annotatedWith(RawSource.class).to(dataSource);
    bind(PredictionComputer.class).in(Singleton.class);
    bind(PredictiveLevels.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  HistoricDataSource provideDataSource(@RawSource HistoricDataSource delegate) {
    ExecutorService executor = Executors.newCachedThreadPool(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("HistoricFetch-%d")
            .build());
    return new TimeLimitedDataSource(delegate, executor, options.historicFetchTimeout);
  }

  @Provides
  @PredictionDir
  Path providePredictionDir() {
    return preparePredictionDir(options.predictionDir);
  }

  /**
   * Creates the prediction directory if needed and makes sure it is writable.
   *
   * @param dir Directory to prepare.
   * @return The directory.
   * @throws IllegalArgumentException If the directory cannot be created or written to.
   */
  public static Path preparePredictionDir(File dir) {
    if (!dir.exists()) {
      if (dir.mkdirs()) {
        LOG.info("Created prediction dir " + dir.getPath() + ".");
      } else {
        throw new IllegalArgumentException(
            "Unable to create prediction dir " + dir.getPath() + ".");
      }
    }

    if (!dir.canWrite()) {
      throw new IllegalArgumentException(
          "Prediction dir " + dir.getPath() + " is not writable.");
    }

    return dir.toPath();
  }
}
