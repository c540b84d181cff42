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
package org.apache.baseline.prediction.config;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.IStringConverterFactory;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.baseline.prediction.app.PredictionMain;
import org.apache.baseline.prediction.config.converters.TimeAmountConverter;
import org.apache.baseline.prediction.config.converters.ZoneIdConverter;
import org.apache.baseline.prediction.config.types.TimeAmount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses command line options and populates {@link CliOptions}.
 */
public final class CommandLine {

  private static final Logger LOG = LoggerFactory.getLogger(CommandLine.class);

  private CommandLine() {
    // Utility class.
  }

  private static JCommander prepareParser(CliOptions options) {
    JCommander.Builder builder = JCommander.newBuilder()
        .programName(PredictionMain.class.getName());

    builder.addConverterFactory(new IStringConverterFactory() {
      private final Map<Class<?>, Class<? extends IStringConverter<?>>> classConverters =
          ImmutableMap.<Class<?>, Class<? extends IStringConverter<?>>>builder()
              .put(TimeAmount.class, TimeAmountConverter.class)
              .put(ZoneId.class, ZoneIdConverter.class)
              .build();

      @Override
      public Class<? extends IStringConverter<?>> getConverter(Class<?> forType) {
        return classConverters.get(forType);
      }
    });

    builder.addObject(getOptionsObjects(options));
    return builder.build();
  }

  /**
   * Applies arg values to a fresh options object.
   *
   * @param args Command line arguments.
   * @return Parsed options.
   * @throws ParameterException If the arguments are invalid. Usage is printed before throwing.
   */
  public static CliOptions parseOptions(String... args) {
    CliOptions options = new CliOptions();
    JCommander parser = prepareParser(options);
    try {
      parser.parse(args);
      return options;
    } catch (ParameterException e) {
      parser.usage();
      LOG.error(e.getMessage());
      throw e;
    }
  }

  @VisibleForTesting
  static List<Object> getOptionsObjects(CliOptions options) {
    ImmutableList.Builder<Object> objects = ImmutableList.builder();

    // Reflect on fields defined in CliOptions to avoid forgetting to add an option field here.
    for (Field field : CliOptions.class.getDeclaredFields()) {
      if (Modifier.isStatic(field.getModifiers())) {
        continue;
      }

      try {
        objects.add(field.get(options));
      } catch (IllegalAccessException e) {
        throw new RuntimeException(e);
      }
    }

    return objects.build();
  }
}
