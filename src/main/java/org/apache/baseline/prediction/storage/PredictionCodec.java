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

import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import org.apache.baseline.prediction.entities.DataStat;
import org.apache.baseline.prediction.entities.LevelsSpec;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.entities.PredictionParameters;
import org.apache.baseline.prediction.entities.Thresholds;
import org.apache.baseline.prediction.period.PredictionPeriod;
import org.apache.baseline.prediction.period.Timegroup;
import org.apache.baseline.prediction.series.ConsolidationFunction;
import org.apache.baseline.prediction.series.TimeWindow;

import static java.util.Objects.requireNonNull;

/**
 * Encodes prediction artifacts as JSON.
 * <p>
 * Statistics points are written as {@code [average, min, max, stdev]} arrays, absent points and
 * an absent standard deviation as {@code null}.
 */
public class PredictionCodec {

  private static void assertRequiredField(String fieldName, @Nullable Object fieldValue) {
    if (fieldValue == null) {
      throw new JsonParseException(String.format("Field %s is required", fieldName));
    }
  }

  private static void assertPair(String fieldName, List<?> pair) {
    assertRequiredField(fieldName, pair);
    if (pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
      throw new JsonParseException(String.format("Field %s must hold two values", fieldName));
    }
  }

  private static class ThresholdsSchema {
    private final Double warn;
    private final Double crit;

    ThresholdsSchema(Thresholds thresholds) {
      warn = thresholds.getWarn();
      crit = thresholds.getCrit();
    }

    Thresholds asThresholds() {
      assertRequiredField("warn", warn);
      assertRequiredField("crit", crit);
      return new Thresholds(warn, crit);
    }
  }

  private static class LevelsSchema {
    private final String type;
    private final Double warn;
    private final Double crit;

    LevelsSchema(LevelsSpec levels) {
      type = levels.getType().getName();
      warn = levels.getThresholds().getWarn();
      crit = levels.getThresholds().getCrit();
    }

    LevelsSpec asLevels() {
      assertRequiredField("type", type);
      assertRequiredField("warn", warn);
      assertRequiredField("crit", crit);
      return LevelsSpec.of(LevelsSpec.Type.forName(type), warn, crit);
    }
  }

  private static class ParametersSchema {
    private final String period;
    private final Integer horizon;
    @SerializedName("levels_upper")
    private final @Nullable LevelsSchema levelsUpper;
    @SerializedName("levels_upper_min")
    private final @Nullable ThresholdsSchema levelsUpperMin;
    @SerializedName("levels_lower")
    private final @Nullable LevelsSchema levelsLower;

    ParametersSchema(PredictionParameters params) {
      period = params.getPeriod().getName();
      horizon = params.getHorizon();
      levelsUpper = params.getLevelsUpper().map(LevelsSchema::new).orElse(null);
      levelsUpperMin = params.getLevelsUpperMin().map(ThresholdsSchema::new).orElse(null);
      levelsLower = params.getLevelsLower().map(LevelsSchema::new).orElse(null);
    }

    PredictionParameters asParameters() {
      assertRequiredField("period", period);
      assertRequiredField("horizon", horizon);
      return PredictionParameters.builder(PredictionPeriod.forName(period), horizon)
          .setLevelsUpper(levelsUpper == null ? null : levelsUpper.asLevels())
          .setLevelsUpperMin(levelsUpperMin == null ? null : levelsUpperMin.asThresholds())
          .setLevelsLower(levelsLower == null ? null : levelsLower.asLevels())
          .build();
    }
  }

  private static class InfoSchema {
    private final String name;
    private final Long time;
    private final List<Long> range;
    private final String cf;
    private final String dsname;
    private final Long slice;
    private final ParametersSchema params;

    InfoSchema(PredictionInfo info) {
      name = info.getName().getName();
      time = info.getTime();
      range = ImmutableList.of(info.getRange().lowerEndpoint(), info.getRange().upperEndpoint());
      cf = info.getCf().getName();
      dsname = info.getDsname();
      slice = info.getSlice();
      params = new ParametersSchema(info.getParams());
    }

    PredictionInfo asInfo() {
      assertRequiredField("name", name);
      assertRequiredField("time", time);
      assertPair("range", range);
      assertRequiredField("cf", cf);
      assertRequiredField("dsname", dsname);
      assertRequiredField("slice", slice);
      assertRequiredField("params", params);
      return new PredictionInfo(
          Timegroup.of(name),
          time,
          Range.closedOpen(range.get(0), range.get(1)),
          ConsolidationFunction.forName(cf),
          dsname,
          slice,
          params.asParameters());
    }
  }

  private static class DataSchema {
    private final List<List<Double>> points;
    @SerializedName("data_twindow")
    private final List<Long> dataTwindow;
    private final Long step;

    DataSchema(PredictionData data) {
      points = Lists.newArrayList(Lists.<Optional<DataStat>, List<Double>>transform(
          data.getPoints(),
          point -> point
              .map(stat -> Lists.newArrayList(
                  stat.getAverage(),
                  stat.getMin(),
                  stat.getMax(),
                  stat.getStdev().orElse(null)))
              .orElse(null)));
      dataTwindow = ImmutableList.of(data.getWindow().getStart(), data.getWindow().getEnd());
      step = data.getStep();
    }

    PredictionData asData() {
      assertRequiredField("points", points);
      assertPair("data_twindow", dataTwindow);
      assertRequiredField("step", step);

      ImmutableList.Builder<Optional<DataStat>> stats = ImmutableList.builder();
      for (@Nullable List<Double> point : points) {
        stats.add(Optional.ofNullable(point).map(DataSchema::asStat));
      }
      return new PredictionData(
          stats.build(),
          new TimeWindow(dataTwindow.get(0), dataTwindow.get(1), step));
    }

    private static DataStat asStat(List<Double> point) {
      if (point.size() != 4 || point.get(0) == null || point.get(1) == null
          || point.get(2) == null) {
        throw new JsonParseException("Malformed statistics point " + point);
      }
      return new DataStat(
          point.get(0),
          point.get(1),
          point.get(2),
          Optional.ofNullable(point.get(3)));
    }
  }

  private final Gson gson;


  public PredictionCodec() {
    this(new GsonBuilder().serializeSpecialFloatingPointValues().create());
  }

  public PredictionCodec(Gson gson) {
    this.gson = requireNonNull(gson);
  }

  public String serializeInfo(PredictionInfo info) {
    return gson.toJson(new InfoSchema(info));
  }

  public String serializeData(PredictionData data) {
    return gson.toJson(new DataSchema(data));
  }

  /**
   * Decodes prediction metadata.
   *
   * @param json Encoded metadata.
   * @return The metadata.
   * @throws CorruptArtifactException If {@code json} is not valid metadata.
   */
  public PredictionInfo deserializeInfo(String json) {
    try {
      @Nullable InfoSchema schema = gson.fromJson(json, InfoSchema.class);
      if (schema == null) {
        throw new CorruptArtifactException("JSON did not include a prediction info object");
      }
      return schema.asInfo();
    } catch (JsonParseException | IllegalArgumentException e) {
      throw new CorruptArtifactException("Problem parsing JSON prediction info.", e);
    }
  }

  /**
   * Decodes prediction statistics.
   *
   * @param json Encoded statistics.
   * @return The statistics.
   * @throws CorruptArtifactException If {@code json} is not valid statistics.
   */
  public PredictionData deserializeData(String json) {
    try {
      @Nullable DataSchema schema = gson.fromJson(json, DataSchema.class);
      if (schema == null) {
        throw new CorruptArtifactException("JSON did not include a prediction data object");
      }
      return schema.asData();
    } catch (JsonParseException | IllegalArgumentException e) {
      throw new CorruptArtifactException("Problem parsing JSON prediction data.", e);
    }
  }
}
