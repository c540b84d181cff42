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

import java.io.IOException;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.util.concurrent.Striped;

import org.apache.baseline.prediction.entities.MetricKey;
import org.apache.baseline.prediction.entities.PredictionData;
import org.apache.baseline.prediction.entities.PredictionInfo;
import org.apache.baseline.prediction.period.Timegroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Stores predictions as a pair of JSON files per timegroup, in a directory per metric.
 * <p>
 * Files are replaced atomically by writing to a temporary file first. Access to the files of one
 * timegroup is serialized among all stores created by the same {@link FileStoreFactory}.
 */
public class FilePredictionStore implements PredictionStore {
  private static final Logger LOG = LoggerFactory.getLogger(FilePredictionStore.class);

  @VisibleForTesting
  static final String INFO_FILE_SUFFIX = ".info";
  @VisibleForTesting
  static final String DATA_FILE_SUFFIX = ".data";

  private static final CharMatcher UNSAFE_PATH_CHARS = CharMatcher.anyOf(" :/\\");

  /**
   * Binding annotation for the directory all predictions are stored under.
   */
  @Qualifier
  @Target({FIELD, PARAMETER, METHOD}) @Retention(RUNTIME)
  public @interface PredictionDir { }

  private final MetricKey key;
  private final Path dir;
  private final PredictionCodec codec;
  private final Striped<Lock> locks;

  @VisibleForTesting
  FilePredictionStore(MetricKey key, Path baseDir, PredictionCodec codec, Striped<Lock> locks) {
    this.key = requireNonNull(key);
    this.dir = baseDir
        .resolve(sanitize(key.getHostName()))
        .resolve(sanitize(key.getServiceDescription()))
        .resolve(sanitize(key.getMetricName()));
    this.codec = requireNonNull(codec);
    this.locks = requireNonNull(locks);
  }

  /**
   * Replaces characters that are unsafe in a path element.
   *
   * @param name Host, service or metric name.
   * @return The name with spaces, colons and slashes replaced by underscores.
   */
  @VisibleForTesting
  static String sanitize(String name) {
    return UNSAFE_PATH_CHARS.replaceFrom(name, '_');
  }

  @Override
  public MetricKey getKey() {
    return key;
  }

  @VisibleForTesting
  Path getDir() {
    return dir;
  }

  @VisibleForTesting
  Path infoFile(Timegroup timegroup) {
    return dir.resolve(sanitize(timegroup.getName()) + INFO_FILE_SUFFIX);
  }

  @VisibleForTesting
  Path dataFile(Timegroup timegroup) {
    return dir.resolve(sanitize(timegroup.getName()) + DATA_FILE_SUFFIX);
  }

  private Lock lockFor(Timegroup timegroup) {
    return locks.get(infoFile(timegroup).toString());
  }

  @Override
  public void save(PredictionInfo info, PredictionData data) {
    String encodedInfo = codec.serializeInfo(info);
    String encodedData = codec.serializeData(data);

    Lock lock = lockFor(info.getName());
    lock.lock();
    try {
      Files.createDirectories(dir);
      replace(infoFile(info.getName()), encodedInfo);
      replace(dataFile(info.getName()), encodedData);
    } catch (IOException e) {
      throw new PredictionStoreException(
          "Failed to save prediction " + info.getName() + " of " + key, e);
    } finally {
      lock.unlock();
    }
    LOG.debug("Saved prediction {} of {} to {}", info.getName(), key, dir);
  }

  private static void replace(Path target, String content) throws IOException {
    Path temp = Files.createTempFile(target.getParent(), "temp_" + target.getFileName(), "");
    try {
      Files.write(temp, content.getBytes(UTF_8));
      Files.move(
          temp,
          target,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } finally {
      if (Files.deleteIfExists(temp)) {
        LOG.info("Deleted incomplete prediction file " + temp);
      }
    }
  }

  @Override
  public void remove(Timegroup timegroup) {
    Lock lock = lockFor(timegroup);
    lock.lock();
    try {
      Files.deleteIfExists(dataFile(timegroup));
      Files.deleteIfExists(infoFile(timegroup));
    } catch (IOException e) {
      throw new PredictionStoreException(
          "Failed to remove prediction " + timegroup + " of " + key, e);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<PredictionInfo> getInfo(Timegroup timegroup) {
    Optional<PredictionInfo> info = read(timegroup, infoFile(timegroup), codec::deserializeInfo);
    if (!info.isPresent()) {
      LOG.debug("No prediction info for group {} of {} available.", timegroup, key);
    }
    return info;
  }

  @Override
  public Optional<PredictionData> getData(Timegroup timegroup) {
    Optional<PredictionData> data = read(timegroup, dataFile(timegroup), codec::deserializeData);
    if (!data.isPresent()) {
      LOG.debug("No prediction for group {} of {} available.", timegroup, key);
    }
    return data;
  }

  private <T> Optional<T> read(Timegroup timegroup, Path file, Function<String, T> decoder) {
    String content;
    Lock lock = lockFor(timegroup);
    lock.lock();
    try {
      content = new String(Files.readAllBytes(file), UTF_8);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new PredictionStoreException("Failed to read " + file, e);
    } finally {
      lock.unlock();
    }

    try {
      return Optional.of(decoder.apply(content));
    } catch (CorruptArtifactException e) {
      throw new CorruptArtifactException("Corrupt prediction file " + file, e);
    }
  }

  /**
   * Creates the stores of individual metrics, all sharing one set of locks.
   */
  public static class FileStoreFactory implements PredictionStore.Factory {
    private static final int LOCK_STRIPES = 64;

    private final Path baseDir;
    private final PredictionCodec codec;
    private final Striped<Lock> locks;

    @Inject
    public FileStoreFactory(@PredictionDir Path baseDir, PredictionCodec codec) {
      this.baseDir = requireNonNull(baseDir);
      this.codec = requireNonNull(codec);
      this.locks = Striped.lazyWeakLock(LOCK_STRIPES);
    }

    @Override
    public PredictionStore forMetric(MetricKey key) {
      return new FilePredictionStore(key, baseDir, codec, locks);
    }
  }
}
