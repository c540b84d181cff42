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
package org.apache.baseline.prediction.period;

import java.util.Objects;

import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Name of a recurring time bucket, such as {@code monday} or day of month {@code 15}.
 */
public final class Timegroup {
  private final String name;

  private Timegroup(String name) {
    this.name = name;
  }

  public static Timegroup of(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "Empty timegroup");
    return new Timegroup(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Timegroup)) {
      return false;
    }
    return name.equals(((Timegroup) o).name);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
