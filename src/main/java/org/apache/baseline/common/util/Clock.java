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
package org.apache.baseline.common.util;

import java.util.concurrent.TimeUnit;

/**
 * An abstraction of the system clock.
 */
public interface Clock {
  /**
   * A clock that returns the the actual time reported by the system.
   */
  Clock SYSTEM_CLOCK = new Clock() {
    @Override public long nowMillis() {
      return System.currentTimeMillis();
    }
  };

  /**
   * Returns the current time in milliseconds since the epoch.
   *
   * @return The current time in milliseconds since the epoch.
   * @see System#currentTimeMillis()
   */
  long nowMillis();

  /**
   * Returns the current time in whole seconds since the epoch, the resolution predictions are
   * computed at.
   *
   * @return The current time in seconds since the epoch.
   */
  default long nowSeconds() {
    return TimeUnit.MILLISECONDS.toSeconds(nowMillis());
  }
}
