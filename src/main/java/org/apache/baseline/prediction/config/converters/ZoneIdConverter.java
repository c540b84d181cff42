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
package org.apache.baseline.prediction.config.converters;

import java.time.DateTimeException;
import java.time.ZoneId;

import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.BaseConverter;

public class ZoneIdConverter extends BaseConverter<ZoneId> {
  public ZoneIdConverter(String optionName) {
    super(optionName);
  }

  @Override
  public ZoneId convert(String raw) {
    try {
      return ZoneId.of(raw);
    } catch (DateTimeException e) {
      throw new ParameterException(getErrorString(raw, "a time zone id such as Europe/Berlin"));
    }
  }
}
