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
package org.apache.baseline.common.testing.easymock;

import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.junit.After;
import org.junit.Before;

/**
 * A baseclass for tests that use EasyMock. Mocks are created from a strict control, which is
 * verified after each test. Tests must call {@code control.replay()} once expectations are set.
 */
public abstract class EasyMockTest {
  protected IMocksControl control;

  @Before
  public final void setupEasyMock() {
    control = EasyMock.createStrictControl();
  }

  @After
  public final void verifyControl() {
    control.verify();
  }

  /**
   * Creates an EasyMock mock with this test's control.
   *
   * @param type The type of the mock to create.
   * @param <T> The type of the mock.
   * @return A mock of the given type.
   */
  protected final <T> T createMock(Class<T> type) {
    return control.createMock(type);
  }
}
