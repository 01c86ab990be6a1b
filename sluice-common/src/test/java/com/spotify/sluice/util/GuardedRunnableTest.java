/*-
 * -\-\-
 * Spotify Sluice Common
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.sluice.util;

import static com.spotify.sluice.util.GuardedRunnable.guard;
import static com.spotify.sluice.util.GuardedRunnable.runGuarded;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class GuardedRunnableTest {

  @Mock Runnable delegate;

  @Test
  public void shouldRunDelegate() {
    guard(delegate).run();
    verify(delegate).run();
  }

  @Test
  public void shouldSwallowException() {
    doThrow(new IllegalStateException("boom")).when(delegate).run();
    runGuarded(delegate);
    verify(delegate).run();
  }

  @Test
  public void shouldSwallowError() {
    doThrow(new AssertionError("boom")).when(delegate).run();
    runGuarded(delegate);
    verify(delegate).run();
  }
}
