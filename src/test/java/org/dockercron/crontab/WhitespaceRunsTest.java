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
package org.dockercron.crontab;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class WhitespaceRunsTest {
  @Test
  public void testRuns() {
    //          0123456789012
    String s = "  a bb   c   ";
    assertEquals(
        ImmutableList.of(
            new WhitespaceRun(0, 2),
            new WhitespaceRun(3, 4),
            new WhitespaceRun(6, 9),
            new WhitespaceRun(10, 13)),
        ImmutableList.copyOf(WhitespaceRuns.in(s)));
  }

  @Test
  public void testMixedWhitespace() {
    assertEquals(
        ImmutableList.of(new WhitespaceRun(1, 4), new WhitespaceRun(5, 6)),
        ImmutableList.copyOf(WhitespaceRuns.in("a \t b\tc")));
  }

  @Test
  public void testNoWhitespace() {
    assertEquals(ImmutableList.of(), ImmutableList.copyOf(WhitespaceRuns.in("abc")));
    assertEquals(ImmutableList.of(), ImmutableList.copyOf(WhitespaceRuns.in("")));
  }

  @Test
  public void testOnlyWhitespace() {
    assertEquals(
        ImmutableList.of(new WhitespaceRun(0, 3)),
        ImmutableList.copyOf(WhitespaceRuns.in("   ")));
  }
}
