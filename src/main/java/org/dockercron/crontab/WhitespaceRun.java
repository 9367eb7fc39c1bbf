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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A maximal run of whitespace within a line, as the half-open char interval
 * {@code [start, end)}.
 */
public final class WhitespaceRun {
  private final int start;
  private final int end;

  WhitespaceRun(int start, int end) {
    checkArgument(start >= 0 && start < end, "Invalid run [%s, %s)", start, end);
    this.start = start;
    this.end = end;
  }

  /**
   * Index of the first whitespace character of the run.
   */
  public int getStart() {
    return start;
  }

  /**
   * Index one past the last whitespace character of the run.
   */
  public int getEnd() {
    return end;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WhitespaceRun)) {
      return false;
    }
    WhitespaceRun that = (WhitespaceRun) o;
    return start == that.start && end == that.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start)
        .add("end", end)
        .toString();
  }
}
