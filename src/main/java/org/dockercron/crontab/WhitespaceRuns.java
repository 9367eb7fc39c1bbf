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

import java.util.Iterator;

import com.google.common.base.CharMatcher;
import com.google.common.collect.AbstractIterator;

import static java.util.Objects.requireNonNull;

/**
 * Locates the runs of whitespace within a line.
 */
public final class WhitespaceRuns {
  static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final CharMatcher NOT_WHITESPACE = WHITESPACE.negate();

  private WhitespaceRuns() {
    // Utility class.
  }

  /**
   * Lazily scans {@code line} for maximal runs of whitespace, left to right. Offsets are char
   * indices into {@code line}, suitable for {@link String#substring(int, int)}. A run that reaches
   * the end of the line is closed at {@code line.length()}.
   *
   * @param line Line to scan.
   * @return An iterator over the runs; empty if the line contains no whitespace.
   */
  public static Iterator<WhitespaceRun> in(CharSequence line) {
    requireNonNull(line);

    return new AbstractIterator<WhitespaceRun>() {
      private int position = 0;

      @Override
      protected WhitespaceRun computeNext() {
        int start = WHITESPACE.indexIn(line, position);
        if (start == -1) {
          return endOfData();
        }
        int end = NOT_WHITESPACE.indexIn(line, start);
        if (end == -1) {
          end = line.length();
        }
        position = end;
        return new WhitespaceRun(start, end);
      }
    };
  }
}
