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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.io.MoreFiles;

import static java.util.Objects.requireNonNull;

/**
 * Reads crontab files into {@link CronJob}s.
 *
 * A job line is either {@code @alias command} or six whitespace-separated schedule fields
 * followed by the command. The command runs from the end of the whitespace separating it from
 * the schedule to the end of the line and is not interpreted any further. Blank lines and lines
 * starting with {@code #} are ignored.
 */
public final class Crontab {
  private static final String COMMENT = "#";
  private static final String ALIAS = "@";

  // Index of the whitespace run that separates the schedule from the command.
  private static final int ALIAS_SEPARATOR = 0;
  private static final int FIELDS_SEPARATOR = 5;

  private Crontab() {
    // Utility class.
  }

  /**
   * Parses a single trimmed, non-blank, non-comment crontab line.
   *
   * @param line The line to parse.
   * @return The job described by the line.
   * @throws CrontabFormatException If the line has too few fields or an invalid schedule.
   */
  public static CronJob parseLine(String line) throws CrontabFormatException {
    requireNonNull(line);

    int separator = line.startsWith(ALIAS) ? ALIAS_SEPARATOR : FIELDS_SEPARATOR;
    Iterator<WhitespaceRun> runs = WhitespaceRuns.in(line);
    WhitespaceRun split = Iterators.get(runs, separator, null);
    if (split == null) {
      throw new CrontabFormatException("Invalid crontab line");
    }

    String schedule = line.substring(0, split.getStart());
    String command = line.substring(split.getEnd());
    try {
      return new CronJob(CrontabEntry.parse(schedule), command);
    } catch (IllegalArgumentException e) {
      throw new CrontabFormatException("Invalid crontab line", e);
    }
  }

  /**
   * Parses the contents of a crontab file. Parsing stops at the first invalid line.
   *
   * @param contents Newline-separated crontab contents.
   * @return The jobs, in file order.
   * @throws CrontabException.InvalidLine If any job line is invalid.
   */
  public static ImmutableList<CronJob> read(String contents) throws CrontabException.InvalidLine {
    ImmutableList.Builder<CronJob> jobs = ImmutableList.builder();

    int lineNumber = 0;
    for (String rawLine : Splitter.on('\n').split(contents)) {
      lineNumber++;
      String line = WhitespaceRuns.WHITESPACE.trimFrom(rawLine);
      if (line.isEmpty() || line.startsWith(COMMENT)) {
        continue;
      }

      try {
        jobs.add(parseLine(line));
      } catch (CrontabFormatException e) {
        throw new CrontabException.InvalidLine(lineNumber, e);
      }
    }

    return jobs.build();
  }

  /**
   * Reads and parses a UTF-8 crontab file. Malformed UTF-8 makes the file unreadable.
   *
   * @param path Location of the crontab.
   * @return The jobs, in file order.
   * @throws CrontabException If the file cannot be read or contains an invalid line.
   */
  public static ImmutableList<CronJob> load(Path path) throws CrontabException {
    String contents;
    try {
      contents = decode(MoreFiles.asByteSource(path).read());
    } catch (IOException e) {
      throw new CrontabException.Unreadable(path, e);
    }

    return read(contents);
  }

  private static String decode(byte[] bytes) throws IOException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return decoder.decode(ByteBuffer.wrap(bytes)).toString();
  }
}
