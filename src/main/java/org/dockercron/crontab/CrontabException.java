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
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a crontab file cannot be loaded.
 */
public abstract class CrontabException extends Exception {
  CrontabException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * The crontab file could not be read.
   */
  public static class Unreadable extends CrontabException {
    private final Path path;

    public Unreadable(Path path, IOException cause) {
      super("Error reading from crontab at " + path, requireNonNull(cause));
      this.path = path;
    }

    public Path getPath() {
      return path;
    }
  }

  /**
   * A line of the crontab file is not a valid job line.
   */
  public static class InvalidLine extends CrontabException {
    private final int lineNumber;

    public InvalidLine(int lineNumber, CrontabFormatException cause) {
      super("Invalid crontab entry on line " + lineNumber + ". Cron expressions must consist of "
          + "six(!) space-separated fields or an alias that starts with @. Environment variable "
          + "specifications are not supported.", requireNonNull(cause));
      this.lineNumber = lineNumber;
    }

    /**
     * The 1-based number of the offending line, counting blank and comment lines.
     */
    public int getLineNumber() {
      return lineNumber;
    }
  }
}
