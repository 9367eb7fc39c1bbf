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

import javax.annotation.Nullable;

/**
 * Thrown when a single crontab line is not a valid job line.
 */
public class CrontabFormatException extends Exception {
  public CrontabFormatException(String message) {
    super(message);
  }

  public CrontabFormatException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
