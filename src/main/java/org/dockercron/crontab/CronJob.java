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

import static java.util.Objects.requireNonNull;

/**
 * One job line of a crontab: the schedule to fire on and the container to start.
 */
public final class CronJob {
  private final CrontabEntry schedule;
  private final String command;

  public CronJob(CrontabEntry schedule, String command) {
    this.schedule = requireNonNull(schedule);
    this.command = requireNonNull(command);
  }

  public CrontabEntry getSchedule() {
    return schedule;
  }

  /**
   * The command text following the schedule, verbatim. Names the container to start.
   */
  public String getCommand() {
    return command;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CronJob)) {
      return false;
    }
    CronJob that = (CronJob) o;
    return Objects.equals(schedule, that.schedule)
        && Objects.equals(command, that.command);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schedule, command);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("schedule", schedule)
        .add("command", command)
        .toString();
  }
}
