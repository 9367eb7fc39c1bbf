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
package org.dockercron.cron;

import java.time.Instant;
import java.util.Optional;

import org.dockercron.crontab.CrontabEntry;

/**
 * A utility function that predicts a cron run given a schedule.
 */
public interface CronPredictor {
  /**
   * Predicts the earliest instant strictly after {@code after} at which a cron schedule will
   * trigger. The result depends only on the schedule and {@code after}.
   * <p>
   * NB: Some cron schedules can predict a run at an invalid date (eg: too far in the future); and
   * it's these predictions that will result in an empty result.
   *
   * @param schedule Cron schedule to predict the next time for.
   * @param after Reference instant.
   * @return A prediction for the next time a cron will run if a valid prediction can be made.
   */
  Optional<Instant> predictNextRun(CrontabEntry schedule, Instant after);
}
