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
package org.dockercron.cron.quartz;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;

import javax.inject.Inject;

import org.dockercron.cron.CronPredictor;
import org.dockercron.crontab.CrontabEntry;
import org.quartz.CronExpression;

import static java.util.Objects.requireNonNull;

class CronPredictorImpl implements CronPredictor {
  // Days of the month to try before giving up on an entry that also restricts the day of week.
  private static final int MAX_SKIPPED_DAYS = 20000;

  private final TimeZone timeZone;

  @Inject
  CronPredictorImpl(TimeZone timeZone) {
    this.timeZone = requireNonNull(timeZone);
  }

  @Override
  public Optional<Instant> predictNextRun(CrontabEntry schedule, Instant after) {
    CronExpression cronExpression = Quartz.cronExpression(schedule, timeZone);
    if (schedule.hasWildcardDayOfMonth() || schedule.hasWildcardDayOfWeek()) {
      return nextValidTimeAfter(cronExpression, after);
    }

    ZoneId zone = timeZone.toZoneId();
    Instant candidateAfter = after;
    for (int i = 0; i < MAX_SKIPPED_DAYS; i++) {
      Optional<Instant> candidate = nextValidTimeAfter(cronExpression, candidateAfter);
      if (!candidate.isPresent()) {
        return candidate;
      }
      ZonedDateTime local = candidate.get().atZone(zone);
      if (schedule.matchesDayOfWeek(local.getDayOfWeek())) {
        return candidate;
      }
      // Resume from the last instant of the rejected day.
      candidateAfter = local.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant()
          .minusMillis(1);
    }
    return Optional.empty();
  }

  private static Optional<Instant> nextValidTimeAfter(CronExpression expression, Instant after) {
    // The getNextValidTimeAfter call may return null; eg: if the date is too far in the future.
    return Optional.ofNullable(expression.getNextValidTimeAfter(Date.from(after)))
        .map(Date::toInstant);
  }
}
