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

import java.text.ParseException;
import java.util.List;
import java.util.TimeZone;

import com.google.common.base.Joiner;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;

import org.dockercron.crontab.CrontabEntry;
import org.quartz.CronExpression;

/**
 * Utilities for converting crontab datatypes to Quartz datatypes.
 */
final class Quartz {
  private Quartz() {
    // Utility class.
  }

  /**
   * Convert a CrontabEntry to a Quartz CronExpression. When the entry restricts dayOfMonth, the
   * expression ignores its dayOfWeek field.
   */
  static CronExpression cronExpression(CrontabEntry entry, TimeZone timeZone) {
    String dayOfMonth;
    if (entry.hasWildcardDayOfMonth()) {
      dayOfMonth = "?"; // special quartz token meaning "don't care"
    } else {
      dayOfMonth = entry.getDayOfMonthAsString();
    }
    String dayOfWeek;
    if (!entry.hasWildcardDayOfMonth()) {
      // Quartz cannot combine both day fields; CronPredictorImpl filters the days of the week.
      dayOfWeek = "?";
    } else {
      List<Integer> daysOfWeek = Lists.newArrayList();
      for (Range<Integer> range : entry.getDayOfWeek().asRanges()) {
        for (int i : ContiguousSet.create(range, DiscreteDomain.integers())) {
          daysOfWeek.add(i + 1); // Quartz numbers days from 1 (Sunday).
        }
      }
      dayOfWeek = Joiner.on(",").join(daysOfWeek);
    }

    String rawCronExpression = Joiner.on(" ").join(
        entry.getSecondAsString(),
        entry.getMinuteAsString(),
        entry.getHourAsString(),
        dayOfMonth,
        entry.getMonthAsString(),
        dayOfWeek);
    CronExpression cronExpression;
    try {
      cronExpression = new CronExpression(rawCronExpression);
    } catch (ParseException e) {
      // Every valid CrontabEntry renders to a valid Quartz expression.
      throw new IllegalStateException(
          "Quartz rejected " + rawCronExpression + " derived from " + entry, e);
    }
    cronExpression.setTimeZone(timeZone);
    return cronExpression;
  }
}
