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

import java.util.TimeZone;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

import org.dockercron.cron.CronPredictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides a {@link CronPredictor} backed by Quartz cron expressions. Only the expression
 * evaluator of Quartz is used; jobs are not scheduled through a Quartz scheduler.
 */
public class CronModule extends AbstractModule {
  private static final Logger LOG = LoggerFactory.getLogger(CronModule.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-cron_timezone", description = "TimeZone to use for cron predictions.")
    public String cronTimezone = "GMT";
  }

  private final Options options;

  public CronModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    bind(CronPredictor.class).to(CronPredictorImpl.class);
    bind(CronPredictorImpl.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  TimeZone provideTimeZone() {
    TimeZone timeZone = TimeZone.getTimeZone(options.cronTimezone);
    TimeZone systemTimeZone = TimeZone.getDefault();
    if (!timeZone.hasSameRules(systemTimeZone)) {
      LOG.warn("Cron schedules are configured to fire according to timezone "
          + timeZone.getDisplayName()
          + " but system timezone is set to "
          + systemTimeZone.getDisplayName());
    }
    return timeZone;
  }
}
