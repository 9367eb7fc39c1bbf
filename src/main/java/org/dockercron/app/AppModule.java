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
package org.dockercron.app;

import java.util.List;
import java.util.Set;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.TypeLiteral;
import com.google.inject.multibindings.Multibinder;

import org.dockercron.common.util.Clock;
import org.dockercron.config.CliOptions;
import org.dockercron.config.validators.PositiveNumber;
import org.dockercron.cron.quartz.CronModule;
import org.dockercron.crontab.CronJob;
import org.dockercron.docker.DockerModule;
import org.dockercron.scheduler.JobScheduler;
import org.dockercron.scheduler.JobScheduler.ShutdownGracePeriod;

import static java.util.Objects.requireNonNull;

/**
 * Binding module for the docker-cron application.
 */
public class AppModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-shutdown_grace_period_ms",
        validateValueWith = PositiveNumber.class,
        description = "Time to wait for cancelled job loops to exit during shutdown.")
    public long shutdownGracePeriodMs = 5000;
  }

  private final List<CronJob> jobs;
  private final CliOptions options;

  public AppModule(List<CronJob> jobs, CliOptions options) {
    this.jobs = ImmutableList.copyOf(jobs);
    this.options = requireNonNull(options);
  }

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(new TypeLiteral<List<CronJob>>() { }).toInstance(jobs);
    bind(Long.class)
        .annotatedWith(ShutdownGracePeriod.class)
        .toInstance(options.app.shutdownGracePeriodMs);

    install(new CronModule(options.cron));
    install(new DockerModule(options.docker));

    bind(JobScheduler.class).in(Singleton.class);
    Multibinder.newSetBinder(binder(), Service.class).addBinding().to(JobScheduler.class);
  }

  @Provides
  @Singleton
  ServiceManager provideServiceManager(Set<Service> services) {
    return new ServiceManager(services);
  }
}
