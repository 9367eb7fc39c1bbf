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

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.inject.Inject;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.spi.Message;

import org.dockercron.config.CliOptions;
import org.dockercron.config.CommandLine;
import org.dockercron.crontab.CronJob;
import org.dockercron.crontab.Crontab;
import org.dockercron.crontab.CrontabException;
import org.dockercron.docker.DockerEngineClient;
import org.dockercron.scheduler.JobScheduler.ShutdownGracePeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launcher for docker-cron.
 */
public class DockerCronMain {
  private static final Logger LOG = LoggerFactory.getLogger(DockerCronMain.class);

  // Time allowed for stopping services beyond the job loops' grace period.
  private static final long STOP_SLACK_MS = 1000;

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(
        description = "<crontab file> whose schedules have six fields "
            + "(second minute hour dayOfMonth month dayOfWeek), with dayOfWeek 0-6 and 0 = Sunday",
        required = true)
    public List<String> crontab = Lists.newArrayList();
  }

  @Inject private ServiceManager services;
  @Inject private DockerEngineClient dockerClient;
  @Inject @ShutdownGracePeriod private long shutdownGracePeriodMs;

  @VisibleForTesting
  long stopTimeoutMs() {
    return shutdownGracePeriodMs + STOP_SLACK_MS;
  }

  private void stop() {
    LOG.info("Stopping docker-cron.");
    try {
      services.stopAsync().awaitStopped(stopTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.info("Shutdown did not complete in time: " + e);
    }
    closeDockerClient();
    LOG.info("Shutdown complete.");
  }

  private void closeDockerClient() {
    try {
      dockerClient.close();
    } catch (IOException e) {
      LOG.warn("Failed to close Docker client: " + e, e);
    }
  }

  /**
   * Starts every job loop and blocks until the process is told to terminate.
   *
   * @return {@code false} if the services could not be started.
   */
  boolean run() {
    services.startAsync();
    try {
      services.awaitHealthy();
    } catch (IllegalStateException e) {
      LOG.error("Failed to start: " + e.getMessage());
      services.servicesByState().get(Service.State.FAILED)
          .forEach(service -> LOG.error("Startup of " + service + " failed",
              service.failureCause()));
      services.stopAsync();
      closeDockerClient();
      return false;
    }

    // Exit 0 on SIGTERM once every job loop has been torn down.
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      stop();
      Runtime.getRuntime().halt(0);
    }, "ShutdownHook"));

    services.awaitStopped();
    return true;
  }

  @VisibleForTesting
  static Module getUniversalModule(List<CronJob> jobs, CliOptions options) {
    return new AppModule(jobs, options);
  }

  @VisibleForTesting
  static List<CronJob> loadCrontab(CliOptions options) throws CrontabException {
    return Crontab.load(Paths.get(options.main.crontab.get(0)));
  }

  public static void main(String... args) {
    Thread.setDefaultUncaughtExceptionHandler(
        (t, e) -> LOG.error("Uncaught exception from " + t + ":" + e, e));

    CliOptions options = CommandLine.parseOptions(args);

    List<CronJob> jobs;
    try {
      jobs = loadCrontab(options);
    } catch (CrontabException e) {
      LOG.error(e.getMessage(), e.getCause());
      System.exit(1);
      return;
    }
    LOG.info("Loaded {} jobs from {}", jobs.size(), options.main.crontab.get(0));

    DockerCronMain main = new DockerCronMain();
    try {
      Injector injector = Guice.createInjector(getUniversalModule(jobs, options));
      injector.injectMembers(main);
    } catch (CreationException e) {
      for (Message m : e.getErrorMessages()) {
        LOG.error(m.getMessage(), m.getCause());
      }
      System.exit(1);
      return;
    }

    if (!main.run()) {
      System.exit(1);
    }
  }
}
