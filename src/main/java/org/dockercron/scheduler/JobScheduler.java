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
package org.dockercron.scheduler;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractIdleService;

import org.dockercron.base.AsyncUtil;
import org.dockercron.common.util.Clock;
import org.dockercron.cron.CronPredictor;
import org.dockercron.crontab.CronJob;
import org.dockercron.docker.ContainerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Owns one {@link JobLoop} per cron job. Starting the service checks that the container backend
 * is reachable and then starts every loop on its own thread; stopping it cancels all of them at
 * once, interrupting whatever they are doing.
 */
public class JobScheduler extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

  /**
   * Binding annotation for the time, in milliseconds, that shutdown waits for cancelled job
   * threads to exit.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD })
  @Retention(RUNTIME)
  public @interface ShutdownGracePeriod { }

  private final List<CronJob> jobs;
  private final ContainerBackend backend;
  private final CronPredictor predictor;
  private final Clock clock;
  private final long gracePeriodMs;

  private ThreadPoolExecutor executor;
  private List<Future<?>> loops = ImmutableList.of();

  @Inject
  JobScheduler(
      List<CronJob> jobs,
      ContainerBackend backend,
      CronPredictor predictor,
      Clock clock,
      @ShutdownGracePeriod long gracePeriodMs) {

    this.jobs = ImmutableList.copyOf(jobs);
    this.backend = requireNonNull(backend);
    this.predictor = requireNonNull(predictor);
    this.clock = requireNonNull(clock);
    this.gracePeriodMs = gracePeriodMs;
  }

  @Override
  protected void startUp() throws Exception {
    backend.ping();
    LOG.info("Container backend is reachable.");

    if (jobs.isEmpty()) {
      LOG.warn("Crontab defines no jobs, nothing will be scheduled.");
    }

    executor = AsyncUtil.loggingExecutor(Math.max(1, jobs.size()), "JobLoop-%d", LOG);
    ImmutableList.Builder<Future<?>> started = ImmutableList.builder();
    for (CronJob job : jobs) {
      started.add(executor.submit(new JobLoop(job, backend, predictor, clock)));
    }
    loops = started.build();
    LOG.info("Started {} job loops.", loops.size());
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Cancelling {} job loops.", loops.size());
    for (Future<?> loop : loops) {
      loop.cancel(true);
    }
    if (executor != null) {
      executor.shutdownNow();
      if (!executor.awaitTermination(gracePeriodMs, TimeUnit.MILLISECONDS)) {
        LOG.warn("Job threads did not exit within {} ms.", gracePeriodMs);
      }
    }
  }
}
