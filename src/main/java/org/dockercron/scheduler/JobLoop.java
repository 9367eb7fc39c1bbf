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

import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.math.LongMath;

import org.dockercron.common.util.Clock;
import org.dockercron.cron.CronPredictor;
import org.dockercron.crontab.CronJob;
import org.dockercron.docker.BackendException;
import org.dockercron.docker.ContainerBackend;
import org.dockercron.docker.WaitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Runs a single cron job until interrupted: sleeps until the next instant its schedule matches,
 * starts the job's container and waits for it to exit, then repeats.
 *
 * <p>Failures of a single fire are logged and never end the loop. A failed start is not retried;
 * the job simply waits for its next scheduled instant, measured from the time the failure was
 * observed. Interruption of the running thread is the only way out.
 */
public class JobLoop implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(JobLoop.class);

  private static final long NANOS_PER_MILLI = Duration.ofMillis(1).toNanos();

  private final CronJob job;
  private final ContainerBackend backend;
  private final CronPredictor predictor;
  private final Clock clock;

  public JobLoop(CronJob job, ContainerBackend backend, CronPredictor predictor, Clock clock) {
    this.job = requireNonNull(job);
    this.backend = requireNonNull(backend);
    this.predictor = requireNonNull(predictor);
    this.clock = requireNonNull(clock);
  }

  private String container() {
    return job.getCommand();
  }

  @Override
  public void run() {
    LOG.debug("Scheduling container {} with schedule {}", container(), job.getSchedule());
    try {
      while (!Thread.currentThread().isInterrupted()) {
        awaitNextFire();
        fire();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.debug("Stopped scheduling container {}", container());
  }

  private void awaitNextFire() throws InterruptedException {
    Instant now = clock.nowInstant();
    Instant next = predictor.predictNextRun(job.getSchedule(), now)
        .orElseThrow(() -> new IllegalStateException(
            "Schedule " + job.getSchedule() + " of container " + container()
                + " has no instant after " + now));

    long sleepMs = sleepMillis(now, next);
    LOG.debug("Container {} fires at {}, sleeping {} ms", container(), next, sleepMs);
    clock.waitFor(sleepMs);
    LOG.debug("Woke up to start container {}", container());
  }

  /**
   * Milliseconds to sleep to get from {@code now} to {@code next}, rounded up so that a positive
   * remainder never becomes a zero-length sleep.
   */
  @VisibleForTesting
  static long sleepMillis(Instant now, Instant next) {
    long nanos = Duration.between(now, next).toNanos();
    if (nanos <= 0) {
      return 0;
    }
    return LongMath.divide(nanos, NANOS_PER_MILLI, RoundingMode.CEILING);
  }

  private void fire() throws InterruptedException {
    try {
      backend.start(container());
    } catch (BackendException | RuntimeException e) {
      LOG.warn("Failed to start container " + container() + ": " + e.getMessage(), e);
      return;
    }

    WaitOutcome outcome;
    try {
      outcome = backend.awaitCompletion(container());
    } catch (RuntimeException e) {
      outcome = WaitOutcome.backendError(e);
    }
    report(outcome);
  }

  private void report(WaitOutcome outcome) {
    switch (outcome.getKind()) {
      case SUCCEEDED:
        LOG.debug("Successful exit of container {}", container());
        break;

      case FAILED_WITH_MESSAGE:
        LOG.warn("Container wait request returned error message for container {}: {}"
            + " (status code {})",
            container(),
            outcome.getMessage().orElse(""),
            outcome.getStatusCode());
        break;

      case FAILED_WITH_STATUS:
        LOG.warn("Job did not succeed, container {} exited with status code {}",
            container(),
            outcome.getStatusCode());
        break;

      case BACKEND_ERROR:
        LOG.warn("Error waiting for completion of container " + container(),
            outcome.getError().orElse(null));
        break;

      case NO_RESPONSE:
        LOG.warn("No response to wait request on Docker API for container {}", container());
        break;

      default:
        throw new IllegalStateException("Unhandled wait outcome " + outcome);
    }
  }
}
