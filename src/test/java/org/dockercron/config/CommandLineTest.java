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
package org.dockercron.config;

import java.util.List;

import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;

import org.dockercron.app.AppModule;
import org.dockercron.app.DockerCronMain;
import org.dockercron.cron.quartz.CronModule;
import org.dockercron.docker.DockerModule;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CommandLineTest {
  @Test
  public void testDefaults() {
    CliOptions options = CommandLine.parse("/etc/crontab");

    assertEquals(ImmutableList.of("/etc/crontab"), options.main.crontab);
    assertEquals("GMT", options.cron.cronTimezone);
    assertEquals(5000, options.docker.dockerConnectTimeoutMs);
    assertEquals(30000, options.docker.dockerRequestTimeoutMs);
    assertEquals(5000L, options.app.shutdownGracePeriodMs);
  }

  @Test
  public void testParseAllOptions() {
    CliOptions options = CommandLine.parse(
        "-cron_timezone=Europe/Berlin",
        "-docker_host=tcp://docker.example.com:2375",
        "-docker_connect_timeout_ms=42",
        "-docker_request_timeout_ms=43",
        "-shutdown_grace_period_ms=44",
        "/etc/crontab");

    assertEquals(ImmutableList.of("/etc/crontab"), options.main.crontab);
    assertEquals("Europe/Berlin", options.cron.cronTimezone);
    assertEquals("tcp://docker.example.com:2375", options.docker.dockerHost);
    assertEquals(42, options.docker.dockerConnectTimeoutMs);
    assertEquals(43, options.docker.dockerRequestTimeoutMs);
    assertEquals(44L, options.app.shutdownGracePeriodMs);
  }

  @Test(expected = ParameterException.class)
  public void testMissingCrontab() {
    CommandLine.parse("-cron_timezone=GMT");
  }

  @Test(expected = ParameterException.class)
  public void testTooManyCrontabs() {
    CommandLine.parse("/etc/crontab", "/etc/another");
  }

  @Test(expected = ParameterException.class)
  public void testNonPositiveTimeout() {
    CommandLine.parse("-docker_request_timeout_ms=0", "/etc/crontab");
  }

  @Test(expected = ParameterException.class)
  public void testNegativeGracePeriod() {
    CommandLine.parse("-shutdown_grace_period_ms=-1", "/etc/crontab");
  }

  @Test(expected = ParameterException.class)
  public void testUnknownOption() {
    CommandLine.parse("-cluster_name=test", "/etc/crontab");
  }

  @Test
  public void testOptionsObjects() {
    CliOptions options = new CliOptions();
    List<Object> objects = CommandLine.getOptionsObjects(options);

    assertEquals(4, objects.size());
    assertTrue(objects.contains(options.main));
    assertTrue(objects.stream().anyMatch(o -> o instanceof DockerCronMain.Options));
    assertTrue(objects.stream().anyMatch(o -> o instanceof AppModule.Options));
    assertTrue(objects.stream().anyMatch(o -> o instanceof CronModule.Options));
    assertTrue(objects.stream().anyMatch(o -> o instanceof DockerModule.Options));
  }
}
