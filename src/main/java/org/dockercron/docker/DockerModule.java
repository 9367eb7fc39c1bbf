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
package org.dockercron.docker;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.inject.AbstractModule;

import org.dockercron.config.validators.PositiveNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Binding module for the Docker Engine API client.
 */
public class DockerModule extends AbstractModule {
  private static final Logger LOG = LoggerFactory.getLogger(DockerModule.class);

  private static final String DEFAULT_DOCKER_HOST = "unix:///var/run/docker.sock";

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-docker_host",
        description = "Docker daemon address (unix:// or tcp://). "
            + "Defaults to $DOCKER_HOST, then " + DEFAULT_DOCKER_HOST + ".")
    public String dockerHost =
        MoreObjects.firstNonNull(System.getenv("DOCKER_HOST"), DEFAULT_DOCKER_HOST);

    @Parameter(names = "-docker_connect_timeout_ms",
        validateValueWith = PositiveNumber.class,
        description = "Timeout for establishing a connection to the Docker daemon.")
    public int dockerConnectTimeoutMs = 5000;

    @Parameter(names = "-docker_request_timeout_ms",
        validateValueWith = PositiveNumber.class,
        description = "Timeout for ping and container start requests. "
            + "Waiting for a container to exit is never timed out.")
    public int dockerRequestTimeoutMs = 30000;
  }

  private final Options options;

  public DockerModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    URI dockerHost = dockerHost(options.dockerHost);
    LOG.info("Using Docker daemon at " + dockerHost);

    // No response timeout: waiting for a container holds its connection until the exit.
    DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
        .dockerHost(dockerHost)
        .connectionTimeout(Duration.ofMillis(options.dockerConnectTimeoutMs))
        .build();

    bind(DockerHttpClient.class).toInstance(httpClient);
    bind(DockerEngineClient.Settings.class).toInstance(
        new DockerEngineClient.Settings(dockerHost, options.dockerRequestTimeoutMs));
    bind(ContainerBackend.class).to(DockerEngineClient.class);
    bind(DockerEngineClient.class).in(Singleton.class);
  }

  /**
   * Normalizes a Docker host address into the form the transport dials.
   *
   * @param dockerHost Address in {@code DOCKER_HOST} syntax.
   * @return A {@code unix://} socket path or a {@code tcp://} host and port.
   * @throws IllegalArgumentException If the address does not use a supported scheme.
   */
  @VisibleForTesting
  static URI dockerHost(String dockerHost) {
    URI uri = URI.create(CharMatcher.is('/').trimTrailingFrom(dockerHost.trim()));
    String scheme = MoreObjects.firstNonNull(uri.getScheme(), "").toLowerCase(Locale.ENGLISH);

    switch (scheme) {
      case "unix":
        checkArgument(!Strings.isNullOrEmpty(uri.getRawPath()),
            "Docker host %s names no socket", dockerHost);
        return URI.create("unix://" + uri.getRawPath());
      case "tcp":
      case "http":
        checkArgument(uri.getHost() != null, "Docker host %s names no host", dockerHost);
        return URI.create("tcp://" + uri.getRawAuthority());
      default:
        throw new IllegalArgumentException("Unsupported Docker host " + dockerHost
            + ", expected a unix:// or tcp:// address.");
    }
  }
}
