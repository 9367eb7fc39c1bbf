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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.inject.Inject;

import com.github.dockerjava.transport.DockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient.Request;
import com.github.dockerjava.transport.DockerHttpClient.Response;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.io.ByteStreams;
import com.google.common.net.UrlEscapers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A {@link ContainerBackend} speaking the Docker Engine HTTP API.
 *
 * <p>Requests are issued on a private pool of daemon threads so that the calling thread stays
 * interruptible while the transport blocks on its socket.
 */
public class DockerEngineClient implements ContainerBackend, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(DockerEngineClient.class);

  private static final Gson GSON = new Gson();
  private static final Escaper PATH_SEGMENT = UrlEscapers.urlPathSegmentEscaper();
  private static final long NO_TIMEOUT = -1;
  private static final int HTTP_OK = 200;

  /**
   * Where the daemon listens and how long ping and start requests may take.
   */
  public static class Settings {
    private final URI dockerHost;
    private final int requestTimeoutMs;

    public Settings(URI dockerHost, int requestTimeoutMs) {
      checkArgument(requestTimeoutMs > 0, "Request timeout must be positive.");
      this.dockerHost = requireNonNull(dockerHost);
      this.requestTimeoutMs = requestTimeoutMs;
    }

    URI getDockerHost() {
      return dockerHost;
    }

    int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }
  }

  private final DockerHttpClient httpClient;
  private final Settings settings;
  private final ExecutorService requestExecutor;

  @Inject
  DockerEngineClient(DockerHttpClient httpClient, Settings settings) {
    this.httpClient = requireNonNull(httpClient);
    this.settings = requireNonNull(settings);
    this.requestExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("docker-http-%d")
        .build());
  }

  @Override
  public void ping() throws BackendException, InterruptedException {
    Reply reply;
    try {
      reply = execute(Request.Method.GET, "/_ping", settings.getRequestTimeoutMs());
    } catch (ExecutionException | TimeoutException e) {
      throw new BackendException(
          "Failed to reach Docker daemon at " + settings.getDockerHost(), causeOf(e));
    }

    if (reply.statusCode != HTTP_OK) {
      throw new BackendException("Docker daemon at " + settings.getDockerHost()
          + " answered ping with " + reply.describe());
    }
  }

  @Override
  public void start(String container) throws BackendException, InterruptedException {
    Reply reply;
    try {
      reply = execute(
          Request.Method.POST,
          containerPath(container, "start"),
          settings.getRequestTimeoutMs());
    } catch (ExecutionException | TimeoutException e) {
      throw new BackendException("Failed to start container " + container, causeOf(e));
    }

    if (!isSuccess(reply.statusCode)) {
      throw new BackendException(
          "Failed to start container " + container + ": " + reply.describe());
    }
  }

  @Override
  public WaitOutcome awaitCompletion(String container) throws InterruptedException {
    Reply reply;
    try {
      reply = execute(Request.Method.POST, containerPath(container, "wait"), NO_TIMEOUT);
    } catch (ExecutionException | TimeoutException e) {
      return WaitOutcome.backendError(causeOf(e));
    }

    if (reply.statusCode != HTTP_OK) {
      return WaitOutcome.backendError(new BackendException(
          "Waiting for container " + container + " failed: " + reply.describe()));
    }
    return parseWaitResponse(reply.body);
  }

  /**
   * Stops issuing requests and releases the connections to the daemon.
   */
  @Override
  public void close() throws IOException {
    requestExecutor.shutdownNow();
    httpClient.close();
  }

  private Reply execute(Request.Method method, String path, long timeoutMs)
      throws ExecutionException, TimeoutException, InterruptedException {

    Request request = Request.builder()
        .method(method)
        .path(path)
        .build();
    Future<Reply> future = requestExecutor.submit(() -> {
      try (Response response = httpClient.execute(request)) {
        return new Reply(response.getStatusCode(), readBody(response));
      }
    });

    try {
      if (timeoutMs == NO_TIMEOUT) {
        return future.get();
      }
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException | TimeoutException e) {
      future.cancel(true);
      throw e;
    }
  }

  private static String readBody(Response response) throws IOException {
    InputStream body = response.getBody();
    if (body == null) {
      return "";
    }
    return new String(ByteStreams.toByteArray(body), StandardCharsets.UTF_8);
  }

  private static String containerPath(String container, String action) {
    return "/containers/" + PATH_SEGMENT.escape(container) + "/" + action;
  }

  private static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  private static Throwable causeOf(Exception e) {
    if (e instanceof ExecutionException) {
      return MoreObjects.firstNonNull(e.getCause(), e);
    }
    return e;
  }

  /**
   * Classifies the body of a successful {@code /containers/{id}/wait} response.
   */
  @VisibleForTesting
  static WaitOutcome parseWaitResponse(String body) {
    WaitResponse wait;
    try {
      wait = GSON.fromJson(body, WaitResponse.class);
    } catch (JsonParseException e) {
      return WaitOutcome.backendError(e);
    }

    if (wait == null) {
      return WaitOutcome.noResponse();
    }
    if (wait.statusCode == null) {
      return WaitOutcome.backendError(
          new BackendException("Wait response carries no status code: " + body));
    }
    if (wait.statusCode == 0) {
      return WaitOutcome.succeeded();
    }

    String message = wait.error == null ? null : wait.error.message;
    if (Strings.isNullOrEmpty(message)) {
      return WaitOutcome.failedWithStatus(wait.statusCode);
    }
    return WaitOutcome.failedWithMessage(wait.statusCode, message);
  }

  // A fully read response.
  private static class Reply {
    final int statusCode;
    final String body;

    Reply(int statusCode, String body) {
      this.statusCode = statusCode;
      this.body = body;
    }

    String describe() {
      String message = body.trim();
      try {
        ErrorResponse error = GSON.fromJson(body, ErrorResponse.class);
        if (error != null && !Strings.isNullOrEmpty(error.message)) {
          message = error.message;
        }
      } catch (JsonParseException e) {
        LOG.debug("Docker error body is not JSON: {}", body);
      }
      return "HTTP " + statusCode + (message.isEmpty() ? "" : " " + message);
    }
  }

  private static class WaitResponse {
    @SerializedName("StatusCode")
    Long statusCode;

    @SerializedName("Error")
    WaitError error;
  }

  private static class WaitError {
    @SerializedName("Message")
    String message;
  }

  private static class ErrorResponse {
    @SerializedName("message")
    String message;
  }
}
