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

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The result of waiting for a container to stop.
 */
public final class WaitOutcome {
  /**
   * The closed set of ways a wait can end.
   */
  public enum Kind {
    /**
     * The container exited with status 0.
     */
    SUCCEEDED,
    /**
     * The container failed and the daemon supplied a message.
     */
    FAILED_WITH_MESSAGE,
    /**
     * The container failed with a non-zero status and no message.
     */
    FAILED_WITH_STATUS,
    /**
     * The wait request itself failed.
     */
    BACKEND_ERROR,
    /**
     * The daemon ended the wait without producing a result.
     */
    NO_RESPONSE
  }

  private static final WaitOutcome SUCCEEDED = new WaitOutcome(Kind.SUCCEEDED, 0, null, null);
  private static final WaitOutcome NO_RESPONSE =
      new WaitOutcome(Kind.NO_RESPONSE, 0, null, null);

  private final Kind kind;
  private final long statusCode;
  private final String message;
  private final Throwable error;

  private WaitOutcome(Kind kind, long statusCode, String message, Throwable error) {
    this.kind = kind;
    this.statusCode = statusCode;
    this.message = message;
    this.error = error;
  }

  public static WaitOutcome succeeded() {
    return SUCCEEDED;
  }

  public static WaitOutcome failedWithMessage(long statusCode, String message) {
    checkArgument(!message.isEmpty(), "A failure message must not be empty.");
    return new WaitOutcome(Kind.FAILED_WITH_MESSAGE, statusCode, message, null);
  }

  public static WaitOutcome failedWithStatus(long statusCode) {
    return new WaitOutcome(Kind.FAILED_WITH_STATUS, statusCode, null, null);
  }

  public static WaitOutcome backendError(Throwable error) {
    return new WaitOutcome(Kind.BACKEND_ERROR, 0, null, requireNonNull(error));
  }

  public static WaitOutcome noResponse() {
    return NO_RESPONSE;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The container's exit status; only meaningful for the {@code FAILED_*} kinds.
   */
  public long getStatusCode() {
    return statusCode;
  }

  public Optional<String> getMessage() {
    return Optional.ofNullable(message);
  }

  public Optional<Throwable> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WaitOutcome)) {
      return false;
    }
    WaitOutcome that = (WaitOutcome) o;
    return kind == that.kind
        && statusCode == that.statusCode
        && Objects.equals(message, that.message)
        && Objects.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, statusCode, message, error);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kind", kind)
        .add("statusCode", statusCode)
        .add("message", message)
        .add("error", error)
        .toString();
  }
}
