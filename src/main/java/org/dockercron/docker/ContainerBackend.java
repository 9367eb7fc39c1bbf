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

/**
 * The daemon that starts containers and reports their completion.
 * <p>
 * Implementations must be safe for concurrent use by many job loops. Every call blocks the
 * calling thread and responds to interruption by abandoning the request.
 */
public interface ContainerBackend {
  /**
   * Checks that the daemon is reachable.
   *
   * @throws BackendException If the daemon cannot be reached or answers with an error.
   * @throws InterruptedException If interrupted while waiting for the answer.
   */
  void ping() throws BackendException, InterruptedException;

  /**
   * Starts a container.
   *
   * @param container Name or id of the container.
   * @throws BackendException If the container could not be started.
   * @throws InterruptedException If interrupted while waiting for the answer.
   */
  void start(String container) throws BackendException, InterruptedException;

  /**
   * Waits until a container stops running. May block indefinitely.
   *
   * @param container Name or id of the container.
   * @return How the wait ended. Failures of the wait itself are reported as outcomes.
   * @throws InterruptedException If interrupted while waiting.
   */
  WaitOutcome awaitCompletion(String container) throws InterruptedException;
}
