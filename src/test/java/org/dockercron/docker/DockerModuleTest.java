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

import java.io.IOException;
import java.net.URI;

import com.google.inject.Guice;
import com.google.inject.Injector;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DockerModuleTest {
  @Test
  public void testUnixSocketHost() {
    assertEquals(
        URI.create("unix:///var/run/docker.sock"),
        DockerModule.dockerHost("unix:///var/run/docker.sock"));
    assertEquals(
        URI.create("unix:///run/user/1000/docker.sock"),
        DockerModule.dockerHost(" UNIX:///run/user/1000/docker.sock "));
  }

  @Test
  public void testDefaultsToUnixSocket() {
    if (System.getenv("DOCKER_HOST") == null) {
      assertEquals("unix:///var/run/docker.sock", new DockerModule.Options().dockerHost);
    }
  }

  @Test
  public void testTcpHost() {
    assertEquals(
        URI.create("tcp://localhost:2375"),
        DockerModule.dockerHost("tcp://localhost:2375"));
    assertEquals(
        URI.create("tcp://10.0.0.1:2375"),
        DockerModule.dockerHost("TCP://10.0.0.1:2375/"));
    assertEquals(
        URI.create("tcp://docker.example.com:2375"),
        DockerModule.dockerHost("http://docker.example.com:2375"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnixSocketWithoutPath() {
    DockerModule.dockerHost("unix://docker.sock");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTcpWithoutHost() {
    DockerModule.dockerHost("tcp:///var/run/docker.sock");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingScheme() {
    DockerModule.dockerHost("localhost:2375");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedScheme() {
    DockerModule.dockerHost("ssh://docker.example.com");
  }

  @Test
  public void testBindings() throws IOException {
    DockerModule.Options options = new DockerModule.Options();
    options.dockerHost = "unix:///var/run/docker.sock";
    Injector injector = Guice.createInjector(new DockerModule(options));

    DockerEngineClient client = injector.getInstance(DockerEngineClient.class);
    try {
      ContainerBackend backend = injector.getInstance(ContainerBackend.class);
      assertTrue(backend instanceof DockerEngineClient);
      assertSame(client, backend);
    } finally {
      client.close();
    }
  }
}
