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

import java.nio.charset.StandardCharsets;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LogbackConfigTest {
  private LoggerContext context;

  @Before
  public void setUp() throws Exception {
    context = new LoggerContext();
    JoranConfigurator configurator = new JoranConfigurator();
    configurator.setContext(context);
    configurator.doConfigure(LogbackConfigTest.class.getResource("/logback.xml"));
  }

  @After
  public void tearDown() {
    context.stop();
  }

  @Test
  public void testEventsAreLoggedAsJson() {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    Appender<ILoggingEvent> appender = root.getAppender("STDOUT");
    assertTrue(String.valueOf(appender), appender instanceof ConsoleAppender);
    Encoder<ILoggingEvent> encoder = ((ConsoleAppender<ILoggingEvent>) appender).getEncoder();

    LoggingEvent event = new LoggingEvent(
        LogbackConfigTest.class.getName(),
        context.getLogger(DockerCronMain.class),
        Level.WARN,
        "Failed to start container {}",
        null,
        new Object[] {"backup"});
    String line = new String(encoder.encode(event), StandardCharsets.UTF_8);

    JsonObject json = JsonParser.parseString(line).getAsJsonObject();
    assertEquals("Failed to start container backup", json.get("message").getAsString());
    assertEquals("WARN", json.get("level").getAsString());
    assertEquals(DockerCronMain.class.getName(), json.get("logger_name").getAsString());
  }
}
