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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

import org.dockercron.app.DockerCronMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses command line options and populates {@link CliOptions}.
 */
public final class CommandLine {

  private static final Logger LOG = LoggerFactory.getLogger(CommandLine.class);

  private CommandLine() {
    // Utility class.
  }

  private static JCommander prepareParser(CliOptions options) {
    return JCommander.newBuilder()
        .programName(DockerCronMain.class.getName())
        .addObject(getOptionsObjects(options))
        .build();
  }

  /**
   * Parses and validates arguments, throwing on invalid input.
   *
   * @param args Command line arguments.
   * @return Populated options.
   * @throws ParameterException If the arguments are not valid.
   */
  @VisibleForTesting
  static CliOptions parse(String... args) throws ParameterException {
    CliOptions options = new CliOptions();
    prepareParser(options).parse(args);
    if (options.main.crontab.size() != 1) {
      throw new ParameterException(
          "Expected exactly one crontab file, got " + options.main.crontab);
    }
    return options;
  }

  /**
   * Applies arg values to the options object, printing usage and exiting the process if they are
   * not valid.
   *
   * @param args Command line arguments.
   * @return Populated options.
   */
  public static CliOptions parseOptions(String... args) {
    try {
      return parse(args);
    } catch (ParameterException e) {
      prepareParser(new CliOptions()).usage();
      LOG.error(e.getMessage());
      System.exit(1);
      throw new RuntimeException(e);
    }
  }

  @VisibleForTesting
  static List<Object> getOptionsObjects(CliOptions options) {
    ImmutableList.Builder<Object> objects = ImmutableList.builder();

    // Reflect on fields defined in CliOptions to DRY and avoid mistakes of forgetting to add an
    // option field here.
    for (Field field : CliOptions.class.getDeclaredFields()) {
      if (Modifier.isStatic(field.getModifiers())) {
        continue;
      }

      try {
        objects.add(field.get(options));
      } catch (IllegalAccessException e) {
        throw new RuntimeException(e);
      }
    }

    return objects.build();
  }
}
