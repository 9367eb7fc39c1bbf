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

import org.dockercron.app.AppModule;
import org.dockercron.app.DockerCronMain;
import org.dockercron.cron.quartz.CronModule;
import org.dockercron.docker.DockerModule;

public class CliOptions {
  public final DockerCronMain.Options main = new DockerCronMain.Options();
  public final AppModule.Options app = new AppModule.Options();
  public final CronModule.Options cron = new CronModule.Options();
  public final DockerModule.Options docker = new DockerModule.Options();
}
