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
package org.dockercron.crontab;

import java.io.File;
import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CrontabTest {
  // Based on the crontab(5) man page example, fixed up to six fields.
  private static final String EXAMPLE = String.join("\n",
      "       0  5 0 * * *       example_daily   ",
      "   # run at 2:15pm on the first of every month",
      "",
      "       0 15  14 1 * *     example_monthly",
      "",
      "   # run at 10 pm on weekdays",
      "       0 0 22  * * 1-5    example_weekdays",
      "",
      "   # run 23 minutes after midn, 2am, 4am ..., everyday",
      "       0 23 0-23/2 *  * * example_every_other_hour",
      "",
      "   # run at 5 after 4 every sunday",
      "       0 5 4 * *  sun     example_sunday",
      "",
      "   # test alias",
      "   @monthly example_alias",
      "");

  @Rule
  public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static CronJob job(String schedule, String command) {
    return new CronJob(CrontabEntry.parse(schedule), command);
  }

  @Test
  public void testRead() throws Exception {
    assertEquals(
        ImmutableList.of(
            job("0 5 0 * * *", "example_daily"),
            job("0 15 14 1 * *", "example_monthly"),
            job("0 0 22 * * 1-5", "example_weekdays"),
            job("0 23 0-23/2 * * *", "example_every_other_hour"),
            job("0 5 4 * * 0", "example_sunday"),
            job("0 0 0 1 * *", "example_alias")),
        Crontab.read(EXAMPLE));
  }

  @Test
  public void testReadEmpty() throws Exception {
    assertEquals(ImmutableList.of(), Crontab.read(""));
    assertEquals(ImmutableList.of(), Crontab.read("\n  \n# nothing to see here\n"));
  }

  @Test
  public void testReadWindowsLineEndings() throws Exception {
    assertEquals(
        ImmutableList.of(job("@daily", "first"), job("@hourly", "second")),
        Crontab.read("@daily first\r\n@hourly second\r\n"));
  }

  @Test
  public void testParseSixFields() throws Exception {
    CronJob job = Crontab.parseLine("2   *   * * * * foo");
    assertEquals(CrontabEntry.parse("2 * * * * *"), job.getSchedule());
    assertEquals("foo", job.getCommand());
  }

  @Test
  public void testParseSplitsOnSixthRun() throws Exception {
    CronJob job = Crontab.parseLine("0\t*  *\t\t* * *  \t run  this\tthing");
    assertEquals(CrontabEntry.parse("0 * * * * *"), job.getSchedule());
    assertEquals("run  this\tthing", job.getCommand());
  }

  @Test
  public void testParseAlias() throws Exception {
    CronJob job = Crontab.parseLine("@weekly     bar");
    assertEquals(CrontabEntry.parse("@weekly"), job.getSchedule());
    assertEquals("bar", job.getCommand());

    job = Crontab.parseLine("@daily a  b   c");
    assertEquals("a  b   c", job.getCommand());
  }

  @Test
  public void testTooFewRuns() {
    List<String> lines = ImmutableList.of(
        "@daily",
        "* * * * * *",
        "* * * * *",
        "* * * * * foo",
        "0 0 0 * *  foo");
    for (String line : lines) {
      try {
        Crontab.parseLine(line);
        fail("Expected " + line + " to be rejected.");
      } catch (CrontabFormatException e) {
        assertEquals("Invalid crontab line", e.getMessage());
      }
    }
  }

  @Test
  public void testInvalidSchedule() {
    List<String> lines = ImmutableList.of(
        "61 * * * * * foo",
        "* * * * * 7 foo",
        "@fortnightly foo",
        "a b c d e f foo");
    for (String line : lines) {
      try {
        Crontab.parseLine(line);
        fail("Expected " + line + " to be rejected.");
      } catch (CrontabFormatException e) {
        assertTrue(e.getCause() instanceof IllegalArgumentException);
      }
    }
  }

  @Test
  public void testInvalidLineNumber() {
    String contents = String.join("\n",
        "# header",
        "",
        "@daily ok",
        "   ",
        "0 0 * * *  missing_a_field",
        "@hourly never_reached");
    try {
      Crontab.read(contents);
      fail();
    } catch (CrontabException.InvalidLine e) {
      assertEquals(5, e.getLineNumber());
      assertTrue(e.getMessage().startsWith("Invalid crontab entry on line 5."));
      assertTrue(e.getCause() instanceof CrontabFormatException);
    }
  }

  @Test
  public void testFirstInvalidLineWins() {
    try {
      Crontab.read("* * * * * 9 first\n@daily ok\n61 * * * * * second\n");
      fail();
    } catch (CrontabException.InvalidLine e) {
      assertEquals(1, e.getLineNumber());
    }
  }

  @Test
  public void testLoad() throws Exception {
    File crontab = temporaryFolder.newFile("crontab");
    Files.asCharSink(crontab, StandardCharsets.UTF_8).write(EXAMPLE);

    List<CronJob> jobs = Crontab.load(crontab.toPath());
    assertEquals(6, jobs.size());
    assertEquals("example_daily", jobs.get(0).getCommand());
    assertEquals("example_alias", jobs.get(5).getCommand());
  }

  @Test
  public void testLoadMissingFile() throws IOException {
    Path missing = temporaryFolder.getRoot().toPath().resolve("missing");
    try {
      Crontab.load(missing);
      fail();
    } catch (CrontabException.Unreadable e) {
      assertEquals(missing, e.getPath());
      assertTrue(e.getMessage().contains(missing.toString()));
    } catch (CrontabException e) {
      fail("Unexpected " + e);
    }
  }

  @Test
  public void testLoadMalformedUtf8() throws Exception {
    File crontab = temporaryFolder.newFile("crontab");
    Files.write(new byte[] {'@', 'd', 'a', 'i', 'l', 'y', ' ', 'b', 'a', 'c', 'k', (byte) 0xFF,
        'u', 'p', '\n'}, crontab);

    try {
      Crontab.load(crontab.toPath());
      fail();
    } catch (CrontabException.Unreadable e) {
      assertEquals(crontab.toPath(), e.getPath());
      assertTrue(e.getCause() instanceof MalformedInputException);
    } catch (CrontabException e) {
      fail("Unexpected " + e);
    }
  }

  @Test(expected = CrontabException.InvalidLine.class)
  public void testLoadInvalidFile() throws Exception {
    File crontab = temporaryFolder.newFile("crontab");
    Files.asCharSink(crontab, StandardCharsets.UTF_8).write("@daily ok\n@sometimes broken\n");

    Crontab.load(crontab.toPath());
  }
}
