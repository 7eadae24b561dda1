package io.ariasnap.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {

  private static final String SNAPSHOT =
      "- navigation [ref=e1]:\n"
          + "  - link \"Home\" [ref=e2] [cursor=pointer]:\n"
          + "    - /url: /\n"
          + "  - link \"Docs\" [ref=e3] [cursor=pointer]:\n"
          + "    - /url: /docs\n"
          + "  - button \"Menu\" [expanded=false] [ref=e4]\n";

  @TempDir Path dir;

  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;
  private InputStream originalIn;

  @BeforeEach
  void setUp() {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    originalIn = System.in;
    System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
    System.setIn(originalIn);
  }

  private int execute(String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  private String getOutput() {
    return outContent.toString(StandardCharsets.UTF_8);
  }

  private Path snapshotFile(String content) throws IOException {
    Path file = dir.resolve("snapshot.yaml");
    Files.writeString(file, content);
    return file;
  }

  @Test
  void queriesSnapshotFileAsJson() throws IOException {
    int exitCode =
        execute(
            "-f",
            snapshotFile(SNAPSHOT).toString(),
            "-u",
            "https://example.com",
            "--flatten",
            "-q",
            "[?role == 'link'].props.url",
            "--format",
            "json");

    assertEquals(0, exitCode, errContent.toString(StandardCharsets.UTF_8));
    String output = getOutput();
    assertTrue(output.contains("\"success\" : true"), output);
    assertTrue(output.contains("\"total_items\" : 2"), output);
    assertTrue(output.contains("\"url\" : \"https://example.com\""), output);
    assertTrue(output.contains("/docs"), output);
  }

  @Test
  void readsStdinByDefaultAndWritesYaml() {
    System.setIn(new ByteArrayInputStream(SNAPSHOT.getBytes(StandardCharsets.UTF_8)));

    int exitCode = execute("--silent");

    assertEquals(0, exitCode);
    String output = getOutput();
    assertTrue(output.startsWith("success: true\n"), output);
    assertTrue(output.contains("cache_key: \"nav_"), output);
    assertFalse(output.contains("snapshot:"), output);
  }

  @Test
  void pagesResults() throws IOException {
    int exitCode =
        execute(
            "-f",
            snapshotFile(SNAPSHOT).toString(),
            "--flatten",
            "--limit",
            "2",
            "--offset",
            "1",
            "--silent");

    assertEquals(0, exitCode);
    String output = getOutput();
    assertTrue(output.contains("total_items: 4"), output);
    assertTrue(output.contains("has_more: true"), output);
  }

  @Test
  void parseErrorExitsWithFailure() throws IOException {
    int exitCode = execute("-f", snapshotFile("- link \"Home\n").toString());

    assertEquals(1, exitCode);
    assertTrue(getOutput().contains("success: false"), getOutput());
    assertTrue(getOutput().contains("Line 1: "), getOutput());
  }

  @Test
  void invalidQueryExitsWithFailure() throws IOException {
    int exitCode = execute("-f", snapshotFile(SNAPSHOT).toString(), "-q", "[?role ==");

    assertEquals(1, exitCode);
    assertTrue(getOutput().contains("Invalid JMESPath query"), getOutput());
  }

  @Test
  void missingFileIsReported() {
    int exitCode = execute("-f", dir.resolve("absent.yaml").toString());

    assertEquals(1, exitCode);
    assertTrue(errContent.toString(StandardCharsets.UTF_8).contains("file not found"));
    assertEquals("", getOutput());
  }

  @Test
  void configFileSetsDefaults() throws IOException {
    Path config = dir.resolve("snapshot.properties");
    Files.writeString(config, "defaultLimit=1\nformat=json\n");

    int exitCode =
        execute("-c", config.toString(), "-f", snapshotFile(SNAPSHOT).toString(), "--flatten");

    assertEquals(0, exitCode);
    assertTrue(getOutput().contains("\"limit\" : 1"), getOutput());
    assertTrue(getOutput().contains("\"has_more\" : true"), getOutput());
  }

  @Test
  void unreadableConfigIsReported() throws IOException {
    Path config = Files.createDirectory(dir.resolve("config.properties"));

    int exitCode = execute("-c", config.toString(), "-f", snapshotFile(SNAPSHOT).toString());

    assertEquals(1, exitCode);
    String err = errContent.toString(StandardCharsets.UTF_8);
    assertTrue(err.startsWith("Error: cannot read config: "), err);
    assertFalse(err.contains("Exception"), err);
    assertEquals("", getOutput());
  }

  @Test
  void invalidConfigValueIsReported() throws IOException {
    Path config = dir.resolve("snapshot.properties");
    Files.writeString(config, "maxLimit=4294967297\n");

    int exitCode = execute("-c", config.toString(), "-f", snapshotFile(SNAPSHOT).toString());

    assertEquals(1, exitCode);
    String err = errContent.toString(StandardCharsets.UTF_8);
    assertTrue(err.contains("Error: cannot read config: "), err);
    assertTrue(err.contains("maxLimit"), err);
  }
}
