package io.ariasnap.shell;

import io.ariasnap.cache.SnapshotCache;
import io.ariasnap.config.SnapshotConfig;
import io.ariasnap.format.OutputFormat;
import io.ariasnap.format.OutputFormatter;
import io.ariasnap.query.JmesPathQueryEngine;
import io.ariasnap.service.SnapshotQueryService;
import io.ariasnap.service.SnapshotRequest;
import io.ariasnap.service.SnapshotResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Command-line front end: reads one snapshot, runs it through {@link SnapshotQueryService} and
 * prints the response. Logging goes to stderr so stdout carries only the response.
 */
@CommandLine.Command(
    name = "aria-snapshot",
    description = "Parse, query and page accessibility snapshots",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "Snapshot file; '-' or absent reads stdin")
  private String file;

  @CommandLine.Option(
      names = {"-u", "--url"},
      description = "Page URL the snapshot was taken from")
  private String url;

  @CommandLine.Option(
      names = {"-q", "--query"},
      description = "JMESPath expression applied to the snapshot")
  private String query;

  @CommandLine.Option(
      names = "--flatten",
      description = "Flatten the tree before querying")
  private boolean flatten;

  @CommandLine.Option(names = "--limit", description = "Page size")
  private Integer limit;

  @CommandLine.Option(names = "--offset", description = "Page start", defaultValue = "0")
  private int offset;

  @CommandLine.Option(names = "--format", description = "Output format: json or yaml")
  private String format;

  @CommandLine.Option(names = "--silent", description = "Report metadata without the snapshot")
  private boolean silent;

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Properties file with ttlSeconds, defaultLimit, maxLimit and format")
  private Path configFile;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    LOG.info(
        "aria-snapshot starting: file={}, query={}, flatten={}, config={}",
        file == null ? "-" : file,
        query,
        flatten,
        configFile);
    SnapshotConfig config;
    try {
      config = loadConfig();
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: cannot read config: " + e.getMessage());
      return 1;
    }
    OutputFormat outputFormat =
        format != null ? OutputFormat.parse(format) : config.defaultFormat();

    String raw;
    try {
      raw = readSnapshot();
    } catch (IOException e) {
      System.err.println("Error: cannot read snapshot: " + e.getMessage());
      return 1;
    }

    try (SnapshotCache cache = new SnapshotCache(config.defaultTtl())) {
      SnapshotQueryService service =
          new SnapshotQueryService(cache, new JmesPathQueryEngine(), config);
      SnapshotResponse response =
          service.execute(
              SnapshotRequest.fresh(url, raw)
                  .query(query)
                  .flatten(flatten)
                  .limit(limit)
                  .offset(offset)
                  .format(outputFormat)
                  .silent(silent)
                  .build());
      LOG.debug("Request finished, success={}", response.success());
      System.out.print(OutputFormatter.format(response.toMap(), outputFormat));
      System.out.flush();
      return response.success() ? 0 : 1;
    }
  }

  private SnapshotConfig loadConfig() throws IOException {
    SnapshotConfig base =
        configFile != null ? SnapshotConfig.load(configFile) : SnapshotConfig.defaults();
    return base.withSystemOverrides();
  }

  private String readSnapshot() throws IOException {
    if (file == null || file.equals("-")) {
      return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }
    Path p = Paths.get(file);
    if (!Files.exists(p)) {
      throw new IOException("file not found: " + file);
    }
    return Files.readString(p, StandardCharsets.UTF_8);
  }
}
