package ca.gc.cra.tide.api;

import ca.gc.cra.tide.application.pipeline.ReplicationConsumer;
import ca.gc.cra.tide.application.pipeline.StreamFailureException;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.config.CompositionRoot;
import ca.gc.cra.tide.config.StreamConfig;
import ca.gc.cra.tide.config.StreamConfigLoader;
import ca.gc.cra.tide.config.SubscriptionSpec;
import ca.gc.cra.tide.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.tide.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tide.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.tide.logging.LoggingConfigurator;
import ca.gc.cra.tide.logging.Logs;
import java.io.IOException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a logical replication slot and logs every matching change event.
 *
 * @since 0.1.0
 */
public final class StreamCli {
  private static final Logger log = LoggerFactory.getLogger(StreamCli.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 10;
  private static final String SUMMARY_USAGE =
      "usage: stream [config=PATH] [host=HOST] [port=PORT] [database=DB] [user=USER] [password=PASS] "
          + "[slotName=SLOT] [publicationName=PUB] [subscriptions=TYPE:schema.table,...] [--dry-run]";
  private static final String HELP_TEXT = """
      TIDE stream command

      Usage:
        stream [options]

      Connection:
        host=HOST                 Database host (default localhost, env DB_HOST)
        port=PORT                 Database port (default 5432, env DB_PORT)
        database=DB               Database holding the publication (default postgres, env DB_NAME)
        user=USER                 Role with the REPLICATION attribute (default postgres, env DB_USER)
        password=PASS             Password (env DB_PASS)

      Replication:
        slotName=SLOT             Existing logical slot using pgoutput (default slot1, env SLOT_NAME)
        publicationName=PUB       Existing publication (default pub1, env PUBLICATION_NAME)
        startLsn=X/Y              Resume position; defaults to the slot's confirmed position
        ackMessages=N             Acknowledge after N processed messages (default 100)
        ackIntervalMillis=MS      Acknowledge pending progress after MS milliseconds (default 10000, 0 disables)
        pollIntervalMillis=MS     Pause between polls when idle (default 100)
        statusIntervalMillis=MS   Driver standby status interval (default 10000)

      Subscriptions:
        subscriptions=LIST        Comma separated TYPE:schema.table entries (default UPDATE:public.*)
                                  TYPE is INSERT, UPDATE, DELETE, TRUNCATE or ANY; * matches any schema or table
        logValueBytes=N           Byte budget per logged column value (default 256)

      Telemetry:
        metricsExporter=otlp|none OpenTelemetry metrics exporter (env OTEL_METRICS_EXPORTER)
        otelEndpoint=URL          OTLP endpoint (env OTEL_EXPORTER_OTLP_ENDPOINT)
        otelResourceAttributes=K=V,...
        otelExportIntervalSeconds=N

      Global options:
        config=PATH               YAML file with common and stream sections
        --dry-run                 Validate configuration and print the plan without connecting
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Precedence: CLI > environment > YAML > defaults.
      """;

  private StreamCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.getenv(), TelemetrySettings.fromEnvironment());
  }

  static ExitCode run(String[] args, Map<String, String> environment, TelemetrySettings telemetryFallback) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for stream CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    StreamConfig config;
    TelemetrySettings telemetry;
    try {
      Map<String, String> effective =
          new LinkedHashMap<>(StreamConfigLoader.loadEffective(kv, environment, log::warn));
      telemetry = TelemetryConfigurator.resolve(effective, telemetryFallback);
      config = StreamConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid stream configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }
    if (config.subscriptions().isEmpty()) {
      log.warn("No subscriptions configured; changes will be acknowledged without being logged");
    }

    MetricsPort metrics = telemetry.disabled() ? new NoOpMetricsAdapter() : new OpenTelemetryMetricsAdapter(telemetry);
    try {
      return stream(new CompositionRoot(config, metrics));
    } finally {
      if (metrics instanceof AutoCloseable closeable) {
        closeMetrics(closeable);
      }
    }
  }

  private static ExitCode stream(CompositionRoot root) {
    StreamConfig config = root.config();
    ReplicationConsumer consumer;
    try {
      consumer = root.replicationConsumer();
    } catch (IllegalArgumentException ex) {
      log.error("Stream configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }

    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; stopping slot {}", config.slotName());
      consumer.stop();
      try {
        if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Stream did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "tide-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      log.info("Starting stream for slot {} publication {} on {}",
          config.slotName(), config.publicationName(), config.connection());
      consumer.start(config.slotName(), config.publicationName());
      log.info("Stream for slot {} stopped", config.slotName());
      return ExitCode.SUCCESS;
    } catch (StreamFailureException ex) {
      log.error("Stream for slot {} failed at {}: {}", config.slotName(), ex.position(), ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (SQLException | IOException ex) {
      log.error("Replication connection failure for slot {}: {}", config.slotName(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Stream configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Stream interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in stream", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in stream", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static void closeMetrics(AutoCloseable metrics) {
    try {
      metrics.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics adapter", ex);
    }
  }

  private static void printDryRunPlan(StreamConfig config, TelemetrySettings telemetry) {
    StringJoiner subscriptions = new StringJoiner(", ");
    for (SubscriptionSpec spec : config.subscriptions()) {
      subscriptions.add(spec.toString());
    }
    CliPrinter.printLines(
        "Stream dry-run: no connection will be opened.",
        " JDBC URL         : " + config.connection().jdbcUrl(),
        " User             : " + config.connection().user(),
        " Password         : " + (config.connection().password() == null
            || config.connection().password().isEmpty() ? "<none>" : Logs.redact(config.connection().password())),
        " Slot             : " + config.slotName(),
        " Publication      : " + config.publicationName(),
        " Start LSN        : " + (config.startLsn().isValid() ? config.startLsn() : "<slot confirmed position>"),
        " Ack every        : " + config.acknowledgement().maxMessages() + " messages or "
            + config.acknowledgement().intervalMillis() + " ms",
        " Poll interval    : " + config.connection().pollIntervalMillis() + " ms",
        " Subscriptions    : " + (config.subscriptions().isEmpty() ? "<none>" : subscriptions.toString()),
        " Metrics exporter : " + telemetry.exporter() + (telemetry.disabled() ? "" : " -> " + telemetry.endpoint()),
        " Re-run without --dry-run to start streaming.");
  }
}
