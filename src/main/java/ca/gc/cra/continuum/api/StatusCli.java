package ca.gc.cra.continuum.api;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.license.LicensePolicyException;
import ca.gc.cra.continuum.config.CompositionRoot;
import ca.gc.cra.continuum.config.ContinuumConfig;
import ca.gc.cra.continuum.config.ContinuumRuntime;
import ca.gc.cra.continuum.config.EnvironmentConfig;
import ca.gc.cra.continuum.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code continuum status}: validates the license once and prints service, health and license status.
 *
 * <p>Exits with {@link ExitCode#LICENSE_INVALID} when the license is rejected in stop mode.</p>
 *
 * @since 0.1.0
 */
public final class StatusCli {
  private static final Logger log = LoggerFactory.getLogger(StatusCli.class);
  private static final String HELP_TEXT = """
      Continuum status

      Usage:
        status [config=FILE] [key=value ...] [--pretty]

      Prints {service, health, license}. Credentials are never printed.
      """;

  private StatusCli() {}

  public static void main(String[] args) {
    System.exit(run(args, EnvironmentConfig.system()).code());
  }

  static ExitCode run(String[] args, EnvironmentConfig environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ContinuumConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      config = ConfigCliUtils.resolve("status", kv, environment);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (ContinuumRuntime runtime = new CompositionRoot(config, environment).build()) {
      GovernanceApi api = new GovernanceApi(runtime);
      ExitCode exit = ExitCode.SUCCESS;
      try {
        runtime.licenseGate().startup();
      } catch (LicensePolicyException ex) {
        log.error("License rejected: {}", ex.reason());
        exit = ExitCode.LICENSE_INVALID;
      }
      Map<String, Object> report = new LinkedHashMap<>();
      report.put("service", api.root());
      report.put("health", api.health());
      report.put("license", api.license());
      CliPrinter.println(new JsonSupport().write(report, input.hasFlag("--pretty")));
      return exit;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in status", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
