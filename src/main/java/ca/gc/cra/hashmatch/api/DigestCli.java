package ca.gc.cra.hashmatch.api;

import ca.gc.cra.hashmatch.config.DefaultsForMode;
import ca.gc.cra.hashmatch.config.DigestConfig;
import ca.gc.cra.hashmatch.infrastructure.digest.JcaDigestAdapter;
import ca.gc.cra.hashmatch.logging.LoggingConfigurator;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for the {@code digest} command, which prints a target digest for a known value.
 */
public final class DigestCli {
  private static final Logger log = LoggerFactory.getLogger(DigestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: digest value=TEXT [algorithm=SHA256|SHA384|SHA512|PBKDF2] [salt=HEX] [pbkdf2Iterations=N]";
  private static final String HELP_TEXT = """
      HASHMATCH digest helper

      Usage:
        digest value=TEXT [options]

      Options:
        algorithm=NAME        SHA256 (default), SHA384, SHA512 or PBKDF2
        salt=HEX              PBKDF2 salt; a random salt is generated when omitted
        pbkdf2Iterations=N    PBKDF2 iteration count (default 100000)
        pbkdf2SaltLength=N    PBKDF2 salt length in bytes (default 32)
        config=PATH           YAML file with 'common' and 'digest' sections
        --help                Show this message

      The printed value can be passed unchanged as target= to the match command.
      """;

  private DigestCli() {}

  /**
   * Runs the command and exits the JVM with its exit code.
   *
   * @param args command arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> unknownFlags = input.unknownFlags(Set.of());
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    DigestConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      config = DigestConfig.fromMap(ConfigCliUtils.effectiveConfig(DefaultsForMode.MODE_DIGEST, kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid digest arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      byte[] salt = config.salt()
          .orElseGet(() -> config.digest().algorithm().salted()
              ? JcaDigestAdapter.randomSalt(config.digest().pbkdf2SaltLength())
              : new byte[0]);
      JcaDigestAdapter adapter = new JcaDigestAdapter(config.digest(), salt);
      CliPrinter.println(adapter.digest(config.value()));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Digest setup error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (GeneralSecurityException ex) {
      log.error("Unable to compute digest", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
