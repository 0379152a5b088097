package com.jokes.cli;

import com.jokes.JokeClient;
import com.jokes.JokeClientConfig;
import com.jokes.common.status.StatusOr;
import com.jokes.dto.Joke;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.tinylog.Logger;

/**
 * Command line entry point: fetches jokes matching the given flags and prints them, separated
 * by {@code ---} lines.
 *
 * <p>Exit codes: 0 on success, 1 if the jokes could not be fetched, 2 for bad flags or
 * configuration.
 */
public final class Main {

  static final int EXIT_OK = 0;
  static final int EXIT_FETCH_FAILED = 1;
  static final int EXIT_USAGE = 2;

  static final String SEPARATOR = "---";

  private Main() {}

  public static void main(String[] args) {
    int exitCode = run(args, System.getenv(), System.out, System.err, JokeClient::new);
    if (exitCode != EXIT_OK) {
      System.exit(exitCode);
    }
  }

  /**
   * Runs the command.
   *
   * @param args The command line arguments
   * @param env The environment to read configuration from
   * @param out Where jokes are printed
   * @param err Where errors and usage are printed
   * @param clientFactory Creates the client for the resolved configuration
   * @return The process exit code
   */
  static int run(
      String[] args,
      Map<String, String> env,
      PrintStream out,
      PrintStream err,
      Function<JokeClientConfig, JokeClient> clientFactory) {
    StatusOr<CommandLineOptions> options = CommandLineOptions.parse(args);
    if (options.isNotOk()) {
      err.println(options.getStatus().getMessage());
      err.println(CommandLineOptions.USAGE);
      return EXIT_USAGE;
    }
    if (options.getValue().help()) {
      out.println(CommandLineOptions.USAGE);
      return EXIT_OK;
    }

    StatusOr<JokeClientConfig> config = JokeClientConfig.fromEnvironment(env);
    if (config.isNotOk()) {
      err.println(config.getStatus().getMessage());
      return EXIT_USAGE;
    }
    Logger.debug("Using {}", config.getValue());

    StatusOr<List<Joke>> jokes =
        clientFactory.apply(config.getValue()).fetch(options.getValue().request());
    if (jokes.isNotOk()) {
      err.println(jokes.getStatus().getMessage());
      return EXIT_FETCH_FAILED;
    }

    List<Joke> fetched = jokes.getValue();
    for (int i = 0; i < fetched.size(); i++) {
      out.println(fetched.get(i).displayText());
      if (i < fetched.size() - 1) {
        out.println(SEPARATOR);
      }
    }
    return EXIT_OK;
  }
}
