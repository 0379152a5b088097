package com.jokes.cli;

import com.google.common.collect.ImmutableMap;
import com.jokes.IdRange;
import com.jokes.JokeRequest;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import java.util.function.BiFunction;

/**
 * Parsed command line. Flags may be written with one or two leading dashes, and their value
 * either as the next argument or after {@code =}: {@code -amount 3}, {@code --amount=3}.
 *
 * @param request The joke request built from the flags
 * @param help Whether usage was requested
 */
public record CommandLineOptions(JokeRequest request, boolean help) {

  static final int DEFAULT_AMOUNT = 1;

  /** Valued flags, each mapped onto the request setter it feeds. */
  private static final ImmutableMap<String, BiFunction<JokeRequest, String, Status>> VALUED_FLAGS =
      ImmutableMap.<String, BiFunction<JokeRequest, String, Status>>builder()
          .put("amount", JokeRequest::setAmount)
          .put("contains", (request, text) -> {
            request.withContains(text);
            return Status.ok();
          })
          .put("flag", JokeRequest::addBlacklistFlag)
          .put("category", JokeRequest::addCategory)
          .put("lang", JokeRequest::setLanguage)
          .put("type", JokeRequest::setType)
          .put("id", (request, value) -> IdRange.parse(value).map(request::withIdRange).getStatus())
          .build();

  static final String USAGE =
      String.join(
          "\n",
          "Usage: jokes [flags]",
          "  -amount n       Get n number of jokes (default " + DEFAULT_AMOUNT + ")",
          "  -category cat   Add category cat: Any, Misc, Programming, Dark, Pun, Spooky,"
              + " Christmas",
          "  -contains text  Get jokes containing text",
          "  -flag flag      Add blacklist flag: nsfw, religious, political, racist, sexist,"
              + " explicit",
          "  -id n[-m]       Get the joke with ID n, or IDs n to m",
          "  -lang lang      Set language to lang: cs, de, en, es, fr, pt",
          "  -safe           Set safe-mode on",
          "  -type type      Set type to type: single, twopart",
          "  -help           Show this message",
          "",
          "Environment: JOKEAPI_BASE_URL, JOKEAPI_CONNECT_TIMEOUT_SECONDS,"
              + " JOKEAPI_REQUEST_TIMEOUT_SECONDS");

  /**
   * Parses the command line arguments.
   *
   * @param args The arguments, without the program name
   * @return The options, or an INVALID_ARGUMENT status describing the first bad argument
   */
  public static StatusOr<CommandLineOptions> parse(String[] args) {
    JokeRequest request = new JokeRequest().withAmount(DEFAULT_AMOUNT);
    boolean help = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
        return StatusOr.ofStatus(Status.invalidArgument("unexpected argument: " + arg));
      }

      String name = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
      String inlineValue = null;
      int eq = name.indexOf('=');
      if (eq >= 0) {
        inlineValue = name.substring(eq + 1);
        name = name.substring(0, eq);
      }

      if (name.equals("help") || name.equals("h")) {
        help = true;
        continue;
      }
      if (name.equals("safe")) {
        StatusOr<Boolean> safe = parseBoolean(inlineValue);
        if (safe.isNotOk()) {
          return StatusOr.ofStatus(safe.getStatus());
        }
        request.withSafeMode(safe.getValue());
        continue;
      }

      BiFunction<JokeRequest, String, Status> setter = VALUED_FLAGS.get(name);
      if (setter == null) {
        return StatusOr.ofStatus(Status.invalidArgument("flag provided but not defined: -" + name));
      }
      String value = inlineValue;
      if (value == null) {
        if (i + 1 >= args.length) {
          return StatusOr.ofStatus(Status.invalidArgument("flag needs an argument: -" + name));
        }
        value = args[++i];
      }

      Status status = setter.apply(request, value);
      if (status.isError()) {
        return StatusOr.ofStatus(
            Status.invalidArgument(
                "invalid value \"" + value + "\" for flag -" + name + ": " + status.getMessage()));
      }
    }
    return StatusOr.ofValue(new CommandLineOptions(request, help));
  }

  private static StatusOr<Boolean> parseBoolean(String value) {
    if (value == null || value.equals("true")) {
      return StatusOr.ofValue(true);
    }
    if (value.equals("false")) {
      return StatusOr.ofValue(false);
    }
    return StatusOr.ofStatus(
        Status.invalidArgument("invalid boolean value \"" + value + "\" for flag -safe"));
  }
}
