package com.jokes.util;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** Utility class for encoding and decoding URL query strings. */
public final class QueryStrings {

  // Only RFC 3986 unreserved characters stay literal, so '*' is escaped and '~' is not.
  private static final Escaper ESCAPER = new PercentEscaper("-_.~", true);

  private QueryStrings() {
    // Utility class, no instances
  }

  /**
   * Encodes parameters as {@code key=value} pairs joined by {@code &}, sorted by key. Keys and
   * values are form-escaped, so spaces become {@code +}. A parameter with an empty value is
   * still written with its {@code =}. Null keys or values are not allowed.
   *
   * @param params The parameters to encode
   * @return The encoded query string, empty if there are no parameters
   */
  public static String encode(Map<String, String> params) {
    return ImmutableSortedMap.copyOf(params).entrySet().stream()
        .map(e -> ESCAPER.escape(e.getKey()) + "=" + ESCAPER.escape(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  /**
   * Decodes a query string into its parameters. A parameter without {@code =} decodes to an
   * empty value; when a key repeats, the first occurrence wins.
   *
   * @param rawQuery The encoded query string, with or without a leading {@code ?}
   * @return The decoded parameters in the order they appear, or an INVALID_ARGUMENT status
   */
  public static StatusOr<ImmutableMap<String, String>> decode(String rawQuery) {
    String query = Strings.nullToEmpty(rawQuery);
    if (query.startsWith("?")) {
      query = query.substring(1);
    }

    Map<String, String> params = new LinkedHashMap<>();
    for (String pair : Splitter.on('&').omitEmptyStrings().split(query)) {
      int eq = pair.indexOf('=');
      String key = eq >= 0 ? pair.substring(0, eq) : pair;
      String value = eq >= 0 ? pair.substring(eq + 1) : "";
      try {
        params.putIfAbsent(
            URLDecoder.decode(key, StandardCharsets.UTF_8),
            URLDecoder.decode(value, StandardCharsets.UTF_8));
      } catch (IllegalArgumentException e) {
        return StatusOr.ofStatus(Status.invalidArgument("invalid query parameter: \"" + pair + "\""));
      }
    }
    return StatusOr.ofValue(ImmutableMap.copyOf(params));
  }
}
