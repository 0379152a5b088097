package com.jokes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration record for talking to the JokeAPI service.
 *
 * @param baseUrl Scheme and host of the service, e.g. {@code https://v2.jokeapi.dev}
 * @param connectTimeout How long to wait for a connection to be established
 * @param requestTimeout How long to wait for a complete response
 * @param userAgent The User-Agent header sent with each request
 */
public record JokeClientConfig(
    URI baseUrl,
    Duration connectTimeout,
    Duration requestTimeout,
    String userAgent
) {

  public static final URI DEFAULT_BASE_URL = URI.create("https://v2.jokeapi.dev");
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_USER_AGENT = "jokes-client/0.1";

  public static final String ENV_BASE_URL = "JOKEAPI_BASE_URL";
  public static final String ENV_CONNECT_TIMEOUT = "JOKEAPI_CONNECT_TIMEOUT_SECONDS";
  public static final String ENV_REQUEST_TIMEOUT = "JOKEAPI_REQUEST_TIMEOUT_SECONDS";

  private static final ImmutableSet<String> SCHEMES = ImmutableSet.of("http", "https");

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if baseUrl is not an absolute http or https URL
   */
  public JokeClientConfig {
    checkNotNull(baseUrl, "baseUrl");
    checkArgument(isHttpUrl(baseUrl), "baseUrl must be an http or https URL: %s", baseUrl);
    checkNotNull(connectTimeout, "connectTimeout");
    checkNotNull(requestTimeout, "requestTimeout");
    checkNotNull(userAgent, "userAgent");
  }

  /** Returns the configuration for the public service with default timeouts. */
  public static JokeClientConfig defaults() {
    return new JokeClientConfig(
        DEFAULT_BASE_URL, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, DEFAULT_USER_AGENT);
  }

  /**
   * Builds a configuration from environment variables, falling back to the defaults for
   * variables that are unset or empty.
   *
   * @param env The environment, usually {@code System.getenv()}
   * @return The configuration, or an INVALID_ARGUMENT status naming the bad variable
   */
  public static StatusOr<JokeClientConfig> fromEnvironment(Map<String, String> env) {
    URI baseUrl = DEFAULT_BASE_URL;
    String rawBaseUrl = env.get(ENV_BASE_URL);
    if (!Strings.isNullOrEmpty(rawBaseUrl)) {
      try {
        baseUrl = new URI(rawBaseUrl);
      } catch (URISyntaxException e) {
        return StatusOr.ofStatus(
            Status.invalidArgument(ENV_BASE_URL + " is not a valid URL: " + rawBaseUrl));
      }
      if (baseUrl.getScheme() == null || baseUrl.getHost() == null) {
        return StatusOr.ofStatus(
            Status.invalidArgument(ENV_BASE_URL + " must include a scheme and host: " + rawBaseUrl));
      }
      if (!isHttpUrl(baseUrl)) {
        return StatusOr.ofStatus(
            Status.invalidArgument(ENV_BASE_URL + " must be an http or https URL: " + rawBaseUrl));
      }
    }

    StatusOr<Duration> connectTimeout =
        seconds(env, ENV_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT);
    if (connectTimeout.isNotOk()) {
      return StatusOr.ofStatus(connectTimeout.getStatus());
    }
    StatusOr<Duration> requestTimeout =
        seconds(env, ENV_REQUEST_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    if (requestTimeout.isNotOk()) {
      return StatusOr.ofStatus(requestTimeout.getStatus());
    }

    return StatusOr.ofValue(
        new JokeClientConfig(
            baseUrl, connectTimeout.getValue(), requestTimeout.getValue(), DEFAULT_USER_AGENT));
  }

  private static boolean isHttpUrl(URI uri) {
    return uri.getScheme() != null
        && SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
        && uri.getHost() != null;
  }

  private static StatusOr<Duration> seconds(
      Map<String, String> env, String name, Duration defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return StatusOr.ofValue(defaultValue);
    }
    try {
      long value = Long.parseLong(raw.trim());
      if (value <= 0) {
        return StatusOr.ofStatus(Status.invalidArgument(name + " must be positive: " + raw));
      }
      return StatusOr.ofValue(Duration.ofSeconds(value));
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(Status.invalidArgument(name + " is not a number: " + raw));
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("baseUrl", baseUrl)
        .add("connectTimeout", connectTimeout)
        .add("requestTimeout", requestTimeout)
        .add("userAgent", userAgent)
        .toString();
  }
}
