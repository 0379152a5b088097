package com.jokes;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.io.ByteStreams;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import com.jokes.dto.Joke;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Issues {@link JokeRequest}s against the service. One blocking GET per call; nothing is
 * retried or cached.
 */
public final class JokeClient {

  private final JokeClientConfig config;
  private final HttpTransport transport;
  private final ResponseParser parser;

  /** Creates a client that uses the JDK HTTP client. */
  public JokeClient(JokeClientConfig config) {
    this(config, new JdkHttpTransport(config));
  }

  /** Creates a client that sends requests through the given transport. */
  public JokeClient(JokeClientConfig config, HttpTransport transport) {
    this(config, transport, new ResponseParser());
  }

  JokeClient(JokeClientConfig config, HttpTransport transport, ResponseParser parser) {
    this.config = checkNotNull(config, "config");
    this.transport = checkNotNull(transport, "transport");
    this.parser = checkNotNull(parser, "parser");
  }

  /** Returns a client for the public service, shared by {@link JokeRequest#get()}. */
  public static JokeClient defaultClient() {
    return DefaultClientHolder.INSTANCE;
  }

  public JokeClientConfig getConfig() {
    return config;
  }

  /**
   * Fetches the jokes matching a request.
   *
   * @param request The filter criteria
   * @return The jokes, or an UNAVAILABLE status if the transport failed, returned no body or
   *     the body could not be read, or whatever status {@link ResponseParser} reported
   */
  @Nonnull
  public StatusOr<List<Joke>> fetch(JokeRequest request) {
    URI uri = request.url(config.baseUrl());
    Logger.debug("Fetching jokes: {}", uri);

    byte[] body;
    try (InputStream in = transport.get(uri)) {
      if (in == null) {
        throw new IOException("GET " + uri + " returned no body");
      }
      body = ByteStreams.toByteArray(in);
    } catch (IOException e) {
      Logger.warn(e, "GET {} failed", uri);
      return StatusOr.ofStatus(Status.unavailable(e));
    }
    return parser.parse(body);
  }

  private static final class DefaultClientHolder {
    private static final JokeClient INSTANCE = new JokeClient(JokeClientConfig.defaults());
  }
}
