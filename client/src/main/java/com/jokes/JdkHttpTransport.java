package com.jokes;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.tinylog.Logger;

/**
 * {@link HttpTransport} backed by the JDK's {@link HttpClient}. The body is returned whatever the
 * status code, since the service describes failures in a JSON body.
 */
public final class JdkHttpTransport implements HttpTransport {

  private final HttpClient httpClient;
  private final JokeClientConfig config;

  public JdkHttpTransport(JokeClientConfig config) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        config);
  }

  JdkHttpTransport(HttpClient httpClient, JokeClientConfig config) {
    this.httpClient = httpClient;
    this.config = config;
  }

  @Override
  public InputStream get(URI uri) throws IOException {
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .header("User-Agent", config.userAgent())
            .GET()
            .build();

    try {
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      Logger.debug("GET {} returned HTTP {}", uri, response.statusCode());
      return response.body();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("GET " + uri + " interrupted");
      interrupted.initCause(e);
      throw interrupted;
    }
  }
}
