package com.jokes;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * The single capability the client needs from an HTTP stack: perform a GET and hand back the
 * response body. Implementations must be safe for concurrent use if requests are issued from
 * several threads.
 */
@FunctionalInterface
public interface HttpTransport {

  /**
   * Performs a GET request.
   *
   * @param uri The full request URL, including the query string
   * @return The response body. The caller reads it fully and closes it.
   * @throws IOException if the request could not be completed
   */
  InputStream get(URI uri) throws IOException;
}
