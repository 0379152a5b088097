package com.jokes;

import com.jokes.common.status.Status;
import com.jokes.common.status.StatusCode;
import com.jokes.dto.ErrorResponse;
import java.util.Optional;

/**
 * Raised in place of a joke list when the service answers with an error payload. It is never
 * thrown by this library; it travels as the cause of an {@code API_ERROR} status so callers
 * can rethrow it if they prefer exceptions.
 */
public class JokeApiException extends Exception {
  private final transient ErrorResponse errorResponse;

  public JokeApiException(ErrorResponse errorResponse) {
    super(errorResponse.describe());
    this.errorResponse = errorResponse;
  }

  /**
   * Wraps an error payload as an API_ERROR status. The message is the payload's
   * {@code message: additionalInfo} text and the cause is a {@code JokeApiException}.
   */
  public static Status toStatus(ErrorResponse errorResponse) {
    JokeApiException exception = new JokeApiException(errorResponse);
    return Status.of(StatusCode.API_ERROR, exception.getMessage(), exception);
  }

  /** Returns the payload behind an API_ERROR status, or empty for any other status. */
  public static Optional<ErrorResponse> errorResponseOf(Status status) {
    if (status.getCause() instanceof JokeApiException apiException) {
      return Optional.of(apiException.getErrorResponse());
    }
    return Optional.empty();
  }

  /** Returns the payload the service sent. */
  public ErrorResponse getErrorResponse() {
    return errorResponse;
  }
}
