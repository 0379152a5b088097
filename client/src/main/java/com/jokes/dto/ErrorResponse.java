package com.jokes.dto;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * An error payload sent by the service, recognized by {@code "error": true}.
 *
 * @param code The service's error code (for example 106, "No matching joke found")
 * @param message A short description of the error
 * @param additionalInfo Details about what caused the error
 * @param causedBy The individual reasons reported by the service, without null entries
 * @param internalError Whether the failure was on the service's side
 * @param timestamp Milliseconds since the epoch at which the error occurred
 */
public record ErrorResponse(
    int code,
    String message,
    String additionalInfo,
    List<String> causedBy,
    boolean internalError,
    long timestamp
) {
  public ErrorResponse {
    causedBy = causedBy == null
        ? ImmutableList.of()
        : causedBy.stream().filter(Objects::nonNull).collect(ImmutableList.toImmutableList());
  }

  /** Returns the {@code message: additionalInfo} form used when reporting this error. */
  public String describe() {
    return message + ": " + additionalInfo;
  }
}
