package com.jokes.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation: a {@link StatusCode}, plus a message and the underlying cause
 * for failures. Validation, transport, decode and remote API failures are all reported through
 * this type instead of being thrown.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a status with an explicit code, message and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause);
  }

  public static Status ok() {
    return new Status(StatusCode.OK, null, null);
  }

  /** A value was outside its vocabulary or range. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /**
   * The request could not be sent or its response could not be read. The message is taken
   * verbatim from {@code cause}.
   */
  public static Status unavailable(Throwable cause) {
    return new Status(StatusCode.UNAVAILABLE, cause.getMessage(), cause);
  }

  /** The response arrived but could not be decoded. */
  public static Status dataLoss(String message) {
    return new Status(StatusCode.DATA_LOSS, message, null);
  }

  /** The response arrived but could not be decoded; {@code cause} is the decoder's failure. */
  public static Status dataLoss(String message, Throwable cause) {
    return new Status(StatusCode.DATA_LOSS, message, cause);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the human-readable message, or null for OK. */
  public String getMessage() {
    return message;
  }

  /** Returns the exception behind this status, or null if there is none. */
  public Throwable getCause() {
    return cause;
  }

  public boolean isError() {
    return code != StatusCode.OK;
  }

  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
