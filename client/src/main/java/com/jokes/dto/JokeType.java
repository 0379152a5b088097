package com.jokes.dto;

import com.google.gson.annotations.SerializedName;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;

/**
 * Joke shape: a single line, or a setup followed by a delivery.
 *
 * @see <a href="https://jokeapi.dev/#joke-type">Joke type</a>
 */
public enum JokeType {
  @SerializedName("single") SINGLE("single"),
  @SerializedName("twopart") TWOPART("twopart");

  private final String token;

  JokeType(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  /**
   * Parses a joke type token. Matching is case-sensitive.
   *
   * @param token The raw token, may be null
   * @return The matching type, or an INVALID_ARGUMENT status
   */
  public static StatusOr<JokeType> fromToken(String token) {
    if (token == null) {
      return StatusOr.ofStatus(Status.invalidArgument("invalid type: null"));
    }

    return switch (token) {
      case "single" -> StatusOr.ofValue(SINGLE);
      case "twopart" -> StatusOr.ofValue(TWOPART);
      default -> StatusOr.ofStatus(Status.invalidArgument("invalid type: \"" + token + "\""));
    };
  }
}
