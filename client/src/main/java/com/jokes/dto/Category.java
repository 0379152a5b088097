package com.jokes.dto;

import com.google.gson.annotations.SerializedName;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;

/**
 * Joke categories. Unlike the other vocabularies, category tokens are capitalized.
 *
 * @see <a href="https://jokeapi.dev/#categories">Categories</a>
 */
public enum Category {
  @SerializedName("Any") ANY("Any"),
  @SerializedName("Misc") MISC("Misc"),
  @SerializedName("Programming") PROGRAMMING("Programming"),
  @SerializedName("Dark") DARK("Dark"),
  @SerializedName("Pun") PUN("Pun"),
  @SerializedName("Spooky") SPOOKY("Spooky"),
  @SerializedName("Christmas") CHRISTMAS("Christmas");

  private final String token;

  Category(String token) {
    this.token = token;
  }

  /** Returns the token used for this category in the request path. */
  public String token() {
    return token;
  }

  /**
   * Parses a category token. Matching is case-sensitive, so {@code "dark"} is rejected.
   *
   * @param token The raw token, may be null
   * @return The matching category, or an INVALID_ARGUMENT status
   */
  public static StatusOr<Category> fromToken(String token) {
    if (token == null) {
      return StatusOr.ofStatus(Status.invalidArgument("invalid category: null"));
    }

    return switch (token) {
      case "Any" -> StatusOr.ofValue(ANY);
      case "Misc" -> StatusOr.ofValue(MISC);
      case "Programming" -> StatusOr.ofValue(PROGRAMMING);
      case "Dark" -> StatusOr.ofValue(DARK);
      case "Pun" -> StatusOr.ofValue(PUN);
      case "Spooky" -> StatusOr.ofValue(SPOOKY);
      case "Christmas" -> StatusOr.ofValue(CHRISTMAS);
      default -> StatusOr.ofStatus(Status.invalidArgument("invalid category: \"" + token + "\""));
    };
  }
}
