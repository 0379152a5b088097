package com.jokes.dto;

import com.google.gson.annotations.SerializedName;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;

/**
 * Blacklist flags. A request can exclude jokes carrying any of these flags, and every joke
 * reports which of them apply to it.
 *
 * @see <a href="https://jokeapi.dev/#blacklist-flags">Blacklist flags</a>
 */
public enum Flag {
  @SerializedName("nsfw") NSFW("nsfw"),
  @SerializedName("religious") RELIGIOUS("religious"),
  @SerializedName("political") POLITICAL("political"),
  @SerializedName("racist") RACIST("racist"),
  @SerializedName("sexist") SEXIST("sexist"),
  @SerializedName("explicit") EXPLICIT("explicit");

  private final String token;

  Flag(String token) {
    this.token = token;
  }

  /** Returns the token used for this flag on the wire. */
  public String token() {
    return token;
  }

  /**
   * Parses a flag token. Matching is case-sensitive.
   *
   * @param token The raw token, may be null
   * @return The matching flag, or an INVALID_ARGUMENT status
   */
  public static StatusOr<Flag> fromToken(String token) {
    if (token == null) {
      return StatusOr.ofStatus(Status.invalidArgument("invalid flag: null"));
    }

    return switch (token) {
      case "nsfw" -> StatusOr.ofValue(NSFW);
      case "religious" -> StatusOr.ofValue(RELIGIOUS);
      case "political" -> StatusOr.ofValue(POLITICAL);
      case "racist" -> StatusOr.ofValue(RACIST);
      case "sexist" -> StatusOr.ofValue(SEXIST);
      case "explicit" -> StatusOr.ofValue(EXPLICIT);
      default -> StatusOr.ofStatus(Status.invalidArgument("invalid flag: \"" + token + "\""));
    };
  }
}
