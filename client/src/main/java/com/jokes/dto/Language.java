package com.jokes.dto;

import com.google.gson.annotations.SerializedName;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;

/**
 * Languages a joke can be requested in.
 *
 * @see <a href="https://jokeapi.dev/#lang">Languages</a>
 */
public enum Language {
  @SerializedName("cs") CS("cs"), // Czech
  @SerializedName("de") DE("de"), // German
  @SerializedName("en") EN("en"), // English
  @SerializedName("es") ES("es"), // Spanish
  @SerializedName("fr") FR("fr"), // French
  @SerializedName("pt") PT("pt"); // Portuguese

  private final String code;

  Language(String code) {
    this.code = code;
  }

  /** Returns the two-letter language code. */
  public String token() {
    return code;
  }

  /**
   * Parses a two-letter language code. Matching is case-sensitive.
   *
   * @param code The raw code, may be null
   * @return The matching language, or an INVALID_ARGUMENT status
   */
  public static StatusOr<Language> fromToken(String code) {
    if (code == null) {
      return StatusOr.ofStatus(Status.invalidArgument("invalid lang code: null"));
    }

    return switch (code) {
      case "cs" -> StatusOr.ofValue(CS);
      case "de" -> StatusOr.ofValue(DE);
      case "en" -> StatusOr.ofValue(EN);
      case "es" -> StatusOr.ofValue(ES);
      case "fr" -> StatusOr.ofValue(FR);
      case "pt" -> StatusOr.ofValue(PT);
      default -> StatusOr.ofStatus(Status.invalidArgument("invalid lang code: \"" + code + "\""));
    };
  }
}
