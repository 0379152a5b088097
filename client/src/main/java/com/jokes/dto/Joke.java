package com.jokes.dto;

import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.SerializedName;
import java.util.Map;

/**
 * A single joke as returned by the {@code joke} endpoint.
 *
 * <p>Single jokes carry their text in {@code joke}; two-part jokes carry {@code setup} and
 * {@code delivery} instead. The unused fields are null.
 *
 * @param category The joke's category
 * @param delivery The punchline of a two-part joke
 * @param flags Which blacklist flags apply to this joke
 * @param id The joke's numeric identifier
 * @param joke The text of a single joke
 * @param language The language the joke is written in
 * @param safe Whether the service considers the joke safe
 * @param setup The setup of a two-part joke
 * @param type Whether this is a single or two-part joke
 */
public record Joke(
    Category category,
    String delivery,
    Map<Flag, Boolean> flags,
    int id,
    String joke,
    @SerializedName("lang") Language language,
    boolean safe,
    String setup,
    JokeType type
) {
  public Joke {
    // Entries without a flag or a value are dropped.
    ImmutableMap.Builder<Flag, Boolean> known = ImmutableMap.builder();
    if (flags != null) {
      flags.forEach((flag, set) -> {
        if (flag != null && set != null) {
          known.put(flag, set);
        }
      });
    }
    flags = known.build();
  }

  /** Returns true if the service marked this joke with the given flag. */
  public boolean isFlagged(Flag flag) {
    return Boolean.TRUE.equals(flags.get(flag));
  }

  /**
   * Returns the text to show a reader: setup and delivery on separate lines for a two-part
   * joke, otherwise the joke itself.
   */
  public String displayText() {
    if (type == JokeType.TWOPART) {
      return setup + "\n" + delivery;
    }
    return joke;
  }
}
