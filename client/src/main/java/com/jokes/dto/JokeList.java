package com.jokes.dto;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * The response shape used when more than one joke was requested.
 *
 * @param amount The number of jokes the service returned
 * @param jokes The jokes, in the order the service sent them; null entries are dropped
 */
public record JokeList(int amount, List<Joke> jokes) {
  public JokeList {
    jokes = jokes == null
        ? ImmutableList.of()
        : jokes.stream().filter(Objects::nonNull).collect(ImmutableList.toImmutableList());
  }
}
