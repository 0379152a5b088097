package com.jokes.dto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JokeTest {

  @Test
  void testTwoPartDisplayText() {
    Joke joke =
        new Joke(
            Category.PROGRAMMING,
            "Because they mistake Halloween for Christmas.",
            Map.of(),
            1,
            null,
            Language.EN,
            true,
            "Why do programmers confuse Halloween and Christmas?",
            JokeType.TWOPART);

    assertEquals(
        "Why do programmers confuse Halloween and Christmas?\n"
            + "Because they mistake Halloween for Christmas.",
        joke.displayText());
  }

  @Test
  void testSingleDisplayText() {
    Joke joke =
        new Joke(Category.PUN, null, Map.of(), 2, "I'm reading a book on anti-gravity.",
            Language.EN, true, null, JokeType.SINGLE);

    assertEquals("I'm reading a book on anti-gravity.", joke.displayText());
  }

  @Test
  void testFlagsDropEntriesWithoutFlagOrValue() {
    Map<Flag, Boolean> raw = new HashMap<>();
    raw.put(Flag.NSFW, true);
    raw.put(Flag.RACIST, false);
    raw.put(null, true);
    raw.put(Flag.SEXIST, null);

    Joke joke = new Joke(Category.DARK, null, raw, 3, "x", Language.EN, false, null, JokeType.SINGLE);

    assertEquals(2, joke.flags().size());
    assertTrue(joke.isFlagged(Flag.NSFW));
    assertFalse(joke.isFlagged(Flag.RACIST));
    assertFalse(joke.isFlagged(Flag.SEXIST));
  }

  @Test
  void testMissingFlagsBecomeEmpty() {
    Joke joke = new Joke(Category.MISC, null, null, 4, "x", Language.DE, true, null, JokeType.SINGLE);
    assertTrue(joke.flags().isEmpty());
  }

  @Test
  void testNullListEntriesAreDropped() {
    Joke joke = new Joke(Category.MISC, null, null, 5, "x", Language.EN, true, null, JokeType.SINGLE);

    assertEquals(List.of(joke), new JokeList(2, Arrays.asList(null, joke)).jokes());
    assertEquals(
        List.of("a", "b"),
        new ErrorResponse(106, "m", "i", Arrays.asList("a", null, "b"), false, 0L).causedBy());
  }
}
