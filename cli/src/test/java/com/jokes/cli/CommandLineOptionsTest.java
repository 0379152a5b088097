package com.jokes.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.jokes.IdRange;
import com.jokes.JokeRequest;
import com.jokes.common.status.StatusCode;
import com.jokes.common.status.StatusOr;
import com.jokes.dto.Category;
import com.jokes.dto.Flag;
import com.jokes.dto.JokeType;
import com.jokes.dto.Language;
import org.junit.jupiter.api.Test;

class CommandLineOptionsTest {

  @Test
  void testDefaultsToOneJoke() {
    StatusOr<CommandLineOptions> options = CommandLineOptions.parse(new String[0]);

    assertTrue(options.isOk());
    assertFalse(options.getValue().help());
    assertEquals(ImmutableMap.of("amount", "1"), options.getValue().request().query());
  }

  @Test
  void testAllFlags() {
    StatusOr<CommandLineOptions> options = CommandLineOptions.parse(new String[] {
        "-amount", "3",
        "--contains=cat",
        "-safe",
        "-flag", "nsfw",
        "-flag=racist",
        "-category", "Programming",
        "--category", "Pun",
        "-lang", "de",
        "-type", "twopart",
        "-id", "5-9"
    });

    assertTrue(options.isOk(), () -> options.getStatus().toString());
    JokeRequest request = options.getValue().request();
    assertEquals(3, request.getAmount().getAsInt());
    assertEquals("cat", request.getContains());
    assertTrue(request.isSafeMode());
    assertEquals(ImmutableList.of(Flag.NSFW, Flag.RACIST), request.getBlacklist());
    assertEquals(ImmutableList.of(Category.PROGRAMMING, Category.PUN), request.getCategories());
    assertEquals(Language.DE, request.getLanguage().orElseThrow());
    assertEquals(JokeType.TWOPART, request.getType().orElseThrow());
    assertEquals(new IdRange(5, 9), request.getIdRange().orElseThrow());
  }

  @Test
  void testSafeAcceptsExplicitBoolean() {
    assertFalse(CommandLineOptions.parse(new String[] {"-safe=false"}).getValue().request().isSafeMode());
    assertTrue(CommandLineOptions.parse(new String[] {"-safe=maybe"}).isNotOk());
  }

  @Test
  void testHelp() {
    assertTrue(CommandLineOptions.parse(new String[] {"-help"}).getValue().help());
    assertTrue(CommandLineOptions.parse(new String[] {"--h"}).getValue().help());
  }

  @Test
  void testInvalidValueReportsSetterMessage() {
    StatusOr<CommandLineOptions> options =
        CommandLineOptions.parse(new String[] {"-category", "dark"});

    assertEquals(StatusCode.INVALID_ARGUMENT, options.getStatus().getCode());
    assertEquals(
        "invalid value \"dark\" for flag -category: invalid category: \"dark\"",
        options.getStatus().getMessage());
  }

  @Test
  void testUnknownFlag() {
    assertEquals(
        "flag provided but not defined: -format",
        CommandLineOptions.parse(new String[] {"-format", "xml"}).getStatus().getMessage());
  }

  @Test
  void testMissingValue() {
    assertEquals(
        "flag needs an argument: -lang",
        CommandLineOptions.parse(new String[] {"-lang"}).getStatus().getMessage());
  }

  @Test
  void testPositionalArgumentIsRejected() {
    assertEquals(
        "unexpected argument: Programming",
        CommandLineOptions.parse(new String[] {"Programming"}).getStatus().getMessage());
  }
}
