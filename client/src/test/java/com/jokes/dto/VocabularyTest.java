package com.jokes.dto;

import static org.junit.jupiter.api.Assertions.*;

import com.jokes.common.status.StatusCode;
import com.jokes.common.status.StatusOr;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Tests for the token parsing of the closed vocabularies. */
class VocabularyTest {

  @ParameterizedTest
  @EnumSource(Language.class)
  void testLanguageTokensParse(Language language) {
    assertEquals(language, Language.fromToken(language.token()).getValue());
  }

  @ParameterizedTest
  @EnumSource(Flag.class)
  void testFlagTokensParse(Flag flag) {
    assertEquals(flag, Flag.fromToken(flag.token()).getValue());
  }

  @ParameterizedTest
  @EnumSource(Category.class)
  void testCategoryTokensParse(Category category) {
    assertEquals(category, Category.fromToken(category.token()).getValue());
  }

  @ParameterizedTest
  @EnumSource(JokeType.class)
  void testJokeTypeTokensParse(JokeType type) {
    assertEquals(type, JokeType.fromToken(type.token()).getValue());
  }

  @Test
  void testInvalidTokensAreRejected() {
    assertInvalid(Language.fromToken("invalid"), "invalid lang code: \"invalid\"");
    assertInvalid(Flag.fromToken("invalid"), "invalid flag: \"invalid\"");
    assertInvalid(Category.fromToken("invalid"), "invalid category: \"invalid\"");
    assertInvalid(JokeType.fromToken("invalid"), "invalid type: \"invalid\"");
  }

  @Test
  void testTokensAreCaseSensitive() {
    assertEquals("Programming", Category.PROGRAMMING.token());
    assertEquals("nsfw", Flag.NSFW.token());
    assertInvalid(Category.fromToken("dark"), "invalid category: \"dark\"");
    assertInvalid(Flag.fromToken("NSFW"), "invalid flag: \"NSFW\"");
    assertInvalid(Language.fromToken("EN"), "invalid lang code: \"EN\"");
    assertInvalid(JokeType.fromToken("TwoPart"), "invalid type: \"TwoPart\"");
  }

  @Test
  void testNullTokensAreRejected() {
    assertTrue(Language.fromToken(null).isNotOk());
    assertTrue(Flag.fromToken(null).isNotOk());
    assertTrue(Category.fromToken(null).isNotOk());
    assertTrue(JokeType.fromToken(null).isNotOk());
  }

  private static void assertInvalid(StatusOr<?> result, String message) {
    assertTrue(result.isNotOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
    assertEquals(message, result.getStatus().getMessage());
  }
}
