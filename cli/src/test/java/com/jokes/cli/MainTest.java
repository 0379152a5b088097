package com.jokes.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.jokes.HttpTransport;
import com.jokes.JokeClient;
import com.jokes.JokeClientConfig;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {

  private static final String TWO_JOKES =
      "{\"error\":false,\"amount\":2,\"jokes\":["
          + "{\"category\":\"Pun\",\"type\":\"twopart\",\"setup\":\"Setup?\",\"delivery\":\"Delivery.\","
          + "\"id\":1,\"safe\":true,\"lang\":\"en\",\"flags\":{}},"
          + "{\"category\":\"Misc\",\"type\":\"single\",\"joke\":\"One liner.\","
          + "\"id\":2,\"safe\":true,\"lang\":\"en\",\"flags\":{}}]}";

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private final AtomicReference<URI> requested = new AtomicReference<>();
  private final AtomicReference<JokeClientConfig> usedConfig = new AtomicReference<>();

  private String responseBody;

  @BeforeEach
  void setUp() {
    responseBody = TWO_JOKES;
  }

  @Test
  void testPrintsJokesWithSeparator() {
    int exit = run("-amount", "2", "-category", "Pun");

    assertEquals(Main.EXIT_OK, exit);
    assertEquals("Setup?\nDelivery.\n---\nOne liner.\n", stdout());
    assertEquals("https://v2.jokeapi.dev/joke/Pun?amount=2", requested.get().toString());
  }

  @Test
  void testBaseUrlComesFromEnvironment() {
    int exit = run(Map.of("JOKEAPI_BASE_URL", "http://localhost:7000"), "-safe");

    assertEquals(Main.EXIT_OK, exit);
    assertEquals(URI.create("http://localhost:7000"), usedConfig.get().baseUrl());
    assertEquals("http://localhost:7000/joke/Any?amount=1&safe-mode=", requested.get().toString());
  }

  @Test
  void testNonHttpBaseUrlIsUsageError() {
    int exit = run(Map.of("JOKEAPI_BASE_URL", "ftp://example.com"));

    assertEquals(Main.EXIT_USAGE, exit);
    assertNull(usedConfig.get());
    assertTrue(stderr().contains("JOKEAPI_BASE_URL must be an http or https URL"));
  }

  @Test
  void testApiErrorExitsWithFailure() {
    responseBody = "{\"error\":true,\"code\":106,\"message\":\"No matching joke found\","
        + "\"additionalInfo\":\"Try fewer filters\"}";

    int exit = run("-contains", "zzz");

    assertEquals(Main.EXIT_FETCH_FAILED, exit);
    assertEquals("", stdout());
    assertTrue(stderr().startsWith("No matching joke found: Try fewer filters"));
  }

  @Test
  void testBadFlagPrintsUsage() {
    int exit = run("-lang", "xx");

    assertEquals(Main.EXIT_USAGE, exit);
    assertNull(requested.get());
    assertTrue(stderr().contains("invalid lang code: \"xx\""));
    assertTrue(stderr().contains("Usage: jokes [flags]"));
  }

  @Test
  void testHelpPrintsUsageWithoutFetching() {
    assertEquals(Main.EXIT_OK, run("-help"));
    assertTrue(stdout().startsWith("Usage: jokes [flags]"));
    assertNull(requested.get());
  }

  @Test
  void testBadConfigurationIsReported() {
    int exit = run(Map.of("JOKEAPI_REQUEST_TIMEOUT_SECONDS", "never"));

    assertEquals(Main.EXIT_USAGE, exit);
    assertTrue(stderr().contains("JOKEAPI_REQUEST_TIMEOUT_SECONDS is not a number: never"));
  }

  private int run(String... args) {
    return run(Map.of(), args);
  }

  private int run(Map<String, String> env, String... args) {
    HttpTransport transport = uri -> {
      requested.set(uri);
      return new ByteArrayInputStream(responseBody.getBytes(StandardCharsets.UTF_8));
    };
    return Main.run(
        args,
        env,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8),
        config -> {
          usedConfig.set(config);
          return new JokeClient(config, transport);
        });
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
  }
}
