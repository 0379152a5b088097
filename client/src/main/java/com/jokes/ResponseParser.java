package com.jokes;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import com.jokes.dto.ErrorResponse;
import com.jokes.dto.Flag;
import com.jokes.dto.Joke;
import com.jokes.dto.JokeList;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Decodes the body of a {@code joke} endpoint response.
 *
 * <p>The service does not tag its payloads, so decoding happens in two stages. The body is
 * first read as a generic object to inspect the required boolean {@code error} field and
 * whether an {@code amount} field is present; then it is decoded into the matching shape:
 *
 * <ul>
 *   <li>{@code error: true}: an {@link ErrorResponse}, returned as an API_ERROR status
 *   <li>{@code amount} present: a {@link JokeList}, returned as its jokes
 *   <li>otherwise: a single {@link Joke}, returned as a one-element list
 * </ul>
 *
 * <p>Flag names outside {@link Flag} are skipped, so the service can add flags without breaking
 * older clients.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class ResponseParser {

  static final String ERROR_FIELD = "error";
  static final String AMOUNT_FIELD = "amount";

  private static final Type FLAGS_TYPE = new TypeToken<Map<Flag, Boolean>>() {}.getType();

  private final Gson gson =
      new GsonBuilder()
          .registerTypeAdapter(
              FLAGS_TYPE, (JsonDeserializer<Map<Flag, Boolean>>) ResponseParser::decodeFlags)
          .create();

  /** Decodes a UTF-8 response body. */
  @Nonnull
  public StatusOr<List<Joke>> parse(byte[] body) {
    return parse(new String(body, StandardCharsets.UTF_8));
  }

  /**
   * Decodes a response body.
   *
   * @param body The JSON text sent by the service
   * @return The jokes, or a DATA_LOSS status for undecodable input, or an API_ERROR status
   *     for an error payload
   */
  @Nonnull
  public StatusOr<List<Joke>> parse(String body) {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseString(body);
      if (!element.isJsonObject()) {
        Logger.warn("Malformed response, expected a JSON object: {}", body);
        return StatusOr.ofStatus(Status.dataLoss("malformed response: expected a JSON object"));
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      Logger.warn("Malformed response: {}", e.getMessage());
      return StatusOr.ofStatus(Status.dataLoss("malformed response: " + e.getMessage(), e));
    }

    if (!root.has(ERROR_FIELD)) {
      Logger.warn("Malformed response, missing \"error\" property: {}", body);
      return StatusOr.ofStatus(Status.dataLoss("response has no \"error\" property"));
    }
    JsonElement error = root.get(ERROR_FIELD);
    if (!error.isJsonPrimitive() || !((JsonPrimitive) error).isBoolean()) {
      Logger.warn("Malformed response, \"error\" is not a boolean: {}", error);
      return StatusOr.ofStatus(
          Status.dataLoss("malformed response: \"error\" is not a boolean: " + error));
    }

    try {
      if (error.getAsBoolean()) {
        ErrorResponse response = gson.fromJson(root, ErrorResponse.class);
        Logger.debug("Service returned error {}: {}", response.code(), response.describe());
        return StatusOr.ofStatus(JokeApiException.toStatus(response));
      }

      if (root.has(AMOUNT_FIELD)) {
        JokeList list = gson.fromJson(root, JokeList.class);
        Logger.debug("Decoded {} jokes", list.jokes().size());
        return StatusOr.ofValue(list.jokes());
      }

      Joke joke = gson.fromJson(root, Joke.class);
      return StatusOr.ofValue(ImmutableList.of(joke));
    } catch (RuntimeException e) {
      // Gson reports a failing record constructor as a plain RuntimeException.
      Logger.warn("Failed to decode response: {}", e.getMessage());
      return StatusOr.ofStatus(Status.dataLoss("malformed response: " + e.getMessage(), e));
    }
  }

  private static Map<Flag, Boolean> decodeFlags(
      JsonElement json, Type type, JsonDeserializationContext context) {
    if (!json.isJsonObject()) {
      throw new JsonParseException("\"flags\" is not an object: " + json);
    }
    Map<Flag, Boolean> flags = new EnumMap<>(Flag.class);
    for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject().entrySet()) {
      StatusOr<Flag> flag = Flag.fromToken(entry.getKey());
      JsonElement value = entry.getValue();
      if (flag.isNotOk() || value.isJsonNull()) {
        continue;
      }
      if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
        throw new JsonParseException("flag \"" + entry.getKey() + "\" is not a boolean: " + value);
      }
      flags.put(flag.getValue(), value.getAsBoolean());
    }
    return flags;
  }
}
