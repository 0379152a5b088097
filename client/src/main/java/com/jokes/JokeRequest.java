package com.jokes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import com.jokes.dto.Category;
import com.jokes.dto.Flag;
import com.jokes.dto.Joke;
import com.jokes.dto.JokeType;
import com.jokes.dto.Language;
import com.jokes.util.QueryStrings;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Filter criteria for a request to the {@code joke} endpoint.
 *
 * <p>Fields can be set in two ways. The {@code with*} methods take typed values and are meant
 * for code. The validated setters ({@link #addBlacklistFlag}, {@link #addCategory},
 * {@link #setLanguage}, {@link #setType}, {@link #setAmount}) take raw strings, check them
 * against the fixed vocabulary and report a bad value as an INVALID_ARGUMENT {@link Status},
 * leaving the request unchanged. That makes them usable directly as command line callbacks.
 *
 * <p>A request is a plain mutable value. Build a fresh one per query and do not share it
 * between threads while it is being modified.
 *
 * <pre>
 * JokeRequest request = new JokeRequest()
 *     .withCategory(Category.PROGRAMMING)
 *     .withBlacklist(Flag.NSFW)
 *     .withAmount(3);
 * StatusOr&lt;List&lt;Joke&gt;&gt; jokes = request.get();
 * </pre>
 */
public final class JokeRequest {

  public static final String KEY_AMOUNT = "amount";
  public static final String KEY_BLACKLIST = "blacklistFlags";
  public static final String KEY_CONTAINS = "contains";
  public static final String KEY_ID_RANGE = "idRange";
  public static final String KEY_LANG = "lang";
  public static final String KEY_SAFE = "safe-mode";
  public static final String KEY_TYPE = "type";

  private static final Joiner COMMA = Joiner.on(',');

  private OptionalInt amount = OptionalInt.empty();
  private final List<Flag> blacklist = new ArrayList<>();
  private final List<Category> categories = new ArrayList<>();
  private String contains = "";
  private IdRange idRange;
  private Language language;
  private boolean safeMode;
  private JokeType type;

  /** Creates a request with no criteria set: one joke from any category. */
  public JokeRequest() {}

  /**
   * Rebuilds a request from an encoded query string, validating every value.
   *
   * <p>Categories are part of the URL path rather than the query, so the result never has any.
   *
   * @param rawQuery The query string, with or without a leading {@code ?}
   * @return The request, or an INVALID_ARGUMENT status for an unknown parameter or bad value
   */
  public static StatusOr<JokeRequest> fromQuery(String rawQuery) {
    return QueryStrings.decode(rawQuery).flatMap(JokeRequest::fromParameters);
  }

  private static StatusOr<JokeRequest> fromParameters(Map<String, String> params) {
    JokeRequest request = new JokeRequest();
    for (Map.Entry<String, String> param : params.entrySet()) {
      String value = param.getValue();
      Status status =
          switch (param.getKey()) {
            case KEY_AMOUNT -> request.setAmount(value);
            case KEY_BLACKLIST -> addEach(value, request::addBlacklistFlag);
            case KEY_CONTAINS -> {
              request.withContains(value);
              yield Status.ok();
            }
            case KEY_ID_RANGE -> IdRange.parse(value).map(request::withIdRange).getStatus();
            case KEY_LANG -> request.setLanguage(value);
            case KEY_SAFE -> {
              request.withSafeMode(true);
              yield Status.ok();
            }
            case KEY_TYPE -> request.setType(value);
            default -> Status.invalidArgument("unknown query parameter: \"" + param.getKey() + "\"");
          };
      if (status.isError()) {
        return StatusOr.ofStatus(status);
      }
    }
    return StatusOr.ofValue(request);
  }

  private static Status addEach(String commaSeparated, Function<String, Status> adder) {
    for (String token : Splitter.on(',').split(commaSeparated)) {
      Status status = adder.apply(token);
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }

  /* ---------------------- Typed setters ---------------------- */

  /**
   * Sets how many jokes to fetch. 0 clears the amount, letting the service return one joke.
   *
   * @throws IllegalArgumentException if amount is negative
   */
  public JokeRequest withAmount(int amount) {
    checkArgument(amount >= 0, "amount must not be negative: %s", amount);
    this.amount = amount == 0 ? OptionalInt.empty() : OptionalInt.of(amount);
    return this;
  }

  /** Appends a blacklist flag. */
  public JokeRequest withBlacklist(Flag flag) {
    blacklist.add(checkNotNull(flag, "flag"));
    return this;
  }

  /** Appends a category. */
  public JokeRequest withCategory(Category category) {
    categories.add(checkNotNull(category, "category"));
    return this;
  }

  /** Restricts results to jokes containing the given text. An empty string clears it. */
  public JokeRequest withContains(String contains) {
    this.contains = Strings.nullToEmpty(contains);
    return this;
  }

  /** Restricts results to the given IDs, or clears the restriction when null. */
  public JokeRequest withIdRange(IdRange idRange) {
    this.idRange = idRange;
    return this;
  }

  /** Sets the language, or clears it when null. */
  public JokeRequest withLanguage(Language language) {
    this.language = language;
    return this;
  }

  public JokeRequest withSafeMode(boolean safeMode) {
    this.safeMode = safeMode;
    return this;
  }

  /** Sets the joke type, or clears it when null. */
  public JokeRequest withType(JokeType type) {
    this.type = type;
    return this;
  }

  /* ---------------------- Validated setters ---------------------- */

  /** Parses and sets the amount. Fails for anything but a non-negative integer. */
  public Status setAmount(String rawAmount) {
    int parsed;
    try {
      parsed = Integer.parseInt(Strings.nullToEmpty(rawAmount).trim());
    } catch (NumberFormatException e) {
      return Status.invalidArgument("invalid amount: \"" + rawAmount + "\"");
    }
    if (parsed < 0) {
      return Status.invalidArgument("invalid amount: \"" + rawAmount + "\"");
    }
    withAmount(parsed);
    return Status.ok();
  }

  /** Validates and appends a blacklist flag, e.g. {@code "nsfw"}. */
  public Status addBlacklistFlag(String rawFlag) {
    return Flag.fromToken(rawFlag).map(this::withBlacklist).getStatus();
  }

  /** Validates and appends a category, e.g. {@code "Programming"}. */
  public Status addCategory(String rawCategory) {
    return Category.fromToken(rawCategory).map(this::withCategory).getStatus();
  }

  /** Validates and sets the two-letter language code, e.g. {@code "de"}. */
  public Status setLanguage(String rawLanguage) {
    return Language.fromToken(rawLanguage).map(this::withLanguage).getStatus();
  }

  /** Validates and sets the joke type, {@code "single"} or {@code "twopart"}. */
  public Status setType(String rawType) {
    return JokeType.fromToken(rawType).map(this::withType).getStatus();
  }

  /* ---------------------- Getters ---------------------- */

  public OptionalInt getAmount() {
    return amount;
  }

  public ImmutableList<Flag> getBlacklist() {
    return ImmutableList.copyOf(blacklist);
  }

  public ImmutableList<Category> getCategories() {
    return ImmutableList.copyOf(categories);
  }

  public String getContains() {
    return contains;
  }

  public Optional<IdRange> getIdRange() {
    return Optional.ofNullable(idRange);
  }

  public Optional<Language> getLanguage() {
    return Optional.ofNullable(language);
  }

  public boolean isSafeMode() {
    return safeMode;
  }

  public Optional<JokeType> getType() {
    return Optional.ofNullable(type);
  }

  /* ---------------------- Rendering ---------------------- */

  /**
   * Returns the query parameters for the criteria that are set, in a fixed order. Safe mode is
   * a bare switch and maps to an empty value.
   */
  @Nonnull
  public ImmutableMap<String, String> query() {
    ImmutableMap.Builder<String, String> params = ImmutableMap.builder();
    amount.ifPresent(n -> params.put(KEY_AMOUNT, Integer.toString(n)));
    if (!blacklist.isEmpty()) {
      params.put(KEY_BLACKLIST, COMMA.join(blacklist.stream().map(Flag::token).iterator()));
    }
    if (!contains.isEmpty()) {
      params.put(KEY_CONTAINS, contains);
    }
    if (idRange != null) {
      params.put(KEY_ID_RANGE, idRange.toQueryValue());
    }
    if (language != null) {
      params.put(KEY_LANG, language.token());
    }
    if (safeMode) {
      params.put(KEY_SAFE, "");
    }
    if (type != null) {
      params.put(KEY_TYPE, type.token());
    }
    return params.build();
  }

  /** Returns the comma-joined category path segment, {@code Any} when no category is set. */
  public String categoryPath() {
    if (categories.isEmpty()) {
      return Category.ANY.token();
    }
    return COMMA.join(categories.stream().map(Category::token).iterator());
  }

  /** Returns the full request URL against the public service. */
  @Nonnull
  public URI url() {
    return url(JokeClientConfig.DEFAULT_BASE_URL);
  }

  /**
   * Returns the full request URL against the given base, e.g.
   * {@code https://v2.jokeapi.dev/joke/Dark,Pun?amount=2}.
   */
  @Nonnull
  public URI url(URI baseUrl) {
    String base = baseUrl.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    StringBuilder url = new StringBuilder(base).append("/joke/").append(categoryPath());
    String encodedQuery = QueryStrings.encode(query());
    if (!encodedQuery.isEmpty()) {
      url.append('?').append(encodedQuery);
    }
    return URI.create(url.toString());
  }

  /* ---------------------- Fetching ---------------------- */

  /** Fetches the matching jokes from the public service with the default transport. */
  @Nonnull
  public StatusOr<List<Joke>> get() {
    return JokeClient.defaultClient().fetch(this);
  }

  /**
   * Fetches the matching jokes from the public service through the given transport, or the
   * default one when {@code transport} is null.
   */
  @Nonnull
  public StatusOr<List<Joke>> get(HttpTransport transport) {
    if (transport == null) {
      return get();
    }
    return new JokeClient(JokeClientConfig.defaults(), transport).fetch(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("categories", categories)
        .add("query", query())
        .toString();
  }
}
