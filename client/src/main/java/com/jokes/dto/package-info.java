/**
 * Data types exchanged with the JokeAPI service.
 *
 * <p>The enums in this package are closed vocabularies. Each one exposes the exact token the
 * service uses through {@code token()}, and a {@code fromToken(String)} factory that returns a
 * {@link com.jokes.common.status.StatusOr} instead of throwing on unknown input. Tokens are
 * case-sensitive: languages, flags and types are lower case, categories are capitalized.
 *
 * <p>The records are decode targets for Gson. JSON keys that differ from the Java component
 * names are mapped with {@link com.google.gson.annotations.SerializedName}.
 */
package com.jokes.dto;
