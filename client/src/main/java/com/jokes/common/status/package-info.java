/**
 * Contains classes for error handling and status reporting.
 *
 * <p>Every failure a joke request can run into is returned as a value rather than thrown:
 *
 * <ul>
 *   <li>{@link com.jokes.common.status.StatusCode} - Enum of possible outcomes
 *   <li>{@link com.jokes.common.status.Status} - An outcome with an optional message and cause
 *   <li>{@link com.jokes.common.status.StatusOr} - Holds either a successful value or an error
 *       status
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * JokeRequest request = new JokeRequest();
 * Status status = request.addCategory(userInput);
 * if (status.isError()) {
 *     System.err.println(status.getMessage()); // invalid category: "..."
 *     return;
 * }
 *
 * StatusOr&lt;List&lt;Joke&gt;&gt; result = request.get();
 * if (result.isOk()) {
 *     result.getValue().forEach(joke -&gt; System.out.println(joke.displayText()));
 * } else if (result.getStatus().getCode() == StatusCode.API_ERROR) {
 *     ErrorResponse error = JokeApiException.errorResponseOf(result.getStatus()).orElseThrow();
 *     // Inspect error.code(), error.causedBy(), ...
 * }
 * </pre>
 */
package com.jokes.common.status;
