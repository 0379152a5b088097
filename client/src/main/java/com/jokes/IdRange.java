package com.jokes;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.jokes.common.status.Status;
import com.jokes.common.status.StatusOr;
import java.util.List;

/**
 * An inclusive range of joke IDs. An upper bound of 0 means the range selects the single ID
 * {@code lower}.
 *
 * @param lower The first ID in the range
 * @param upper The last ID in the range, or 0 for a single ID
 * @see <a href="https://jokeapi.dev/#idrange-param">ID range</a>
 */
public record IdRange(int lower, int upper) {
  public IdRange {
    checkArgument(lower >= 0, "lower bound must not be negative: %s", lower);
    checkArgument(upper >= 0, "upper bound must not be negative: %s", upper);
  }

  /** Returns a range selecting exactly one joke. */
  public static IdRange single(int id) {
    return new IdRange(id, 0);
  }

  /**
   * Parses the {@code number[-number]} form produced by {@link #toQueryValue()}.
   *
   * @param value The raw value, e.g. {@code "5"} or {@code "2-32"}
   * @return The parsed range, or an INVALID_ARGUMENT status
   */
  public static StatusOr<IdRange> parse(String value) {
    if (value == null || value.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument("invalid id range: \"\""));
    }
    List<String> bounds = Splitter.on('-').splitToList(value);
    if (bounds.size() > 2) {
      return StatusOr.ofStatus(invalid(value));
    }
    try {
      int lower = Integer.parseInt(bounds.get(0));
      int upper = bounds.size() == 2 ? Integer.parseInt(bounds.get(1)) : 0;
      if (lower < 0 || upper < 0) {
        return StatusOr.ofStatus(invalid(value));
      }
      return StatusOr.ofValue(new IdRange(lower, upper));
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(invalid(value));
    }
  }

  /** Renders the range as {@code lower} or {@code lower-upper}. */
  public String toQueryValue() {
    if (upper > 0) {
      return lower + "-" + upper;
    }
    return Integer.toString(lower);
  }

  private static Status invalid(String value) {
    return Status.invalidArgument("invalid id range: \"" + value + "\"");
  }
}
