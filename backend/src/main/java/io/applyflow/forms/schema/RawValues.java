package io.applyflow.forms.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lenient readers over untyped JSON values ({@code Map}, {@code List}, {@code String}, {@code
 * Number}, {@code Boolean}, null) as produced by Jackson. Every reader is total: input of the
 * wrong shape yields null or an empty value instead of an exception.
 */
public final class RawValues {

  private RawValues() {}

  /** Returns the value as a string-keyed map, or an empty map when it is not a JSON object. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value) {
    return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
  }

  public static boolean isObject(Object value) {
    return value instanceof Map<?, ?>;
  }

  /** Returns the value as a list, or null when it is not a JSON array. */
  public static List<?> asList(Object value) {
    return value instanceof List<?> list ? list : null;
  }

  /** Returns the first value that is not null. */
  public static Object firstPresent(Object... candidates) {
    for (Object candidate : candidates) {
      if (candidate != null) {
        return candidate;
      }
    }
    return null;
  }

  /** Returns the value when it is a string, otherwise null. */
  public static String string(Object value) {
    return value instanceof String str ? str : null;
  }

  /** Returns the value when it is a non-empty string, otherwise null. */
  public static String nonEmptyString(Object value) {
    return value instanceof String str && !str.isEmpty() ? str : null;
  }

  /** Stringifies scalars; numbers are written without a trailing ".0". */
  public static String text(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof String str) {
      return str;
    }
    if (value instanceof Number number) {
      var decimal = decimal(number);
      return decimal != null ? decimal.toPlainString() : number.toString();
    }
    if (value instanceof Collection<?> items) {
      return items.stream()
          .map(item -> Objects.toString(text(item), ""))
          .collect(Collectors.joining(","));
    }
    return value.toString();
  }

  /** Returns the first string among the candidates, or {@code fallback}. */
  public static String stringOr(String fallback, Object... candidates) {
    for (Object candidate : candidates) {
      if (candidate instanceof String str) {
        return str;
      }
    }
    return fallback;
  }

  /**
   * Coerces numbers and numeric strings to a {@link BigDecimal} without trailing zeros and with a
   * scale of at least zero, so {@code "2.50"}, {@code 2.5d} and {@code 1e2} read as {@code 2.5},
   * {@code 2.5} and {@code 100}. NaN, infinities, blank and unparseable strings give null.
   */
  public static BigDecimal decimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return normalize(decimal);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? normalize(BigDecimal.valueOf(d)) : null;
    }
    if (value instanceof Number number) {
      return parseDecimal(number.toString());
    }
    if (value instanceof String str && !str.isBlank()) {
      return parseDecimal(str.trim());
    }
    return null;
  }

  /** Returns the first candidate that coerces to a number. */
  public static BigDecimal firstDecimal(Object... candidates) {
    for (Object candidate : candidates) {
      var decimal = decimal(candidate);
      if (decimal != null) {
        return decimal;
      }
    }
    return null;
  }

  /**
   * Keeps the trimmed, non-blank string entries of a list. Returns null when the value is not a
   * list or nothing survives.
   */
  public static List<String> stringList(Object value) {
    var list = asList(value);
    if (list == null) {
      return null;
    }
    var items = new ArrayList<String>();
    for (Object entry : list) {
      if (entry instanceof String str && !str.isBlank()) {
        items.add(str.trim());
      }
    }
    return items.isEmpty() ? null : List.copyOf(items);
  }

  /** Returns the first candidate that yields a non-empty string list. */
  public static List<String> firstStringList(Object... candidates) {
    for (Object candidate : candidates) {
      var list = stringList(candidate);
      if (list != null) {
        return list;
      }
    }
    return null;
  }

  /**
   * Concatenates the lists, trims entries, drops blanks and duplicates (case-sensitive) keeping
   * the first occurrence. Returns an empty list when nothing survives.
   */
  @SafeVarargs
  public static List<String> mergeDistinct(List<String>... lists) {
    var merged = new LinkedHashSet<String>();
    for (List<String> list : lists) {
      if (list == null) {
        continue;
      }
      for (String entry : list) {
        if (entry != null && !entry.isBlank()) {
          merged.add(entry.trim());
        }
      }
    }
    return List.copyOf(merged);
  }

  /**
   * Reads a flag: booleans as-is, "true"/"false" in any casing, non-zero numbers as true.
   * Everything else is false.
   */
  public static boolean flag(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return "true".equals(str.trim().toLowerCase(Locale.ROOT));
    }
    if (value instanceof Number) {
      var decimal = decimal(value);
      return decimal != null && decimal.signum() != 0;
    }
    return false;
  }

  private static BigDecimal parseDecimal(String str) {
    try {
      return normalize(new BigDecimal(str));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static BigDecimal normalize(BigDecimal decimal) {
    var stripped = decimal.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
  }
}
