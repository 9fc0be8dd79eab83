package ru.dimension.inject;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments exactly as a caller passes them: positional values plus keyword values.
 * Immutable; {@link #with(String, Object)} returns a copy. Null values are allowed.
 *
 * <pre>
 *   hasher.call(CallArgs.of("x").with("hash", customHash));
 * </pre>
 */
public final class CallArgs {
  private static final CallArgs EMPTY = new CallArgs(List.of(), Map.of());

  private final List<Object> positional;
  private final Map<String, Object> keywords;

  private CallArgs(List<Object> positional, Map<String, Object> keywords) {
    this.positional = positional;
    this.keywords = keywords;
  }

  public static CallArgs empty() {
    return EMPTY;
  }

  public static CallArgs of(Object... positional) {
    if (positional == null || positional.length == 0) {
      return EMPTY;
    }
    return new CallArgs(Collections.unmodifiableList(Arrays.asList(positional.clone())), Map.of());
  }

  public static CallArgs keyword(String name, Object value) {
    return EMPTY.with(name, value);
  }

  public CallArgs with(String name, Object value) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> copy = new LinkedHashMap<>(keywords);
    copy.put(name, value);
    return new CallArgs(positional, Collections.unmodifiableMap(copy));
  }

  /**
   * Copy with all {@code extra} keywords added; existing keywords with the same name are replaced.
   */
  public CallArgs withAll(Map<String, ?> extra) {
    if (extra.isEmpty()) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(keywords);
    copy.putAll(extra);
    return new CallArgs(positional, Collections.unmodifiableMap(copy));
  }

  public List<Object> positional() {
    return positional;
  }

  public Map<String, Object> keywords() {
    return keywords;
  }

  public boolean hasKeyword(String name) {
    return keywords.containsKey(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CallArgs c)) return false;
    return positional.equals(c.positional) && keywords.equals(c.keywords);
  }

  @Override
  public int hashCode() {
    return Objects.hash(positional, keywords);
  }

  @Override
  public String toString() {
    return "CallArgs{positional=" + positional + ", keywords=" + keywords + "}";
  }
}
