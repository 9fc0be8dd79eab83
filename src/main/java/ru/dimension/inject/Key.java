package ru.dimension.inject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named dependency key, for dependencies that are not naturally a type.
 *
 * <pre>
 *   static final Key HASH = Key.of("hash");
 *   static final Key FOO_MAP = Key.of(Map.class, "foo");
 * </pre>
 *
 * A key given a parameter as its declared default always denotes a dependency,
 * never a literal value.
 *
 * Labels must be immutable values with {@code equals}/{@code hashCode}; arrays are rejected.
 */
public final class Key implements DependencyKey {
  private final Object label;

  private Key(Object label) {
    this.label = label;
  }

  public static Key of(Object label) {
    return new Key(checkLabel(label, "label"));
  }

  /**
   * Composite key; equal to any other key built from equal parts in the same order.
   */
  public static Key of(Object first, Object... more) {
    checkLabel(first, "first");
    if (more == null || more.length == 0) {
      return new Key(first);
    }
    List<Object> parts = new ArrayList<>(more.length + 1);
    parts.add(first);
    for (Object part : more) {
      parts.add(checkLabel(part, "label part"));
    }
    return new Key(Collections.unmodifiableList(parts));
  }

  private static Object checkLabel(Object label, String what) {
    Objects.requireNonNull(label, what);
    if (label.getClass().isArray()) {
      throw new IllegalArgumentException("Array " + what + " compares by identity: " + label);
    }
    return label;
  }

  public Object label() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Key k)) return false;
    return label.equals(k.label);
  }

  @Override
  public int hashCode() {
    return label.hashCode();
  }

  @Override
  public String toString() {
    return "Key{" + label + "}";
  }
}
