package ru.dimension.inject;

import java.util.Objects;

/**
 * Dependency key for a class or interface. Matching is exact; no inheritance is taken into account.
 */
public record TypeKey(Class<?> type) implements DependencyKey {

  public TypeKey {
    Objects.requireNonNull(type, "type");
  }

  public static TypeKey of(Class<?> type) {
    return new TypeKey(type);
  }

  @Override
  public String toString() {
    return "TypeKey{" + type.getName() + "}";
  }
}
