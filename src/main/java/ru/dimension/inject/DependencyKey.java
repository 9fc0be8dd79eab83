package ru.dimension.inject;

import java.util.Objects;

/**
 * Identifier used to index a {@link DependencyMap}.
 *
 * Either a {@link Key} (a named capability such as "hash") or a {@link TypeKey}
 * (a class or interface). Both share a plain value-equality contract.
 */
public sealed interface DependencyKey permits Key, TypeKey {

  /**
   * Normalizes any identifier into a key:
   * keys are returned as is, classes become {@link TypeKey}, anything else becomes a {@link Key}.
   */
  static DependencyKey of(Object identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (identifier instanceof DependencyKey key) return key;
    if (identifier instanceof Class<?> type) return TypeKey.of(type);
    return Key.of(identifier);
  }
}
