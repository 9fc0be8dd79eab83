package ru.dimension.inject;

/**
 * Thrown when a key has no provider bound in the dependency map being resolved.
 */
public class UnknownDependencyException extends IllegalStateException {
  private final transient DependencyKey key;

  public UnknownDependencyException(DependencyKey key) {
    this(key, "No provider registered for " + key);
  }

  public UnknownDependencyException(DependencyKey key, String message) {
    super(message);
    this.key = key;
  }

  public DependencyKey key() {
    return key;
  }
}
