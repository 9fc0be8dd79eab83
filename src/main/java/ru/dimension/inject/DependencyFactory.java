package ru.dimension.inject;

/**
 * Constructor function of a factory-backed provider. Receives the map that is resolving,
 * so a factory can look up its own dependencies.
 */
@FunctionalInterface
public interface DependencyFactory<T> {
  T create(DependencyMap dependencies);
}
