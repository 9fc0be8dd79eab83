package ru.dimension.inject;

/**
 * Body of an {@link Operation}, receiving its already bound arguments.
 */
@FunctionalInterface
public interface Invocation<R> {
  R invoke(Arguments args) throws Exception;
}
