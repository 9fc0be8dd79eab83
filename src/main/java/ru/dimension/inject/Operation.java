package ru.dimension.inject;

/**
 * A callable unit with a declared {@link Signature}.
 *
 * Callers pass positional and keyword arguments through {@link CallArgs}; the operation binds
 * them to its signature before running. An operation returned by {@link Injector#wrap(Operation)}
 * is called exactly the same way.
 *
 * <pre>
 *   Operation&lt;String&gt; hasher = Operation.of("hasher",
 *       Signature.builder().param("subject").param("hash", HASH).build(),
 *       args -> args.get("hash", HashFunction.class).apply(args.get("subject", String.class)));
 * </pre>
 */
public interface Operation<R> {

  String name();

  Signature signature();

  /**
   * Runs the operation. Whatever the body throws propagates unchanged.
   */
  R call(CallArgs args) throws Exception;

  default R call(Object... positional) throws Exception {
    return call(CallArgs.of(positional));
  }

  static <R> Operation<R> of(String name, Signature signature, Invocation<R> body) {
    return new PlainOperation<>(name, signature, body);
  }
}
