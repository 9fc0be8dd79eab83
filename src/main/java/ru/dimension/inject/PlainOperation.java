package ru.dimension.inject;

import java.util.Objects;

final class PlainOperation<R> implements Operation<R> {
  private final String name;
  private final Signature signature;
  private final Invocation<R> body;

  PlainOperation(String name, Signature signature, Invocation<R> body) {
    this.name = Objects.requireNonNull(name, "name");
    this.signature = Objects.requireNonNull(signature, "signature");
    this.body = Objects.requireNonNull(body, "body");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Signature signature() {
    return signature;
  }

  @Override
  public R call(CallArgs args) throws Exception {
    return body.invoke(signature.bind(args));
  }

  @Override
  public String toString() {
    return name + signature;
  }
}
