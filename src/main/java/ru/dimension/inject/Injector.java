package ru.dimension.inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps operations so they supply their own dependencies from a bound {@link DependencyMap}.
 *
 * <pre>
 *   Injector inject = Injector.bind(deps);
 *   Operation&lt;String&gt; hasher = inject.wrap(rawHasher);
 *
 *   hasher.call("foobarbaz");                                  // hash resolved from deps
 *   hasher.call(CallArgs.of("x").with("hash", customHash));    // explicit value wins
 * </pre>
 *
 * A parameter is an injection point when its declared default is a {@link Key} or a
 * {@link TypeKey}, or a class bound in the map at wrap time. Other parameters are bound the
 * ordinary way. The injector itself is immutable; to substitute dependencies in tests,
 * bind another injector to a {@link PatchedDependencyMap}.
 */
public final class Injector {

  private static final Logger log = LoggerFactory.getLogger(Injector.class);

  private final DependencyMap dependencies;
  private final boolean warnWhenUnneeded;

  private Injector(DependencyMap dependencies, boolean warnWhenUnneeded) {
    this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
    this.warnWhenUnneeded = warnWhenUnneeded;
  }

  public static Injector bind(DependencyMap dependencies) {
    return builder(dependencies).build();
  }

  /**
   * Binds to a map of instances built from a literal key to value mapping.
   */
  public static Injector bind(Map<?, ?> instances) {
    return bind(DependencyMap.ofInstances(instances));
  }

  public static Builder builder(DependencyMap dependencies) {
    return new Builder(dependencies);
  }

  public DependencyMap dependencies() {
    return dependencies;
  }

  /**
   * Returns an operation with the same name and signature that resolves every injection point
   * the caller leaves out. If {@code operation} has no injection point it is returned as is.
   */
  public <R> Operation<R> wrap(Operation<R> operation) {
    Objects.requireNonNull(operation, "operation");
    List<InjectedOperation.InjectionPoint> points = injectionPoints(operation.signature());

    if (points.isEmpty()) {
      if (warnWhenUnneeded) {
        log.warn("{}: No injectable params found. You can safely skip the injector.", operation.name());
      } else {
        log.debug("{}: No injectable params found", operation.name());
      }
      return operation;
    }

    InjectedOperation<R> wrapped = new InjectedOperation<>(operation, dependencies, points);
    log.debug("{}: Wrapped with injection points {}", operation.name(), wrapped.injectionPoints());
    return wrapped;
  }

  public <R> Operation<R> wrap(String name, Signature signature, Invocation<R> body) {
    return wrap(Operation.of(name, signature, body));
  }

  private List<InjectedOperation.InjectionPoint> injectionPoints(Signature signature) {
    List<InjectedOperation.InjectionPoint> points = new ArrayList<>();
    List<Signature.Parameter> params = signature.parameters();

    for (int i = 0; i < params.size(); i++) {
      Signature.Parameter p = params.get(i);
      if (!p.hasDefault()) continue;

      DependencyKey key = injectionKey(p.defaultValue());
      if (key != null) {
        points.add(new InjectedOperation.InjectionPoint(p.name(), i, key));
      }
    }
    return points;
  }

  private DependencyKey injectionKey(Object defaultValue) {
    // explicit keys always denote a dependency, even one not registered yet
    if (defaultValue instanceof DependencyKey key) {
      return key;
    }
    if (defaultValue instanceof Class<?> type) {
      TypeKey key = TypeKey.of(type);
      return dependencies.contains(key) ? key : null;
    }
    return null;
  }

  @Override
  public String toString() {
    return "Injector{" + dependencies + "}";
  }

  public static final class Builder {
    private final DependencyMap dependencies;
    private boolean warnWhenUnneeded = true;

    private Builder(DependencyMap dependencies) {
      this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
    }

    /**
     * Whether wrapping an operation without injection points logs a warning (default) or
     * only a debug message.
     */
    public Builder warnWhenUnneeded(boolean enabled) {
      this.warnWhenUnneeded = enabled;
      return this;
    }

    public Injector build() {
      return new Injector(dependencies, warnWhenUnneeded);
    }
  }
}
