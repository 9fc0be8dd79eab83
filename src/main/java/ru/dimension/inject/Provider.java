package ru.dimension.inject;

import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recipe for producing the value of a dependency.
 *
 * <ul>
 *   <li>{@link Instance} - a precomputed value, returned unchanged</li>
 *   <li>{@link Factory} - constructor invoked on every resolution</li>
 *   <li>{@link SingletonFactory} - constructor invoked at most once, result memoized</li>
 *   <li>{@link ThreadFactory} - constructor invoked at most once per thread</li>
 * </ul>
 */
public abstract sealed class Provider<T>
    permits Provider.Instance, Provider.Factory, Provider.SingletonFactory, Provider.ThreadFactory {

  private static final Logger log = LoggerFactory.getLogger(Provider.class);

  private Provider() {}

  public static <T> Provider<T> instance(T value) {
    return new Instance<>(value);
  }

  public static <T> Provider<T> factory(DependencyFactory<? extends T> constructor) {
    return new Factory<>(constructor);
  }

  public static <T> Provider<T> factory(Supplier<? extends T> constructor) {
    Objects.requireNonNull(constructor, "constructor");
    return new Factory<>(deps -> constructor.get());
  }

  public static <T> Provider<T> singleton(DependencyFactory<? extends T> constructor) {
    return new SingletonFactory<>(constructor);
  }

  public static <T> Provider<T> singleton(Supplier<? extends T> constructor) {
    Objects.requireNonNull(constructor, "constructor");
    return new SingletonFactory<>(deps -> constructor.get());
  }

  public static <T> Provider<T> threadLocal(DependencyFactory<? extends T> constructor) {
    return new ThreadFactory<>(constructor);
  }

  public static <T> Provider<T> threadLocal(Supplier<? extends T> constructor) {
    Objects.requireNonNull(constructor, "constructor");
    return new ThreadFactory<>(deps -> constructor.get());
  }

  /**
   * Produces the value bound under {@code key}, using {@code dependencies} as the registry
   * handed to constructor functions.
   */
  abstract T provide(DependencyKey key, DependencyMap dependencies);

  /**
   * Equivalent provider with empty caches.
   */
  abstract Provider<T> fresh();

  /**
   * Discards any memoized value. No-op for providers without a cache.
   */
  void reset() {}

  private static <T> T construct(DependencyFactory<? extends T> constructor,
                                 DependencyKey key,
                                 DependencyMap dependencies) {
    try {
      return constructor.create(dependencies);
    } catch (RuntimeException | Error e) {
      // constructor failures usually show up at development time, make them loud
      log.error("Unexpected problem when creating an instance for {}", key, e);
      throw e;
    }
  }

  // =========================================================================
  // Variants
  // =========================================================================

  public static final class Instance<T> extends Provider<T> {
    private final T value;

    private Instance(T value) {
      this.value = value;
    }

    public T value() {
      return value;
    }

    @Override
    T provide(DependencyKey key, DependencyMap dependencies) {
      return value;
    }

    @Override
    Provider<T> fresh() {
      return this;
    }

    @Override
    public String toString() {
      return "Instance{" + value + "}";
    }
  }

  public static final class Factory<T> extends Provider<T> {
    private final DependencyFactory<? extends T> constructor;

    private Factory(DependencyFactory<? extends T> constructor) {
      this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    @Override
    T provide(DependencyKey key, DependencyMap dependencies) {
      log.debug("Running factory for dependency {}", key);
      return construct(constructor, key, dependencies);
    }

    @Override
    Provider<T> fresh() {
      return new Factory<>(constructor);
    }

    @Override
    public String toString() {
      return "Factory";
    }
  }

  public static final class SingletonFactory<T> extends Provider<T> {
    private final DependencyFactory<? extends T> constructor;
    private volatile boolean constructed;
    private T instance;

    private SingletonFactory(DependencyFactory<? extends T> constructor) {
      this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    public boolean isConstructed() {
      return constructed;
    }

    @Override
    T provide(DependencyKey key, DependencyMap dependencies) {
      if (!constructed) {
        synchronized (this) {
          if (!constructed) {
            log.debug("Running singleton factory for dependency {}", key);
            instance = construct(constructor, key, dependencies);
            // the write to the volatile flag publishes instance
            constructed = true;
          }
        }
      }
      return instance;
    }

    @Override
    Provider<T> fresh() {
      return new SingletonFactory<>(constructor);
    }

    @Override
    synchronized void reset() {
      constructed = false;
      instance = null;
    }

    @Override
    public String toString() {
      return "SingletonFactory{constructed=" + constructed + "}";
    }
  }

  public static final class ThreadFactory<T> extends Provider<T> {
    private final DependencyFactory<? extends T> constructor;
    private volatile ThreadLocal<Cell<T>> cells = new ThreadLocal<>();

    private ThreadFactory(DependencyFactory<? extends T> constructor) {
      this.constructor = Objects.requireNonNull(constructor, "constructor");
    }

    @Override
    T provide(DependencyKey key, DependencyMap dependencies) {
      ThreadLocal<Cell<T>> local = cells;
      Cell<T> cell = local.get();
      if (cell == null) {
        log.debug("Running thread factory for dependency {} in thread {}", key, Thread.currentThread().getName());
        cell = new Cell<>(construct(constructor, key, dependencies));
        local.set(cell);
      }
      return cell.value();
    }

    @Override
    Provider<T> fresh() {
      return new ThreadFactory<>(constructor);
    }

    @Override
    void reset() {
      cells = new ThreadLocal<>();
    }

    @Override
    public String toString() {
      return "ThreadFactory";
    }

    private record Cell<T>(T value) {}
  }
}
