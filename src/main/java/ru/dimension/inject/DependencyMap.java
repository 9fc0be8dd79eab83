package ru.dimension.inject;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of dependency keys to {@link Provider providers}.
 *
 * Keys may be given as {@link DependencyKey} instances, as classes, or as any other
 * identifier (see {@link DependencyKey#of(Object)}). Registering a key that is already
 * bound replaces its provider; a replaced singleton's cached value is discarded with it.
 *
 * <pre>
 *   DependencyMap deps = new DependencyMap();
 *   deps.register(Config.class, new Config("settings.cfg"));
 *   deps.registerSingleton(Redis.class, d -> new Redis(d.resolve(Config.class)));
 *   deps.registerFactory(Key.of("request-id"), () -> UUID.randomUUID());
 * </pre>
 *
 * Registration is expected to happen at configuration time, but the registry is backed by a
 * concurrent map so registration and resolution may safely race.
 */
public class DependencyMap {

  private static final Logger log = LoggerFactory.getLogger(DependencyMap.class);

  private static final ThreadLocal<Deque<Creation>> creationStack = ThreadLocal.withInitial(ArrayDeque::new);

  private final Map<DependencyKey, Provider<?>> providers = new ConcurrentHashMap<>();

  public DependencyMap() {}

  public DependencyMap(Map<DependencyKey, ? extends Provider<?>> initial) {
    providers.putAll(initial);
  }

  /**
   * Builds a map where every entry of {@code values} is bound as an instance.
   */
  public static DependencyMap ofInstances(Map<?, ?> values) {
    Objects.requireNonNull(values, "values");
    DependencyMap map = new DependencyMap();
    for (Map.Entry<?, ?> e : values.entrySet()) {
      map.register(e.getKey(), e.getValue());
    }
    return map;
  }

  public static Builder builder() {
    return new Builder();
  }

  // =========================================================================
  // Registration API
  // =========================================================================

  /**
   * Binds {@code key} to a precomputed value.
   */
  public void register(Object key, Object value) {
    register(key, Provider.instance(value));
  }

  public void register(Object key, Provider<?> provider) {
    DependencyKey k = DependencyKey.of(key);
    Objects.requireNonNull(provider, "provider");
    registry().put(k, provider);
    log.debug("Registered {} with {}", k, provider);
  }

  public void registerFactory(Object key, DependencyFactory<?> constructor) {
    register(key, Provider.factory(constructor));
  }

  public void registerFactory(Object key, Supplier<?> constructor) {
    register(key, Provider.factory(constructor));
  }

  public void registerSingleton(Object key, DependencyFactory<?> constructor) {
    register(key, Provider.singleton(constructor));
  }

  public void registerSingleton(Object key, Supplier<?> constructor) {
    register(key, Provider.singleton(constructor));
  }

  public void registerThreadLocal(Object key, DependencyFactory<?> constructor) {
    register(key, Provider.threadLocal(constructor));
  }

  public void registerThreadLocal(Object key, Supplier<?> constructor) {
    register(key, Provider.threadLocal(constructor));
  }

  /**
   * Removes the binding for {@code key}.
   *
   * @return true if a binding was present
   */
  public boolean remove(Object key) {
    DependencyKey k = DependencyKey.of(key);
    boolean removed = registry().remove(k) != null;
    if (removed) {
      log.debug("Removed {}", k);
    }
    return removed;
  }

  /**
   * Discards every memoized singleton and thread-local value, so the next resolution
   * constructs them again. Mostly useful between unit tests.
   */
  public void resetSingletons() {
    for (Provider<?> provider : registry().values()) {
      provider.reset();
    }
  }

  // =========================================================================
  // Retrieval API
  // =========================================================================

  public Object resolve(Object key) {
    DependencyKey k = DependencyKey.of(key);
    Provider<?> provider = lookup(k);
    if (provider == null) {
      throw new UnknownDependencyException(k);
    }
    return provideWithCycleDetection(k, provider);
  }

  public <T> T resolve(Class<T> type) {
    return type.cast(resolve((Object) type));
  }

  public <T> T resolve(Object key, Class<T> type) {
    return type.cast(resolve(key));
  }

  /**
   * Membership test. Never triggers construction.
   */
  public boolean contains(Object key) {
    return lookup(DependencyKey.of(key)) != null;
  }

  public Set<DependencyKey> keys() {
    return Set.copyOf(registry().keySet());
  }

  private Object provideWithCycleDetection(DependencyKey key, Provider<?> provider) {
    Deque<Creation> stack = creationStack.get();
    Creation creation = new Creation(this, key);
    if (stack.contains(creation)) {
      List<DependencyKey> path = new ArrayList<>();
      stack.descendingIterator().forEachRemaining(c -> path.add(c.key()));
      throw new IllegalStateException("Circular dependency detected: " + path + " -> " + key);
    }
    stack.push(creation);
    try {
      return provider.provide(key, this);
    } finally {
      stack.pop();
    }
  }

  // maps compare by identity, so the same key resolved from another map is not a cycle
  private record Creation(DependencyMap map, DependencyKey key) {}

  // =========================================================================
  // Extension points
  // =========================================================================

  /**
   * Bindings that registration, removal and scopes operate on.
   */
  protected Map<DependencyKey, Provider<?>> registry() {
    return providers;
  }

  /**
   * Provider used to resolve {@code key}, or null when unbound.
   */
  protected Provider<?> lookup(DependencyKey key) {
    return registry().get(key);
  }

  // =========================================================================
  // Scopes
  // =========================================================================

  /**
   * Snapshots the current bindings; closing the returned scope restores them.
   *
   * <pre>
   *   try (DependencyMap.Scope ignored = deps.openScope()) {
   *     deps.register(Clock.class, fixedClock);
   *     ...
   *   }
   * </pre>
   */
  public Scope openScope() {
    Map<DependencyKey, Provider<?>> target = registry();
    Map<DependencyKey, Provider<?>> snapshot = new HashMap<>(target);
    return () -> {
      target.keySet().retainAll(snapshot.keySet());
      target.putAll(snapshot);
      log.debug("Restored {} bindings", snapshot.size());
    };
  }

  /**
   * Restorable change to a dependency map. Closing never throws.
   */
  @FunctionalInterface
  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }

  // =========================================================================
  // Proxies
  // =========================================================================

  /**
   * Returns a proxy for {@code iface} that resolves the current binding of the interface
   * on every method call, so it reflects re-registrations.
   */
  @SuppressWarnings("unchecked")
  public <T> T proxy(Class<T> iface) {
    Objects.requireNonNull(iface, "iface");
    if (!iface.isInterface()) {
      throw new IllegalArgumentException(iface.getName() + " is not an interface");
    }
    TypeKey key = TypeKey.of(iface);
    return (T) Proxy.newProxyInstance(
        iface.getClassLoader(),
        new Class<?>[] { iface },
        (proxy, method, args) -> invokeOnCurrent(key, method, args)
    );
  }

  private Object invokeOnCurrent(TypeKey key, Method method, Object[] args) throws Throwable {
    Object target = resolve(key);
    if (target == null) {
      throw new IllegalStateException("Dependency " + key + " resolved to null");
    }
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      throw e.getCause();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + registry().keySet();
  }

  // =========================================================================
  // Builder
  // =========================================================================

  public static final class Builder {
    private final Map<DependencyKey, Provider<?>> providers = new LinkedHashMap<>();

    private Builder() {}

    public Builder instance(Object key, Object value) {
      return provider(key, Provider.instance(value));
    }

    public Builder factory(Object key, DependencyFactory<?> constructor) {
      return provider(key, Provider.factory(constructor));
    }

    public Builder factory(Object key, Supplier<?> constructor) {
      return provider(key, Provider.factory(constructor));
    }

    public Builder singleton(Object key, DependencyFactory<?> constructor) {
      return provider(key, Provider.singleton(constructor));
    }

    public Builder singleton(Object key, Supplier<?> constructor) {
      return provider(key, Provider.singleton(constructor));
    }

    public Builder threadLocal(Object key, DependencyFactory<?> constructor) {
      return provider(key, Provider.threadLocal(constructor));
    }

    public Builder threadLocal(Object key, Supplier<?> constructor) {
      return provider(key, Provider.threadLocal(constructor));
    }

    public Builder provider(Object key, Provider<?> provider) {
      providers.put(DependencyKey.of(key), Objects.requireNonNull(provider, "provider"));
      return this;
    }

    /**
     * Builds a map from the bindings configured so far. Every map gets its own copies of the
     * providers, so maps built from one builder never share singleton values.
     */
    public DependencyMap build() {
      return new DependencyMap(freshProviders());
    }

    /**
     * Builds a {@link ContextualDependencyMap} whose root bindings are the ones configured so far.
     */
    public ContextualDependencyMap buildContextual() {
      return new ContextualDependencyMap(freshProviders());
    }

    private Map<DependencyKey, Provider<?>> freshProviders() {
      Map<DependencyKey, Provider<?>> copy = new LinkedHashMap<>();
      providers.forEach((key, provider) -> copy.put(key, provider.fresh()));
      return copy;
    }
  }
}
