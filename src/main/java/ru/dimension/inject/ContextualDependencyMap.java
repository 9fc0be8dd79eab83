package ru.dimension.inject;

import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dependency map that keeps an isolated set of bindings per context value, e.g. per locale.
 *
 * A context is initialized on first use with fresh copies of the root bindings, so singleton
 * and thread-local providers construct their values once per context. Root bindings added
 * after a context was created are not visible in it.
 *
 * <pre>
 *   try (DependencyMap.Scope ignored = deps.activate("es")) {
 *     greet();   // resolves against the "es" context
 *   }
 * </pre>
 *
 * The active context is shared by all threads using this map.
 */
public class ContextualDependencyMap extends DependencyMap {

  private static final Logger log = LoggerFactory.getLogger(ContextualDependencyMap.class);

  private final Map<Object, DependencyMap> contexts = new HashMap<>();
  private volatile Object current;
  private volatile DependencyMap active;

  public ContextualDependencyMap() {}

  public ContextualDependencyMap(Map<DependencyKey, ? extends Provider<?>> initial) {
    super(initial);
  }

  /**
   * Switches to {@code context}, creating it if needed; {@code null} switches back to the root.
   *
   * @return the map now receiving registrations and lookups
   */
  public synchronized DependencyMap context(Object context) {
    if (context == null) {
      current = null;
      active = null;
      return this;
    }

    DependencyMap map = contexts.get(context);
    if (map == null) {
      log.debug("Initializing dependency map for context: {}", context);
      Map<DependencyKey, Provider<?>> seeded = new HashMap<>();
      super.registry().forEach((key, provider) -> seeded.put(key, provider.fresh()));
      map = new DependencyMap(seeded);
      contexts.put(context, map);
    }

    log.debug("Switched dependency map context to: {}", context);
    current = context;
    active = map;
    return map;
  }

  /**
   * Switches to {@code context} until the returned scope is closed, then restores whichever
   * context was active before.
   */
  public synchronized Scope activate(Object context) {
    Object previous = current;
    context(context);
    return () -> context(previous);
  }

  /**
   * Drops every context and switches back to the root.
   */
  public synchronized void reset() {
    contexts.clear();
    context(null);
  }

  public Object currentContext() {
    return current;
  }

  @Override
  protected Map<DependencyKey, Provider<?>> registry() {
    DependencyMap map = active;
    return map != null ? map.registry() : super.registry();
  }
}
