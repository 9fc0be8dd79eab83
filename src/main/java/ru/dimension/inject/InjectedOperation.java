package ru.dimension.inject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operation that resolves its unfilled injection points before delegating to the original.
 *
 * The injection points are fixed when the operation is wrapped. Values are resolved on every
 * call, so re-registering a key is visible to the next call.
 */
public final class InjectedOperation<R> implements Operation<R> {

  private static final Logger log = LoggerFactory.getLogger(InjectedOperation.class);

  record InjectionPoint(String name, int index, DependencyKey key) {}

  private final Operation<R> original;
  private final DependencyMap dependencies;
  private final List<InjectionPoint> injectionPoints;

  InjectedOperation(Operation<R> original, DependencyMap dependencies, List<InjectionPoint> injectionPoints) {
    this.original = original;
    this.dependencies = dependencies;
    this.injectionPoints = List.copyOf(injectionPoints);
  }

  @Override
  public String name() {
    return original.name();
  }

  @Override
  public Signature signature() {
    return original.signature();
  }

  public Operation<R> original() {
    return original;
  }

  /**
   * Injectable parameter names mapped to the keys they resolve, in parameter order.
   */
  public Map<String, DependencyKey> injectionPoints() {
    Map<String, DependencyKey> out = new LinkedHashMap<>();
    for (InjectionPoint point : injectionPoints) {
      out.put(point.name(), point.key());
    }
    return Collections.unmodifiableMap(out);
  }

  @Override
  public R call(CallArgs args) throws Exception {
    int positionalCount = args.positional().size();
    Map<String, Object> injected = new LinkedHashMap<>();

    for (InjectionPoint point : injectionPoints) {
      // explicit arguments win, positional or keyword
      if (point.index() < positionalCount || args.hasKeyword(point.name())) continue;

      log.debug("{}: Injecting {} with {}", name(), point.name(), point.key());
      injected.put(point.name(), dependencies.resolve(point.key()));
    }

    return original.call(args.withAll(injected));
  }

  @Override
  public String toString() {
    return "Injected" + injectionPoints() + "{" + original + "}";
  }
}
