package ru.dimension.inject;

import java.util.Objects;

/**
 * Overlay over another dependency map. Registrations land in the overlay and hide the
 * target's bindings for the same keys; everything else resolves through the target.
 *
 * Providers of the target receive this map as their registry, so dependencies they look
 * up on their own also see the patched values.
 *
 * <pre>
 *   PatchedDependencyMap patched = new PatchedDependencyMap(deps);
 *   patched.register(Mailer.class, fakeMailer);
 *   Injector.bind(patched).wrap(signup).call("bob");
 * </pre>
 */
public class PatchedDependencyMap extends DependencyMap {

  private final DependencyMap target;

  public PatchedDependencyMap(DependencyMap target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  public DependencyMap target() {
    return target;
  }

  /**
   * Drops every patched binding.
   */
  public void clear() {
    registry().clear();
  }

  @Override
  protected Provider<?> lookup(DependencyKey key) {
    Provider<?> patched = registry().get(key);
    return patched != null ? patched : target.lookup(key);
  }

  @Override
  public String toString() {
    return "PatchedDependencyMap" + registry().keySet() + " over " + target;
  }
}
