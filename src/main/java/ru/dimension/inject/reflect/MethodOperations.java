package ru.dimension.inject.reflect;

import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import ru.dimension.inject.Key;
import ru.dimension.inject.Operation;
import ru.dimension.inject.Signature;
import ru.dimension.inject.TypeKey;

/**
 * Adapts plain Java methods into {@link Operation operations}, reading injection points
 * from {@code jakarta.inject} annotations.
 *
 * <ul>
 *   <li>{@code @Named("hash")} parameter - default is {@code Key.of("hash")}</li>
 *   <li>{@link Assisted @Assisted} parameter - no default, the caller must pass a value</li>
 *   <li>any other parameter of an {@code @Inject} method - default is the {@link TypeKey} of its type</li>
 *   <li>any other parameter - no default</li>
 * </ul>
 *
 * Caller-supplied parameters must come before injected ones, as for any signature.
 *
 * Parameter names come from the class file, so code should be compiled with {@code -parameters};
 * otherwise they are {@code arg0}, {@code arg1}, ...
 */
public final class MethodOperations {

  private MethodOperations() {}

  /**
   * Operation for the single method called {@code methodName} on {@code target}'s class.
   */
  public static <R> Operation<R> of(Object target, String methodName) {
    Objects.requireNonNull(target, "target");
    return of(target, findMethod(target.getClass(), methodName));
  }

  /**
   * Operation for the single static method called {@code methodName} declared by {@code type}.
   */
  public static <R> Operation<R> ofStatic(Class<?> type, String methodName) {
    Method method = findMethod(type, methodName);
    if (!Modifier.isStatic(method.getModifiers())) {
      throw new IllegalArgumentException("Method is not static: " + type.getName() + "#" + methodName);
    }
    return of(null, method);
  }

  public static <R> Operation<R> of(Object target, Method method) {
    Objects.requireNonNull(method, "method");
    boolean isStatic = Modifier.isStatic(method.getModifiers());
    if (!isStatic && target == null) {
      throw new IllegalArgumentException("Instance method needs a target: " + describe(method));
    }

    MethodHandle mh = unreflect(method);
    MethodHandle bound = isStatic ? mh : mh.bindTo(target);

    return Operation.of(method.getName(), signatureOf(method), args -> {
      try {
        @SuppressWarnings("unchecked")
        R result = (R) bound.invokeWithArguments(args.toArray());
        return result;
      } catch (Exception | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new IllegalStateException("Failed to invoke " + describe(method), t);
      }
    });
  }

  /**
   * Reads the method's parameters into a signature.
   */
  public static Signature signatureOf(Method method) {
    boolean injectByType = method.isAnnotationPresent(Inject.class);
    List<Signature.Parameter> params = new ArrayList<>();
    for (Parameter p : method.getParameters()) {
      Named named = p.getAnnotation(Named.class);
      if (named != null && !named.value().isBlank()) {
        params.add(Signature.Parameter.withDefault(p.getName(), Key.of(named.value().trim())));
      } else if (injectByType && !p.isAnnotationPresent(Assisted.class)) {
        params.add(Signature.Parameter.withDefault(p.getName(), TypeKey.of(p.getType())));
      } else {
        params.add(Signature.Parameter.required(p.getName()));
      }
    }
    return Signature.of(params);
  }

  private static Method findMethod(Class<?> type, String methodName) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(methodName, "methodName");

    Method found = null;
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Method m : c.getDeclaredMethods()) {
        if (m.isSynthetic() || m.isBridge() || !m.getName().equals(methodName)) continue;
        if (found != null) {
          throw new IllegalArgumentException("Ambiguous method name: " + type.getName() + "#" + methodName);
        }
        found = m;
      }
      if (found != null) break;
    }

    if (found == null) {
      throw new IllegalArgumentException("No method " + methodName + " in " + type.getName());
    }
    return found;
  }

  private static MethodHandle unreflect(Method method) {
    try {
      MethodHandles.Lookup lookup = MethodHandles.lookup();
      MethodHandles.Lookup privateLookup = MethodHandles.privateLookupIn(method.getDeclaringClass(), lookup);
      return privateLookup.unreflect(method);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot access method " + describe(method), e);
    }
  }

  private static String describe(Method method) {
    return method.getDeclaringClass().getName() + "#" + method.getName();
  }
}
