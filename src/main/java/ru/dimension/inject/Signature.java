package ru.dimension.inject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered parameter list of an {@link Operation}, each parameter optionally carrying a
 * declared default value.
 *
 * A default that is a {@link Key}, or a class / {@link TypeKey} bound in the injector's map,
 * marks the parameter as an injection point. Any other default is an ordinary value used
 * when the caller omits the argument.
 *
 * <pre>
 *   Signature sig = Signature.builder()
 *       .param("subject")
 *       .param("hash", HASH)
 *       .build();
 * </pre>
 */
public final class Signature {

  public record Parameter(String name, boolean hasDefault, Object defaultValue) {
    public Parameter {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Parameter name must be non-blank");
      }
      if (!hasDefault && defaultValue != null) {
        throw new IllegalArgumentException("Parameter '" + name + "' has no default but a default value was given");
      }
    }

    public static Parameter required(String name) {
      return new Parameter(name, false, null);
    }

    public static Parameter withDefault(String name, Object defaultValue) {
      return new Parameter(name, true, defaultValue);
    }
  }

  private final List<Parameter> parameters;
  private final Map<String, Integer> indexByName;

  private Signature(List<Parameter> parameters) {
    Map<String, Integer> index = new HashMap<>();
    boolean seenDefault = false;
    for (int i = 0; i < parameters.size(); i++) {
      Parameter p = parameters.get(i);
      if (index.putIfAbsent(p.name(), i) != null) {
        throw new IllegalArgumentException("Duplicate parameter '" + p.name() + "'");
      }
      if (p.hasDefault()) {
        seenDefault = true;
      } else if (seenDefault) {
        throw new IllegalArgumentException("Non-default parameter '" + p.name() + "' follows a default parameter");
      }
    }
    this.parameters = List.copyOf(parameters);
    this.indexByName = Map.copyOf(index);
  }

  public static Signature of(Parameter... parameters) {
    return new Signature(List.of(parameters));
  }

  public static Signature of(List<Parameter> parameters) {
    return new Signature(parameters);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  public int size() {
    return parameters.size();
  }

  /**
   * Position of the named parameter, or -1.
   */
  public int indexOf(String name) {
    Integer i = indexByName.get(name);
    return i == null ? -1 : i;
  }

  /**
   * Binds call arguments to parameters the ordinary way: positionals by position, then
   * keywords by name, then declared defaults for anything still missing.
   *
   * @throws IllegalArgumentException on too many positionals, an unknown keyword, a parameter
   *                                  given twice, or a missing argument without default
   */
  public Arguments bind(CallArgs args) {
    Objects.requireNonNull(args, "args");
    List<Object> positional = args.positional();
    if (positional.size() > parameters.size()) {
      throw new IllegalArgumentException(
          "Takes " + parameters.size() + " positional arguments but " + positional.size() + " were given");
    }

    Object[] values = new Object[parameters.size()];
    boolean[] filled = new boolean[parameters.size()];

    for (int i = 0; i < positional.size(); i++) {
      values[i] = positional.get(i);
      filled[i] = true;
    }

    for (Map.Entry<String, Object> e : args.keywords().entrySet()) {
      int i = indexOf(e.getKey());
      if (i == -1) {
        throw new IllegalArgumentException("Unexpected keyword argument '" + e.getKey() + "'");
      }
      if (filled[i]) {
        throw new IllegalArgumentException("Got multiple values for argument '" + e.getKey() + "'");
      }
      values[i] = e.getValue();
      filled[i] = true;
    }

    for (int i = 0; i < values.length; i++) {
      if (filled[i]) continue;
      Parameter p = parameters.get(i);
      if (!p.hasDefault()) {
        throw new IllegalArgumentException("Missing required argument '" + p.name() + "'");
      }
      values[i] = p.defaultValue();
    }

    return new Arguments(this, values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Signature s)) return false;
    return parameters.equals(s.parameters);
  }

  @Override
  public int hashCode() {
    return parameters.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < parameters.size(); i++) {
      Parameter p = parameters.get(i);
      if (i > 0) sb.append(", ");
      sb.append(p.name());
      if (p.hasDefault()) sb.append('=').append(p.defaultValue());
    }
    return sb.append(')').toString();
  }

  public static final class Builder {
    private final List<Parameter> parameters = new ArrayList<>();

    private Builder() {}

    public Builder param(String name) {
      parameters.add(Parameter.required(name));
      return this;
    }

    public Builder param(String name, Object defaultValue) {
      parameters.add(Parameter.withDefault(name, defaultValue));
      return this;
    }

    public Signature build() {
      return new Signature(parameters);
    }
  }
}
