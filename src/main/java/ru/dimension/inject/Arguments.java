package ru.dimension.inject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments bound to a {@link Signature}, as handed to an operation's body.
 */
public final class Arguments {
  private final Signature signature;
  private final Object[] values;

  Arguments(Signature signature, Object[] values) {
    this.signature = signature;
    this.values = values;
  }

  public Signature signature() {
    return signature;
  }

  public Object get(int index) {
    if (index < 0 || index >= values.length) {
      throw new IndexOutOfBoundsException("No parameter at index " + index + " in " + signature);
    }
    return values[index];
  }

  public Object get(String name) {
    int i = signature.indexOf(name);
    if (i == -1) {
      throw new IllegalArgumentException("No parameter named '" + name + "' in " + signature);
    }
    return values[i];
  }

  public <T> T get(String name, Class<T> type) {
    return type.cast(get(name));
  }

  public boolean contains(String name) {
    return signature.indexOf(name) != -1;
  }

  public int size() {
    return values.length;
  }

  /**
   * Values in parameter order, suitable for a reflective invocation.
   */
  public Object[] toArray() {
    return values.clone();
  }

  public Map<String, Object> asMap() {
    List<Signature.Parameter> params = signature.parameters();
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++) {
      out.put(params.get(i).name(), values[i]);
    }
    return Collections.unmodifiableMap(out);
  }

  @Override
  public String toString() {
    return "Arguments" + asMap();
  }
}
