package qdot.fitting.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed ordering of the named parameters of a model. Parameter vectors handed to models and
 * solvers are plain arrays; this table is the only place where a slot of such an array is
 * associated with a parameter name, so lookups never depend on map iteration order.
 */
public class ParameterSchema {

  private final String[] names;
  private final Map<String, Integer> indices;

  public ParameterSchema(String... names) {
    this.names = names.clone();
    indices = new LinkedHashMap<>();
    for (int i = 0; i < names.length; ++i) {
      if (indices.put(names[i], i) != null) {
        throw new IllegalArgumentException("Duplicate parameter name: " + names[i]);
      }
    }
  }

  /**
   * Get the slot of a named parameter
   *
   * @param name Parameter name
   * @return Index of the parameter in vectors following this schema
   * @throws IllegalArgumentException if the model has no parameter with that name
   */
  public int indexOf(String name) {
    Integer idx = indices.get(name);
    if (idx == null) {
      throw new IllegalArgumentException(
          "No parameter named " + name + " in " + Arrays.toString(names));
    }
    return idx;
  }

  public boolean contains(String name) {
    return indices.containsKey(name);
  }

  public String getName(int index) {
    return names[index];
  }

  public List<String> getNames() {
    return Collections.unmodifiableList(Arrays.asList(names));
  }

  public int size() {
    return names.length;
  }

  /**
   * Check that a parameter vector has one entry per named parameter
   *
   * @param parameters Vector to check
   * @throws IllegalArgumentException if the lengths disagree
   */
  public void checkLength(double[] parameters) {
    if (parameters.length != names.length) {
      throw new IllegalArgumentException("Expected " + names.length + " parameters "
          + Arrays.toString(names) + " but got " + parameters.length);
    }
  }

  @Override
  public String toString() {
    return Arrays.toString(names);
  }
}
