package io.intellixity.pgvibe.query;

import java.lang.reflect.Array;
import java.util.*;

/** Operand shape helpers shared by expression nodes. */
final class Operands {
  private Operands() {}

  /** Copies a collection or array into a list that tolerates nulls; any other value yields null. */
  static List<Object> asList(Object value) {
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value != null && value.getClass().isArray()) {
      int n = Array.getLength(value);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(value, i));
      return out;
    }
    return null;
  }

  static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
