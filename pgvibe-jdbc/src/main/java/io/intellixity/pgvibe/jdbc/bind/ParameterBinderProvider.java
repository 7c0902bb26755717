package io.intellixity.pgvibe.jdbc.bind;

import java.util.Collection;

/** Discovered through {@code META-INF/pgvibe.factories}, keyed by dialect id. */
public interface ParameterBinderProvider {
  /** Dialect id this provider targets, or "*" for global. */
  String dialectId();

  Collection<ParameterBinder<?>> binders();
}
