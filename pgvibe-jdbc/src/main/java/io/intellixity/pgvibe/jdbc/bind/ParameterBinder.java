package io.intellixity.pgvibe.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Sets one positional parameter on a {@link PreparedStatement}.
 *
 * <p>A binder is consulted only for non-null values that are instances of {@link #valueType()};
 * {@link #supports} can narrow further.</p>
 */
public interface ParameterBinder<T> {
  Class<T> valueType();

  default boolean supports(T value) { return true; }

  void bind(PreparedStatement ps, int position, T value) throws SQLException;
}
