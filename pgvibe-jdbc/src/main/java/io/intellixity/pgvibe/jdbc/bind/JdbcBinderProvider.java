package io.intellixity.pgvibe.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * Base for JDBC binder providers. Dialect binders are evaluated before the shared JDBC ones,
 * which end with a {@code setObject} fallback.
 */
public abstract class JdbcBinderProvider implements ParameterBinderProvider {
  @Override
  public final Collection<ParameterBinder<?>> binders() {
    List<ParameterBinder<?>> out = new ArrayList<>(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  protected Collection<ParameterBinder<?>> dialectBinders() {
    return Collections.emptyList();
  }

  protected Collection<ParameterBinder<?>> jdbcBinders() {
    return List.of(new InstantBinder(), new SetObjectBinder());
  }

  static final class InstantBinder implements ParameterBinder<Instant> {
    @Override public Class<Instant> valueType() { return Instant.class; }

    @Override
    public void bind(PreparedStatement ps, int position, Instant value) throws SQLException {
      ps.setTimestamp(position, Timestamp.from(value));
    }
  }

  static final class SetObjectBinder implements ParameterBinder<Object> {
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
      ps.setObject(position, value);
    }
  }
}
