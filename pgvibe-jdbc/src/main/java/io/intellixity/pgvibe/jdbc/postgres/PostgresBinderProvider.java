package io.intellixity.pgvibe.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgvibe.jdbc.bind.JdbcBinderProvider;
import io.intellixity.pgvibe.jdbc.bind.ParameterBinder;
import org.postgresql.util.PGobject;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.*;

/** Postgres-specific JDBC binders (dialectId="postgres"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Override
  public String dialectId() {
    return "postgres";
  }

  @Override
  protected Collection<ParameterBinder<?>> dialectBinders() {
    return List.of(new JsonbMapBinder(), new CollectionArrayBinder(), new JavaArrayBinder());
  }

  /** Maps become jsonb documents. */
  static final class JsonbMapBinder implements ParameterBinder<Map<?, ?>> {
    @SuppressWarnings("unchecked")
    @Override public Class<Map<?, ?>> valueType() { return (Class<Map<?, ?>>) (Class<?>) Map.class; }

    @Override
    public void bind(PreparedStatement ps, int position, Map<?, ?> value) throws SQLException {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      try {
        obj.setValue(JSON.writeValueAsString(value));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Cannot serialize Map parameter " + position + " as jsonb", e);
      }
      ps.setObject(position, obj);
    }
  }

  /** Lists and sets become native arrays; the element type follows the first non-null element. */
  static final class CollectionArrayBinder implements ParameterBinder<Collection<?>> {
    @SuppressWarnings("unchecked")
    @Override public Class<Collection<?>> valueType() { return (Class<Collection<?>>) (Class<?>) Collection.class; }

    @Override
    public void bind(PreparedStatement ps, int position, Collection<?> value) throws SQLException {
      Object[] arr = value.toArray();
      ps.setArray(position, ps.getConnection().createArrayOf(elementType(arr), arr));
    }
  }

  /** Object and primitive arrays other than {@code byte[]}, which the driver binds as bytea. */
  static final class JavaArrayBinder implements ParameterBinder<Object> {
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(Object value) {
      return value.getClass().isArray() && !(value instanceof byte[]);
    }

    @Override
    public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
      int n = Array.getLength(value);
      Object[] arr = new Object[n];
      for (int i = 0; i < n; i++) arr[i] = Array.get(value, i);
      ps.setArray(position, ps.getConnection().createArrayOf(elementType(arr), arr));
    }
  }

  static String elementType(Object[] values) {
    for (Object v : values) {
      if (v == null) continue;
      if (v instanceof String) return "text";
      if (v instanceof Integer || v instanceof Short) return "int4";
      if (v instanceof Long) return "int8";
      if (v instanceof Double || v instanceof Float) return "float8";
      if (v instanceof Boolean) return "bool";
      if (v instanceof UUID) return "uuid";
      if (v instanceof BigDecimal) return "numeric";
      throw new IllegalArgumentException("Unsupported Postgres array element type: " + v.getClass().getName());
    }
    return "text";
  }
}
