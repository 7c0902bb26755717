package io.intellixity.pgvibe.jdbc.bind;

import io.intellixity.pgvibe.util.FactoriesLoader;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.*;

/**
 * Binder registry built from {@code META-INF/pgvibe.factories}.
 *
 * Resolution: dialect-specific providers first, then global ones ({@code dialectId="*"}); binder order
 * within a provider is kept; the first binder whose value type and {@code supports} match wins.
 * Nulls are bound with {@code setNull(Types.NULL)}.
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final List<ParameterBinder<?>> dialectOrdered;
  private final List<ParameterBinder<?>> globalOrdered;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, FactoriesLoader.load(ParameterBinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<? extends ParameterBinderProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? "" : dialectId;
    List<ParameterBinder<?>> dialect = new ArrayList<>();
    List<ParameterBinder<?>> global = new ArrayList<>();
    for (ParameterBinderProvider p : providers) {
      if (p == null || p.binders() == null) continue;
      String did = normalizeDialect(p.dialectId());
      if (GLOBAL_DIALECT.equals(did)) global.addAll(p.binders());
      else if (this.dialectId.equals(did)) dialect.addAll(p.binders());
    }
    this.dialectOrdered = List.copyOf(dialect);
    this.globalOrdered = List.copyOf(global);
  }

  public String dialectId() { return dialectId; }

  public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(position, Types.NULL);
      return;
    }
    if (tryBind(dialectOrdered, ps, position, value)) return;
    if (tryBind(globalOrdered, ps, position, value)) return;
    throw new IllegalArgumentException("No binder found for dialectId=" + dialectId +
        ", valueType=" + value.getClass().getName());
  }

  private static boolean tryBind(List<ParameterBinder<?>> ordered, PreparedStatement ps, int position, Object value)
      throws SQLException {
    for (ParameterBinder<?> b : ordered) {
      if (!b.valueType().isInstance(value)) continue;
      @SuppressWarnings("unchecked")
      ParameterBinder<Object> bb = (ParameterBinder<Object>) b;
      if (bb.supports(value)) {
        bb.bind(ps, position, value);
        return true;
      }
    }
    return false;
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }
}
