package io.intellixity.pgvibe.dmlast;

import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/**
 * {@code ON CONFLICT [(cols) | ON CONSTRAINT name] DO NOTHING | DO UPDATE SET ...}.
 * At most one of {@code targetColumns}/{@code constraint} is set; DO UPDATE requires one of them.
 */
public record OnConflict(List<String> targetColumns, String constraint, Action action, Map<String, Object> updates) {
  public enum Action { DO_NOTHING, DO_UPDATE }

  public OnConflict {
    targetColumns = targetColumns == null ? List.of() : List.copyOf(targetColumns);
    Objects.requireNonNull(action, "action");
    // values may be null, so no Map.copyOf
    updates = updates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(updates));
    if (!targetColumns.isEmpty() && constraint != null) {
      throw new QueryValidationException(Kind.INVALID_OPERAND, "ON CONFLICT takes either columns or a constraint, not both");
    }
    if (action == Action.DO_UPDATE) {
      if (targetColumns.isEmpty() && constraint == null) {
        throw new QueryValidationException(Kind.INVALID_OPERAND, "ON CONFLICT DO UPDATE requires conflict columns or a constraint");
      }
      if (updates.isEmpty()) {
        throw new QueryValidationException(Kind.INVALID_OPERAND, "ON CONFLICT DO UPDATE requires at least one SET column");
      }
    }
  }

  public boolean hasTarget() { return !targetColumns.isEmpty() || constraint != null; }
}
