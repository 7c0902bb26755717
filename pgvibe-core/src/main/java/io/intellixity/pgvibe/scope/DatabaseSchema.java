package io.intellixity.pgvibe.scope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Static description of tables and their declared column types (e.g. {@code integer}, {@code text[]}, {@code jsonb}).
 *
 * <p>Purely descriptive: it is never checked against a live database. JSON form:</p>
 * <pre>
 * { "tables": { "users": { "id": "integer", "tags": "text[]" } } }
 * </pre>
 */
public final class DatabaseSchema {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final Map<String, Map<String, String>> tables;

  private DatabaseSchema(Map<String, Map<String, String>> tables) {
    Map<String, Map<String, String>> copy = new LinkedHashMap<>();
    tables.forEach((t, cols) -> copy.put(t, Collections.unmodifiableMap(new LinkedHashMap<>(cols))));
    this.tables = Collections.unmodifiableMap(copy);
  }

  public static Builder builder() { return new Builder(); }

  public static DatabaseSchema fromJson(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    JsonNode root = JSON.readTree(in);
    JsonNode tablesNode = root == null ? null : root.get("tables");
    if (tablesNode == null || !tablesNode.isObject()) {
      throw new IllegalArgumentException("Schema JSON must contain a \"tables\" object");
    }
    Builder b = builder();
    Iterator<Map.Entry<String, JsonNode>> it = tablesNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> t = it.next();
      if (!t.getValue().isObject()) {
        throw new IllegalArgumentException("Columns of table '" + t.getKey() + "' must be an object");
      }
      b.table(t.getKey());
      Iterator<Map.Entry<String, JsonNode>> cols = t.getValue().fields();
      while (cols.hasNext()) {
        Map.Entry<String, JsonNode> c = cols.next();
        b.column(t.getKey(), c.getKey(), c.getValue().asText());
      }
    }
    return b.build();
  }

  public Set<String> tableNames() { return tables.keySet(); }

  public boolean hasTable(String table) { return tables.containsKey(table); }

  public boolean hasColumn(String table, String column) {
    Map<String, String> cols = tables.get(table);
    return cols != null && cols.containsKey(column);
  }

  public Optional<String> columnType(String table, String column) {
    Map<String, String> cols = tables.get(table);
    return cols == null ? Optional.empty() : Optional.ofNullable(cols.get(column));
  }

  public static final class Builder {
    private final Map<String, Map<String, String>> tables = new LinkedHashMap<>();

    private Builder() {}

    public Builder table(String table) {
      tables.computeIfAbsent(Objects.requireNonNull(table, "table"), k -> new LinkedHashMap<>());
      return this;
    }

    public Builder column(String table, String column, String type) {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(type, "type");
      table(table);
      tables.get(table).put(column, type.trim());
      return this;
    }

    public DatabaseSchema build() { return new DatabaseSchema(tables); }
  }
}
