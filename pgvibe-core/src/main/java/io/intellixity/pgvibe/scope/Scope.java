package io.intellixity.pgvibe.scope;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.ident.ColumnSpec;
import io.intellixity.pgvibe.ident.IdentifierParser;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;

import java.util.*;

/**
 * Tables visible to a query (first = FROM, rest = joins), keyed by qualifier.
 *
 * <p>Immutable: {@link #withTable(TableRef)} returns a new scope. Once a table is aliased its
 * original name is no longer a legal qualifier.</p>
 *
 * <p>Bare column names are never auto-qualified; callers that know which table a bare name belongs to
 * (a JOIN's ON clause) pass that table's qualifier as {@code defaultQualifier}.</p>
 */
public final class Scope {
  private final List<TableRef> tables;
  private final Map<String, TableRef> byQualifier;
  private final DatabaseSchema schema;

  private Scope(List<TableRef> tables, Map<String, TableRef> byQualifier, DatabaseSchema schema) {
    this.tables = tables;
    this.byQualifier = byQualifier;
    this.schema = schema;
  }

  /** @param schema optional static schema; null disables existence and ambiguity checks */
  public static Scope of(TableRef from, DatabaseSchema schema) {
    Objects.requireNonNull(from, "from");
    Map<String, TableRef> m = new LinkedHashMap<>();
    m.put(from.qualifier(), from);
    return new Scope(List.of(from), Collections.unmodifiableMap(m), schema);
  }

  public Scope withTable(TableRef table) {
    Objects.requireNonNull(table, "table");
    String q = table.qualifier();
    if (byQualifier.containsKey(q)) {
      throw new QueryValidationException(Kind.DUPLICATE_ALIAS,
          "Qualifier '" + q + "' is already used in this query");
    }
    List<TableRef> ts = new ArrayList<>(tables);
    ts.add(table);
    Map<String, TableRef> m = new LinkedHashMap<>(byQualifier);
    m.put(q, table);
    return new Scope(List.copyOf(ts), Collections.unmodifiableMap(m), schema);
  }

  public TableRef from() { return tables.get(0); }
  public List<TableRef> tables() { return tables; }
  public DatabaseSchema schema() { return schema; }

  public Optional<TableRef> table(String qualifier) {
    return Optional.ofNullable(byQualifier.get(qualifier));
  }

  public ColumnRef resolveColumn(String reference, String defaultQualifier) {
    return resolve(IdentifierParser.parseColumnReference(reference), defaultQualifier);
  }

  /**
   * Validates {@code ref} against this scope.
   *
   * @return the reference as it must be rendered: qualified refs unchanged, bare refs qualified with
   *     {@code defaultQualifier} when one is given and left bare otherwise
   */
  public ColumnRef resolve(ColumnRef ref, String defaultQualifier) {
    Objects.requireNonNull(ref, "ref");
    if (ref.isQualified()) {
      TableRef t = requireQualifier(ref.qualifier(), ref);
      checkColumnExists(t, ref);
      return ref;
    }
    if (defaultQualifier != null) {
      ColumnRef q = ref.withQualifier(defaultQualifier);
      TableRef t = requireQualifier(defaultQualifier, q);
      checkColumnExists(t, q);
      return q;
    }
    checkBareColumn(ref);
    return ref;
  }

  /** Validates a select-list item; wildcards need only a valid qualifier. */
  public ColumnSpec resolveSelection(ColumnSpec spec) {
    if (spec.isWildcard()) {
      if (spec.qualifier() != null) requireQualifier(spec.qualifier(), spec.ref());
      return spec;
    }
    resolve(spec.ref(), null);
    return spec;
  }

  /** Declared type of a column, when a schema is attached and the owning table is unambiguous. */
  public Optional<String> columnType(ColumnRef ref) {
    if (schema == null) return Optional.empty();
    if (ref.isQualified()) {
      TableRef t = byQualifier.get(ref.qualifier());
      return t == null ? Optional.empty() : schema.columnType(t.name(), ref.column());
    }
    List<TableRef> owners = owningTables(ref.column());
    if (owners.size() != 1) return Optional.empty();
    return schema.columnType(owners.get(0).name(), ref.column());
  }

  private TableRef requireQualifier(String qualifier, ColumnRef ref) {
    TableRef t = byQualifier.get(qualifier);
    if (t != null) return t;
    for (TableRef candidate : tables) {
      if (candidate.aliased() && candidate.name().equals(qualifier)) {
        throw new QueryValidationException(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
            "Table '" + candidate.name() + "' is aliased as '" + candidate.alias() +
                "'; reference '" + ref + "' must use '" + candidate.alias() + "." + ref.column() + "'");
      }
    }
    throw new QueryValidationException(Kind.UNRESOLVED_COLUMN,
        "Unknown table or alias '" + qualifier + "' in column reference '" + ref +
            "' (in scope: " + byQualifier.keySet() + ")");
  }

  private void checkColumnExists(TableRef t, ColumnRef ref) {
    if (schema == null || !schema.hasTable(t.name())) return;
    if (!schema.hasColumn(t.name(), ref.column())) {
      throw new QueryValidationException(Kind.UNRESOLVED_COLUMN,
          "Column '" + ref.column() + "' does not exist in table '" + t.name() + "'");
    }
  }

  private void checkBareColumn(ColumnRef ref) {
    if (schema == null) return;
    boolean allKnown = tables.stream().allMatch(t -> schema.hasTable(t.name()));
    List<TableRef> owners = owningTables(ref.column());
    if (owners.isEmpty() && allKnown) {
      throw new QueryValidationException(Kind.UNRESOLVED_COLUMN,
          "Column '" + ref.column() + "' does not exist in any of: " + byQualifier.keySet());
    }
    if (owners.size() > 1) {
      List<String> qs = owners.stream().map(TableRef::qualifier).toList();
      throw new QueryValidationException(Kind.AMBIGUOUS_COLUMN,
          "Column '" + ref.column() + "' is ambiguous; it exists in " + qs +
              ". Qualify it, e.g. '" + qs.get(0) + "." + ref.column() + "'");
    }
  }

  private List<TableRef> owningTables(String column) {
    List<TableRef> out = new ArrayList<>();
    for (TableRef t : tables) {
      if (schema.hasColumn(t.name(), column)) out.add(t);
    }
    return out;
  }
}
