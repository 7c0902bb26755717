package io.intellixity.pgvibe.query;

import io.intellixity.pgvibe.ident.ColumnRef;
import io.intellixity.pgvibe.ident.TableRef;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.scope.DatabaseSchema;
import io.intellixity.pgvibe.scope.Scope;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExpressionBuilderTest {
  private final ExpressionBuilder eb = new ExpressionBuilder(Scope.of(new TableRef("users", "u"), null));

  @Test
  void parsesOperatorsCaseAndWhitespaceInsensitively() {
    assertEquals(ComparisonOperator.EQ, ComparisonOperator.parse("="));
    assertEquals(ComparisonOperator.NE, ComparisonOperator.parse("<>"));
    assertEquals(ComparisonOperator.NE, ComparisonOperator.parse("!="));
    assertEquals(ComparisonOperator.ILIKE, ComparisonOperator.parse("ILike"));
    assertEquals(ComparisonOperator.NOT_IN, ComparisonOperator.parse(" NOT   in "));
    assertEquals(ComparisonOperator.IS_NOT, ComparisonOperator.parse("is Not"));
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> ComparisonOperator.parse("~")).kind());
  }

  @Test
  void resolvesColumnsWhenNodesAreBuilt() {
    Comparison c = eb.cmp("u.id", "=", 1);
    assertEquals(ColumnRef.qualified("u", "id"), c.column());
    assertEquals(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
        assertThrows(QueryValidationException.class, () -> eb.eq("users.id", 1)).kind());
    assertEquals(Kind.UNRESOLVED_COLUMN,
        assertThrows(QueryValidationException.class, () -> eb.jsonb("x.meta")).kind());
  }

  @Test
  void collectionOperatorsNeedCollections() {
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> eb.cmp("id", "in", 5)).kind());
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> eb.in("id", null)).kind());
    assertEquals(List.of(1, 2), eb.cmp("id", "in", new int[] { 1, 2 }).values());
    assertEquals(Arrays.asList(1, null), eb.cmp("id", "not in", Arrays.asList(1, null)).values());
  }

  @Test
  void scalarOperatorsRejectCollections() {
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> eb.cmp("id", "=", List.of(1))).kind());
  }

  @Test
  void nullHandling() {
    assertNull(eb.isNull("deleted_at").value());
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> eb.cmp("deleted_at", "is", "x")).kind());
    assertEquals(Kind.INVALID_OPERAND,
        assertThrows(QueryValidationException.class, () -> eb.gt("id", null)).kind());
    assertEquals(ComparisonOperator.EQ, eb.eq("name", null).operator());
  }

  @Test
  void groupsAreImmutable() {
    LogicalGroup g = eb.and(eb.eq("a", 1));
    LogicalGroup g2 = g.with(eb.eq("b", 2));
    assertEquals(1, g.elements().size());
    assertEquals(2, g2.elements().size());
    assertSame(g.elements().get(0), g2.elements().get(0));
    assertTrue(eb.and().isEmpty());
    assertEquals(Clause.OR, eb.or().clause());
  }

  @Test
  void groupsRejectNullChildren() {
    assertThrows(QueryValidationException.class, () -> eb.and(eb.eq("a", 1), null));
    assertThrows(QueryValidationException.class, () -> eb.not(null));
  }

  @Test
  void arrayElementTypeComesFromSchema() {
    DatabaseSchema schema = DatabaseSchema.builder()
        .column("users", "tags", "text[]")
        .column("users", "scores", "integer[]")
        .column("users", "name", "text")
        .build();
    ExpressionBuilder typed = new ExpressionBuilder(Scope.of(TableRef.of("users"), schema));
    assertEquals("text", typed.array("tags").elementType());
    assertEquals("integer", typed.array("scores").elementType());
    assertEquals("text", typed.array("name").elementType());
    assertEquals("text", eb.array("tags").elementType());
  }

  @Test
  void arrayOperandShapes() {
    assertEquals(List.of("a", "b"), eb.array("tags").contains("a", "b").values());
    assertEquals(List.of(), eb.array("tags").overlaps(List.of()).values());
    assertThrows(QueryValidationException.class, () -> eb.array("tags").hasAny(List.of("a")));
    assertThrows(QueryValidationException.class, () -> eb.array("tags").hasAll(null));
  }

  @Test
  void jsonbNavigationAccumulatesPath() {
    JsonCondition c = eb.jsonb("metadata").field("prefs").field("lang").isEqualTo("en");
    assertEquals(List.of("prefs", "lang"), c.path());
    assertEquals(PathStyle.FIELD, c.pathStyle());
    assertEquals(PathStyle.PATH, eb.jsonb("metadata").path("a", "b").exists().pathStyle());
  }

  @Test
  void jsonbRejectsBadOperands() {
    JsonbExpressionBuilder j = eb.jsonb("metadata");
    assertThrows(QueryValidationException.class, () -> j.field(""));
    assertThrows(QueryValidationException.class, () -> j.path());
    assertThrows(QueryValidationException.class, () -> j.hasAnyKey());
    assertThrows(QueryValidationException.class, () -> j.contains(null));
    assertThrows(QueryValidationException.class, () -> j.field("a").isEqualTo(null));
    assertThrows(QueryValidationException.class, () -> j.path("a").isEqualTo(null));
  }

  @Test
  void rawFragmentNeedsText() {
    assertThrows(QueryValidationException.class, () -> eb.raw("  "));
    assertEquals(Arrays.asList(1, null), RawFragment.of("a = $1 or b = $2", 1, null).params());
  }
}
