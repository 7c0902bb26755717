package io.intellixity.pgvibe.builder;

import io.intellixity.pgvibe.PgVibe;
import io.intellixity.pgvibe.exec.QueryExecutor;
import io.intellixity.pgvibe.query.QueryValidationException;
import io.intellixity.pgvibe.query.QueryValidationException.Kind;
import io.intellixity.pgvibe.query.RawFragment;
import io.intellixity.pgvibe.scope.DatabaseSchema;
import io.intellixity.pgvibe.sql.CompiledQuery;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class SelectQueryBuilderTest {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

  private final PgVibe db = PgVibe.create();

  /** Placeholders first appear as $1, $2, ... in order and there is exactly one parameter per number. */
  static void assertPlaceholdersSequential(CompiledQuery q) {
    Matcher m = PLACEHOLDER.matcher(q.sql());
    int highest = 0;
    while (m.find()) {
      int k = Integer.parseInt(m.group(1));
      assertTrue(k <= highest + 1, "placeholder $" + k + " appears before $" + (highest + 1) + " in " + q.sql());
      highest = Math.max(highest, k);
    }
    assertEquals(highest, q.parameters().size(), q.sql());
  }

  @Test
  void successiveWheresCombineWithAnd() {
    SelectQueryBuilder q = db.selectFrom("users").where("a", "=", 1).where("b", "=", 2);
    assertEquals("SELECT * FROM users WHERE a = $1 AND b = $2", q.compile().sql());

    SelectQueryBuilder three = q.where("c", "=", 3);
    assertEquals("SELECT * FROM users WHERE (a = $1 AND b = $2 AND c = $3)", three.compile().sql());
    assertEquals(List.of(1, 2, 3), three.compile().parameters());
  }

  @Test
  void whereAfterOrGroupNestsIt() {
    CompiledQuery q = db.selectFrom("users")
        .where(eb -> eb.or(eb.eq("a", 1), eb.eq("b", 2)))
        .where("c", "=", 3)
        .compile();
    assertEquals("SELECT * FROM users WHERE ((a = $1 OR b = $2) AND c = $3)", q.sql());
  }

  @Test
  void whereAfterEmptyAndDoesNotDoubleWrap() {
    CompiledQuery q = db.selectFrom("users")
        .where(eb -> eb.and())
        .where(eb -> eb.or(eb.eq("a", 1), eb.eq("b", 2)))
        .compile();
    assertEquals("SELECT * FROM users WHERE a = $1 OR b = $2", q.sql());
    assertEquals(List.of(1, 2), q.parameters());
  }

  @Test
  void whereAllJoinsWithAnd() {
    CompiledQuery q = db.selectFrom("users")
        .whereAll(eb -> List.of(eb.eq("a", 1), eb.gt("b", 2)))
        .compile();
    assertEquals("SELECT * FROM users WHERE a = $1 AND b > $2", q.sql());
  }

  @Test
  void callbackMustReturnExpression() {
    assertEquals(Kind.INVALID_OPERAND, assertThrows(QueryValidationException.class,
        () -> db.selectFrom("users").where(eb -> null)).kind());
  }

  @Test
  void snapshotsBranchIndependently() {
    SelectQueryBuilder base = db.selectFrom("users").select("id").where("a", "=", 1);
    SelectQueryBuilder left = base.where("b", "=", 2).orderBy("id");
    SelectQueryBuilder right = base.where("c", "=", 3).limit(5);

    assertEquals("SELECT id FROM users WHERE a = $1", base.compile().sql());
    assertEquals("SELECT id FROM users WHERE a = $1 AND b = $2 ORDER BY id ASC", left.compile().sql());
    assertEquals("SELECT id FROM users WHERE a = $1 AND c = $2 LIMIT 5", right.compile().sql());
    assertEquals(List.of(1, 3), right.compile().parameters());
  }

  @Test
  void compileIsIdempotent() {
    SelectQueryBuilder q = db.selectFrom("users").where("id", "in", List.of(1, 2));
    CompiledQuery first = q.compile();
    assertSame(first, q.compile());
    assertSame(first, q.toSQL());
    assertEquals(first, db.selectFrom("users").where("id", "in", List.of(1, 2)).compile());
  }

  @Test
  void snapshotsCompileFromManyThreads() throws Exception {
    SelectQueryBuilder q = db.selectFrom("users as u")
        .innerJoin("posts as p", "u.id", "p.user_id")
        .where(eb -> eb.and(eb.eq("u.active", true), eb.array("p.tags").overlaps("a", "b"), eb.raw("p.id > $1", 10)));
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<CompiledQuery>> fs = new ArrayList<>();
      for (int i = 0; i < 16; i++) fs.add(pool.submit(q::compile));
      Set<String> sqls = new HashSet<>();
      for (Future<CompiledQuery> f : fs) sqls.add(f.get(10, TimeUnit.SECONDS).sql());
      assertEquals(Set.of("SELECT * FROM users AS u INNER JOIN posts AS p ON u.id = p.user_id " +
          "WHERE (u.active = $1 AND p.tags && ARRAY[$2, $3] AND p.id > $4)"), sqls);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void parameterOrderMatchesPlaceholders() {
    CompiledQuery q = db.selectFrom("users as u")
        .leftJoin("posts as p", "id", "user_id")
        .where("u.name", "like", "A%")
        .where(eb -> eb.or(
            eb.in("u.id", List.of(1, 2)),
            eb.not(eb.jsonb("u.metadata").field("x").isEqualTo("y")),
            eb.array("u.tags").hasAny("t")))
        .where(RawFragment.of("coalesce(p.title, $2) <> $1", "a", "b"))
        .orderBy("u.id", "DESC")
        .compile();
    assertPlaceholdersSequential(q);
    assertEquals(List.of("A%", 1, 2, "y", "t", "b", "a"), q.parameters());
  }

  @Test
  void bareColumnsAreNeverAutoQualified() {
    assertEquals("SELECT * FROM users AS u WHERE id = $1",
        db.selectFrom("users as u").where("id", "=", 1).compile().sql());
  }

  @Test
  void joinDefaultsBareColumnsToTheirSide() {
    assertEquals("SELECT * FROM users AS u INNER JOIN posts AS p ON u.id = p.user_id",
        db.selectFrom("users as u").innerJoin("posts as p", "id", "user_id").compile().sql());
  }

  @Test
  void aliasExclusivityIsEnforcedEverywhere() {
    SelectQueryBuilder q = db.selectFrom("users as u");
    assertEquals(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
        assertThrows(QueryValidationException.class, () -> q.where("users.id", "=", 1)).kind());
    assertEquals(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
        assertThrows(QueryValidationException.class, () -> q.innerJoin("posts as p", "users.id", "p.user_id")).kind());
    assertEquals(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
        assertThrows(QueryValidationException.class, () -> q.orderBy("users.name")).kind());
    assertEquals(Kind.ALIAS_EXCLUSIVITY_VIOLATION,
        assertThrows(QueryValidationException.class, () -> q.select("users.name").compile()).kind());
  }

  @Test
  void duplicateJoinAliasIsRejected() {
    assertEquals(Kind.DUPLICATE_ALIAS, assertThrows(QueryValidationException.class,
        () -> db.selectFrom("users as u").innerJoin("posts as u", "id", "user_id")).kind());
  }

  @Test
  void selectionsMayNameLaterJoins() {
    CompiledQuery q = db.selectFrom("users as u").select("p.title").innerJoin("posts as p", "id", "user_id").compile();
    assertEquals("SELECT p.title FROM users AS u INNER JOIN posts AS p ON u.id = p.user_id", q.sql());
    assertEquals(Kind.UNRESOLVED_COLUMN, assertThrows(QueryValidationException.class,
        () -> db.selectFrom("users").select("p.title").compile()).kind());
  }

  @Test
  void whitespaceInTableExpressionIsNormalized() {
    assertEquals("SELECT * FROM Users AS u", db.selectFrom("  Users   AS   u ").compile().sql());
  }

  @Test
  void schemaCatchesAmbiguousBareColumns() {
    DatabaseSchema schema = DatabaseSchema.builder()
        .column("users", "id", "integer")
        .column("posts", "id", "integer")
        .column("posts", "user_id", "integer")
        .build();
    SelectQueryBuilder q = PgVibe.create(schema).selectFrom("users as u").innerJoin("posts as p", "id", "user_id");
    assertEquals(Kind.AMBIGUOUS_COLUMN, assertThrows(QueryValidationException.class, () -> q.where("id", "=", 1)).kind());
    assertEquals("SELECT * FROM users AS u INNER JOIN posts AS p ON u.id = p.user_id WHERE p.id = $1",
        q.where("p.id", "=", 1).compile().sql());
  }

  @Test
  void sortDirectionAndPagingAreValidated() {
    SelectQueryBuilder q = db.selectFrom("users");
    assertEquals(Kind.INVALID_OPERAND, assertThrows(QueryValidationException.class, () -> q.orderBy("id", "sideways")).kind());
    assertEquals(Kind.INVALID_OPERAND, assertThrows(QueryValidationException.class, () -> q.limit(-1)).kind());
    assertEquals(Kind.INVALID_OPERAND, assertThrows(QueryValidationException.class, () -> q.offset(-5)).kind());
    assertEquals("SELECT * FROM users ORDER BY id ASC LIMIT 0 OFFSET 0", q.orderBy("id", " asc ").limit(0).offset(0).compile().sql());
  }

  @Test
  void executeRequiresExecutor() {
    assertThrows(IllegalStateException.class, () -> db.selectFrom("users").execute());
  }

  @Test
  void executeHandsCompiledQueryToExecutor() {
    List<CompiledQuery> seen = new ArrayList<>();
    QueryExecutor executor = new QueryExecutor() {
      @Override
      public List<Map<String, Object>> query(CompiledQuery query) {
        seen.add(query);
        return List.of(Map.of("id", 42));
      }

      @Override
      public long update(CompiledQuery query) {
        throw new UnsupportedOperationException();
      }
    };
    List<Map<String, Object>> rows = db.withExecutor(executor)
        .selectFrom("users").select("id").where("id", "=", 42).execute();
    assertEquals(List.of(Map.of("id", 42)), rows);
    assertEquals("SELECT id FROM users WHERE id = $1", seen.get(0).sql());
  }
}
