package io.intellixity.pgvibe.sql;

import io.intellixity.pgvibe.PgVibe;
import io.intellixity.pgvibe.query.Expression;
import io.intellixity.pgvibe.query.ExpressionBuilder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.arguments;

/** Every row is rendered as the whole WHERE clause, so the outermost node is the root. */
final class ParenthesizationMatrixTest {
  private static Arguments row(String name, Function<ExpressionBuilder, Expression> tree, String where) {
    return arguments(name, tree, where);
  }

  static Stream<Arguments> matrix() {
    return Stream.of(
        row("comparison", eb -> eb.eq("a", 1), "a = $1"),
        row("and of two", eb -> eb.and(eb.eq("a", 1), eb.eq("b", 2)), "a = $1 AND b = $2"),
        row("or of two", eb -> eb.or(eb.eq("a", 1), eb.eq("b", 2)), "a = $1 OR b = $2"),
        row("and of three", eb -> eb.and(eb.eq("a", 1), eb.eq("b", 2), eb.eq("c", 3)),
            "(a = $1 AND b = $2 AND c = $3)"),
        row("or of three", eb -> eb.or(eb.eq("a", 1), eb.eq("b", 2), eb.eq("c", 3)),
            "(a = $1 OR b = $2 OR c = $3)"),
        row("and with nested or", eb -> eb.and(eb.eq("a", 1), eb.or(eb.eq("b", 2), eb.eq("c", 3))),
            "(a = $1 AND (b = $2 OR c = $3))"),
        row("or with nested and", eb -> eb.or(eb.and(eb.eq("a", 1), eb.eq("b", 2)), eb.eq("c", 3)),
            "((a = $1 AND b = $2) OR c = $3)"),
        row("same operator is not flattened", eb -> eb.or(eb.eq("a", 1), eb.or(eb.eq("b", 2), eb.eq("c", 3))),
            "(a = $1 OR (b = $2 OR c = $3))"),
        row("single child", eb -> eb.and(eb.eq("a", 1)), "a = $1"),
        row("single logical child", eb -> eb.and(eb.or(eb.eq("a", 1), eb.eq("b", 2))),
            "a = $1 OR b = $2"),
        row("single child of three", eb -> eb.or(eb.and(eb.eq("a", 1), eb.eq("b", 2), eb.eq("c", 3))),
            "(a = $1 AND b = $2 AND c = $3)"),
        row("single child nested twice", eb -> eb.and(eb.or(eb.and(eb.eq("a", 1), eb.eq("b", 2)))),
            "a = $1 AND b = $2"),
        row("single child inside and", eb -> eb.and(eb.eq("a", 1), eb.or(eb.eq("b", 2))),
            "(a = $1 AND (b = $2))"),
        row("not single logical child", eb -> eb.not(eb.and(eb.or(eb.eq("a", 1), eb.eq("b", 2)))),
            "NOT (a = $1 OR b = $2)"),
        row("empty and", eb -> eb.and(), "true"),
        row("empty or", eb -> eb.or(), "false"),
        row("empty group as child", eb -> eb.and(eb.eq("a", 1), eb.and()), "(a = $1 AND true)"),
        row("empty or as child", eb -> eb.or(eb.eq("a", 1), eb.or()), "(a = $1 OR false)"),
        row("not comparison", eb -> eb.not(eb.eq("a", 1)), "NOT (a = $1)"),
        row("not and of two", eb -> eb.not(eb.and(eb.eq("a", 1), eb.eq("b", 2))), "NOT (a = $1 AND b = $2)"),
        row("not and of three", eb -> eb.not(eb.and(eb.eq("a", 1), eb.eq("b", 2), eb.eq("c", 3))),
            "NOT (a = $1 AND b = $2 AND c = $3)"),
        row("not group with logical child",
            eb -> eb.not(eb.or(eb.eq("a", 1), eb.and(eb.eq("b", 2), eb.eq("c", 3)))),
            "NOT (a = $1 OR (b = $2 AND c = $3))"),
        row("not not", eb -> eb.not(eb.not(eb.eq("a", 1))), "NOT (NOT (a = $1))"),
        row("not empty", eb -> eb.not(eb.and()), "NOT (true)"),
        row("and with not child", eb -> eb.and(eb.eq("a", 1), eb.not(eb.eq("b", 2))), "a = $1 AND NOT (b = $2)"),
        row("not or inside and", eb -> eb.and(eb.not(eb.or(eb.eq("a", 1), eb.eq("b", 2))), eb.eq("c", 3)),
            "NOT (a = $1 OR b = $2) AND c = $3"),
        row("deep mix",
            eb -> eb.or(eb.and(eb.eq("a", 1), eb.not(eb.or(eb.eq("b", 2), eb.eq("c", 3)))), eb.eq("d", 4)),
            "((a = $1 AND NOT (b = $2 OR c = $3)) OR d = $4)")
    );
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource("matrix")
  void rendersWhereClause(String name, Function<ExpressionBuilder, Expression> tree, String where) {
    CompiledQuery q = PgVibe.create().selectFrom("t").where(tree).compile();
    assertEquals("SELECT * FROM t WHERE " + where, q.sql(), name);
  }
}
