package io.intellixity.pgvibe.query;

import java.util.Objects;

/**
 * Raised when a query under construction references invalid identifiers or operands.
 * <p>
 * Thrown synchronously by the builder method or by compilation; never deferred to execution.
 */
public final class QueryValidationException extends RuntimeException {
  public enum Kind {
    /** Bad table/column/alias syntax. */
    MALFORMED_EXPRESSION,
    DUPLICATE_ALIAS,
    /** An aliased table was qualified by its original name. */
    ALIAS_EXCLUSIVITY_VIOLATION,
    UNRESOLVED_COLUMN,
    AMBIGUOUS_COLUMN,
    /** Operand shape does not fit the operator. */
    INVALID_OPERAND,
    EMPTY_IDENTIFIER
  }

  private final Kind kind;

  public QueryValidationException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public QueryValidationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() { return kind; }
}
