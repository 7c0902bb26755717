package io.intellixity.pgvibe.query;

public enum Clause {
  AND(" AND ", "true"),
  OR(" OR ", "false");

  private final String separator;
  private final String emptyLiteral;

  Clause(String separator, String emptyLiteral) {
    this.separator = separator;
    this.emptyLiteral = emptyLiteral;
  }

  public String separator() { return separator; }

  /** Identity element rendered for a group without children. */
  public String emptyLiteral() { return emptyLiteral; }
}
