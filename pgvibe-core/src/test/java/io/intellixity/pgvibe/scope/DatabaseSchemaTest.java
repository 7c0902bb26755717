package io.intellixity.pgvibe.scope;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseSchemaTest {
  @Test
  void loadsTablesAndTypesFromJson() throws Exception {
    DatabaseSchema s;
    try (InputStream in = getClass().getResourceAsStream("/schema.json")) {
      s = DatabaseSchema.fromJson(in);
    }
    assertEquals(java.util.Set.of("users", "posts"), s.tableNames());
    assertTrue(s.hasColumn("posts", "user_id"));
    assertFalse(s.hasColumn("posts", "email"));
    assertEquals("jsonb", s.columnType("users", "metadata").orElseThrow());
    assertTrue(s.columnType("nope", "id").isEmpty());
  }

  @Test
  void builderTrimsTypes() {
    DatabaseSchema s = DatabaseSchema.builder().column("t", "c", " uuid ").table("empty").build();
    assertEquals("uuid", s.columnType("t", "c").orElseThrow());
    assertTrue(s.hasTable("empty"));
  }

  @Test
  void rejectsJsonWithoutTables() {
    InputStream in = new ByteArrayInputStream("{\"columns\":{}}".getBytes(StandardCharsets.UTF_8));
    assertThrows(IllegalArgumentException.class, () -> DatabaseSchema.fromJson(in));
  }

  @Test
  void rejectsNonObjectColumns() {
    InputStream in = new ByteArrayInputStream("{\"tables\":{\"t\":[\"a\"]}}".getBytes(StandardCharsets.UTF_8));
    assertThrows(IllegalArgumentException.class, () -> DatabaseSchema.fromJson(in));
  }
}
