package io.intellixity.pgvibe.jdbc;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class PgVibeJdbcSettingsTest {
  private static Properties props(String... kv) {
    Properties p = new Properties();
    for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
    return p;
  }

  @Test
  void appliesDefaults() {
    PgVibeJdbcSettings s = PgVibeJdbcSettings.fromProperties(props("pgvibe.jdbc.url", " jdbc:postgresql://db/app "));
    assertEquals("jdbc:postgresql://db/app", s.url());
    assertNull(s.username());
    assertEquals("public", s.schema());
    assertEquals(10, s.maximumPoolSize());
    assertEquals(30_000L, s.connectionTimeoutMs());
  }

  @Test
  void urlIsRequired() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PgVibeJdbcSettings.fromProperties(props("pgvibe.jdbc.username", "x")));
    assertTrue(ex.getMessage().contains("pgvibe.jdbc.url"));
  }

  @Test
  void rejectsBadNumbers() {
    assertThrows(IllegalArgumentException.class, () -> PgVibeJdbcSettings.fromProperties(
        props("pgvibe.jdbc.url", "jdbc:postgresql://db/app", "pgvibe.jdbc.pool.maximumSize", "many")));
    assertThrows(IllegalArgumentException.class, () -> PgVibeJdbcSettings.fromProperties(
        props("pgvibe.jdbc.url", "jdbc:postgresql://db/app", "pgvibe.jdbc.pool.maximumSize", "0")));
  }

  @Test
  void loadsClasspathResource() {
    PgVibeJdbcSettings s = PgVibeJdbcSettings.load();
    assertEquals("jdbc:postgresql://localhost:5432/pgvibe_test", s.url());
    assertEquals("pgvibe", s.username());
    assertEquals("secret", s.password());
    assertEquals("app", s.schema());
    assertEquals(4, s.maximumPoolSize());
  }

  @Test
  void loadsFile() throws Exception {
    Path f = Files.createTempFile("pgvibe", ".properties");
    try {
      Files.writeString(f, "pgvibe.jdbc.url=jdbc:postgresql://h/db\npgvibe.jdbc.pool.connectionTimeoutMs=1500\n");
      PgVibeJdbcSettings s = PgVibeJdbcSettings.load(f);
      assertEquals(1500L, s.connectionTimeoutMs());
    } finally {
      Files.deleteIfExists(f);
    }
  }

  @Test
  void toStringMasksPassword() {
    PgVibeJdbcSettings s = new PgVibeJdbcSettings("jdbc:postgresql://h/db", "u", "hunter2", null, 2, 1000);
    assertFalse(s.toString().contains("hunter2"));
  }
}
