package io.intellixity.pgvibe.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings read from a properties file.
 *
 * <pre>
 * pgvibe.jdbc.url=jdbc:postgresql://localhost:5432/app
 * pgvibe.jdbc.username=app
 * pgvibe.jdbc.password=secret
 * pgvibe.jdbc.schema=public
 * pgvibe.jdbc.pool.maximumSize=10
 * pgvibe.jdbc.pool.connectionTimeoutMs=30000
 * </pre>
 */
public record PgVibeJdbcSettings(
    String url,
    String username,
    String password,
    String schema,
    int maximumPoolSize,
    long connectionTimeoutMs
) {
  public static final String RESOURCE = "pgvibe.properties";
  public static final String PREFIX = "pgvibe.jdbc.";

  public static final String DEFAULT_SCHEMA = "public";
  public static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000L;

  public PgVibeJdbcSettings {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Missing required property " + PREFIX + "url");
    }
    schema = (schema == null || schema.isBlank()) ? DEFAULT_SCHEMA : schema;
    if (maximumPoolSize < 1) throw new IllegalArgumentException(PREFIX + "pool.maximumSize must be >= 1");
    if (connectionTimeoutMs < 250) throw new IllegalArgumentException(PREFIX + "pool.connectionTimeoutMs must be >= 250");
  }

  public static PgVibeJdbcSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    return new PgVibeJdbcSettings(
        trimmed(p, "url"),
        trimmed(p, "username"),
        p.getProperty(PREFIX + "password"),
        trimmed(p, "schema"),
        intProperty(p, "pool.maximumSize", DEFAULT_MAXIMUM_POOL_SIZE),
        longProperty(p, "pool.connectionTimeoutMs", DEFAULT_CONNECTION_TIMEOUT_MS)
    );
  }

  /** Loads {@value #RESOURCE} from the context class loader. */
  public static PgVibeJdbcSettings load() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = PgVibeJdbcSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) throw new IllegalStateException("Classpath resource " + RESOURCE + " not found");
      Properties p = new Properties();
      p.load(in);
      return fromProperties(p);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
  }

  public static PgVibeJdbcSettings load(Path file) throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Properties p = new Properties();
      p.load(r);
      return fromProperties(p);
    }
  }

  @Override
  public String toString() {
    return "PgVibeJdbcSettings[url=" + url + ", username=" + username + ", password=****, schema=" + schema +
        ", maximumPoolSize=" + maximumPoolSize + ", connectionTimeoutMs=" + connectionTimeoutMs + "]";
  }

  private static String trimmed(Properties p, String key) {
    String v = p.getProperty(PREFIX + key);
    return v == null ? null : v.trim();
  }

  private static int intProperty(Properties p, String key, int def) {
    String v = trimmed(p, key);
    if (v == null || v.isEmpty()) return def;
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + PREFIX + key + " must be an integer, got '" + v + "'", e);
    }
  }

  private static long longProperty(Properties p, String key, long def) {
    String v = trimmed(p, key);
    if (v == null || v.isEmpty()) return def;
    try {
      return Long.parseLong(v);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + PREFIX + key + " must be an integer, got '" + v + "'", e);
    }
  }
}
