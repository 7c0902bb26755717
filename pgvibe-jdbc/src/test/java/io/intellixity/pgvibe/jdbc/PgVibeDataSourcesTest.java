package io.intellixity.pgvibe.jdbc;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.pgvibe.PgVibe;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.*;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

final class PgVibeDataSourcesTest {
  @Test
  void mapsSettingsToHikariConfig() {
    PgVibeJdbcSettings s = new PgVibeJdbcSettings("jdbc:postgresql://h/db", "u", "p", "app", 3, 2500);
    HikariConfig hc = PgVibeDataSources.toHikariConfig(s);
    assertEquals("jdbc:postgresql://h/db", hc.getJdbcUrl());
    assertEquals("u", hc.getUsername());
    assertEquals("p", hc.getPassword());
    assertEquals("app", hc.getSchema());
    assertEquals(3, hc.getMaximumPoolSize());
    assertEquals(2500L, hc.getConnectionTimeout());
    assertEquals("pgvibe", hc.getPoolName());
  }

  @Test
  void connectedEntryPointRunsQueries() throws SQLException {
    DataSource dataSource = mock(DataSource.class);
    Connection connection = mock(Connection.class);
    PreparedStatement statement = mock(PreparedStatement.class);
    ResultSet resultSet = mock(ResultSet.class);
    ResultSetMetaData metaData = mock(ResultSetMetaData.class);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.getMetaData()).thenReturn(metaData);
    when(metaData.getColumnCount()).thenReturn(2);
    when(metaData.getColumnLabel(1)).thenReturn("id");
    when(metaData.getColumnLabel(2)).thenReturn("name");
    when(resultSet.next()).thenReturn(true, false);
    when(resultSet.getObject(1)).thenReturn(42);
    when(resultSet.getObject(2)).thenReturn("Ann");

    PgVibe db = PgVibeDataSources.connect(dataSource, null);
    List<Map<String, Object>> rows = db.selectFrom("users").select("id", "name").where("id", "=", 42).execute();

    verify(connection).prepareStatement("SELECT id, name FROM users WHERE id = ?");
    verify(statement).setObject(1, 42);
    assertEquals(List.of(Map.of("id", 42, "name", "Ann")), rows);
  }
}
