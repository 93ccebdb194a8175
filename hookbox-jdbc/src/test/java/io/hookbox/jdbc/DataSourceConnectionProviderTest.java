package io.hookbox.jdbc;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void opensConnectionsFromDataSource() throws Exception {
    DataSource ds = Databases.h2("data_source_provider_test");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    assertSame(ds, provider.dataSource());
    try (Connection conn = provider.getConnection()) {
      assertFalse(conn.isClosed());
      assertTrue(conn.getMetaData().getURL().startsWith("jdbc:h2:mem:data_source_provider_test"));
    }
  }

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
