package reaper.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import reaper.jdbc.store.AbstractJdbcReplicaStore;
import reaper.jdbc.store.H2ReplicaStore;

import javax.sql.DataSource;

class H2ReplicaStoreIntegrationTest extends AbstractReplicaStoreIntegrationTest {

  private static final H2ReplicaStore STORE = new H2ReplicaStore();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = Schemas.h2();
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcReplicaStore store() {
    return STORE;
  }
}
