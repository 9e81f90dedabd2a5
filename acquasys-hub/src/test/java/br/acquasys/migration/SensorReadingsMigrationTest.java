package br.acquasys.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SensorReadingsMigrationTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private DatabaseMetaData metadata;
    @Mock
    private ResultSet tables;
    @Mock
    private Statement statement;

    private SensorReadingsMigration migration;

    @BeforeEach
    void setUp() {
        migration = new SensorReadingsMigration(dataSource);
    }

    private void givenTableLookup(boolean exists) throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metadata);
        when(metadata.getTables(isNull(), isNull(), eq("sensor_readings"), any())).thenReturn(tables);
        when(tables.next()).thenReturn(exists);
    }

    @Test
    void createsTableAndIndexesWhenMissing() throws Exception {
        givenTableLookup(false);
        when(connection.createStatement()).thenReturn(statement);

        assertTrue(migration.migrate());

        verify(statement).execute(contains("CREATE TABLE IF NOT EXISTS sensor_readings"));
        verify(statement).execute(contains("idx_sensor_readings_ts"));
        verify(statement).execute(contains("idx_sensor_readings_device_ts"));
    }

    @Test
    void leavesExistingTableAlone() throws Exception {
        givenTableLookup(true);

        assertTrue(migration.migrate());

        verify(connection, never()).createStatement();
    }

    @Test
    void unreachableDatabaseReportsFalse() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        assertFalse(migration.migrate());
    }
}
