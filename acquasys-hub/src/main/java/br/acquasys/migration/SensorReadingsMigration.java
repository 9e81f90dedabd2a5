package br.acquasys.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the {@code sensor_readings} table and its time index on startup.
 */
public final class SensorReadingsMigration {
    private static final Logger log = LoggerFactory.getLogger(SensorReadingsMigration.class);

    static final String TABLE = "sensor_readings";

    private final DataSource dataSource;

    public SensorReadingsMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return true if the schema is in place, false if the database was unreachable
     */
    public boolean migrate() {
        log.info("[MIGRATION] Checking {} table", TABLE);

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE)) {
                log.info("[MIGRATION] {} table already exists", TABLE);
                return true;
            }
            log.info("[MIGRATION] Creating {} table...", TABLE);
            createTable(conn);
            log.info("[MIGRATION] ✓ {} table created", TABLE);
            return true;
        } catch (SQLException e) {
            log.error("[MIGRATION] Schema check failed, history will be served from memory: {}", e.getMessage());
            return false;
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE IF NOT EXISTS sensor_readings (
                id BIGSERIAL PRIMARY KEY,
                device VARCHAR(64) NOT NULL,
                ts TIMESTAMPTZ NOT NULL,
                level DOUBLE PRECISION NOT NULL,
                temperature DOUBLE PRECISION NOT NULL,
                current_a DOUBLE PRECISION NOT NULL,
                flow_rate DOUBLE PRECISION NOT NULL,
                pump_on BOOLEAN NOT NULL,
                vibration_x DOUBLE PRECISION NOT NULL,
                vibration_y DOUBLE PRECISION NOT NULL,
                vibration_z DOUBLE PRECISION NOT NULL,
                vibration_rms DOUBLE PRECISION NOT NULL,
                runtime_ms BIGINT NOT NULL,
                heap_bytes BIGINT NOT NULL,
                rssi INT NOT NULL,
                efficiency DOUBLE PRECISION
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_sensor_readings_ts ON sensor_readings (ts DESC)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_sensor_readings_device_ts ON sensor_readings (device, ts DESC)");
        }
    }
}
