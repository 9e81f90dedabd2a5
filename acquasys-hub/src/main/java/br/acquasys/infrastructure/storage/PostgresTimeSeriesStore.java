package br.acquasys.infrastructure.storage;

import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.domain.telemetry.Vibration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of TimeSeriesStore over the {@code sensor_readings} table.
 */
public final class PostgresTimeSeriesStore implements TimeSeriesStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresTimeSeriesStore.class);

    private final DataSource dataSource;

    public PostgresTimeSeriesStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(SensorReading reading) {
        String sql = """
            INSERT INTO sensor_readings (device, ts, level, temperature, current_a, flow_rate, pump_on,
                                         vibration_x, vibration_y, vibration_z, vibration_rms,
                                         runtime_ms, heap_bytes, rssi, efficiency)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Vibration v = reading.vibration();
            ps.setString(1, reading.device());
            ps.setTimestamp(2, Timestamp.from(reading.timestamp()));
            ps.setDouble(3, reading.level());
            ps.setDouble(4, reading.temperature());
            ps.setDouble(5, reading.current());
            ps.setDouble(6, reading.flowRate());
            ps.setBoolean(7, reading.pumpOn());
            ps.setDouble(8, v.x());
            ps.setDouble(9, v.y());
            ps.setDouble(10, v.z());
            ps.setDouble(11, v.rms());
            ps.setLong(12, reading.runtime());
            ps.setLong(13, reading.heap());
            ps.setInt(14, reading.rssi());
            if (reading.efficiency() != null) {
                ps.setDouble(15, reading.efficiency());
            } else {
                ps.setNull(15, Types.DOUBLE);
            }

            ps.executeUpdate();

        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to insert reading from " + reading.device(), e);
        }
    }

    @Override
    public List<SensorReading> findSince(Instant since, int limit) {
        String sql = """
            SELECT device, ts, level, temperature, current_a, flow_rate, pump_on,
                   vibration_x, vibration_y, vibration_z, vibration_rms,
                   runtime_ms, heap_bytes, rssi, efficiency
            FROM sensor_readings
            WHERE ts >= ?
            ORDER BY ts DESC
            LIMIT ?
            """;

        List<SensorReading> readings = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            ps.setInt(2, limit);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    readings.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new TimeSeriesStoreException("Failed to query readings since " + since, e);
        }
        return readings;
    }

    @Override
    public boolean ping() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.debug("[SINK] Store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private SensorReading mapRow(ResultSet rs) throws SQLException {
        double efficiency = rs.getDouble("efficiency");
        Double eff = rs.wasNull() ? null : efficiency;
        return new SensorReading(
            rs.getString("device"),
            rs.getTimestamp("ts").toInstant(),
            rs.getDouble("level"),
            rs.getDouble("temperature"),
            rs.getDouble("current_a"),
            rs.getDouble("flow_rate"),
            rs.getBoolean("pump_on"),
            new Vibration(
                rs.getDouble("vibration_x"),
                rs.getDouble("vibration_y"),
                rs.getDouble("vibration_z"),
                rs.getDouble("vibration_rms")),
            rs.getLong("runtime_ms"),
            rs.getLong("heap_bytes"),
            rs.getInt("rssi"),
            eff
        );
    }
}
