package br.acquasys.application.orchestration;

import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.util.Html;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds the status projection and its chat rendering (Telegram HTML subset).
 */
public final class StatusReportFormatter {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy, HH:mm:ss");

    public static final String OFFLINE_REPORT =
        "❌ <b>System offline</b>\nNo recent data from the pump controller.";

    private final ZoneId zone;

    public StatusReportFormatter(ZoneId zone) {
        this.zone = zone;
    }

    public StatusSnapshot snapshot(SensorReading latest, ConnectionState transport, boolean storeDegraded,
                                   boolean autoMode, double efficiency, Instant now) {
        String mode = modeLabel(autoMode);
        String updatedAt = TIMESTAMP.format(now.atZone(zone));
        if (latest == null) {
            return StatusSnapshot.offline(transport.name(), storeDegraded, mode, updatedAt);
        }

        long uptime = latest.runtime() / 1000;
        return new StatusSnapshot(
            true,
            transport.name(),
            storeDegraded,
            latest.device(),
            latest.level(),
            latest.temperature(),
            latest.current(),
            latest.vibration().rms(),
            latest.pumpOn(),
            mode,
            efficiency,
            uptime / 60,
            uptime % 60,
            Math.round(latest.heap() / 1024.0),
            latest.rssi(),
            updatedAt
        );
    }

    public String render(StatusSnapshot s) {
        if (!s.online()) {
            return OFFLINE_REPORT;
        }
        boolean connected = ConnectionState.CONNECTED.name().equals(s.transport());

        StringBuilder sb = new StringBuilder();
        sb.append("📊 <b>AcquaSys System Status</b>\n\n");

        sb.append("📡 <b>Connectivity:</b>\n");
        sb.append("• MQTT: ").append(connected ? "🟢 Connected" : "🔴 " + s.transport()).append('\n');
        sb.append("• Device: 🟢 Online (").append(Html.escape(s.device())).append(")\n");
        if (s.storeDegraded()) {
            sb.append("• History: 🟡 in-memory only\n");
        }
        sb.append('\n');

        sb.append("💧 <b>Sensors:</b>\n");
        sb.append(fmt("• Level: %.1f%%\n", s.level()));
        sb.append(fmt("• Temperature: %.1f°C\n", s.temperature()));
        sb.append(fmt("• Current: %.2fA\n", s.current()));
        sb.append(fmt("• Vibration: %.3fG\n\n", s.vibrationRms()));

        sb.append("🚰 <b>Pump:</b>\n");
        sb.append("• Status: ").append(Boolean.TRUE.equals(s.pumpOn()) ? "🟢 ON" : "🔴 OFF").append('\n');
        sb.append("• Mode: ").append(s.mode()).append('\n');
        sb.append(fmt("• Efficiency: %.1f%%\n\n", s.efficiency()));

        sb.append("🖥️ <b>Controller:</b>\n");
        sb.append("• Uptime: ").append(s.uptimeMinutes()).append("min ").append(s.uptimeSeconds()).append("s\n");
        sb.append("• Free memory: ").append(s.freeMemoryKb()).append("KB\n");
        sb.append("• WiFi: ").append(s.rssi()).append("dBm\n\n");

        sb.append("🕐 <b>Last update:</b> ").append(s.updatedAt());
        return sb.toString();
    }

    static String modeLabel(boolean autoMode) {
        return autoMode ? "Automatic" : "Manual";
    }

    private static String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
