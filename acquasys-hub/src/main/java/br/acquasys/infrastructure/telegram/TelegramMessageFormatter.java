package br.acquasys.infrastructure.telegram;

import br.acquasys.domain.monitoring.Alert;
import br.acquasys.util.Html;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders alerts in Telegram's HTML subset.
 */
final class TelegramMessageFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy, HH:mm:ss");

    private final ZoneId zone;

    TelegramMessageFormatter(ZoneId zone) {
        this.zone = zone;
    }

    String formatAlert(Alert alert) {
        String icon = switch (alert.getLevel()) {
            case CRITICAL -> "🚨";
            case WARNING -> "⚠️";
            case INFO -> "ℹ️";
        };

        StringBuilder sb = new StringBuilder();
        sb.append(icon).append(" <b>AcquaSys Alert</b>\n\n");
        sb.append("📍 <b>Device:</b> ").append(Html.escape(alert.getDevice())).append('\n');
        if (alert.getWaterLevel() != null) {
            sb.append(String.format(Locale.ROOT, "💧 <b>Level:</b> %.1f%%\n", alert.getWaterLevel()));
        }
        if (alert.getCurrent() != null) {
            sb.append(String.format(Locale.ROOT, "⚡ <b>Current:</b> %.2fA\n", alert.getCurrent()));
        }
        if (alert.getVibrationRms() != null) {
            sb.append(String.format(Locale.ROOT, "📳 <b>Vibration:</b> %.3fG\n", alert.getVibrationRms()));
        }
        if (alert.getPumpOn() != null) {
            boolean on = alert.getPumpOn();
            sb.append(on ? "🟢" : "🔴").append(" <b>Pump:</b> ").append(on ? "ON" : "OFF").append('\n');
        }
        sb.append('\n');
        sb.append("📝 <b>Message:</b> ").append(Html.escape(alert.getMessage())).append('\n');
        sb.append("🕐 <b>Time:</b> ").append(TIMESTAMP.format(alert.getTimestamp().atZone(zone)));
        return sb.toString();
    }
}
