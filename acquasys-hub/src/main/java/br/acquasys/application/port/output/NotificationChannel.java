package br.acquasys.application.port.output;

import br.acquasys.domain.monitoring.Alert;

/**
 * Operator notification channel.
 */
public interface NotificationChannel {

    /**
     * Deliver an alert. Best effort: delivery failures are logged by the channel.
     */
    void sendAlert(Alert alert);

    boolean isEnabled();
}
