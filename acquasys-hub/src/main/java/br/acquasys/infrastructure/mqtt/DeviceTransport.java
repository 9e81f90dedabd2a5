package br.acquasys.infrastructure.mqtt;

import java.util.List;

/**
 * Minimal publish/subscribe transport to the device broker.
 *
 * Implementations do not reconnect on their own; {@link TelemetryIngressAdapter} owns the
 * reconnection policy.
 */
public interface DeviceTransport {

    /**
     * Callbacks from the transport's I/O thread.
     */
    interface Listener {

        void onMessage(String topic, String payload);

        void onConnectionLost(Throwable cause);
    }

    void setListener(Listener listener);

    /**
     * Blocking connect.
     *
     * @throws TransportConnectionException if the broker is unreachable or rejects the session
     */
    void connect();

    /**
     * Subscribe to the given topics at QoS 1.
     *
     * @throws TransportConnectionException if the subscription fails
     */
    void subscribe(List<String> topics);

    /**
     * Publish a UTF-8 payload.
     *
     * @throws TransportConnectionException if the message could not be handed to the broker
     */
    void publish(String topic, String payload, int qos);

    boolean isConnected();

    /**
     * Disconnect and release the client. Safe to call more than once.
     */
    void close();

    String describe();
}
