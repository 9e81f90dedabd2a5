package br.acquasys.infrastructure.mqtt;

/**
 * Exception thrown when the device transport cannot connect, subscribe or publish.
 */
public class TransportConnectionException extends RuntimeException {

    private final String brokerUri;

    public TransportConnectionException(String brokerUri, String message) {
        super(String.format("[%s] %s", brokerUri, message));
        this.brokerUri = brokerUri;
    }

    public TransportConnectionException(String brokerUri, String message, Throwable cause) {
        super(String.format("[%s] %s", brokerUri, message), cause);
        this.brokerUri = brokerUri;
    }

    public String getBrokerUri() {
        return brokerUri;
    }
}
