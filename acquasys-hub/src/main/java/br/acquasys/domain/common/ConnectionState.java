package br.acquasys.domain.common;

/**
 * Connection state of the device transport.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
