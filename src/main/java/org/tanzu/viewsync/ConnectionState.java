package org.tanzu.viewsync;

/**
 * Lifecycle of a viewer push channel. {@link #CLOSED} is terminal; reconnecting creates a new connection.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}
