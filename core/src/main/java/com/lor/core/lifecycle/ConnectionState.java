package com.lor.core.lifecycle;

/**
 * States of the connection owned by a {@link ConnectionLifecycle}.
 * CONNECTED and FAILED both end in DISPOSED; DISPOSED is final.
 */
public enum ConnectionState {

    NONE,

    CONNECTING,

    CONNECTED,

    FAILED,

    DISPOSED
}
