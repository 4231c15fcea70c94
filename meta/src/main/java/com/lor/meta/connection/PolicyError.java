package com.lor.meta.connection;

/**
 * Certificate problems a TLS connection may be told to tolerate.
 */
public enum PolicyError {

    REMOTE_CERTIFICATE_NOT_AVAILABLE,

    REMOTE_CERTIFICATE_NAME_MISMATCH,

    REMOTE_CERTIFICATE_CHAIN_ERRORS
}
