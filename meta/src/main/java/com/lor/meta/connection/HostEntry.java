package com.lor.meta.connection;

import lombok.Value;

/**
 * One broker address of a connection. Hosts are tried in order.
 */
@Value
public class HostEntry {

    String host;

    int port;

    TlsOptions tls;
}
