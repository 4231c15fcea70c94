/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lor.meta.connection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.net.ssl.X509KeyManager;
import javax.net.ssl.X509TrustManager;
import java.util.List;
import java.util.Set;

/**
 * TLS settings shared by every host of a connection.
 */
@Value
@Builder(toBuilder = true)
public class TlsOptions {

    public static final String DEFAULT_VERSION = "TLSv1.2";

    private static final TlsOptions DISABLED = TlsOptions.builder().enabled(false).build();

    boolean enabled;

    /**
     * Name expected on the server certificate, sent as SNI when set explicitly
     */
    String serverName;

    /**
     * PKCS#12 file holding the client certificate and key
     */
    String certPath;

    String certPassphrase;

    @Singular
    Set<PolicyError> acceptablePolicyErrors;

    String version;

    /**
     * Additional X.509 certificate files to trust
     */
    @Singular
    List<String> certificatePaths;

    /**
     * Chooses the client certificate, replaces {@link #certPath} when set
     */
    X509KeyManager certificateSelector;

    /**
     * Validates the server certificate chain, replaces the default trust when set
     */
    X509TrustManager certificateValidator;

    public static TlsOptions disabled() {
        return DISABLED;
    }

    public boolean isAcceptable(PolicyError error) {
        return acceptablePolicyErrors.contains(error);
    }

    public String getVersionOrDefault() {
        return version == null || version.isEmpty() ? DEFAULT_VERSION : version;
    }

    /**
     * Resolves the options for one host: the server name defaults to the host name.
     */
    public TlsOptions resolveFor(String host) {
        if (!enabled || (serverName != null && !serverName.isEmpty())) {
            return this;
        }
        return toBuilder().serverName(host).build();
    }
}
