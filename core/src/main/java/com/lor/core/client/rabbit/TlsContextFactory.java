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
package com.lor.core.client.rabbit;

import com.lor.meta.connection.PolicyError;
import com.lor.meta.connection.TlsOptions;
import com.rabbitmq.client.TrustEverythingTrustManager;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

/**
 * Builds the SSL context of a TLS connection from {@link TlsOptions}.
 */
public class TlsContextFactory {

    static final String KEYSTORE_TYPE = "PKCS12";

    /**
     * @throws GeneralSecurityException if the key material or the trusted certificates cannot be used
     * @throws IOException if a certificate file cannot be read
     */
    public SSLContext createContext(TlsOptions tls) throws GeneralSecurityException, IOException {
        SSLContext context = SSLContext.getInstance(tls.getVersionOrDefault());
        context.init(keyManagers(tls), trustManagers(tls), null);
        return context;
    }

    KeyManager[] keyManagers(TlsOptions tls) throws GeneralSecurityException, IOException {
        if (tls.getCertificateSelector() != null) {
            return new KeyManager[] {tls.getCertificateSelector()};
        }
        if (tls.getCertPath() == null || tls.getCertPath().isEmpty()) {
            return null;
        }
        char[] passphrase = tls.getCertPassphrase() == null ? new char[0] : tls.getCertPassphrase().toCharArray();
        KeyStore keyStore = KeyStore.getInstance(KEYSTORE_TYPE);
        try (InputStream in = Files.newInputStream(Paths.get(tls.getCertPath()))) {
            keyStore.load(in, passphrase);
        }
        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore, passphrase);
        return factory.getKeyManagers();
    }

    TrustManager[] trustManagers(TlsOptions tls) throws GeneralSecurityException, IOException {
        if (tls.getCertificateValidator() != null) {
            return new TrustManager[] {tls.getCertificateValidator()};
        }
        if (tls.isAcceptable(PolicyError.REMOTE_CERTIFICATE_CHAIN_ERRORS)
            || tls.isAcceptable(PolicyError.REMOTE_CERTIFICATE_NOT_AVAILABLE)) {
            return new TrustManager[] {new TrustEverythingTrustManager()};
        }
        if (tls.getCertificatePaths().isEmpty()) {
            return null;
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        int index = 0;
        for (X509Certificate accepted : defaultTrustManager().getAcceptedIssuers()) {
            trustStore.setCertificateEntry("default-" + index++, accepted);
        }
        CertificateFactory certificates = CertificateFactory.getInstance("X.509");
        for (String path : tls.getCertificatePaths()) {
            try (InputStream in = Files.newInputStream(Paths.get(path))) {
                for (Certificate certificate : certificates.generateCertificates(in)) {
                    trustStore.setCertificateEntry("configured-" + index++, certificate);
                }
            }
        }
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(trustStore);
        return factory.getTrustManagers();
    }

    private static X509TrustManager defaultTrustManager() throws GeneralSecurityException {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init((KeyStore) null);
        for (TrustManager manager : factory.getTrustManagers()) {
            if (manager instanceof X509TrustManager) {
                return (X509TrustManager) manager;
            }
        }
        throw new GeneralSecurityException("no default X.509 trust manager");
    }
}
