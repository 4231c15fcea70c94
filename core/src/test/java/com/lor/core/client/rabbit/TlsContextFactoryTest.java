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
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.nio.file.NoSuchFileException;
import java.security.cert.X509Certificate;

import static org.junit.jupiter.api.Assertions.*;

class TlsContextFactoryTest {

    private final TlsContextFactory factory = new TlsContextFactory();

    @Test
    void testDefaultContext() throws Exception {
        TlsOptions tls = TlsOptions.builder().enabled(true).build();

        SSLContext context = factory.createContext(tls);

        assertEquals("TLSv1.2", context.getProtocol());
        assertNull(factory.keyManagers(tls));
        assertNull(factory.trustManagers(tls));
    }

    @Test
    void testChainErrorsTrustEverything() throws Exception {
        TlsOptions tls = TlsOptions.builder()
            .enabled(true)
            .acceptablePolicyError(PolicyError.REMOTE_CERTIFICATE_CHAIN_ERRORS)
            .build();

        TrustManager[] managers = factory.trustManagers(tls);

        assertEquals(1, managers.length);
        assertInstanceOf(TrustEverythingTrustManager.class, managers[0]);
    }

    @Test
    void testValidationCallbackWins() throws Exception {
        X509TrustManager validator = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        TlsOptions tls = TlsOptions.builder()
            .enabled(true)
            .acceptablePolicyError(PolicyError.REMOTE_CERTIFICATE_CHAIN_ERRORS)
            .certificateValidator(validator)
            .build();

        TrustManager[] managers = factory.trustManagers(tls);

        assertSame(validator, managers[0]);
    }

    @Test
    void testVersion() throws Exception {
        TlsOptions tls = TlsOptions.builder().enabled(true).version("TLSv1.3").build();

        assertEquals("TLSv1.3", factory.createContext(tls).getProtocol());
    }

    @Test
    void testMissingClientCertificate() {
        TlsOptions tls = TlsOptions.builder().enabled(true).certPath("does-not-exist.p12").certPassphrase("x").build();

        assertThrows(NoSuchFileException.class, () -> factory.createContext(tls));
    }
}
