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
package com.lor.core.config;

import com.lor.meta.connection.PolicyError;
import com.lor.meta.connection.TlsOptions;
import lombok.Data;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Node;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.status.StatusLogger;

import javax.net.ssl.X509KeyManager;
import javax.net.ssl.X509TrustManager;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * TLS settings of the broker connection.
 * <pre>
 * &lt;AmqpSsl enabled="true" serverName="rabbit.example.com" certPath="client.p12" certPassphrase="changeit"
 *      acceptablePolicyErrors="RemoteCertificateNameMismatch" version="TLSv1.3"/&gt;
 * </pre>
 */
@Data
@Plugin(name = "AmqpSsl", category = Node.CATEGORY, printObject = true)
public class SslProperties {

    private static final Logger LOGGER = StatusLogger.getLogger();

    private boolean enabled;

    private String serverName;

    private String certPath;

    private String certPassphrase;

    private Set<PolicyError> acceptablePolicyErrors = EnumSet.noneOf(PolicyError.class);

    private String version;

    private List<String> certificates = new ArrayList<>();

    private X509KeyManager certificateSelector;

    private X509TrustManager certificateValidator;

    @PluginFactory
    public static SslProperties createSsl(
        @PluginAttribute("enabled") boolean enabled,
        @PluginAttribute("serverName") String serverName,
        @PluginAttribute("certPath") String certPath,
        @PluginAttribute(value = "certPassphrase", sensitive = true) String certPassphrase,
        @PluginAttribute("acceptablePolicyErrors") String acceptablePolicyErrors,
        @PluginAttribute("version") String version,
        @PluginAttribute("certificates") String certificates
    ) {
        SslProperties ssl = new SslProperties();
        ssl.setEnabled(enabled);
        ssl.setServerName(serverName);
        ssl.setCertPath(certPath);
        ssl.setCertPassphrase(certPassphrase);
        ssl.setAcceptablePolicyErrors(parsePolicyErrors(acceptablePolicyErrors));
        ssl.setVersion(version);
        ssl.setCertificates(splitList(certificates));
        return ssl;
    }

    /**
     * Parses a comma separated list of policy errors. Both {@code REMOTE_CERTIFICATE_NAME_MISMATCH}
     * and {@code RemoteCertificateNameMismatch} are accepted; unknown names are skipped.
     */
    static Set<PolicyError> parsePolicyErrors(String value) {
        Set<PolicyError> errors = EnumSet.noneOf(PolicyError.class);
        for (String name : splitList(value)) {
            PolicyError error = parsePolicyError(name);
            if (error == null) {
                LOGGER.warn("ignoring unknown TLS policy error {}", name);
            } else {
                errors.add(error);
            }
        }
        return errors;
    }

    private static PolicyError parsePolicyError(String name) {
        String normalized = name.replace("_", "").toUpperCase(Locale.ROOT);
        for (PolicyError error : PolicyError.values()) {
            if (error.name().replace("_", "").equals(normalized)) {
                return error;
            }
        }
        return null;
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    public TlsOptions toTlsOptions() {
        if (!enabled) {
            return TlsOptions.disabled();
        }
        return TlsOptions.builder()
            .enabled(true)
            .serverName(serverName)
            .certPath(certPath)
            .certPassphrase(certPassphrase)
            .acceptablePolicyErrors(acceptablePolicyErrors)
            .version(version)
            .certificatePaths(certificates)
            .certificateSelector(certificateSelector)
            .certificateValidator(certificateValidator)
            .build();
    }
}
