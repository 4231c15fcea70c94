package com.lor.meta.connection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TlsOptionsTest {

    @Test
    void testDisabledOptionsAreNotResolved() {
        TlsOptions disabled = TlsOptions.disabled();

        assertSame(disabled, disabled.resolveFor("rabbit-1"));
        assertNull(disabled.getServerName());
    }

    @Test
    void testExplicitServerNameWins() {
        TlsOptions tls = TlsOptions.builder().enabled(true).serverName("rabbit.example.com").build();

        assertEquals("rabbit.example.com", tls.resolveFor("10.0.0.1").getServerName());
    }

    @Test
    void testVersionDefault() {
        assertEquals("TLSv1.2", TlsOptions.builder().enabled(true).build().getVersionOrDefault());
        assertEquals("TLSv1.3", TlsOptions.builder().enabled(true).version("TLSv1.3").build().getVersionOrDefault());
    }

    @Test
    void testUnresolvedTlsFailsValidation() {
        TlsOptions tls = TlsOptions.builder().enabled(true).build();
        ConnectionDescriptor descriptor = ConnectionDescriptor.builder()
            .host(new HostEntry("rabbit-1", 5671, tls))
            .port(5671)
            .tls(tls)
            .build();

        assertThrows(IllegalArgumentException.class, descriptor::validate);
    }
}
