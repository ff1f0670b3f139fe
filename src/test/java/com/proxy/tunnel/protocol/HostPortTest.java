package com.proxy.tunnel.protocol;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostPortTest {

    @Test
    void parsesHostName() {
        HostPort hostPort = HostPort.parse("example.com:443");

        assertEquals("example.com", hostPort.getHost());
        assertEquals(443, hostPort.getPort());
        assertEquals("example.com:443", hostPort.toString());
    }

    @Test
    void parsesIpv4() {
        HostPort hostPort = HostPort.parse("192.0.2.1:8443");

        assertEquals("192.0.2.1", hostPort.getHost());
        assertEquals(8443, hostPort.getPort());
    }

    @Test
    void parsesBracketedIpv6() {
        HostPort hostPort = HostPort.parse("[2001:db8::1]:443");

        assertEquals("2001:db8::1", hostPort.getHost());
        assertEquals(443, hostPort.getPort());
        assertEquals("[2001:db8::1]:443", hostPort.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "example.com", ":443", "example.com:", "example.com:0", "example.com:65536",
            "example.com:https", "2001:db8::1:443", "[2001:db8::1]", "[2001:db8::1]443"})
    void rejectsInvalidAuthorities(String authority) {
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse(authority));
    }
}
