package net.spookly.edgegate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ListenAddressTest {
    @Test
    void parsesHostAndPort() {
        ListenAddress address = ListenAddress.parse("127.0.0.1:9001");
        assertEquals("127.0.0.1", address.host());
        assertEquals(9001, address.port());
    }

    @Test
    void parsesBracketedIpv6() {
        ListenAddress address = ListenAddress.parse("[::1]:8000");
        assertEquals("::1", address.host());
        assertEquals("[::1]:8000", address.toString());
    }

    @Test
    void rejectsMissingPort() {
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost:http"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost:70000"));
    }
}
