package net.spookly.edgegate.util;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetAddress;
import java.util.List;

import org.junit.jupiter.api.Test;

class CidrMatcherTest {
    @Test
    void matchesAllowedNetworks() throws Exception {
        CidrMatcher matcher = CidrMatcher.from(List.of("10.0.0.0/8", "192.168.1.0/24"));
        assertTrue(matcher.isAllowed(InetAddress.getByName("10.1.2.3")));
        assertTrue(matcher.isAllowed(InetAddress.getByName("192.168.1.42")));
        assertFalse(matcher.isAllowed(InetAddress.getByName("172.16.0.1")));
    }

    @Test
    void emptyListAllowsEveryAddress() throws Exception {
        CidrMatcher matcher = CidrMatcher.from(List.of());
        assertTrue(matcher.isUnrestricted());
        assertTrue(matcher.isAllowed(InetAddress.getByName("203.0.113.9")));
    }

    @Test
    void rejectsMalformedCidr() {
        assertThrows(IllegalArgumentException.class, () -> CidrMatcher.from(List.of("10.0.0.0/40")));
    }
}
