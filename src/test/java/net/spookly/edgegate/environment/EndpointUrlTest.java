package net.spookly.edgegate.environment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EndpointUrlTest {
    @Test
    void parsesLocalSocket() {
        EndpointUrl url = EndpointUrl.parse("unix:///var/run/docker.sock");
        assertEquals(EndpointUrl.Scheme.UNIX, url.scheme());
        assertEquals("/var/run/docker.sock", url.path());
        assertEquals("localhost", url.hostHeader());
        assertTrue(url.isLocalSocket());
    }

    @Test
    void parsesHttpsWithDefaultPortAndBasePath() {
        EndpointUrl url = EndpointUrl.parse("https://k8s.internal/api-proxy/");
        assertEquals(443, url.port());
        assertEquals("/api-proxy", url.path());
        assertEquals("k8s.internal", url.hostHeader());
        assertFalse(url.isLocalSocket());
    }

    @Test
    void bareHostPortIsTcp() {
        EndpointUrl url = EndpointUrl.parse("10.0.0.5:2375");
        assertEquals(EndpointUrl.Scheme.TCP, url.scheme());
        assertEquals("10.0.0.5:2375", url.hostHeader());
    }

    @Test
    void rejectsUnsupportedProtocolAndMissingPort() {
        assertThrows(IllegalArgumentException.class, () -> EndpointUrl.parse("ftp://host:21"));
        assertThrows(IllegalArgumentException.class, () -> EndpointUrl.parse("tcp://host"));
        assertThrows(IllegalArgumentException.class, () -> EndpointUrl.parse("unix://"));
    }

    @Test
    void kindsAcceptMatchingSchemes() {
        assertTrue(EnvironmentKind.DOCKER_SOCKET.accepts(EndpointUrl.Scheme.UNIX));
        assertFalse(EnvironmentKind.DOCKER_SOCKET.accepts(EndpointUrl.Scheme.HTTPS));
        assertTrue(EnvironmentKind.KUBERNETES_HTTP.accepts(EndpointUrl.Scheme.HTTPS));
        assertEquals(EnvironmentKind.KUBERNETES_EDGE, EnvironmentKind.fromConfig("KUBERNETES_EDGE"));
        assertThrows(IllegalArgumentException.class, () -> EnvironmentKind.fromConfig("nomad"));
    }
}
