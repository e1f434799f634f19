package net.spookly.edgegate.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.spookly.edgegate.environment.ApiFamily;
import org.junit.jupiter.api.Test;

class ApiPathTest {

    @Test
    void parsesDockerRouteWithQuery() {
        ApiPath path = ApiPath.parse("/api/endpoints/edge-1/docker/containers/json?all=1").orElseThrow();

        assertEquals("edge-1", path.environmentId());
        assertEquals(ApiFamily.DOCKER, path.family());
        assertEquals("/containers/json?all=1", path.forwardPath());
    }

    @Test
    void parsesKubernetesRoute() {
        ApiPath path = ApiPath.parse("/api/endpoints/k8s/kubernetes/api/v1/namespaces").orElseThrow();

        assertEquals(ApiFamily.KUBERNETES, path.family());
        assertEquals("/api/v1/namespaces", path.forwardPath());
    }

    @Test
    void familyRootForwardsSlash() {
        assertEquals("/", ApiPath.parse("/api/endpoints/edge-1/docker").orElseThrow().forwardPath());
        assertEquals("/?x=1", ApiPath.parse("/api/endpoints/edge-1/docker?x=1").orElseThrow().forwardPath());
    }

    @Test
    void decodesEnvironmentId() {
        assertEquals("prod east", ApiPath.parse("/api/endpoints/prod%20east/docker/info").orElseThrow().environmentId());
    }

    @Test
    void rejectsUnknownShapes() {
        assertTrue(ApiPath.parse(null).isEmpty());
        assertTrue(ApiPath.parse("/v1.43/containers/json").isEmpty());
        assertTrue(ApiPath.parse("/api/endpoints/").isEmpty());
        assertTrue(ApiPath.parse("/api/endpoints/edge-1").isEmpty());
        assertTrue(ApiPath.parse("/api/endpoints/edge-1/podman/info").isEmpty());
        assertTrue(ApiPath.parse("/api/endpoints/edge-1/docker/../../secret").isEmpty());
        assertTrue(ApiPath.parse("/api/endpoints/edge-1/docker/containers/..").isEmpty());
    }
}
