package net.spookly.edgegate.proxy;

import java.util.regex.Pattern;

import net.spookly.edgegate.environment.Environment;

/**
 * Docker Engine API: pins requests to the environment's API version when one is configured.
 */
public final class DockerRequestRewriter extends RequestRewriter {
    private static final Pattern VERSIONED_PATH = Pattern.compile("^/v\\d+(\\.\\d+)?(/.*|\\?.*)?$");

    private final String apiVersion;

    DockerRequestRewriter(Environment environment) {
        super(environment);
        String version = environment.apiVersion();
        this.apiVersion = version == null || version.isBlank() ? null : version.trim();
    }

    @Override
    protected String rewritePath(String path) {
        if (apiVersion == null || VERSIONED_PATH.matcher(path).matches()) {
            return path;
        }
        return "/v" + apiVersion + path;
    }
}
