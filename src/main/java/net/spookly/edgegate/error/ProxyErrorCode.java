package net.spookly.edgegate.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Stable error codes for request-path failures, with the HTTP status the client-facing listener answers with.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public enum ProxyErrorCode {
    ENVIRONMENT_NOT_FOUND(404),
    ENVIRONMENT_UNREACHABLE(503),
    CONFIG_INVALID(500),
    UPSTREAM_PROTOCOL_ERROR(502),
    UPGRADE_FAILED(502),
    SUB_CONNECTION_FAILED(502);

    private final int httpStatus;
}
