package net.spookly.edgegate.frontend;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON envelope for responses generated by edgegate itself rather than relayed from an environment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResponse {
    public final boolean ok;
    public final String code;
    public final String message;
    public final Object data;

    public static ApiResponse ok(Object data) {
        return new ApiResponse(true, null, null, data);
    }

    public static ApiResponse error(String code, String message) {
        return new ApiResponse(false, code, message, null);
    }
}
