package net.spookly.edgegate.proxy;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Parsed upstream response head. {@code headLength} counts the bytes up to and including the blank line.
 */
@Value
@Accessors(fluent = true)
public class ResponseHead {
    int status;
    String reason;
    HttpHeaders headers;
    int headLength;

    public boolean isSwitchingProtocols() {
        return status == 101;
    }

    public boolean isInformational() {
        return status >= 100 && status < 200;
    }

    /**
     * @return the declared body length, or -1 when the body is chunked or delimited by close
     */
    public long contentLength() {
        if (headers.containsValue(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED, true)) {
            return -1;
        }
        String value = headers.get(HttpHeaderNames.CONTENT_LENGTH);
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
