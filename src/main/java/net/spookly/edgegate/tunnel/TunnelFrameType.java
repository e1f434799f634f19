package net.spookly.edgegate.tunnel;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Frame types on the tunnel control connection. Control frames use stream id 0.
 */
@Getter
@Accessors(fluent = true)
public enum TunnelFrameType {
    HELLO(0x01),
    HELLO_ACK(0x02),
    PING(0x03),
    PONG(0x04),
    GOAWAY(0x05),
    OPEN(0x10),
    OPEN_ACK(0x11),
    DATA(0x12),
    RESET(0x13),
    CLOSE(0x14);

    private static final TunnelFrameType[] BY_CODE = new TunnelFrameType[256];

    static {
        for (TunnelFrameType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    TunnelFrameType(int code) {
        this.code = code;
    }

    public boolean isStreamFrame() {
        return code >= OPEN.code;
    }

    /**
     * @return the type for a wire code, or null when unknown
     */
    public static TunnelFrameType fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }
}
