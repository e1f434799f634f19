package net.spookly.edgegate.tunnel;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.Unpooled;

/**
 * JSON payloads of the handshake frames.
 */
public final class TunnelMessages {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private TunnelMessages() {
    }

    public static final class Hello {
        public String environmentId;
        public String credentialToken;
        public String agentVersion;
    }

    public static final class HelloAck {
        public boolean accepted;
        public RejectReason reason;
        public String message;
        public Long heartbeatIntervalMs;

        public static HelloAck accepted(long heartbeatIntervalMs) {
            HelloAck ack = new HelloAck();
            ack.accepted = true;
            ack.heartbeatIntervalMs = heartbeatIntervalMs;
            return ack;
        }

        public static HelloAck rejected(RejectReason reason, String message) {
            HelloAck ack = new HelloAck();
            ack.accepted = false;
            ack.reason = reason;
            ack.message = message;
            return ack;
        }
    }

    public static TunnelFrame hello(Hello hello) {
        return new TunnelFrame(TunnelFrameType.HELLO, 0, encode(hello));
    }

    public static TunnelFrame helloAck(HelloAck ack) {
        return new TunnelFrame(TunnelFrameType.HELLO_ACK, 0, encode(ack));
    }

    /**
     * @throws IllegalArgumentException when the payload is not valid JSON for {@code type}
     */
    public static <T> T decode(ByteBuf payload, Class<T> type) {
        try (InputStream input = new ByteBufInputStream(payload.duplicate())) {
            T value = MAPPER.readValue(input, type);
            if (value == null) {
                throw new IllegalArgumentException("empty " + type.getSimpleName() + " payload");
            }
            return value;
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + " payload", e);
        }
    }

    private static ByteBuf encode(Object value) {
        try {
            return Unpooled.wrappedBuffer(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }
}
