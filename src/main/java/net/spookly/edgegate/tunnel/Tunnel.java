package net.spookly.edgegate.tunnel;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import io.netty.channel.Channel;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * An established agent connection for one environment.
 */
@Getter
@Accessors(fluent = true)
public final class Tunnel {
    private final String environmentId;
    private final Channel channel;
    private final TunnelMultiplexer multiplexer;
    private final Instant establishedAt;
    private final SocketAddress remoteAddress;
    private final String agentVersion;
    @Getter(AccessLevel.NONE)
    private final AtomicReference<TunnelState> state = new AtomicReference<>(TunnelState.ACTIVE);
    private volatile Instant lastActivityAt;

    public Tunnel(String environmentId,
                  Channel channel,
                  TunnelMultiplexer multiplexer,
                  Instant establishedAt,
                  String agentVersion) {
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
        this.establishedAt = Objects.requireNonNull(establishedAt, "establishedAt");
        this.remoteAddress = channel.remoteAddress();
        this.agentVersion = agentVersion;
        this.lastActivityAt = establishedAt;
    }

    public TunnelState state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == TunnelState.ACTIVE && channel.isActive();
    }

    /**
     * @return true when this call moved the tunnel out of ACTIVE
     */
    public boolean markClosing() {
        return state.compareAndSet(TunnelState.ACTIVE, TunnelState.CLOSING);
    }

    public void touch(Instant now) {
        lastActivityAt = now;
    }

    @Override
    public String toString() {
        return "Tunnel{" + environmentId + " from " + remoteAddress + ", " + state.get() + "}";
    }
}
