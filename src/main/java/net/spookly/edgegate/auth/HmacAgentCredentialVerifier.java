package net.spookly.edgegate.auth;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.Environment;

/**
 * Verifies tokens issued by {@link AgentCredentials} against the environment's edge key.
 */
public final class HmacAgentCredentialVerifier implements AgentCredentialVerifier {
    private final int clockSkewSeconds;
    private final NonceCache nonceCache;
    private final Clock clock;

    public HmacAgentCredentialVerifier(int clockSkewSeconds, Clock clock) {
        this.clockSkewSeconds = clockSkewSeconds;
        this.nonceCache = new NonceCache(clockSkewSeconds * 2L);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<AuthResult> verify(Environment environment, String credentialToken) {
        return CompletableFuture.completedFuture(AgentCredentials.verify(
                environment.id(), environment.edgeKey(), credentialToken, clockSkewSeconds, nonceCache, clock));
    }
}
