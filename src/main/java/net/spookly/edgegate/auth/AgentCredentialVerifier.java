package net.spookly.edgegate.auth;

import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.Environment;

/**
 * Decides whether a connecting agent may serve an environment. May complete asynchronously.
 */
@FunctionalInterface
public interface AgentCredentialVerifier {
    CompletableFuture<AuthResult> verify(Environment environment, String credentialToken);
}
