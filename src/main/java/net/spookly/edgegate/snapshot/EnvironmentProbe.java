package net.spookly.edgegate.snapshot;

import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.environment.Environment;

/**
 * Checks whether an environment answers. Completes with false for a bad answer and exceptionally when
 * the environment could not be reached.
 */
public interface EnvironmentProbe extends AutoCloseable {
    CompletableFuture<Boolean> probe(Environment environment, int timeoutMs);

    @Override
    default void close() {
    }
}
