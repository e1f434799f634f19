package net.spookly.edgegate.tunnel;

import java.util.concurrent.CompletableFuture;

import net.spookly.edgegate.proxy.UpstreamConnection;
import net.spookly.edgegate.proxy.UpstreamReader;

/**
 * Connects the local end of a stream the peer asked to open.
 */
@FunctionalInterface
public interface StreamDialer {
    CompletableFuture<UpstreamConnection> dial(String target, UpstreamReader reader);
}
