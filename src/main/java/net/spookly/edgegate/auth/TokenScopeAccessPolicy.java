package net.spookly.edgegate.auth;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.edgegate.config.EdgegateConfig;

/**
 * Restricts each API token to the environments listed for it. A token with no list, or with {@code "*"},
 * may reach every environment.
 */
public final class TokenScopeAccessPolicy implements AccessPolicy {
    private static final String WILDCARD = "*";

    private final Map<String, Set<String>> scopes = new HashMap<>();

    public TokenScopeAccessPolicy(List<EdgegateConfig.ApiTokenConfig> tokens) {
        if (tokens == null) {
            return;
        }
        for (EdgegateConfig.ApiTokenConfig token : tokens) {
            if (token.environments == null || token.environments.isEmpty() || token.environments.contains(WILDCARD)) {
                scopes.put(token.name, null);
            } else {
                scopes.put(token.name, Set.copyOf(token.environments));
            }
        }
    }

    @Override
    public boolean isAllowed(String principal, String environmentId) {
        if (principal == null || !scopes.containsKey(principal)) {
            return false;
        }
        Set<String> allowed = scopes.get(principal);
        return allowed == null || allowed.contains(environmentId);
    }
}
