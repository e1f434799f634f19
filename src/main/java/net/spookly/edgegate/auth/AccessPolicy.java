package net.spookly.edgegate.auth;

@FunctionalInterface
public interface AccessPolicy {
    AccessPolicy ALLOW_ALL = (principal, environmentId) -> true;

    boolean isAllowed(String principal, String environmentId);
}
