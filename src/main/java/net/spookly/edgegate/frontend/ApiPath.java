package net.spookly.edgegate.frontend;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.edgegate.environment.ApiFamily;

/**
 * Client-facing route {@code /api/endpoints/{id}/{docker|kubernetes}/<path>[?query]}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiPath {
    static final String PREFIX = "/api/endpoints/";

    private final String environmentId;
    private final ApiFamily family;
    /**
     * Path (with query) forwarded to the environment; always starts with {@code /}.
     */
    private final String forwardPath;

    public static Optional<ApiPath> parse(String uri) {
        if (uri == null || !uri.startsWith(PREFIX)) {
            return Optional.empty();
        }
        int queryStart = uri.indexOf('?');
        String path = queryStart < 0 ? uri : uri.substring(0, queryStart);
        String query = queryStart < 0 ? "" : uri.substring(queryStart);
        String rest = path.substring(PREFIX.length());
        int idEnd = rest.indexOf('/');
        if (idEnd <= 0) {
            return Optional.empty();
        }
        String environmentId = URLDecoder.decode(rest.substring(0, idEnd), StandardCharsets.UTF_8);
        String afterId = rest.substring(idEnd + 1);
        int familyEnd = afterId.indexOf('/');
        String familySegment = familyEnd < 0 ? afterId : afterId.substring(0, familyEnd);
        ApiFamily family;
        switch (familySegment.toLowerCase(Locale.ROOT)) {
            case "docker":
                family = ApiFamily.DOCKER;
                break;
            case "kubernetes":
                family = ApiFamily.KUBERNETES;
                break;
            default:
                return Optional.empty();
        }
        String forward = familyEnd < 0 ? "/" : afterId.substring(familyEnd);
        if (environmentId.isBlank() || forward.contains("/../") || forward.endsWith("/..")) {
            return Optional.empty();
        }
        return Optional.of(new ApiPath(environmentId, family, forward + query));
    }
}
