package com.phiprotection.infrastructure.security;

import com.phiprotection.config.PhiProtectionProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies request paths as public or protected.
 *
 * A path matches a prefix when it equals the prefix or continues it with {@code /} or {@code ?}.
 * Protected prefixes are checked first, and paths that match neither table are protected.
 */
@Component
@Slf4j
public class RoutePolicy {

    public enum RouteClass {
        PUBLIC,
        PROTECTED,
        UNCLASSIFIED
    }

    private final List<String> publicPrefixes;
    private final List<String> protectedPrefixes;

    public RoutePolicy(PhiProtectionProperties properties) {
        this.publicPrefixes = List.copyOf(properties.getAccess().getPublicPaths());
        this.protectedPrefixes = List.copyOf(properties.getAccess().getProtectedPaths());
    }

    public RouteClass classify(String path) {
        if (path == null || path.isEmpty()) {
            return RouteClass.UNCLASSIFIED;
        }
        if (matchesAny(path, protectedPrefixes)) {
            return RouteClass.PROTECTED;
        }
        if (matchesAny(path, publicPrefixes)) {
            return RouteClass.PUBLIC;
        }
        return RouteClass.UNCLASSIFIED;
    }

    public boolean requiresAuthentication(String path) {
        RouteClass routeClass = classify(path);
        if (routeClass == RouteClass.UNCLASSIFIED) {
            log.debug("Unclassified route treated as protected: {}", Encode.forJava(path));
        }
        return routeClass != RouteClass.PUBLIC;
    }

    /**
     * Request matcher form used by the security filter chain.
     */
    public boolean isPublic(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !requiresAuthentication(path);
    }

    static boolean matches(String path, String prefix) {
        return path.equals(prefix)
            || path.startsWith(prefix + "/")
            || path.startsWith(prefix + "?");
    }

    private static boolean matchesAny(String path, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (matches(path, prefix)) {
                return true;
            }
        }
        return false;
    }
}
