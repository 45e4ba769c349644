package conductor.coordinator.util;

import java.util.Locale;

/**
 * Resource context (repository path) comparison helpers.
 * Matching is case-insensitive, treats '\' and '/' as the same separator
 * and ignores trailing separators.
 */
public final class ResourceContexts {

    private ResourceContexts() {
    }

    /** Normalized form used for equality and grouping. Null becomes "". */
    public static String normalize(String context) {
        if (context == null) {
            return "";
        }
        String s = context.trim().replace('\\', '/');
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') {
            end--;
        }
        return s.substring(0, end).toLowerCase(Locale.ROOT);
    }

    /**
     * Both contexts must be non-empty to match.
     */
    public static boolean matches(String workerContext, String requestedContext) {
        if (isEmpty(workerContext) || isEmpty(requestedContext)) {
            return false;
        }
        return normalize(workerContext).equals(normalize(requestedContext));
    }

    public static boolean isEmpty(String context) {
        return context == null || context.isBlank();
    }

    /** Last path segment, e.g. "repoA" for "C:\work\repoA\" */
    public static String lastSegment(String context) {
        if (context == null) {
            return "";
        }
        String s = context.trim().replace('\\', '/');
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        int slash = s.lastIndexOf('/');
        return slash >= 0 ? s.substring(slash + 1) : s;
    }
}
