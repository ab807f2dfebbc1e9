package com.deepansh.explorer.tool.impl;

/**
 * Helpers for repository-relative, '/'-separated paths.
 */
final class RepositoryPaths {

    private RepositoryPaths() {
    }

    /**
     * Prefix an entry path must start with to lie under {@code directory}.
     * "", "." and "./" all mean the repository root.
     */
    static String directoryPrefix(String directory) {
        String normalized = directory == null ? "" : directory.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.equals(".") || normalized.equals("/")) {
            normalized = "";
        }
        if (!normalized.isEmpty() && !normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        return normalized;
    }

    /** Number of separators in a relative path: 0 for a direct child. */
    static int depth(String relativePath) {
        int depth = 0;
        for (int i = 0; i < relativePath.length(); i++) {
            if (relativePath.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }
}
