package com.deepansh.explorer.repo;

/**
 * A file or directory inside a repository. Paths are repository-relative and use '/'.
 */
public record RepositoryFile(String path, boolean directory, long size) {

    public String extension() {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase() : "";
    }
}
