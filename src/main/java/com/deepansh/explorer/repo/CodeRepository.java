package com.deepansh.explorer.repo;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of a code repository used by the repository tools.
 */
public interface CodeRepository {

    /** Human-readable identifier, e.g. the root path */
    String getName();

    /**
     * All files and directories, depth-first, excluding ignored entries.
     */
    List<RepositoryFile> walk() throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if the path does not exist
     */
    String readFile(String path) throws IOException;

    boolean exists(String path);
}
