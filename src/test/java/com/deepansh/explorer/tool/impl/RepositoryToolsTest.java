package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.support.InMemoryCodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryToolsTest {

    private InMemoryCodeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCodeRepository()
                .with("README.md", "# Demo\n\nInstall with pip.\n")
                .with("main.py", "import os\n\nclass App:\n    def run(self):\n        pass  # TODO\n")
                .with("src/util.py", "def helper():\n    return 42\n")
                .with("src/deep/nested/core.py", "def core():\n    return 'API'\n");
    }

    @Test
    void scan_respectsMaxDepth() throws Exception {
        Map<String, Object> result = result(new ScanDirectoryTool(repository)
                .execute(Map.of("directory", ".", "max_depth", 0)));

        assertThat(paths(result, "contents")).containsExactlyInAnyOrder("src", "README.md", "main.py");
        assertThat(result).containsEntry("total_files", 2).containsEntry("total_directories", 1);
    }

    @Test
    void scan_subdirectory_onlyListsItsEntries() throws Exception {
        Map<String, Object> result = result(new ScanDirectoryTool(repository)
                .execute(Map.of("directory", "src", "max_depth", 5)));

        assertThat(paths(result, "contents"))
                .containsExactlyInAnyOrder("src/deep", "src/deep/nested", "src/util.py", "src/deep/nested/core.py");
    }

    @Test
    void list_filtersByPattern() throws Exception {
        Map<String, Object> result = result(new ListFilesTool(repository).execute(Map.of("pattern", ".py")));

        assertThat(paths(result, "files")).containsExactlyInAnyOrder("main.py", "src/util.py", "src/deep/nested/core.py");
        assertThat(result).containsEntry("count", 3);
    }

    @Test
    void read_truncatesToMaxLines_butReportsFullLineCount() throws Exception {
        Map<String, Object> result = result(new ReadFileTool(repository)
                .execute(Map.of("file_path", "main.py", "max_lines", 2)));

        assertThat(result.get("content")).isEqualTo("import os\n");
        assertThat(result).containsEntry("line_count", 6).containsEntry("truncated", true);
    }

    @Test
    void read_missingFile_throws() {
        assertThatThrownBy(() -> new ReadFileTool(repository).execute(Map.of("file_path", "nope.py")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void search_isCaseInsensitive_andFiltersByType() throws Exception {
        Map<String, Object> result = result(new SearchFilesTool(repository)
                .execute(Map.of("pattern", "api", "file_types", List.of(".py"))));

        List<Map<String, Object>> hits = (List<Map<String, Object>>) result.get("results");
        assertThat(hits).hasSize(1);
        assertThat(hits.get(0)).containsEntry("file_path", "src/deep/nested/core.py")
                .containsEntry("total_matches", 1);
        List<Map<String, Object>> matches = (List<Map<String, Object>>) hits.get(0).get("matches");
        assertThat(matches.get(0)).containsEntry("line_num", 2).containsEntry("content", "return 'API'");
    }

    @Test
    void search_stopsAtMaxResults() throws Exception {
        Map<String, Object> result = result(new SearchFilesTool(repository)
                .execute(Map.of("pattern", "def", "max_results", 1)));

        assertThat((List<?>) result.get("results")).hasSize(1);
    }

    @Test
    void analyze_reportsLanguageAndPatterns() throws Exception {
        Map<String, Object> result = result(new AnalyzeCodeTool(repository).execute(Map.of("file_path", "main.py")));

        assertThat(result).containsEntry("language", "python")
                .containsEntry("total_lines", 6)
                .containsEntry("non_empty_lines", 4L)
                .containsEntry("estimated_complexity", 0L);
        assertThat((List<String>) result.get("key_patterns"))
                .containsExactly("contains_classes", "contains_functions", "has_imports", "has_todos");
    }

    @Test
    void analyze_unknownExtension() {
        assertThat(AnalyzeCodeTool.detectLanguage("notes.xyz")).isEqualTo("unknown");
    }

    @Test
    void paths_rootAliasesShareOnePrefix() {
        assertThat(RepositoryPaths.directoryPrefix(".")).isEmpty();
        assertThat(RepositoryPaths.directoryPrefix("./")).isEmpty();
        assertThat(RepositoryPaths.directoryPrefix("/")).isEmpty();
        assertThat(RepositoryPaths.directoryPrefix("src")).isEqualTo("src/");
        assertThat(RepositoryPaths.depth("a/b/c.py")).isEqualTo(2);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> result(Object raw) {
        return (Map<String, Object>) raw;
    }

    @SuppressWarnings("unchecked")
    private static List<String> paths(Map<String, Object> result, String key) {
        return ((List<Map<String, Object>>) result.get(key)).stream()
                .map(item -> (String) item.get("path"))
                .toList();
    }
}
