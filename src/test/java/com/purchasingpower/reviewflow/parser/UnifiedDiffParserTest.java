package com.purchasingpower.reviewflow.parser;

import com.purchasingpower.reviewflow.model.diff.DiffFile;
import com.purchasingpower.reviewflow.model.diff.DiffHunk;
import com.purchasingpower.reviewflow.model.diff.DiffLine;
import com.purchasingpower.reviewflow.model.diff.DiffLineType;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.support.TestDiffs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Unified diff parser")
class UnifiedDiffParserTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser();

    @Test
    @DisplayName("Should resolve new-side line numbers of added lines")
    void parse_singleHunk_resolvesNewLineNumbers() {
        // When
        ParsedDiff diff = parser.parse(TestDiffs.CREDENTIAL);

        // Then
        assertThat(diff.filePaths()).containsExactly(TestDiffs.CREDENTIAL_PATH);
        DiffFile file = diff.getFiles().get(0);
        assertThat(file.getLanguage()).isEqualTo("java");

        DiffHunk hunk = file.getHunks().get(0);
        assertThat(hunk.getNewStart()).isEqualTo(10);
        assertThat(hunk.addedLines()).hasSize(1);
        DiffLine added = hunk.addedLines().get(0);
        assertThat(added.getNewLineNumber()).isEqualTo(12);
        assertThat(added.getContent()).contains("password = \"hunter2\"");
    }

    @Test
    @DisplayName("Should split a multi-file diff and skip removed lines")
    void parse_twoFiles_keepsFilesApart() {
        // When
        ParsedDiff diff = parser.parse(TestDiffs.TWO_FILES);

        // Then
        assertThat(diff.filePaths()).containsExactly("app/service.py", "web/App.java");
        assertThat(diff.addedLineCount()).isEqualTo(2);

        DiffHunk javaHunk = diff.getFiles().get(1).getHunks().get(0);
        List<DiffLineType> types = javaHunk.getLines().stream().map(DiffLine::getType).toList();
        assertThat(types).containsExactly(DiffLineType.CONTEXT, DiffLineType.REMOVED,
                DiffLineType.ADDED, DiffLineType.CONTEXT);
        assertThat(javaHunk.addedLines().get(0).getNewLineNumber()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should treat headerless text as added lines of the declared file")
    void parse_headerless_usesDeclaredPath() {
        // Given
        String snippet = "int x = 1;\nint y = 2;";

        // When
        ParsedDiff diff = parser.parse(snippet, List.of("src/Snippet.java"));

        // Then
        assertThat(diff.filePaths()).containsExactly("src/Snippet.java");
        assertThat(diff.addedLineCount()).isEqualTo(2);
        assertThat(diff.hunks().get(0).addedLines().get(1).getNewLineNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should name headerless text 'unknown' when no path is declared")
    void parse_headerlessWithoutPath_usesUnknown() {
        // When
        ParsedDiff diff = parser.parse("print('hi')");

        // Then
        assertThat(diff.filePaths()).containsExactly(UnifiedDiffParser.UNKNOWN_PATH);
    }

    @Test
    @DisplayName("Should strip trailing whitespace when normalizing")
    void normalize_stripsWhitespaceNoise() {
        // Given
        String noisy = "\n\n+line one   \n+line two\t\n\n";

        // When
        String normalized = UnifiedDiffParser.normalize(noisy);

        // Then
        assertThat(normalized).isEqualTo("+line one\n+line two");
        assertThat(UnifiedDiffParser.normalize("+line one\n+line two")).isEqualTo(normalized);
    }
}
