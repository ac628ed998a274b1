package com.purchasingpower.reviewflow.parser;

import com.purchasingpower.reviewflow.model.diff.DiffFile;
import com.purchasingpower.reviewflow.model.diff.DiffHunk;
import com.purchasingpower.reviewflow.model.diff.DiffLine;
import com.purchasingpower.reviewflow.model.diff.DiffLineType;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses unified diffs ({@code git diff} output) into files and hunks.
 *
 * <p>Line numbers are resolved on the new side of the change, which is where
 * review comments are anchored. Text without any diff header is treated as a
 * single file whose every line was added, so a pasted snippet can still be reviewed.
 */
@Slf4j
@Component
public class UnifiedDiffParser {

    public static final String UNKNOWN_PATH = "unknown";

    private static final Pattern GIT_HEADER = Pattern.compile("^diff --git a/(\\S+) b/(\\S+)");
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*");
    private static final String DEV_NULL = "/dev/null";

    public ParsedDiff parse(String diff) {
        return parse(diff, List.of());
    }

    /**
     * @param diff raw diff text
     * @param declaredPaths changed paths reported by the caller, used to name headerless input
     */
    public ParsedDiff parse(String diff, List<String> declaredPaths) {
        String text = diff == null ? "" : diff.replace("\r\n", "\n");
        String[] lines = text.split("\n", -1);

        if (!hasHeaders(lines)) {
            String path = declaredPaths == null || declaredPaths.isEmpty() ? UNKNOWN_PATH : declaredPaths.get(0);
            log.debug("Diff has no headers, treating {} lines as added to {}", lines.length, path);
            return new ParsedDiff(text, List.of(headerless(path, lines)));
        }

        Map<String, List<DiffHunk>> files = new LinkedHashMap<>();
        String currentPath = null;
        int newStart = 0;
        int newLine = 0;
        int oldRemaining = 0;
        int newRemaining = 0;
        List<DiffLine> hunkLines = null;

        for (String line : lines) {
            if (hunkLines != null && oldRemaining <= 0 && newRemaining <= 0) {
                closeHunk(files, currentPath, newStart, hunkLines);
                hunkLines = null;
            }
            Matcher git = GIT_HEADER.matcher(line);
            if (git.matches()) {
                closeHunk(files, currentPath, newStart, hunkLines);
                hunkLines = null;
                currentPath = git.group(2);
                files.computeIfAbsent(currentPath, k -> new ArrayList<>());
                continue;
            }
            if (line.startsWith("+++ ")) {
                closeHunk(files, currentPath, newStart, hunkLines);
                hunkLines = null;
                String path = stripPrefix(line.substring(4).trim());
                if (!DEV_NULL.equals(path)) {
                    currentPath = path;
                }
                if (currentPath == null) {
                    currentPath = UNKNOWN_PATH;
                }
                files.computeIfAbsent(currentPath, k -> new ArrayList<>());
                continue;
            }
            if (line.startsWith("--- ") && hunkLines == null) {
                continue;
            }
            Matcher hunk = HUNK_HEADER.matcher(line);
            if (hunk.matches()) {
                closeHunk(files, currentPath, newStart, hunkLines);
                if (currentPath == null) {
                    currentPath = UNKNOWN_PATH;
                    files.computeIfAbsent(currentPath, k -> new ArrayList<>());
                }
                newStart = Integer.parseInt(hunk.group(3));
                newLine = newStart;
                oldRemaining = hunk.group(2) == null ? 1 : Integer.parseInt(hunk.group(2));
                newRemaining = hunk.group(4) == null ? 1 : Integer.parseInt(hunk.group(4));
                hunkLines = new ArrayList<>();
                continue;
            }
            if (hunkLines == null || line.startsWith("\\")) {
                // file metadata (index, mode, rename) or "\ No newline at end of file"
                continue;
            }
            if (line.startsWith("+")) {
                hunkLines.add(new DiffLine(DiffLineType.ADDED, line.substring(1), newLine++));
                newRemaining--;
            } else if (line.startsWith("-")) {
                hunkLines.add(new DiffLine(DiffLineType.REMOVED, line.substring(1), 0));
                oldRemaining--;
            } else {
                String content = line.startsWith(" ") ? line.substring(1) : line;
                hunkLines.add(new DiffLine(DiffLineType.CONTEXT, content, newLine++));
                oldRemaining--;
                newRemaining--;
            }
        }
        closeHunk(files, currentPath, newStart, hunkLines);

        List<DiffFile> result = new ArrayList<>();
        files.forEach((path, hunks) -> result.add(new DiffFile(path, LanguageDetector.detect(path), List.copyOf(hunks))));
        log.debug("Parsed diff: {} files, {} hunks", result.size(),
                result.stream().mapToInt(f -> f.getHunks().size()).sum());
        return new ParsedDiff(text, List.copyOf(result));
    }

    /**
     * Collapses whitespace noise so that equivalent diffs produce the same cache fingerprint.
     */
    public static String normalize(String diff) {
        if (diff == null) {
            return "";
        }
        String[] lines = diff.replace("\r\n", "\n").split("\n");
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            String trimmed = line.stripTrailing();
            if (trimmed.isEmpty() && sb.length() == 0) {
                continue;
            }
            sb.append(trimmed).append('\n');
        }
        return sb.toString().strip();
    }

    private boolean hasHeaders(String[] lines) {
        for (String line : lines) {
            if (line.startsWith("diff --git ") || line.startsWith("+++ ") || HUNK_HEADER.matcher(line).matches()) {
                return true;
            }
        }
        return false;
    }

    private DiffFile headerless(String path, String[] lines) {
        List<DiffLine> diffLines = new ArrayList<>();
        int lineNo = 1;
        for (String line : lines) {
            if (line.startsWith("-")) {
                diffLines.add(new DiffLine(DiffLineType.REMOVED, line.substring(1), 0));
            } else {
                String content = line.startsWith("+") ? line.substring(1) : line;
                diffLines.add(new DiffLine(DiffLineType.ADDED, content, lineNo++));
            }
        }
        return new DiffFile(path, LanguageDetector.detect(path), List.of(new DiffHunk(path, 1, List.copyOf(diffLines))));
    }

    private void closeHunk(Map<String, List<DiffHunk>> files, String path, int newStart, List<DiffLine> lines) {
        if (lines == null || path == null) {
            return;
        }
        files.computeIfAbsent(path, k -> new ArrayList<>()).add(new DiffHunk(path, newStart, List.copyOf(lines)));
    }

    private String stripPrefix(String path) {
        int tab = path.indexOf('\t');
        String clean = tab >= 0 ? path.substring(0, tab) : path;
        if (clean.startsWith("a/") || clean.startsWith("b/")) {
            return clean.substring(2);
        }
        return clean;
    }
}
