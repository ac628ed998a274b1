package com.purchasingpower.reviewflow.retrieval;

import com.purchasingpower.reviewflow.config.ReviewEngineProperties;
import com.purchasingpower.reviewflow.model.diff.DiffFile;
import com.purchasingpower.reviewflow.model.diff.DiffHunk;
import com.purchasingpower.reviewflow.model.diff.DiffLine;
import com.purchasingpower.reviewflow.model.diff.ParsedDiff;
import com.purchasingpower.reviewflow.model.retrieval.CodeBlock;
import com.purchasingpower.reviewflow.parser.LanguageDetector;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits the new side of a diff into logical code blocks for similarity queries.
 *
 * <p>A block ends at a hunk border, when it reaches the line cap, or when a new
 * declaration starts at brace depth zero. Python and other indentation languages
 * split on top-level {@code def}/{@code class}. Blocks without changed lines are dropped.
 */
@Component
public class DiffChunker {

    private static final Pattern BRACE_DECLARATION = Pattern.compile(
            "^\\s*(?:@\\w+\\s*)*(?:(?:public|private|protected|internal|static|final|abstract|export|default|async|override|suspend)\\s+)*"
                    + "(?:class|interface|enum|record|object|function|fun|func|def|struct|impl|trait|[\\w<>\\[\\],.?]+\\s+\\w+\\s*\\()");
    private static final Pattern INDENT_DECLARATION = Pattern.compile("^(?:async\\s+)?(?:def|class)\\s+\\w+");

    private final int maxChunkLines;

    @Autowired
    public DiffChunker(ReviewEngineProperties properties) {
        this(properties.getRetrieval().getMaxChunkLines());
    }

    public DiffChunker(int maxChunkLines) {
        this.maxChunkLines = maxChunkLines;
    }

    public List<CodeBlock> chunk(ParsedDiff diff) {
        List<CodeBlock> blocks = new ArrayList<>();
        for (DiffFile file : diff.getFiles()) {
            for (DiffHunk hunk : file.getHunks()) {
                chunkHunk(file, hunk, blocks);
            }
        }
        return blocks;
    }

    private void chunkHunk(DiffFile file, DiffHunk hunk, List<CodeBlock> out) {
        boolean braces = LanguageDetector.usesBraces(file.getLanguage());
        List<DiffLine> current = new ArrayList<>();
        int depth = 0;

        for (DiffLine line : hunk.newSideLines()) {
            String content = line.getContent();
            boolean declaration = braces
                    ? depth == 0 && BRACE_DECLARATION.matcher(content).find()
                    : INDENT_DECLARATION.matcher(content).find();

            if (!current.isEmpty() && (declaration || current.size() >= maxChunkLines)) {
                emit(file, current, out);
                current = new ArrayList<>();
            }
            current.add(line);

            if (braces) {
                depth = Math.max(0, depth + braceDelta(content));
            }
        }
        emit(file, current, out);
    }

    private void emit(DiffFile file, List<DiffLine> lines, List<CodeBlock> out) {
        if (lines.isEmpty() || lines.stream().noneMatch(DiffLine::isAdded)) {
            return;
        }
        String text = String.join("\n", lines.stream().map(DiffLine::getContent).toList());
        if (text.isBlank()) {
            return;
        }
        out.add(new CodeBlock(
                file.getPath(),
                file.getLanguage(),
                lines.get(0).getNewLineNumber(),
                lines.get(lines.size() - 1).getNewLineNumber(),
                text));
    }

    private int braceDelta(String content) {
        int delta = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                inString = true;
                quote = c;
            } else if (c == '/' && i + 1 < content.length() && content.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }
}
