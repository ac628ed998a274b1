package com.purchasingpower.reviewflow.model.retrieval;

import lombok.Value;

/**
 * A logical block of changed code used as a similarity query.
 */
@Value
public class CodeBlock {
    String filePath;
    String language;
    int startLine;
    int endLine;
    String text;

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
