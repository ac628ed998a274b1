package com.purchasingpower.reviewflow.model.diff;

import lombok.Value;

import java.util.List;

@Value
public class DiffHunk {
    String filePath;
    int newStart;
    List<DiffLine> lines;

    public List<DiffLine> addedLines() {
        return lines.stream().filter(DiffLine::isAdded).toList();
    }

    /**
     * Lines present after the change (added and context), in order.
     */
    public List<DiffLine> newSideLines() {
        return lines.stream().filter(l -> l.getType() != DiffLineType.REMOVED).toList();
    }
}
