package com.purchasingpower.reviewflow.model.diff;

import lombok.Value;

import java.util.List;

/**
 * A diff split into files and hunks, with new-side line numbers resolved.
 */
@Value
public class ParsedDiff {
    String raw;
    List<DiffFile> files;

    public List<String> filePaths() {
        return files.stream().map(DiffFile::getPath).toList();
    }

    public List<DiffHunk> hunks() {
        return files.stream().flatMap(f -> f.getHunks().stream()).toList();
    }

    public int addedLineCount() {
        return (int) hunks().stream().mapToLong(h -> h.addedLines().size()).sum();
    }

    public boolean isEmpty() {
        return hunks().stream().allMatch(h -> h.getLines().isEmpty());
    }
}
