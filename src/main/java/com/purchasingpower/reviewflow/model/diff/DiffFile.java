package com.purchasingpower.reviewflow.model.diff;

import lombok.Value;

import java.util.List;

@Value
public class DiffFile {
    String path;
    String language;
    List<DiffHunk> hunks;
}
