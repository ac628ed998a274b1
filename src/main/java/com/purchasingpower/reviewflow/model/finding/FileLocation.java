package com.purchasingpower.reviewflow.model.finding;

import lombok.Value;

/**
 * Position of an issue on the new side of the diff.
 */
@Value
public class FileLocation {
    String filePath;
    int line;

    @Override
    public String toString() {
        return filePath + ":" + line;
    }
}
