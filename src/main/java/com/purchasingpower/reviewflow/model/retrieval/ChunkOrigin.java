package com.purchasingpower.reviewflow.model.retrieval;

import java.util.Locale;

public enum ChunkOrigin {
    CODE,
    DOC,
    HISTORY;

    public static ChunkOrigin fromMetadata(String value) {
        if (value == null) {
            return CODE;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "doc":
            case "docs":
            case "documentation":
                return DOC;
            case "history":
            case "commit":
            case "review":
                return HISTORY;
            default:
                return CODE;
        }
    }
}
