package com.purchasingpower.reviewflow.model;

/**
 * External collaborators the engine calls out to.
 *
 * Used by ExternalCallLogger to tag request/response log lines.
 *
 * @see com.purchasingpower.reviewflow.util.ExternalCallLogger
 */
public enum ServiceType {
    PINECONE("🔵", "Pinecone"),
    OLLAMA("🟣", "Ollama"),
    GEMINI("🔴", "Gemini"),
    DATABASE("🟠", "Database");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
