package com.purchasingpower.reviewflow.parser;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a file path to a language name by extension.
 */
public final class LanguageDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("kts", "kotlin"),
            Map.entry("scala", "scala"),
            Map.entry("groovy", "groovy"),
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("go", "go"),
            Map.entry("rb", "ruby"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("php", "php"),
            Map.entry("swift", "swift"),
            Map.entry("sql", "sql"),
            Map.entry("sh", "shell"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("xml", "xml")
    );

    private LanguageDetector() {
    }

    public static String detect(String path) {
        if (path == null) {
            return UNKNOWN;
        }
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot < 0 || dot < slash || dot == path.length() - 1) {
            return UNKNOWN;
        }
        String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(ext, UNKNOWN);
    }

    /**
     * True for languages whose blocks are delimited by braces.
     */
    public static boolean usesBraces(String language) {
        switch (language) {
            case "python":
            case "ruby":
            case "yaml":
            case "shell":
            case "sql":
            case "xml":
            case UNKNOWN:
                return false;
            default:
                return true;
        }
    }
}
