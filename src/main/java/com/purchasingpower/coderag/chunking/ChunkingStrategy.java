package com.purchasingpower.coderag.chunking;

import java.util.Locale;
import java.util.Set;

/**
 * How a file is split, chosen once from its extension.
 */
public enum ChunkingStrategy {

    /**
     * Parsed into an outline of imports, globals, classes and functions.
     */
    DECLARATIVE(Set.of("py", "java")),

    /**
     * C-family text where only brace nesting is tracked.
     */
    BRACE_DELIMITED(Set.of(
            "js", "ts", "jsx", "tsx", "mjs", "cjs", "go", "c", "h", "cpp", "hpp", "cc", "cs",
            "php", "rs", "kt", "swift", "scala", "dart")),

    /**
     * Fixed line windows.
     */
    FALLBACK(Set.of());

    private final Set<String> extensions;

    ChunkingStrategy(Set<String> extensions) {
        this.extensions = extensions;
    }

    public static ChunkingStrategy forPath(String filePath) {
        String extension = extensionOf(filePath);
        for (ChunkingStrategy strategy : values()) {
            if (strategy.extensions.contains(extension)) {
                return strategy;
            }
        }
        return FALLBACK;
    }

    /**
     * Lower-cased extension without the dot, or "" when the name has none.
     */
    public static String extensionOf(String filePath) {
        if (filePath == null) {
            return "";
        }
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        String name = filePath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
