package com.purchasingpower.coderag.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives stable, filesystem-safe session ids from repository URLs.
 *
 * <p>Format: {@code repo_<sha256[:8]>_<owner[:10]>_<repo[:15]>}. The hash is
 * computed over the normalized URL, so {@code https://github.com/o/r.git},
 * {@code https://github.com/o/r/tree/main} and {@code git@github.com:o/r.git}
 * all map to the same session.
 */
public final class SessionIds {

    private static final Pattern SSH_URL = Pattern.compile("git@github\\.com:(.+?)(?:\\.git)?$");
    private static final String GITHUB = "https://github.com/";

    private SessionIds() {
    }

    public static String forRepository(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("Repository URL must not be blank");
        }
        String normalized = normalizeRepoUrl(repoUrl);
        String hash = sha256Hex(normalized).substring(0, 8);

        String[] parts = normalized.substring(GITHUB.length()).split("/");
        String owner = parts.length >= 2 ? parts[0] : "";
        String repo = parts.length >= 2 ? parts[1] : "";

        String cleanOwner = truncate(owner.replaceAll("[^a-zA-Z0-9]", ""), 10);
        String cleanRepo = truncate(repo.replaceAll("[^a-zA-Z0-9]", ""), 15);
        return "repo_" + hash + "_" + cleanOwner + "_" + cleanRepo;
    }

    /**
     * Canonical form {@code https://github.com/<owner>/<repo>}; extra path
     * segments, a trailing slash and the {@code .git} suffix are dropped.
     */
    public static String normalizeRepoUrl(String repoUrl) {
        String url = repoUrl.trim();

        if (url.startsWith("git@")) {
            Matcher ssh = SSH_URL.matcher(url);
            if (ssh.matches()) {
                return GITHUB + ssh.group(1);
            }
        }

        String path = stripSlashes(pathOf(url));
        if (path.endsWith(".git")) {
            path = path.substring(0, path.length() - 4);
        }
        String[] parts = path.split("/");
        if (parts.length >= 2) {
            path = parts[0] + "/" + parts[1];
        }
        return GITHUB + path;
    }

    /**
     * Removes every character outside {@code [a-zA-Z0-9_-]}.
     */
    public static String sanitize(String token) {
        if (token == null) {
            return "";
        }
        return token.replaceAll("[^a-zA-Z0-9_-]", "");
    }

    public static String collectionName(String sessionId) {
        return "repo_" + sanitize(sessionId);
    }

    public static boolean isRepositorySession(String sessionId) {
        return sessionId != null && sessionId.startsWith("repo_");
    }

    private static String pathOf(String url) {
        try {
            String path = new URI(url).getPath();
            return path != null ? path : "";
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Not a repository URL: " + url, e);
        }
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
