package com.purchasingpower.coderag.session.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.coderag.session.SessionContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The {@code <sessionId>.json} context file. Updates are read-modify-write, so
 * keys written by other code survive.
 */
@Slf4j
class SessionContextFile {

    private final Path file;
    private final ObjectMapper objectMapper;

    SessionContextFile(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the context, or empty when the file is missing or unreadable
     */
    synchronized Optional<SessionContext> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SessionContext.class));
        } catch (IOException e) {
            log.warn("⚠️ Unreadable session context {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    synchronized SessionContext update(Consumer<SessionContext> change) {
        SessionContext context = load().orElseGet(SessionContext::new);
        change.accept(context);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(temp.toFile(), context);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write session context " + file, e);
        }
        return context;
    }

    synchronized void delete() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete session context " + file, e);
        }
    }
}
