package io.rolloutkit.recording;

import io.rolloutkit.model.Trajectory;
import io.rolloutkit.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat-completions style export: one {@code {messages, metadata}} line per terminated
 * trajectory. The file is truncated when the log is opened.
 */
public final class OpenAiFormatLog {
    private final Path file;

    public OpenAiFormatLog(Path file) {
        this.file = file;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize conversation log " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    /** Returns whether the trajectory was written; unterminated ones are skipped. */
    public synchronized boolean log(int envIndex, Trajectory trajectory) {
        if (!trajectory.terminated()) {
            return false;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("env_index", envIndex);
        metadata.put("session_id", trajectory.session() == null ? null : trajectory.session().id());
        metadata.put("seed", trajectory.session() == null ? null : trajectory.session().seed());
        metadata.put("total_reward", trajectory.totalReward());
        metadata.put("steps", trajectory.steps());
        metadata.put("termination_reason", trajectory.terminationReason());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("messages", trajectory.conversation());
        entry.put("metadata", metadata);
        try {
            Files.writeString(file, Jsons.toCompactJson(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write conversation log " + file, e);
        }
        return true;
    }
}
