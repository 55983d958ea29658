package io.rolloutkit.recording;

import io.rolloutkit.config.RolloutKitConfig;
import io.rolloutkit.model.Message;
import io.rolloutkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * NDJSON log of conversation snapshots keyed by {@code (env_index, step)}.
 *
 * <p>The mode is decided once, at construction: no file configured means live, a configured
 * file that does not exist yet means record, an existing file means playback. Appends made
 * while recording therefore never switch the same run into playback.
 */
public final class RecordPlaybackStore {
    private static final Logger LOG = LoggerFactory.getLogger(RecordPlaybackStore.class);

    private final Path file;
    private final RecordingMode mode;
    private final Map<Integer, List<RecordedStep>> playback;

    private RecordPlaybackStore(Path file, RecordingMode mode, Map<Integer, List<RecordedStep>> playback) {
        this.file = file;
        this.mode = mode;
        this.playback = playback;
    }

    public static RecordPlaybackStore live() {
        return new RecordPlaybackStore(null, RecordingMode.LIVE, Map.of());
    }

    public static RecordPlaybackStore fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static RecordPlaybackStore fromEnvironment(Map<String, String> env) {
        String configured = env.get(RolloutKitConfig.ENV_PLAYBACK_FILE);
        if (configured == null || configured.isBlank()) {
            return live();
        }
        return forFile(Paths.get(configured.trim()));
    }

    public static RecordPlaybackStore forFile(Path file) {
        if (Files.exists(file)) {
            Map<Integer, List<RecordedStep>> loaded = load(file);
            LOG.info("Playback mode: {} rollouts loaded from {}", loaded.size(), file);
            return new RecordPlaybackStore(file, RecordingMode.PLAYBACK, loaded);
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create recording directory for " + file, e);
        }
        LOG.info("Record mode: writing conversation snapshots to {}", file);
        return new RecordPlaybackStore(file, RecordingMode.RECORD, Map.of());
    }

    public RecordingMode mode() {
        return mode;
    }

    public boolean isRecording() {
        return mode == RecordingMode.RECORD;
    }

    public boolean isPlayback() {
        return mode == RecordingMode.PLAYBACK;
    }

    public Optional<Path> file() {
        return Optional.ofNullable(file);
    }

    /** Appends one snapshot. Does nothing unless recording. */
    public synchronized void record(int envIndex, int step, List<Message> messages) {
        if (mode != RecordingMode.RECORD) {
            return;
        }
        String line = Jsons.toCompactJson(new RecordedStep(envIndex, step, messages)) + "\n";
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append recording entry to " + file, e);
        }
    }

    public Optional<RecordedStep> lookup(int envIndex, int step) {
        for (RecordedStep entry : stepsFor(envIndex)) {
            if (entry.step() == step) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<RecordedStep> stepsFor(int envIndex) {
        return playback.getOrDefault(envIndex, List.of());
    }

    public int rolloutCount() {
        return playback.size();
    }

    /** Entries grouped by env index and ordered by step; later duplicates of a step win. */
    public static Map<Integer, List<RecordedStep>> load(Path file) {
        Map<Integer, TreeMap<Integer, RecordedStep>> grouped = new TreeMap<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read recording " + file, e);
        }
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            RecordedStep entry = Jsons.fromJson(line, RecordedStep.class);
            grouped.computeIfAbsent(entry.envIndex(), k -> new TreeMap<>()).put(entry.step(), entry);
        }
        Map<Integer, List<RecordedStep>> out = new TreeMap<>();
        grouped.forEach((env, steps) -> out.put(env, Collections.unmodifiableList(new ArrayList<>(steps.values()))));
        return Collections.unmodifiableMap(out);
    }
}
