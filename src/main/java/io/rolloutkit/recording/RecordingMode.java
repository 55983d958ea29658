package io.rolloutkit.recording;

public enum RecordingMode {
    LIVE,
    RECORD,
    PLAYBACK
}
