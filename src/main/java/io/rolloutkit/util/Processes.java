package io.rolloutkit.util;

import java.util.Optional;

public final class Processes {
    private Processes() {
    }

    public static long currentPid() {
        return ProcessHandle.current().pid();
    }

    public static boolean isAlive(long pid) {
        if (pid <= 0L) {
            return false;
        }
        if (pid == currentPid()) {
            return true;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.map(ProcessHandle::isAlive).orElse(false);
    }

    public static boolean isAlive(Long pid) {
        return pid != null && isAlive(pid.longValue());
    }
}
