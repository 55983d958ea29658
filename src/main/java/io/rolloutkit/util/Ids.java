package io.rolloutkit.util;

import java.security.SecureRandom;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
    }

    public static String newInvocationId() {
        return "inv_" + randomHex(8);
    }

    public static String newRolloutId() {
        return "rol_" + randomHex(8);
    }

    public static String newRunId() {
        return "run_" + randomHex(6);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return Hashing.toHex(value);
    }
}
