package io.rolloutkit;

import io.rolloutkit.cli.RolloutKitCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RolloutKitCommand()).execute(args);
        System.exit(code);
    }
}
