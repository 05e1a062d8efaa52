package io.rconcron;

import io.rconcron.cli.RconCronCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = RconCronCommand.commandLine().execute(args);
        System.exit(code);
    }
}
