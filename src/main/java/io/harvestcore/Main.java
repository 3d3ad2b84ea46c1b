package io.harvestcore;

import io.harvestcore.cli.HarvestCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new HarvestCommand()).execute(args);
        System.exit(code);
    }
}
