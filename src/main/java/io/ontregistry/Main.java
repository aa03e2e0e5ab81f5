package io.ontregistry;

import io.ontregistry.cli.RegistryCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RegistryCommand()).execute(args);
        System.exit(code);
    }
}
