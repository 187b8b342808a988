package dev.providers;

import dev.providers.cli.AgentProvidersCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AgentProvidersCli()).execute(args);
        System.exit(exitCode);
    }
}
