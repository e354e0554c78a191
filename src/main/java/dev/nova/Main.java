package dev.nova;

import dev.nova.cli.NovaCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new NovaCli()).execute(args);
        System.exit(exitCode);
    }
}
