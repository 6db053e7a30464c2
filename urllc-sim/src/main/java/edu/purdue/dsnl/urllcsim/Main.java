package edu.purdue.dsnl.urllcsim;

import picocli.CommandLine;

import java.io.File;
import java.util.List;
import java.util.Optional;

@CommandLine.Command(name = "urllc-sim", mixinStandardHelpOptions = true, subcommands = {
        RunSetup.class,
        PoliciesCommand.class,
})
public class Main {
    public static class ParentOptions {
        @CommandLine.Option(names = { "-c", "--config" }, description = "JSON configuration file. Built-in"
                + " defaults are used when omitted.")
        public Optional<File> configFile;

        @CommandLine.Option(names = { "-p", "--policy" }, description = "Scheduling policy, overrides the"
                + " configuration. See the `policies` command.")
        public Optional<String> policy;

        @CommandLine.Option(names = { "-s", "--seed" }, split = ",", description = "Random seeds, overrides the"
                + " configuration")
        public List<Long> seeds;

        @CommandLine.Option(names = { "-d", "--duration" }, description = "Simulated seconds, overrides the"
                + " configuration")
        public Optional<Double> duration;

        @CommandLine.Option(names = { "-l", "--logdir" }, description = "Directory for per-seed event logs and"
                + " summary tables")
        public File logDir;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
