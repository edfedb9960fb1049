package com.blueprintprobe;

import com.blueprintprobe.graph.StubModel.Stub;
import com.blueprintprobe.graph.StubSerializer;
import com.blueprintprobe.report.ReportBuilder;
import com.blueprintprobe.report.StubsReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Entry point of blueprint-probe.
 *
 * Usage:
 *   java -jar blueprint-probe-java.jar stubify <project-path> [--output stubs.json]
 *   java -jar blueprint-probe-java.jar atomize <project-path> [--output atoms.json] [--regenerate-stubs]
 *   java -jar blueprint-probe-java.jar specify <project-path> [--output specs.json] [--regenerate-stubs]
 *   java -jar blueprint-probe-java.jar verify [<project-path>] [--output proofs.json] [--regenerate-stubs]
 *
 * The report commands read {@code <project>/.verilib/stubs.json}, running stubify first when it is
 * missing or when {@code --regenerate-stubs} is given.
 */
public class ProbeMain {

    static final String USAGE = "Usage: java -jar blueprint-probe-java.jar <stubify|atomize|specify|verify> "
            + "<project-path> [--output <file>] [--regenerate-stubs]";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[blueprint-probe] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[blueprint-probe] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        String defaultOutput = switch (command) {
            case "stubify" -> "stubs.json";
            case "atomize" -> "atoms.json";
            case "specify" -> "specs.json";
            case "verify"  -> "proofs.json";
            default -> throw new UsageException("Unknown subcommand: " + command);
        };

        // Parse flags
        String projectPath = null;
        String output = defaultOutput;
        boolean regenerateStubs = false;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output", "-o"     -> output = requireNext(args, i++, arg);
                case "--regenerate-stubs" -> regenerateStubs = true;
                default -> {
                    if (arg.startsWith("-")) throw new UsageException("Unknown flag: " + arg);
                    if (projectPath != null) throw new UsageException("Unexpected argument: " + arg);
                    projectPath = arg;
                }
            }
        }

        if (projectPath == null) {
            if (!command.equals("verify")) throw new UsageException("<project-path> is required");
            projectPath = ".";
        }
        if (regenerateStubs && command.equals("stubify")) {
            throw new UsageException("--regenerate-stubs does not apply to stubify");
        }

        Path project = Paths.get(projectPath);
        Path outputPath = Paths.get(output);

        if (command.equals("stubify")) {
            new StubGenerator().run(project, outputPath);
            return;
        }

        Map<String, Stub> stubs = loadStubs(project, regenerateStubs);
        ReportBuilder reports = new ReportBuilder();
        Map<String, ?> report = switch (command) {
            case "atomize" -> reports.atoms(stubs);
            case "specify" -> reports.specs(stubs);
            default        -> reports.proofs(stubs);
        };
        new StubSerializer().writeJson(report, outputPath);
        System.err.println("[blueprint-probe] Wrote " + report.size() + " entries to " + outputPath);
    }

    static Path stubsPath(Path project) {
        return project.resolve(".verilib").resolve("stubs.json");
    }

    private static Map<String, Stub> loadStubs(Path project, boolean regenerate) {
        Path stubsPath = stubsPath(project);
        if (regenerate || !Files.exists(stubsPath)) {
            System.err.println(regenerate
                    ? "[blueprint-probe] Regenerating stubs.json..."
                    : "[blueprint-probe] stubs.json not found, running stubify...");
            new StubGenerator().run(project, stubsPath);
        }
        return new StubsReader().read(stubsPath);
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
