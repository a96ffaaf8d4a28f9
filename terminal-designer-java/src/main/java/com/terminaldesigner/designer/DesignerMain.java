package com.terminaldesigner.designer;

import com.terminaldesigner.designer.config.DesignerConfig;
import com.terminaldesigner.designer.config.DesignerConfigReader;
import com.terminaldesigner.designer.file.ProjectFile;
import com.terminaldesigner.designer.project.EditorProject;
import com.terminaldesigner.designer.view.ObjectHierarchy;
import com.terminaldesigner.designer.view.PoolValidator;
import com.terminaldesigner.designer.view.ValidationIssue;
import com.terminaldesigner.pool.VtVersion;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line access to saved projects.
 *
 * Usage:
 *   java -jar terminal-designer-java.jar inspect  &lt;project.json&gt; [--config &lt;designer.json&gt;]
 *   java -jar terminal-designer-java.jar validate &lt;project.json&gt; [--vt-version N] [--config &lt;designer.json&gt;]
 *
 * {@code validate} exits with 1 when the pool has issues.
 */
public class DesignerMain {

    public static void main(String[] args) {
        try {
            System.exit(run(args, System.out));
        } catch (UsageException e) {
            System.err.println("[terminal-designer] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar terminal-designer-java.jar inspect|validate <project.json> " +
                               "[--vt-version N] [--config <designer.json>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[terminal-designer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static int run(String[] args, PrintStream out) throws ProjectFile.ProjectFileException {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("inspect") && !command.equals("validate")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        String projectPath = null;
        String configPath = null;
        Integer vtVersion = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config"     -> configPath = requireNext(args, i++, "--config");
                case "--vt-version" -> vtVersion  = parseVersion(requireNext(args, i++, "--vt-version"));
                default -> {
                    if (args[i].startsWith("--")) throw new UsageException("Unknown flag: " + args[i]);
                    if (projectPath != null) throw new UsageException("Unexpected argument: " + args[i]);
                    projectPath = args[i];
                }
            }
        }
        if (projectPath == null) throw new UsageException("A project file is required");
        if (vtVersion != null && command.equals("inspect")) {
            throw new UsageException("--vt-version only applies to validate");
        }

        DesignerConfig config = configPath != null
                ? new DesignerConfigReader().read(Paths.get(configPath))
                : DesignerConfig.defaults();

        EditorProject project = load(Paths.get(projectPath), config);

        if (command.equals("inspect")) {
            out.print(ObjectHierarchy.build(project.pool(), project.objectInfo()).render());
            return 0;
        }

        VtVersion version = vtVersion != null ? VtVersion.fromNumber(vtVersion) : project.vtVersion();
        List<ValidationIssue> issues = new PoolValidator().validate(project.pool(), version);
        for (ValidationIssue issue : issues) {
            out.println(issue);
        }
        System.err.println("[terminal-designer] " + issues.size() + " issue(s) for VT version " + version.number());
        return issues.isEmpty() ? 0 : 1;
    }

    private static EditorProject load(Path path, DesignerConfig config) throws ProjectFile.ProjectFileException {
        System.err.println("[terminal-designer] Reading project: " + path);
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read project: " + path, e);
        }
        return ProjectFile.fromBytes(content).toProject(config);
    }

    private static int parseVersion(String value) {
        try {
            int number = Integer.parseInt(value);
            VtVersion.fromNumber(number);
            return number;
        } catch (IllegalArgumentException e) {
            throw new UsageException("Unsupported VT version: " + value);
        }
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
