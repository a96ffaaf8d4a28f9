package com.terminaldesigner.designer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class DesignerMainTest {

    private static final String FIXTURE = Paths.get(System.getProperty("user.dir")).getParent()
            .resolve("test-fixtures/tractor-display/project.json").toString();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(DesignerMain.UsageException.class, () -> DesignerMain.run(new String[]{}, out));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(DesignerMain.UsageException.class, () -> DesignerMain.run(new String[]{"export"}, out));
    }

    @Test
    void missingProjectThrowsUsageException() {
        assertThrows(DesignerMain.UsageException.class, () -> DesignerMain.run(new String[]{"inspect"}, out));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(DesignerMain.UsageException.class,
                () -> DesignerMain.run(new String[]{"validate", FIXTURE, "--strict"}, out));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(DesignerMain.UsageException.class,
                () -> DesignerMain.run(new String[]{"validate", FIXTURE, "--vt-version"}, out));
    }

    @Test
    void unsupportedVersionThrowsUsageException() {
        Exception e = assertThrows(DesignerMain.UsageException.class,
                () -> DesignerMain.run(new String[]{"validate", FIXTURE, "--vt-version", "9"}, out));
        assertTrue(e.getMessage().contains("9"));
    }

    @Test
    void versionFlagIsRejectedForInspect() {
        assertThrows(DesignerMain.UsageException.class,
                () -> DesignerMain.run(new String[]{"inspect", FIXTURE, "--vt-version", "4"}, out));
    }

    @Test
    void inspectPrintsTree() throws Exception {
        assertEquals(0, DesignerMain.run(new String[]{"inspect", FIXTURE}, out));

        String text = output();
        assertTrue(text.startsWith("0: WorkingSet [WorkingSet]\n"));
        assertTrue(text.contains("  Main Screen [DataMask]\n"));
        assertTrue(text.contains("    Header Container [Container]\n"));
    }

    @Test
    void validateFixtureIsClean() throws Exception {
        assertEquals(0, DesignerMain.run(new String[]{"validate", FIXTURE}, out));
        assertEquals("", output());
    }

    @Test
    void validateReportsIssues(@TempDir Path tmp) throws Exception {
        Path project = tmp.resolve("broken.json");
        Files.writeString(project, """
            {
              "format_version": 1,
              "object_pool": [
                { "type": "DataMask", "id": 5, "objectRefs": [ { "id": 77, "offset": { "x": 0, "y": 0 } } ] }
              ]
            }
            """);

        assertEquals(1, DesignerMain.run(new String[]{"validate", project.toString()}, out));
        assertTrue(output().contains("NO_WORKING_SET"));
        assertTrue(output().contains("MISSING_REFERENCE [5]"));
    }

    @Test
    void configFileIsRead(@TempDir Path tmp) throws Exception {
        Path config = tmp.resolve("designer.json");
        Files.writeString(config, "{ \"pool_history_limit\": 3 }");

        assertEquals(0, DesignerMain.run(new String[]{"inspect", FIXTURE, "--config", config.toString()}, out));
    }

    @Test
    void fixtureConfigValidatesAgainstItsVersion() throws Exception {
        String config = Paths.get(FIXTURE).resolveSibling("designer.json").toString();
        assertEquals(0, DesignerMain.run(new String[]{"validate", FIXTURE, "--config", config}, out));
    }

    @Test
    void missingProjectFileFails(@TempDir Path tmp) {
        assertThrows(UncheckedIOException.class,
                () -> DesignerMain.run(new String[]{"inspect", tmp.resolve("none.json").toString()}, out));
    }
}
