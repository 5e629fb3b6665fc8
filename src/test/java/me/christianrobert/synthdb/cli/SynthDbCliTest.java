package me.christianrobert.synthdb.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class SynthDbCliTest {

    private CommandLine commandLine;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = new CommandLine(new SynthDbCli());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    @Test
    void testWithoutArgumentsPrintsUsage() {
        assertEquals(0, commandLine.execute());

        assertTrue(out.toString().contains("Usage: synthdb"), out.toString());
        assertTrue(out.toString().contains("clone"), out.toString());
    }

    @Test
    void testHelpForClone() {
        assertEquals(0, commandLine.execute("help", "clone"));

        assertTrue(out.toString().contains("--url"), out.toString());
    }

    @Test
    void testUnknownCommandFails() {
        assertNotEquals(0, commandLine.execute("explode"));
    }
}
