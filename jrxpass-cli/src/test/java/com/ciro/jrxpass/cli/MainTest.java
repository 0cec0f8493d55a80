package com.ciro.jrxpass.cli;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(1, run());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("build-index-html"));
    }

    @Test
    void helpSucceeds() {
        assertEquals(0, run("--help"));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("deploy"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown command 'deploy'"));
    }

    @Test
    void dispatchesToBuildIndexHtml() {
        assertEquals(1, run("build-index-html"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Usage: build-index-html"));
    }

    private int run(String... args) {
        return Main.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }
}
