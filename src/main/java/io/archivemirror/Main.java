package io.archivemirror;

import io.archivemirror.cli.ArchiveMirrorCommand;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        int code = new CommandLine(new ArchiveMirrorCommand()).execute(args);
        System.exit(code);
    }

    // Explicit -Djava.util.logging.config.file wins over the bundled format.
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("WARN: bundled logging.properties unreadable: " + e.getMessage());
        }
    }
}
