package io.archivemirror.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.archivemirror.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class ArchiveMirrorCommandTest {

    @Test
    void importsDirectoryIssuesCodesAndRoutesToOrigin() throws Exception {
        Path root = Files.createTempDirectory("archive-mirror-test-cli-");
        Path incoming = Files.createTempDirectory("archive-mirror-test-cli-incoming-");
        try {
            Files.writeString(incoming.resolve("reel-1"), "first reel");
            Files.writeString(incoming.resolve("reel-2"), "second reel");
            Files.writeString(incoming.resolve(".hidden"), "skipped");

            Run init = run(root, "init");
            Assertions.assertEquals(0, init.code());
            Assertions.assertTrue(Files.exists(root.resolve("archive-mirror.db")));

            Run imported = run(root, "catalog-import", "--dir", incoming.toString());
            Assertions.assertEquals(0, imported.code(), imported.out());
            Assertions.assertEquals(2, imported.json().path("imported").asInt());
            Assertions.assertTrue(Files.exists(root.resolve("content").resolve("reel-1")));

            Run route = run(root, "route", "reel-1");
            Assertions.assertEquals(0, route.code());
            Assertions.assertTrue(route.json().path("origin").asBoolean());
            Assertions.assertTrue(route.json().path("url").asText().endsWith("/download/reel-1"));
            Assertions.assertEquals(1, run(root, "route", "nothing").code());

            Run withdrawn = run(root, "catalog-approve", "reel-2", "--withdraw");
            Assertions.assertEquals(0, withdrawn.code(), withdrawn.out());
            Assertions.assertTrue(withdrawn.json().path("changed").asBoolean());
            Assertions.assertEquals(1, run(root, "catalog", "--approved-only").json().size());
            Assertions.assertEquals(2, run(root, "catalog").json().size());
            Assertions.assertEquals(1, run(root, "route", "reel-2").code());
            Assertions.assertEquals(1, run(root, "catalog-approve", "nothing").code());

            Run code = run(root, "pairing-code");
            Assertions.assertEquals(0, code.code());
            Assertions.assertTrue(code.json().path("code").asText().matches("[A-Z0-9]{4}-[A-Z0-9]{4}"));

            Assertions.assertEquals(0, run(root, "mirrors").json().size());
            Run sync = run(root, "sync");
            Assertions.assertEquals(0, sync.code());
            Assertions.assertEquals(0, sync.json().size());
            Assertions.assertEquals(1, run(root, "sync", "--mirror", "mir_missing").code());

            Assertions.assertNotEquals(0, run(root, "catalog-import").code());
            Assertions.assertNotEquals(0, run(root, "approve", "mir_missing").code());
            Assertions.assertEquals(1, run(root, "schema-migrations").json().size());
        } finally {
            deleteRecursively(root);
            deleteRecursively(incoming);
        }
    }

    private static Run run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        int code;
        try (PrintStream out = new PrintStream(captured, true, StandardCharsets.UTF_8)) {
            System.setOut(out);
            code = new CommandLine(new ArchiveMirrorCommand()).execute(full);
        } finally {
            System.setOut(original);
        }
        return new Run(code, captured.toString(StandardCharsets.UTF_8));
    }

    private record Run(int code, String out) {
        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(out);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
