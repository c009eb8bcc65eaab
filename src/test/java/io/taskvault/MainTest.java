package io.taskvault;

import io.taskvault.util.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private final TempDirs temp = new TempDirs();

    @AfterEach
    void deleteTempDirs() throws Exception {
        temp.deleteAll();
    }

    @Test
    void initAddAndListShouldRoundTripThroughCommands() throws Exception {
        Path root = temp.create("taskvault-cli-test-");

        assertEquals(0, run(root, "init", "--password", "abc123").code);
        assertEquals(0, run(root, "add", "--password", "abc123", "--title", "Write report", "--duration", "60").code);
        Result listed = run(root, "tasks", "--password", "abc123", "--completed", "false");

        assertEquals(0, listed.code);
        assertTrue(listed.out.contains("Write report"), listed.out);
    }

    @Test
    void wrongPasswordShouldExitWithError() throws Exception {
        Path root = temp.create("taskvault-cli-auth-test-");
        run(root, "init", "--password", "abc123");

        Result result = run(root, "tasks", "--password", "wrong");

        assertEquals(1, result.code);
        assertTrue(result.err.startsWith("error:"), result.err);
    }

    @Test
    void importWithRejectedLinesShouldExitTwo() throws Exception {
        Path root = temp.create("taskvault-cli-import-test-");
        Path file = temp.create("taskvault-cli-import-file-").resolve("tasks.txt");
        Files.writeString(file, "Alpha | | | 30 |\n | no title\n");
        run(root, "init", "--password", "abc123");

        Result result = run(root, "import", "--password", "abc123", "--file", file.toString());

        assertEquals(2, result.code);
        assertTrue(result.out.contains("Alpha"), result.out);
    }

    @Test
    void whereShouldReportExplicitRoot() throws Exception {
        Path root = temp.create("taskvault-cli-where-test-");

        Result result = run(root, "where");

        assertEquals(0, result.code);
        assertTrue(result.out.contains("activeRoot"), result.out);
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 4];
        full[0] = "--root";
        full[1] = root.toString();
        full[2] = "--kdf-iterations";
        full[3] = "1000";
        System.arraycopy(args, 0, full, 4, args.length);
        CommandLine commandLine = Main.commandLine();
        StringWriter err = new StringWriter();
        commandLine.setErr(new PrintWriter(err, true));
        PrintStream original = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            int code = commandLine.execute(full);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString());
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out, String err) {
    }
}
