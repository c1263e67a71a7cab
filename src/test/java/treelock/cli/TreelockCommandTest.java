package treelock.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import treelock.coordinator.model.OperationResult;
import treelock.coordinator.model.OperationStatus;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TreelockCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        TreelockCommand command = new TreelockCommand();
        command.env = Map.of();
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(command)
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
    }

    @Test
    void testResolveWorktreeVerb() {
        assertEquals(0, commandLine.execute("resolve", "commit", "wt1"));
        assertEquals("worktree:wt1", out.toString().trim());
        assertTrue(err.toString().isEmpty());
    }

    @Test
    void testResolveGlobalAndUnknownVerbs() {
        assertEquals(0, commandLine.execute("resolve", "merge"));
        assertEquals("global", out.toString().trim());

        out.getBuffer().setLength(0);
        assertEquals(0, commandLine.execute("resolve", "frobnicate", "wt1"));
        assertEquals("global", out.toString().trim());
        assertTrue(err.toString().contains("unknown verb"));
    }

    @Test
    void testQueriesReportUnavailableCoordinator() throws Exception {
        String port = String.valueOf(freePort());

        assertEquals(ExitCodes.UNAVAILABLE, commandLine.execute("--port", port, "status"));
        assertEquals(ExitCodes.UNAVAILABLE, commandLine.execute("--port", port, "metrics"));
        assertEquals(ExitCodes.UNAVAILABLE, commandLine.execute("--port", port, "patterns"));
        assertTrue(err.toString().contains("coordinator unavailable"));
    }

    @Test
    void testRunFallsBackToFileLocksAndPropagatesCommandOutcome() throws Exception {
        String port = String.valueOf(freePort());
        String lockDir = tempDir.resolve("locks").toString();

        assertEquals(ExitCodes.SUCCESS, commandLine.execute("--port", port, "run",
                "--verb", "commit", "--target", "wt1", "--caller", "wt1",
                "--lock-dir", lockDir, "--timeout", "2s", "--", "true"));

        assertEquals(ExitCodes.FAILED, commandLine.execute("--port", port, "run",
                "--verb", "commit", "--target", "wt1", "--caller", "wt1",
                "--lock-dir", lockDir, "--timeout", "2s", "--", "false"));
        assertTrue(err.toString().contains("failed on worktree:wt1"));
    }

    @Test
    void testRunRequiresVerbAndCommand() {
        assertNotEquals(0, commandLine.execute("run", "--", "true"));
        assertNotEquals(0, commandLine.execute("run", "--verb", "commit"));
    }

    @Test
    void testExitCodes() {
        assertEquals(ExitCodes.SUCCESS, ExitCodes.of(result(OperationStatus.SUCCESS)));
        assertEquals(ExitCodes.TIMEOUT, ExitCodes.of(result(OperationStatus.TIMEOUT)));
        assertEquals(ExitCodes.UNAVAILABLE, ExitCodes.of(result(OperationStatus.UNAVAILABLE)));
        assertEquals(ExitCodes.FAILED, ExitCodes.of(result(OperationStatus.FAILED)));
        assertEquals(ExitCodes.CANCELLED_OR_CONFLICT, ExitCodes.of(result(OperationStatus.CANCELLED)));
        assertEquals(ExitCodes.CANCELLED_OR_CONFLICT, ExitCodes.of(result(OperationStatus.CONFLICT)));
    }

    private static OperationResult result(OperationStatus status) {
        return new OperationResult(status, "global", 0, 0, false, null);
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
