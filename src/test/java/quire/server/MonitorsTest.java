package quire.server;

import quire.Config;
import quire.MockClientHandler;
import quire.Quire;
import quire.protocol.Resp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MonitorsTest {

    private MockClientHandler monitor;
    private MockClientHandler client;

    @BeforeEach
    public void setup() {
        Quire.init(new Config());
        monitor = new MockClientHandler();
        client = new MockClientHandler();
        assertEquals("OK", monitor.run("MONITOR"));
        monitor.replies.clear();
    }

    // The command part of each monitor line, e.g. "\"SET\" \"k\" \"v\"".
    private List<String> observed() {
        List<String> lines = new ArrayList<>();
        for (Object reply : monitor.replies) {
            String line = (String) reply;
            lines.add(line.substring(line.indexOf("] ") + 2));
        }
        return lines;
    }

    @Test
    public void testLineFormat() {
        String line = Monitors.formatLine(1339518083107L, 2, "127.0.0.1:60866",
                Resp.args("set", "k", "a \"b\"\n"));
        assertEquals("1339518083.107000 [2 127.0.0.1:60866] \"set\" \"k\" \"a \\\"b\\\"\\n\"", line);
    }

    @Test
    public void testNonPrintableBytesAreEscaped() {
        List<byte[]> args = new ArrayList<>();
        args.add(new byte[]{'x', 1, (byte) 0xff});
        String line = Monitors.formatLine(0, 0, "a:1", args);
        assertTrue(line.endsWith("\"x\\x01\\xff\""), line);
    }

    @Test
    public void testTransactionOrder() {
        client.run("MULTI");
        client.run("SET", "k", "v");
        client.run("INCR", "n");

        assertEquals(Arrays.asList("\"MULTI\""), observed(), "Queued commands are shown when they run");

        client.run("EXEC");
        assertEquals(Arrays.asList("\"MULTI\"", "\"SET\" \"k\" \"v\"", "\"INCR\" \"n\"", "\"EXEC\""), observed());
    }

    @Test
    public void testAbortedExecIsStillShown() {
        client.run("MULTI");
        client.run("NOSUCH");
        client.run("EXEC");
        assertEquals(Arrays.asList("\"MULTI\"", "\"EXEC\""), observed());
    }

    @Test
    public void testMonitorOnlyAcceptsQuit() {
        monitor.run("SET", "k", "v");
        assertTrue(monitor.replies.isEmpty());
        assertNull(client.run("GET", "k"));
    }

    @Test
    public void testClosedMonitorStopsReceiving() {
        monitor.cleanup();
        client.run("PING");
        assertTrue(monitor.replies.isEmpty());
        assertEquals(0, Quire.monitors.size());
    }

    @Test
    public void testNothingFedWhileLoading() {
        Quire.executor.setLoading(true);
        client.run("SET", "k", "v");
        Quire.executor.setLoading(false);
        assertTrue(monitor.replies.isEmpty());
    }
}
