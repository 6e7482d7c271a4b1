package quire.commands.zset;

import quire.Config;
import quire.MockClientHandler;
import quire.Quire;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ZSetCommandsTest {

    private MockClientHandler client;

    @BeforeEach
    public void setup() {
        Quire.init(new Config());
        client = new MockClientHandler();
    }

    @Test
    public void testAddScoreAndCard() {
        assertEquals(2L, client.run("ZADD", "z", "1", "a", "2.5", "b"));
        assertEquals(0L, client.run("ZADD", "z", "3", "a"));
        assertEquals(2L, client.run("ZCARD", "z"));
        assertEquals("3", client.run("ZSCORE", "z", "a"));
        assertEquals("2.5", client.run("ZSCORE", "z", "b"));
        assertNull(client.run("ZSCORE", "z", "missing"));
        assertNull(client.run("ZSCORE", "nokey", "a"));
        assertEquals(0L, client.run("ZCARD", "nokey"));
    }

    @Test
    public void testRangeOrdersByScoreThenMember() {
        client.run("ZADD", "z", "2", "b", "1", "c", "2", "a", "-inf", "low");

        assertEquals(Arrays.asList("low", "c", "a", "b"), client.run("ZRANGE", "z", "0", "-1"));
        assertEquals(Arrays.asList("a", "b"), client.run("ZRANGE", "z", "-2", "100"));
        assertEquals(Arrays.asList("low", "-inf", "c", "1"), client.run("ZRANGE", "z", "0", "1", "withscores"));
        assertEquals(Collections.emptyList(), client.run("ZRANGE", "z", "3", "1"));
        assertEquals(Collections.emptyList(), client.run("ZRANGE", "z", "10", "20"));
        assertEquals(Collections.emptyList(), client.run("ZRANGE", "nokey", "0", "-1"));
    }

    @Test
    public void testRangeArgumentErrors() {
        client.run("ZADD", "z", "1", "a");
        client.run("ZRANGE", "z", "0", "-1", "WITHSCORE");
        assertEquals("ERR syntax error", client.lastError);
        client.run("ZRANGE", "z", "0", "-1", "WITHSCORES", "extra");
        assertEquals("ERR syntax error", client.lastError);
        client.run("ZRANGE", "z", "a", "-1");
        assertEquals("ERR value is not an integer or out of range", client.lastError);
    }

    @Test
    public void testWithScoresUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            client.run("ZADD", "z", "1", "a");
            assertEquals(Arrays.asList("a", "1"), client.run("ZRANGE", "z", "0", "-1", "withscores"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void testAddRejectsBadInputWithoutWriting() {
        client.run("ZADD", "z", "1", "a", "nan?", "b");
        assertEquals("ERR value is not a valid float", client.lastError);
        assertEquals(0L, client.run("EXISTS", "z"));

        client.run("ZADD", "z", "1", "a", "2");
        assertEquals("ERR syntax error", client.lastError);
        assertEquals(0L, client.run("EXISTS", "z"));
    }

    @Test
    public void testRemoveDropsEmptyKey() {
        client.run("ZADD", "z", "1", "a", "2", "b");
        assertEquals(1L, client.run("ZREM", "z", "a", "missing"));
        assertEquals(Arrays.asList("b"), client.run("ZRANGE", "z", "0", "-1"));
        assertEquals(1L, client.run("ZREM", "z", "b"));
        assertEquals(0L, client.run("EXISTS", "z"));
        assertEquals(0L, client.run("ZREM", "z", "b"));
    }

    @Test
    public void testWrongType() {
        client.run("SET", "s", "v");
        client.run("ZADD", "s", "1", "a");
        assertTrue(client.lastError.startsWith("WRONGTYPE"));
        client.run("ZRANGE", "s", "0", "-1");
        assertTrue(client.lastError.startsWith("WRONGTYPE"));
        client.run("ZCARD", "s");
        assertTrue(client.lastError.startsWith("WRONGTYPE"));
    }

    @Test
    public void testScoreUpdateInvalidatesWatchers() {
        MockClientHandler watcher = new MockClientHandler();
        client.run("ZADD", "z", "1", "a");
        watcher.run("WATCH", "z");

        client.run("ZADD", "z", "1", "a");
        watcher.run("MULTI");
        watcher.run("ZCARD", "z");
        assertEquals(Arrays.asList(1L), watcher.run("EXEC"));

        watcher.run("WATCH", "z");
        client.run("ZADD", "z", "5", "a");
        watcher.run("MULTI");
        watcher.run("ZCARD", "z");
        assertNull(watcher.run("EXEC"));
    }
}
