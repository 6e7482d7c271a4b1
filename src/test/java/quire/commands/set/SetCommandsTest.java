package quire.commands.set;

import quire.Config;
import quire.MockClientHandler;
import quire.Quire;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandsTest {

    private MockClientHandler client;

    @BeforeEach
    public void setup() {
        Quire.init(new Config());
        client = new MockClientHandler();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testAddAndMembers() {
        assertEquals(2L, client.run("SADD", "s", "a", "b"));
        assertEquals(1L, client.run("SADD", "s", "b", "c"));
        assertEquals(3L, client.run("SCARD", "s"));
        assertEquals(1L, client.run("SISMEMBER", "s", "a"));
        assertEquals(0L, client.run("SISMEMBER", "s", "z"));
        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")),
                new HashSet<>((List<Object>) client.run("SMEMBERS", "s")));
    }

    @Test
    public void testAddingExistingMembersChangesNothing() {
        client.run("SADD", "s", "a");
        long dirty = Quire.keyspace.getDirty();

        assertEquals(0L, client.run("SADD", "s", "a"));
        assertEquals(dirty, Quire.keyspace.getDirty());
    }

    @Test
    public void testRemoveDropsEmptySet() {
        client.run("SADD", "s", "a", "b");
        assertEquals(2L, client.run("SREM", "s", "a", "b", "c"));
        assertFalse(Quire.keyspace.exists(0, "s"));
        assertEquals(0L, client.run("SCARD", "s"));
    }

    @Test
    public void testPop() {
        client.run("SADD", "s", "only");
        assertEquals("only", client.run("SPOP", "s"));
        assertFalse(Quire.keyspace.exists(0, "s"));
        assertNull(client.run("SPOP", "s"));
    }

    @Test
    public void testWrongType() {
        client.run("SET", "k", "v");
        client.run("SADD", "k", "a");
        assertTrue(client.lastError.startsWith("WRONGTYPE"));
        client.run("SMEMBERS", "k");
        assertTrue(client.lastError.startsWith("WRONGTYPE"));
    }
}
