package quire.structs;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ZSetTest {

    private static List<String> names(List<ZSet.Member> members) {
        List<String> out = new ArrayList<>();
        for (ZSet.Member m : members) out.add(m.name);
        return out;
    }

    @Test
    public void testPutReportsPreviousScore() {
        ZSet z = new ZSet();
        assertNull(z.put("a", 1));
        assertEquals(1.0, z.put("a", 4));
        assertEquals(4.0, z.score("a"));
        assertEquals(1, z.size());
    }

    @Test
    public void testRescoreMovesMember() {
        ZSet z = new ZSet();
        z.put("a", 1);
        z.put("b", 2);
        z.put("c", 3);
        z.put("a", 10);

        assertEquals(Arrays.asList("b", "c", "a"), names(z.range(0, 2)));
        assertEquals(Arrays.asList("c"), names(z.range(1, 1)));
    }

    @Test
    public void testRemoveKeepsViewsInStep() {
        ZSet z = new ZSet();
        z.put("a", 1);
        z.put("b", 1);
        assertTrue(z.remove("a"));
        assertFalse(z.remove("a"));

        assertNull(z.score("a"));
        assertEquals(Arrays.asList("b"), names(z.range(0, 0)));
        assertEquals(1, z.size());
    }
}
