package quire.structs;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Sorted set: a member to score map plus the members ordered by (score, member).
 * The two views always hold the same members.
 */
public class ZSet {

    public static final class Member implements Comparable<Member> {
        public final double score;
        public final String name;

        public Member(double score, String name) {
            this.score = score;
            this.name = name;
        }

        @Override
        public int compareTo(Member o) {
            int c = Double.compare(score, o.score);
            return c != 0 ? c : name.compareTo(o.name);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Member)) return false;
            Member m = (Member) o;
            return Double.compare(score, m.score) == 0 && name.equals(m.name);
        }

        @Override
        public int hashCode() {
            return 31 * Double.hashCode(score) + name.hashCode();
        }
    }

    private final ConcurrentHashMap<String, Double> scores = new ConcurrentHashMap<>();
    private final NavigableSet<Member> sorted = new ConcurrentSkipListSet<>();

    /**
     * Adds {@code name} or moves it to {@code score}.
     *
     * @return the previous score, or null if the member is new
     */
    public Double put(String name, double score) {
        Double previous = scores.put(name, score);
        if (previous != null) {
            if (previous == score) return previous;
            sorted.remove(new Member(previous, name));
        }
        sorted.add(new Member(score, name));
        return previous;
    }

    public boolean remove(String name) {
        Double previous = scores.remove(name);
        if (previous == null) return false;
        sorted.remove(new Member(previous, name));
        return true;
    }

    public Double score(String name) {
        return scores.get(name);
    }

    public int size() {
        return scores.size();
    }

    /** Members ranked {@code start} to {@code end} inclusive, both already within bounds. */
    public List<Member> range(int start, int end) {
        List<Member> out = new ArrayList<>(end - start + 1);
        Iterator<Member> it = sorted.iterator();
        for (int rank = 0; rank <= end && it.hasNext(); rank++) {
            Member m = it.next();
            if (rank >= start) out.add(m);
        }
        return out;
    }
}
