package quire.db;

import quire.structs.ZSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * A value stored in the keyspace together with its type tag.
 * Strings are {@code byte[]}, lists {@code ConcurrentLinkedDeque<String>},
 * hashes {@code ConcurrentHashMap<String, String>}, sets {@code Set<String>} and
 * sorted sets {@link ZSet}. {@code expireAt} is a unix time in milliseconds, -1 when
 * the key does not expire.
 */
public class ValueEntry {
    public Object value;
    public final DataType type;
    public long expireAt = -1;
    public long lastAccessed;

    public ValueEntry(Object value, DataType type) {
        this.value = value;
        this.type = type;
        this.lastAccessed = System.currentTimeMillis();
    }

    public static ValueEntry string(byte[] value) {
        return new ValueEntry(value, DataType.STRING);
    }

    public static ValueEntry newList() {
        return new ValueEntry(new ConcurrentLinkedDeque<String>(), DataType.LIST);
    }

    public static ValueEntry newHash() {
        return new ValueEntry(new ConcurrentHashMap<String, String>(), DataType.HASH);
    }

    public static ValueEntry newSet() {
        return new ValueEntry(ConcurrentHashMap.<String>newKeySet(), DataType.SET);
    }

    public static ValueEntry newZSet() {
        return new ValueEntry(new ZSet(), DataType.ZSET);
    }

    public boolean isExpired(long now) {
        return expireAt != -1 && now > expireAt;
    }

    public void touch() {
        this.lastAccessed = System.currentTimeMillis();
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object val) {
        this.value = val;
    }

    @SuppressWarnings("unchecked")
    public ConcurrentLinkedDeque<String> asList() {
        return (ConcurrentLinkedDeque<String>) value;
    }

    @SuppressWarnings("unchecked")
    public ConcurrentHashMap<String, String> asHash() {
        return (ConcurrentHashMap<String, String>) value;
    }

    @SuppressWarnings("unchecked")
    public Set<String> asSet() {
        return (Set<String>) value;
    }

    public ZSet asZSet() {
        return (ZSet) value;
    }

    public boolean isEmptyAggregate() {
        switch (type) {
            case LIST: return asList().isEmpty();
            case HASH: return asHash().isEmpty();
            case SET: return asSet().isEmpty();
            case ZSET: return asZSet().size() == 0;
            default: return false;
        }
    }
}
