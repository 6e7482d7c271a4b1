package quire.db;

import quire.Config;
import quire.transaction.TouchNotifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

public class Keyspace {
    public static final int DEFAULT_DB_COUNT = 16;
    public static final String WRONGTYPE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final ConcurrentHashMap<String, ValueEntry>[] databases;
    private final AtomicLong dirty = new AtomicLong(0);
    private final AtomicLong expiredKeys = new AtomicLong(0);
    private TouchNotifier touchNotifier = TouchNotifier.NONE;
    private BiConsumer<Integer, String> expiredKeyHandler = (db, key) -> { };
    private volatile boolean loading;

    public Keyspace(Config config) {
        this(config.databases > 0 ? config.databases : DEFAULT_DB_COUNT);
    }

    @SuppressWarnings("unchecked")
    public Keyspace(int dbCount) {
        this.databases = new ConcurrentHashMap[dbCount];
        for (int i = 0; i < dbCount; i++) {
            this.databases[i] = new ConcurrentHashMap<>();
        }
    }

    public void setTouchNotifier(TouchNotifier touchNotifier) {
        this.touchNotifier = touchNotifier != null ? touchNotifier : TouchNotifier.NONE;
    }

    /** Called with (db, key) for every key removed because its time to live ran out. */
    public void setExpiredKeyHandler(BiConsumer<Integer, String> handler) {
        this.expiredKeyHandler = handler != null ? handler : (db, key) -> { };
    }

    // Nothing expires while the append-only file is replayed.
    public void setLoading(boolean loading) {
        this.loading = loading;
    }

    public boolean isLoading() {
        return loading;
    }

    public int getDbCount() {
        return databases.length;
    }

    public ConcurrentHashMap<String, ValueEntry> getStore(int dbIndex) {
        if (dbIndex < 0 || dbIndex >= databases.length) throw new IllegalArgumentException("DB index out of range");
        return databases[dbIndex];
    }

    public ValueEntry get(int dbIndex, String key) {
        expireIfNeeded(dbIndex, key);
        ValueEntry v = getStore(dbIndex).get(key);
        if (v != null) v.touch();
        return v;
    }

    public boolean exists(int dbIndex, String key) {
        expireIfNeeded(dbIndex, key);
        return getStore(dbIndex).containsKey(key);
    }

    /** Presence check that leaves expired keys in place. */
    public boolean containsKey(int dbIndex, String key) {
        return getStore(dbIndex).containsKey(key);
    }

    /**
     * Deletes {@code key} if its time to live has run out. Watchers of the key are
     * invalidated and the expired-key handler is told, but the change counter does not
     * move: a read that finds an expired key is not itself propagated.
     *
     * @return true if the key was removed
     */
    public boolean expireIfNeeded(int dbIndex, String key) {
        if (loading) return false;
        ConcurrentHashMap<String, ValueEntry> store = getStore(dbIndex);
        ValueEntry v = store.get(key);
        if (v == null || !v.isExpired(System.currentTimeMillis())) return false;
        if (!store.remove(key, v)) return false;
        expiredKeys.incrementAndGet();
        expiredKeyHandler.accept(dbIndex, key);
        touchNotifier.touch(dbIndex, key);
        return true;
    }

    /**
     * Removes every key whose time to live ran out before {@code now}, across all databases.
     */
    public int activeExpireCycle(long now) {
        if (loading) return 0;
        int removed = 0;
        for (int db = 0; db < databases.length; db++) {
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, ValueEntry> e : databases[db].entrySet()) {
                if (e.getValue().isExpired(now)) expired.add(e.getKey());
            }
            for (String key : expired) {
                if (expireIfNeeded(db, key)) removed++;
            }
        }
        return removed;
    }

    /**
     * Sets the absolute expiry of an existing key, in unix milliseconds.
     *
     * @return false if the key does not exist
     */
    public boolean setExpire(int dbIndex, String key, long whenMillis) {
        ValueEntry v = get(dbIndex, key);
        if (v == null) return false;
        v.expireAt = whenMillis;
        signalModified(dbIndex, key);
        return true;
    }

    /** Absolute expiry in unix milliseconds, or -1 when the key is missing or persistent. */
    public long getExpire(int dbIndex, String key) {
        ValueEntry v = get(dbIndex, key);
        return v == null ? -1 : v.expireAt;
    }

    public boolean persist(int dbIndex, String key) {
        ValueEntry v = get(dbIndex, key);
        if (v == null || v.expireAt == -1) return false;
        v.expireAt = -1;
        signalModified(dbIndex, key);
        return true;
    }

    /**
     * Returns the aggregate stored at {@code key}, creating an empty one when the key is absent.
     * Nothing is signalled; the caller does that once it has changed the value.
     *
     * @throws RuntimeException with a WRONGTYPE message if the key holds another type
     */
    public ValueEntry getOrCreate(int dbIndex, String key, DataType type) {
        expireIfNeeded(dbIndex, key);
        ConcurrentHashMap<String, ValueEntry> store = getStore(dbIndex);
        ValueEntry v = store.get(key);
        if (v == null) {
            switch (type) {
                case LIST: v = ValueEntry.newList(); break;
                case HASH: v = ValueEntry.newHash(); break;
                case SET: v = ValueEntry.newSet(); break;
                case ZSET: v = ValueEntry.newZSet(); break;
                default: throw new IllegalArgumentException("Not an aggregate type: " + type);
            }
            store.put(key, v);
        } else if (v.type != type) {
            throw new RuntimeException(WRONGTYPE);
        }
        v.touch();
        return v;
    }

    // Aggregates never stay in the keyspace empty.
    public void removeIfEmpty(int dbIndex, String key) {
        getStore(dbIndex).computeIfPresent(key, (k, v) -> v.isEmptyAggregate() ? null : v);
    }

    public void put(int dbIndex, String key, ValueEntry value) {
        getStore(dbIndex).put(key, value);
        signalModified(dbIndex, key);
    }

    public ValueEntry remove(int dbIndex, String key) {
        ValueEntry v = getStore(dbIndex).remove(key);
        if (v != null) {
            signalModified(dbIndex, key);
        }
        return v;
    }

    /**
     * Records an in-place change to {@code key}: watchers are invalidated and the change
     * counter moves, which is what makes the running command propagate.
     * Commands that mutate a value through {@link #getStore(int)} must call this themselves.
     */
    public void signalModified(int dbIndex, String key) {
        dirty.incrementAndGet();
        touchNotifier.touch(dbIndex, key);
    }

    public long flush(int dbIndex) {
        ConcurrentHashMap<String, ValueEntry> store = getStore(dbIndex);
        touchNotifier.touchOnFlush(dbIndex);
        long removed = store.size();
        store.clear();
        dirty.addAndGet(removed);
        return removed;
    }

    public long flushAll() {
        touchNotifier.touchOnFlush(TouchNotifier.ALL);
        long removed = 0;
        for (ConcurrentHashMap<String, ValueEntry> store : databases) {
            removed += store.size();
            store.clear();
        }
        // FLUSHALL always propagates, even on an empty keyspace.
        dirty.addAndGet(Math.max(1, removed));
        return removed;
    }

    public int size(int dbIndex) {
        return getStore(dbIndex).size();
    }

    public int size() {
        int total = 0;
        for (ConcurrentHashMap<String, ValueEntry> store : databases) total += store.size();
        return total;
    }

    public Set<String> keys(int dbIndex) {
        return getStore(dbIndex).keySet();
    }

    public long getExpiredKeys() {
        return expiredKeys.get();
    }

    public void incrementDirty() {
        dirty.incrementAndGet();
    }

    /** Number of changes since startup; compared before and after a command to decide propagation. */
    public long getDirty() {
        return dirty.get();
    }
}
