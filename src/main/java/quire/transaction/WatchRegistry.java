package quire.transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Server-wide record of WATCHed keys.
 * <p>
 * Two indexes are kept in step: per database, key to the ids of the connections watching
 * it (in watch order), and per connection, the keys it watches together with the
 * {@link MultiState} to flag when one of them is touched. Every entry is added and
 * removed from both sides by the same method.
 * <p>
 * Not synchronized. All callers run on the single command-execution thread.
 */
public class WatchRegistry implements TouchNotifier {

    private static final class Watcher {
        final MultiState state;
        final Set<WatchedKey> keys = new LinkedHashSet<>();

        Watcher(MultiState state) {
            this.state = state;
        }
    }

    private final Map<Integer, Map<String, Set<Long>>> keysByDb = new HashMap<>();
    private final Map<Long, Watcher> watchers = new LinkedHashMap<>();
    private final BiPredicate<Integer, String> keyExists;

    /**
     * @param keyExists tells whether a key is currently present; consulted on flush so
     *                  that only watchers of keys that actually disappear are invalidated
     */
    public WatchRegistry(BiPredicate<Integer, String> keyExists) {
        this.keyExists = keyExists;
    }

    /**
     * Registers {@code clientId} as a watcher of {@code key} in {@code db}.
     *
     * @return false if the connection was already watching that key
     */
    public boolean watch(long clientId, MultiState state, int db, String key) {
        Watcher watcher = watchers.computeIfAbsent(clientId, id -> new Watcher(state));
        if (!watcher.keys.add(new WatchedKey(db, key))) return false;
        keysByDb.computeIfAbsent(db, d -> new HashMap<>())
                .computeIfAbsent(key, k -> new LinkedHashSet<>())
                .add(clientId);
        return true;
    }

    /**
     * Drops every watch held by {@code clientId}. The connection's conflict flag is left alone.
     */
    public void unwatchAll(long clientId) {
        Watcher watcher = watchers.remove(clientId);
        if (watcher == null) return;
        for (WatchedKey wk : watcher.keys) {
            Map<String, Set<Long>> keys = keysByDb.get(wk.getDb());
            if (keys == null) continue;
            Set<Long> ids = keys.get(wk.getKey());
            if (ids == null) continue;
            ids.remove(clientId);
            if (ids.isEmpty()) keys.remove(wk.getKey());
            if (keys.isEmpty()) keysByDb.remove(wk.getDb());
        }
    }

    @Override
    public void touch(int db, String key) {
        Map<String, Set<Long>> keys = keysByDb.get(db);
        if (keys == null) return;
        Set<Long> ids = keys.get(key);
        if (ids == null) return;
        for (Long id : ids) {
            Watcher watcher = watchers.get(id);
            if (watcher != null) watcher.state.markDirtyCas();
        }
    }

    @Override
    public void touchOnFlush(int db) {
        for (Watcher watcher : watchers.values()) {
            Iterator<WatchedKey> it = watcher.keys.iterator();
            while (it.hasNext()) {
                WatchedKey wk = it.next();
                if (db != ALL && wk.getDb() != db) continue;
                if (keyExists.test(wk.getDb(), wk.getKey())) {
                    watcher.state.markDirtyCas();
                    break;
                }
            }
        }
    }

    public List<WatchedKey> getWatchedKeys(long clientId) {
        Watcher watcher = watchers.get(clientId);
        if (watcher == null) return Collections.emptyList();
        return new ArrayList<>(watcher.keys);
    }

    public Set<Long> getWatchers(int db, String key) {
        Map<String, Set<Long>> keys = keysByDb.get(db);
        if (keys == null) return Collections.emptySet();
        Set<Long> ids = keys.get(key);
        return ids == null ? Collections.<Long>emptySet() : Collections.unmodifiableSet(ids);
    }

    public boolean isWatching(long clientId) {
        return watchers.containsKey(clientId);
    }

    public int getWatchingClientCount() {
        return watchers.size();
    }

    public int getWatchedKeyCount() {
        int total = 0;
        for (Map<String, Set<Long>> keys : keysByDb.values()) total += keys.size();
        return total;
    }
}
