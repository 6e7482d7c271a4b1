package quire.transaction;

import java.util.Objects;

public final class WatchedKey {
    private final int db;
    private final String key;

    public WatchedKey(int db, String key) {
        this.db = db;
        this.key = key;
    }

    public int getDb() {
        return db;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WatchedKey)) return false;
        WatchedKey that = (WatchedKey) o;
        return db == that.db && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(db, key);
    }

    @Override
    public String toString() {
        return db + ":" + key;
    }
}
