package quire.transaction;

/**
 * Hook the keyspace write path calls whenever a key is modified or a database is flushed.
 */
public interface TouchNotifier {

    /** Database id meaning "every database" for {@link #touchOnFlush(int)}. */
    int ALL = -1;

    TouchNotifier NONE = new TouchNotifier() {
        @Override
        public void touch(int db, String key) {
        }

        @Override
        public void touchOnFlush(int db) {
        }
    };

    void touch(int db, String key);

    /**
     * Called before a database (or all of them, with {@link #ALL}) is emptied.
     */
    void touchOnFlush(int db);
}
