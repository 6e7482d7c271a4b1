package quire.commands.string;

import quire.Quire;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;

/**
 * Shared arithmetic for INCR, DECR, INCRBY and DECRBY.
 */
final class Counters {
    static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";

    private Counters() {
    }

    static void incrBy(ClientHandler client, String key, long delta) {
        int db = client.getDbIndex();
        final long[] ret = {0};
        Quire.keyspace.expireIfNeeded(db, key);
        try {
            Quire.keyspace.getStore(db).compute(key, (k, v) -> {
                long val = 0;
                if (v != null) {
                    if (v.type != DataType.STRING) throw new RuntimeException(Keyspace.WRONGTYPE);
                    try {
                        val = Long.parseLong(new String((byte[]) v.getValue(), StandardCharsets.UTF_8));
                    } catch (NumberFormatException e) {
                        throw new RuntimeException(NOT_AN_INTEGER);
                    }
                }
                try {
                    val = Math.addExact(val, delta);
                } catch (ArithmeticException e) {
                    throw new RuntimeException("ERR increment or decrement would overflow");
                }
                ret[0] = val;
                byte[] bytes = String.valueOf(val).getBytes(StandardCharsets.UTF_8);
                if (v == null) return ValueEntry.string(bytes);
                v.setValue(bytes);
                v.touch();
                return v;
            });
            Quire.keyspace.signalModified(db, key);
            client.sendInteger(ret[0]);
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }

    static Long parseLong(byte[] arg) {
        try {
            return Long.parseLong(new String(arg, StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
