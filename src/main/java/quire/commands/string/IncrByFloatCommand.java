package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import quire.protocol.Resp;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * INCRBYFLOAT is propagated as a SET of the resulting value, so replicas and the
 * append-only file never redo the floating point arithmetic. A key with a time to
 * live is propagated with its remaining milliseconds as PX.
 */
public class IncrByFloatCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        final double incr;
        try {
            incr = Double.parseDouble(new String(args.get(2), StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            client.sendError("ERR value is not a valid float");
            return;
        }

        final String[] ret = {null};
        final long[] expireAt = {-1};
        Quire.keyspace.expireIfNeeded(db, key);
        try {
            Quire.keyspace.getStore(db).compute(key, (k, v) -> {
                double val = 0;
                if (v != null) {
                    if (v.type != DataType.STRING) throw new RuntimeException(Keyspace.WRONGTYPE);
                    try {
                        val = Double.parseDouble(new String((byte[]) v.getValue(), StandardCharsets.UTF_8));
                    } catch (NumberFormatException e) {
                        throw new RuntimeException("ERR value is not a valid float");
                    }
                }
                val += incr;
                if (Double.isNaN(val) || Double.isInfinite(val)) {
                    throw new RuntimeException("ERR increment would produce NaN or Infinity");
                }
                ret[0] = format(val);
                byte[] bytes = ret[0].getBytes(StandardCharsets.UTF_8);
                if (v == null) return ValueEntry.string(bytes);
                expireAt[0] = v.expireAt;
                v.setValue(bytes);
                v.touch();
                return v;
            });
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
            return;
        }

        Quire.keyspace.signalModified(db, key);
        if (expireAt[0] == -1) {
            client.rewriteCommand(Resp.args("SET", key, ret[0]));
        } else {
            long ttl = Math.max(1, expireAt[0] - System.currentTimeMillis());
            client.rewriteCommand(Resp.args("SET", key, ret[0], "PX", String.valueOf(ttl)));
        }
        client.sendBulkString(ret[0]);
    }

    static String format(double val) {
        if (val == Math.rint(val) && Math.abs(val) < 1e17) return String.valueOf((long) val);
        return new BigDecimal(Double.toString(val)).stripTrailingZeros().toPlainString();
    }
}
