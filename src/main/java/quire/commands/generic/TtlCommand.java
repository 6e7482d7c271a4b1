package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * TTL and PTTL: -2 for a missing key, -1 for a key without a time to live.
 */
public class TtlCommand implements Command {
    private final boolean millis;

    public TtlCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        if (!Quire.keyspace.exists(db, key)) {
            client.sendInteger(-2);
            return;
        }
        long expireAt = Quire.keyspace.getExpire(db, key);
        if (expireAt == -1) {
            client.sendInteger(-1);
            return;
        }
        long ttl = Math.max(0, expireAt - System.currentTimeMillis());
        client.sendInteger(millis ? ttl : (ttl + 500) / 1000);
    }
}
