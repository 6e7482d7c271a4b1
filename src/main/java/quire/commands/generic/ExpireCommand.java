package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import quire.protocol.Resp;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * EXPIRE, PEXPIRE, EXPIREAT and PEXPIREAT. Every successful form is propagated as
 * PEXPIREAT with the absolute deadline, so a replayed log does not stretch the time to live.
 * A deadline already in the past deletes the key and is propagated as DEL.
 */
public class ExpireCommand implements Command {
    private final long unitMillis;
    private final boolean absolute;

    public ExpireCommand(long unitMillis, boolean absolute) {
        this.unitMillis = unitMillis;
        this.absolute = absolute;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        long now = System.currentTimeMillis();

        long when;
        try {
            long amount = Long.parseLong(new String(args.get(2), StandardCharsets.UTF_8));
            when = Math.addExact(Math.multiplyExact(amount, unitMillis), absolute ? 0 : now);
        } catch (NumberFormatException | ArithmeticException e) {
            client.sendError("ERR value is not an integer or out of range");
            return;
        }

        if (!Quire.keyspace.exists(db, key)) {
            client.sendInteger(0);
            return;
        }

        if (when <= now && !Quire.keyspace.isLoading()) {
            Quire.keyspace.remove(db, key);
            client.rewriteCommand(Resp.args("DEL", key));
        } else {
            Quire.keyspace.setExpire(db, key, when);
            client.rewriteCommand(Resp.args("PEXPIREAT", key, String.valueOf(when)));
        }
        client.sendInteger(1);
    }
}
