package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

public class SetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        byte[] val = args.get(2);
        boolean nx = false;
        boolean xx = false;
        long ttlMillis = -1;

        for (int i = 3; i < args.size(); i++) {
            String opt = new String(args.get(i), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
            if (opt.equals("NX")) {
                nx = true;
            } else if (opt.equals("XX")) {
                xx = true;
            } else if ((opt.equals("EX") || opt.equals("PX")) && i + 1 < args.size()) {
                Long amount = Counters.parseLong(args.get(++i));
                if (amount == null) {
                    client.sendError(Counters.NOT_AN_INTEGER);
                    return;
                }
                if (amount <= 0 || (opt.equals("EX") && amount > Long.MAX_VALUE / 1000)) {
                    client.sendError("ERR invalid expire time in set");
                    return;
                }
                ttlMillis = opt.equals("EX") ? amount * 1000 : amount;
            } else {
                client.sendError("ERR syntax error");
                return;
            }
        }
        if (nx && xx) {
            client.sendError("ERR syntax error");
            return;
        }

        int db = client.getDbIndex();
        boolean exists = Quire.keyspace.exists(db, key);
        if ((nx && exists) || (xx && !exists)) {
            client.sendNull();
            return;
        }

        ValueEntry entry = ValueEntry.string(val.clone());
        if (ttlMillis != -1) entry.expireAt = System.currentTimeMillis() + ttlMillis;
        Quire.keyspace.put(db, key, entry);
        client.sendSimpleString("OK");
    }
}
