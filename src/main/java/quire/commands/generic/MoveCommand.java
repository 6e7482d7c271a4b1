package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Moves a key to another database, keeping its time to live. The key is signalled in
 * both databases, so watchers on either side see the move.
 */
public class MoveCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        int target;
        try {
            target = Integer.parseInt(new String(args.get(2), StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            client.sendError("ERR index out of range");
            return;
        }
        if (target < 0 || target >= Quire.keyspace.getDbCount()) {
            client.sendError("ERR index out of range");
            return;
        }
        if (target == db) {
            client.sendError("ERR source and destination objects are the same");
            return;
        }

        ValueEntry val = Quire.keyspace.get(db, key);
        if (val == null || Quire.keyspace.exists(target, key)) {
            client.sendInteger(0);
            return;
        }
        Quire.keyspace.remove(db, key);
        Quire.keyspace.put(target, key, val);
        client.sendInteger(1);
    }
}
