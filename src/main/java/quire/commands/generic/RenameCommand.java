package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RENAME, and RENAMENX when built with {@code nx}. The entry moves as is, so its
 * time to live goes with it. Both names are signalled.
 */
public class RenameCommand implements Command {
    private final boolean nx;

    public RenameCommand() {
        this(false);
    }

    public RenameCommand(boolean nx) {
        this.nx = nx;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String oldKey = new String(args.get(1), StandardCharsets.UTF_8);
        String newKey = new String(args.get(2), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        if (oldKey.equals(newKey)) {
            client.sendError("ERR source and destination objects are the same");
            return;
        }
        if (!Quire.keyspace.exists(db, oldKey)) {
            client.sendError("ERR no such key");
            return;
        }
        if (nx && Quire.keyspace.exists(db, newKey)) {
            client.sendInteger(0);
            return;
        }

        ValueEntry val = Quire.keyspace.remove(db, oldKey);
        Quire.keyspace.put(db, newKey, val);
        if (nx) {
            client.sendInteger(1);
        } else {
            client.sendSimpleString("OK");
        }
    }
}
