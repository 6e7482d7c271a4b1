package quire.commands.list;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class LPopCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        ValueEntry entry = Quire.keyspace.get(db, key);

        if (entry == null) {
            client.sendNull();
            return;
        }
        if (entry.type != DataType.LIST) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        String val = entry.asList().pollFirst();
        if (val == null) {
            client.sendNull();
            return;
        }
        Quire.keyspace.removeIfEmpty(db, key);
        Quire.keyspace.signalModified(db, key);
        client.sendBulkString(val);
    }
}
