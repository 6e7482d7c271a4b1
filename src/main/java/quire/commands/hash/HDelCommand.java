package quire.commands.hash;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class HDelCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        ValueEntry entry = Quire.keyspace.get(db, key);
        if (entry == null) {
            client.sendInteger(0);
            return;
        }
        if (entry.type != DataType.HASH) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        int deleted = 0;
        for (int i = 2; i < args.size(); i++) {
            if (entry.asHash().remove(new String(args.get(i), StandardCharsets.UTF_8)) != null) deleted++;
        }
        if (deleted > 0) {
            Quire.keyspace.removeIfEmpty(db, key);
            Quire.keyspace.signalModified(db, key);
        }
        client.sendInteger(deleted);
    }
}
