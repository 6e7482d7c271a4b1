package quire.commands.hash;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class HSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        String field = new String(args.get(2), StandardCharsets.UTF_8);
        String value = new String(args.get(3), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        try {
            ValueEntry entry = Quire.keyspace.getOrCreate(db, key, DataType.HASH);
            boolean isNew = entry.asHash().put(field, value) == null;
            Quire.keyspace.signalModified(db, key);
            client.sendInteger(isNew ? 1 : 0);
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }
}
