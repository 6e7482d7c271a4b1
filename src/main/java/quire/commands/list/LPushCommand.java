package quire.commands.list;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class LPushCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        try {
            ValueEntry entry = Quire.keyspace.getOrCreate(db, key, DataType.LIST);
            for (int i = 2; i < args.size(); i++) {
                entry.asList().addFirst(new String(args.get(i), StandardCharsets.UTF_8));
            }
            Quire.keyspace.signalModified(db, key);
            client.sendInteger(entry.asList().size());
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }
}
