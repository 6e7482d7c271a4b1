package quire.commands.set;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class SAddCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        try {
            ValueEntry entry = Quire.keyspace.getOrCreate(db, key, DataType.SET);
            int added = 0;
            for (int i = 2; i < args.size(); i++) {
                if (entry.asSet().add(new String(args.get(i), StandardCharsets.UTF_8))) added++;
            }
            if (added > 0) Quire.keyspace.signalModified(db, key);
            client.sendInteger(added);
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }
}
