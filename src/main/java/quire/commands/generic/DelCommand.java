package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class DelCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        int db = client.getDbIndex();
        int deleted = 0;
        for (int i = 1; i < args.size(); i++) {
            String key = new String(args.get(i), StandardCharsets.UTF_8);
            // An already expired key does not count as deleted.
            Quire.keyspace.expireIfNeeded(db, key);
            if (Quire.keyspace.remove(db, key) != null) deleted++;
        }
        client.sendInteger(deleted);
    }
}
