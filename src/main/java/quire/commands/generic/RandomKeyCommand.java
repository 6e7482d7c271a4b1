package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

public class RandomKeyCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        int db = client.getDbIndex();
        Set<String> keys = Quire.keyspace.keys(db);

        // An expired pick is deleted and another one drawn.
        while (!keys.isEmpty()) {
            String key = pick(keys);
            if (key == null) continue;
            if (Quire.keyspace.expireIfNeeded(db, key)) continue;
            client.sendBulkString(key);
            return;
        }
        client.sendNull();
    }

    private static String pick(Set<String> keys) {
        int target = ThreadLocalRandom.current().nextInt(keys.size());
        Iterator<String> it = keys.iterator();
        for (int i = 0; i < target && it.hasNext(); i++) it.next();
        return it.hasNext() ? it.next() : null;
    }
}
