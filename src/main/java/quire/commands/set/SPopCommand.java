package quire.commands.set;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import quire.protocol.Resp;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Removes a random member. The random choice is not replayable, so the command is
 * propagated as SREM of the member that was actually removed.
 */
public class SPopCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        ValueEntry entry = Quire.keyspace.get(db, key);
        if (entry == null) {
            client.sendNull();
            return;
        }
        if (entry.type != DataType.SET) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        Set<String> set = entry.asSet();
        if (set.isEmpty()) {
            client.sendNull();
            return;
        }
        int skip = ThreadLocalRandom.current().nextInt(set.size());
        Iterator<String> it = set.iterator();
        String member = it.next();
        for (int i = 0; i < skip && it.hasNext(); i++) member = it.next();
        set.remove(member);

        Quire.keyspace.removeIfEmpty(db, key);
        Quire.keyspace.signalModified(db, key);
        client.rewriteCommand(Resp.args("SREM", key, member));
        client.sendBulkString(member);
    }
}
