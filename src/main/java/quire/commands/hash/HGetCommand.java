package quire.commands.hash;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class HGetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        String field = new String(args.get(2), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        if (entry == null) {
            client.sendNull();
        } else if (entry.type != DataType.HASH) {
            client.sendError(Keyspace.WRONGTYPE);
        } else {
            client.sendBulkString(entry.asHash().get(field));
        }
    }
}
