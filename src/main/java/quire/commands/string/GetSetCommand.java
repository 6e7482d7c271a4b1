package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class GetSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        ValueEntry old = Quire.keyspace.get(db, key);
        if (old != null && old.type != DataType.STRING) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        Quire.keyspace.put(db, key, ValueEntry.string(args.get(2).clone()));
        if (old == null) {
            client.sendNull();
        } else {
            client.sendBulkString((byte[]) old.getValue());
        }
    }
}
