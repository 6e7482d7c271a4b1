package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class GetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);

        if (entry == null) {
            client.sendNull();
        } else if (entry.type != DataType.STRING) {
            client.sendError(Keyspace.WRONGTYPE);
        } else {
            client.sendBulkString((byte[]) entry.getValue());
        }
    }
}
