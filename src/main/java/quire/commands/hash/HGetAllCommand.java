package quire.commands.hash;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HGetAllCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        if (entry != null && entry.type != DataType.HASH) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        List<byte[]> flat = new ArrayList<>();
        if (entry != null) {
            for (Map.Entry<String, String> e : entry.asHash().entrySet()) {
                flat.add(e.getKey().getBytes(StandardCharsets.UTF_8));
                flat.add(e.getValue().getBytes(StandardCharsets.UTF_8));
            }
        }
        client.sendArray(flat);
    }
}
