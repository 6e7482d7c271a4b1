package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class MSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if (args.size() % 2 == 0) {
            client.sendError("ERR wrong number of arguments for MSET");
            return;
        }
        for (int i = 1; i < args.size(); i += 2) {
            String key = new String(args.get(i), StandardCharsets.UTF_8);
            Quire.keyspace.put(client.getDbIndex(), key, ValueEntry.string(args.get(i + 1).clone()));
        }
        client.sendSimpleString("OK");
    }
}
