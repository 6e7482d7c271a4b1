package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class SetNxCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        if (Quire.keyspace.exists(client.getDbIndex(), key)) {
            client.sendInteger(0);
            return;
        }
        Quire.keyspace.put(client.getDbIndex(), key, ValueEntry.string(args.get(2).clone()));
        client.sendInteger(1);
    }
}
