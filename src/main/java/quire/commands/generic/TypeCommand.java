package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TypeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        client.sendSimpleString(entry == null ? "none" : entry.type.getTypeName());
    }
}
