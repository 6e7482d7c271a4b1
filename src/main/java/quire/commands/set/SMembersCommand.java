package quire.commands.set;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class SMembersCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        if (entry != null && entry.type != DataType.SET) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }
        List<byte[]> members = new ArrayList<>();
        if (entry != null) {
            for (String m : entry.asSet()) members.add(m.getBytes(StandardCharsets.UTF_8));
        }
        client.sendArray(members);
    }
}
