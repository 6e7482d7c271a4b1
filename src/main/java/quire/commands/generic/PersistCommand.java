package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class PersistCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        client.sendInteger(Quire.keyspace.persist(client.getDbIndex(), key) ? 1 : 0);
    }
}
