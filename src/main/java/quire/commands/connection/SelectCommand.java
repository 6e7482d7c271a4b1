package quire.commands.connection;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class SelectCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        int index;
        try {
            index = Integer.parseInt(new String(args.get(1), StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            client.sendError("ERR invalid DB index");
            return;
        }
        if (index < 0 || index >= Quire.keyspace.getDbCount()) {
            client.sendError("ERR invalid DB index");
            return;
        }
        client.setDbIndex(index);
        client.sendSimpleString("OK");
    }
}
