package quire.commands.server;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class FlushDbCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Quire.keyspace.flush(client.getDbIndex());
        client.sendSimpleString("OK");
    }
}
