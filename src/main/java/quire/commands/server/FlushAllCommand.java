package quire.commands.server;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class FlushAllCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Quire.keyspace.flushAll();
        client.sendSimpleString("OK");
    }
}
