package quire.commands.connection;

import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class PingCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if (args.size() > 1) {
            client.sendBulkString(args.get(1));
        } else {
            client.sendSimpleString("PONG");
        }
    }
}
