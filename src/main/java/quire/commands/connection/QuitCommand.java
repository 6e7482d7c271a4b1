package quire.commands.connection;

import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class QuitCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendSimpleString("OK");
        client.close();
    }
}
