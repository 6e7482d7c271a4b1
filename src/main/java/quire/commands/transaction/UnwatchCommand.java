package quire.commands.transaction;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class UnwatchCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Quire.transactions.unwatch(client);
        client.sendSimpleString("OK");
    }
}
