package quire.commands.transaction;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import quire.transaction.TransactionException;
import java.util.List;

public class DiscardCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        try {
            Quire.transactions.discard(client);
            client.sendSimpleString("OK");
        } catch (TransactionException e) {
            client.sendError(e.getMessage());
        }
    }
}
