package quire.commands.transaction;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import quire.transaction.TransactionException;
import java.util.List;

public class ExecCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        try {
            Quire.transactions.exec(client);
        } catch (TransactionException e) {
            client.sendError(e.getMessage());
        }
    }
}
