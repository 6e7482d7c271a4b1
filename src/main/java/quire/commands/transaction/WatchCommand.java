package quire.commands.transaction;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import quire.transaction.TransactionException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class WatchCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        List<String> keys = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            keys.add(new String(args.get(i), StandardCharsets.UTF_8));
        }
        try {
            Quire.transactions.watch(client, keys);
            client.sendSimpleString("OK");
        } catch (TransactionException e) {
            client.sendError(e.getMessage());
        }
    }
}
