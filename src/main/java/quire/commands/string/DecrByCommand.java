package quire.commands.string;

import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class DecrByCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Long decr = Counters.parseLong(args.get(2));
        if (decr == null || decr == Long.MIN_VALUE) {
            client.sendError(Counters.NOT_AN_INTEGER);
            return;
        }
        Counters.incrBy(client, new String(args.get(1), StandardCharsets.UTF_8), -decr);
    }
}
