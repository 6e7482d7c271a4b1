package quire.commands.string;

import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class IncrCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Counters.incrBy(client, new String(args.get(1), StandardCharsets.UTF_8), 1);
    }
}
