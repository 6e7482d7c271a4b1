package quire.commands.zset;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class ZScoreCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        if (entry == null) {
            client.sendNull();
            return;
        }
        if (entry.type != DataType.ZSET) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }
        Double score = entry.asZSet().score(new String(args.get(2), StandardCharsets.UTF_8));
        if (score == null) {
            client.sendNull();
        } else {
            client.sendBulkString(Scores.format(score));
        }
    }
}
