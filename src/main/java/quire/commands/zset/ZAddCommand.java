package quire.commands.zset;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * ZADD key score member [score member ...]. Every score is parsed before anything is
 * written, so a bad score leaves the key untouched. Replies with the number of new members.
 */
public class ZAddCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if (args.size() % 2 != 0) {
            client.sendError("ERR syntax error");
            return;
        }
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();

        int pairs = (args.size() - 2) / 2;
        double[] scores = new double[pairs];
        for (int i = 0; i < pairs; i++) {
            Double score = Scores.parse(args.get(2 + i * 2));
            if (score == null) {
                client.sendError(Scores.NOT_A_FLOAT);
                return;
            }
            scores[i] = score;
        }

        try {
            ValueEntry entry = Quire.keyspace.getOrCreate(db, key, DataType.ZSET);
            int added = 0;
            int updated = 0;
            for (int i = 0; i < pairs; i++) {
                String member = new String(args.get(3 + i * 2), StandardCharsets.UTF_8);
                Double previous = entry.asZSet().put(member, scores[i]);
                if (previous == null) added++;
                else if (previous != scores[i]) updated++;
            }
            if (added > 0 || updated > 0) Quire.keyspace.signalModified(db, key);
            client.sendInteger(added);
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }
}
