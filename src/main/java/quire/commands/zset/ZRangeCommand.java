package quire.commands.zset;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import quire.structs.ZSet;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * ZRANGE key start stop [WITHSCORES], ranks in ascending score order.
 */
public class ZRangeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        boolean withScores = false;
        if (args.size() == 5
                && new String(args.get(4), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT).equals("WITHSCORES")) {
            withScores = true;
        } else if (args.size() >= 5) {
            client.sendError("ERR syntax error");
            return;
        }

        long start;
        long end;
        try {
            start = Long.parseLong(new String(args.get(2), StandardCharsets.UTF_8));
            end = Long.parseLong(new String(args.get(3), StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            client.sendError("ERR value is not an integer or out of range");
            return;
        }

        String key = new String(args.get(1), StandardCharsets.UTF_8);
        ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
        if (entry == null) {
            client.sendArray(Collections.emptyList());
            return;
        }
        if (entry.type != DataType.ZSET) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        int size = entry.asZSet().size();
        if (start < 0) start += size;
        if (end < 0) end += size;
        if (start < 0) start = 0;
        if (start > end || start >= size) {
            client.sendArray(Collections.emptyList());
            return;
        }
        if (end >= size) end = size - 1;

        List<byte[]> reply = new ArrayList<>();
        for (ZSet.Member m : entry.asZSet().range((int) start, (int) end)) {
            reply.add(m.name.getBytes(StandardCharsets.UTF_8));
            if (withScores) reply.add(Scores.format(m.score).getBytes(StandardCharsets.UTF_8));
        }
        client.sendArray(reply);
    }
}
