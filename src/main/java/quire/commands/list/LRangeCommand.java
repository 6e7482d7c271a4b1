package quire.commands.list;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public class LRangeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        int start;
        int end;
        try {
            start = Integer.parseInt(new String(args.get(2), StandardCharsets.UTF_8));
            end = Integer.parseInt(new String(args.get(3), StandardCharsets.UTF_8));
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
        if (entry.type != DataType.LIST) {
            client.sendError(Keyspace.WRONGTYPE);
            return;
        }

        int size = entry.asList().size();
        if (start < 0) start += size;
        if (end < 0) end += size;
        if (start < 0) start = 0;
        if (end >= size) end = size - 1;

        List<byte[]> sub = new ArrayList<>();
        if (start <= end) {
            Iterator<String> it = entry.asList().iterator();
            int idx = 0;
            while (it.hasNext() && idx <= end) {
                String s = it.next();
                if (idx >= start) sub.add(s.getBytes(StandardCharsets.UTF_8));
                idx++;
            }
        }
        client.sendArray(sub);
    }
}
