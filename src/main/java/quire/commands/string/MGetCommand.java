package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class MGetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        List<byte[]> values = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            String key = new String(args.get(i), StandardCharsets.UTF_8);
            ValueEntry entry = Quire.keyspace.get(client.getDbIndex(), key);
            // Missing keys and non-strings both read as nil.
            if (entry == null || entry.type != DataType.STRING) {
                values.add(null);
            } else {
                values.add((byte[]) entry.getValue());
            }
        }
        client.sendArray(values);
    }
}
