package quire.commands.string;

import quire.Quire;
import quire.commands.Command;
import quire.db.DataType;
import quire.db.Keyspace;
import quire.db.ValueEntry;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class AppendCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = new String(args.get(1), StandardCharsets.UTF_8);
        byte[] suffix = args.get(2);
        int db = client.getDbIndex();

        Quire.keyspace.expireIfNeeded(db, key);
        try {
            ValueEntry updated = Quire.keyspace.getStore(db).compute(key, (k, v) -> {
                if (v == null) return ValueEntry.string(suffix.clone());
                if (v.type != DataType.STRING) throw new RuntimeException(Keyspace.WRONGTYPE);

                byte[] current = (byte[]) v.getValue();
                byte[] joined = new byte[current.length + suffix.length];
                System.arraycopy(current, 0, joined, 0, current.length);
                System.arraycopy(suffix, 0, joined, current.length, suffix.length);
                v.setValue(joined);
                v.touch();
                return v;
            });
            Quire.keyspace.signalModified(db, key);
            client.sendInteger(((byte[]) updated.getValue()).length);
        } catch (RuntimeException e) {
            client.sendError(e.getMessage());
        }
    }
}
