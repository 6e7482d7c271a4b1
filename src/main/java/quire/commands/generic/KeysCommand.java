package quire.commands.generic;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import quire.utils.GlobPattern;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class KeysCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String glob = new String(args.get(1), StandardCharsets.UTF_8);
        int db = client.getDbIndex();
        boolean all = glob.equals("*");
        Pattern pattern = all ? null : GlobPattern.compile(glob);

        List<byte[]> matched = new ArrayList<>();
        for (String key : new ArrayList<>(Quire.keyspace.keys(db))) {
            if (!all && !pattern.matcher(key).matches()) continue;
            if (Quire.keyspace.expireIfNeeded(db, key)) continue;
            matched.add(key.getBytes(StandardCharsets.UTF_8));
        }
        client.sendArray(matched);
    }
}
