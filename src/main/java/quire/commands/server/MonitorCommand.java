package quire.commands.server;

import quire.Quire;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.util.List;

public class MonitorCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.setMonitor(true);
        Quire.monitors.add(client);
        client.sendSimpleString("OK");
    }
}
