package quire.commands;

import quire.network.ClientHandler;
import java.util.List;

public interface Command {
    // args includes the command name at index 0.
    // The command replies through the client's send* methods and, when it changes the
    // keyspace in a way that must be propagated differently, calls client.rewriteCommand().
    void execute(ClientHandler client, List<byte[]> args);
}
