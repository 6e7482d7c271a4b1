package quire.server;

import quire.commands.CommandMetadata;
import quire.db.Keyspace;
import quire.network.ClientHandler;
import quire.transaction.QueuedCommand;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one resolved command for a client. Used for commands arriving off the wire and
 * for each command of an EXEC batch.
 */
public class CommandExecutor {
    private final Keyspace keyspace;
    private final Propagator propagator;
    private final Monitors monitors;
    private final AtomicLong totalCommands = new AtomicLong(0);
    private volatile boolean loading = false;

    public CommandExecutor(Keyspace keyspace, Propagator propagator, Monitors monitors) {
        this.keyspace = keyspace;
        this.propagator = propagator;
        this.monitors = monitors;
    }

    /**
     * Executes {@code command} and, if it changed the keyspace, propagates it.
     * The command may replace itself while running (see {@link ClientHandler#rewriteCommand(List)});
     * the form that was propagated is returned.
     */
    public QueuedCommand call(ClientHandler client, QueuedCommand command) {
        client.setCurrentCommand(command);
        if (!command.getMetadata().hasFlag(CommandMetadata.SKIP_MONITOR)) {
            feedMonitors(client, command.getArgs());
        }

        long dirtyBefore = keyspace.getDirty();
        try {
            command.getCommand().execute(client, command.getArgs());
        } finally {
            totalCommands.incrementAndGet();
            // A command that failed halfway still propagates whatever it changed.
            if (keyspace.getDirty() != dirtyBefore) {
                propagator.propagate(client.getDbIndex(), client.getCurrentCommand().getArgs());
            }
        }
        return client.getCurrentCommand();
    }

    public void feedMonitors(ClientHandler client, List<byte[]> args) {
        if (loading || monitors.isEmpty()) return;
        monitors.feed(client, client.getDbIndex(), args);
    }

    public void setLoading(boolean loading) {
        this.loading = loading;
    }

    public boolean isLoading() {
        return loading;
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }
}
