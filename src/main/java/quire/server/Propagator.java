package quire.server;

import quire.persistence.CommandLogger;
import quire.protocol.Resp;
import quire.replication.ReplicationBacklog;
import java.util.List;

/**
 * Single exit point for changes leaving the server.
 * Every propagated command is appended, in the same order, to the replication backlog
 * and to the append-only file. A SELECT is inserted whenever the target database differs
 * from the one the previous command was propagated against.
 */
public class Propagator {
    private final ReplicationBacklog backlog;
    private volatile CommandLogger commandLogger;
    private int selectedDb = -1;
    private volatile boolean enabled = true;

    public Propagator(ReplicationBacklog backlog) {
        this.backlog = backlog;
    }

    public synchronized void propagate(int dbIndex, List<byte[]> args) {
        if (!enabled) return;
        if (dbIndex != selectedDb) {
            append(Resp.command("SELECT", String.valueOf(dbIndex)));
            selectedDb = dbIndex;
        }
        append(Resp.array(args));
    }

    private void append(byte[] bytes) {
        backlog.write(bytes);
        CommandLogger logger = commandLogger;
        if (logger != null) logger.log(bytes);
    }

    public void setCommandLogger(CommandLogger commandLogger) {
        this.commandLogger = commandLogger;
        // A reopened file may end with any SELECT; force a fresh one.
        synchronized (this) {
            selectedDb = -1;
        }
    }

    public CommandLogger getCommandLogger() {
        return commandLogger;
    }

    // Turned off while the append-only file is being replayed.
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ReplicationBacklog getBacklog() {
        return backlog;
    }
}
