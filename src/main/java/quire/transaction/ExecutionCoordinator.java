package quire.transaction;

import quire.db.Keyspace;
import quire.network.ClientHandler;
import quire.protocol.Resp;
import quire.server.CommandExecutor;
import quire.server.Propagator;
import quire.utils.Log;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Drives a connection through MULTI, queueing, DISCARD and EXEC, and keeps its
 * WATCH registrations in step with the transaction lifecycle.
 * <p>
 * Every way out of a transaction (DISCARD, either EXEC outcome, the connection going
 * away) ends in {@link #discardTransaction(ClientHandler)}.
 */
public class ExecutionCoordinator {
    private static final List<byte[]> MULTI_ARGS = Resp.args("MULTI");
    private static final List<byte[]> EXEC_ARGS = Resp.args("EXEC");

    private final WatchRegistry watches;
    private final CommandExecutor executor;
    private final Propagator propagator;
    private final Keyspace keyspace;

    public ExecutionCoordinator(WatchRegistry watches, CommandExecutor executor, Propagator propagator, Keyspace keyspace) {
        this.watches = watches;
        this.executor = executor;
        this.propagator = propagator;
        this.keyspace = keyspace;
    }

    public void multi(ClientHandler client) {
        client.getMultiState().open();
    }

    public void queue(ClientHandler client, QueuedCommand command) {
        client.getMultiState().enqueue(command);
    }

    /**
     * Called by the dispatcher when a command is rejected before it could be queued.
     */
    public void flagTransaction(ClientHandler client) {
        client.getMultiState().flagDirtyExec();
    }

    public void discard(ClientHandler client) {
        if (!client.getMultiState().isOpen()) {
            throw new TransactionException("ERR DISCARD without MULTI");
        }
        discardTransaction(client);
    }

    public void watch(ClientHandler client, List<String> keys) {
        MultiState state = client.getMultiState();
        if (state.isOpen()) {
            throw new TransactionException("ERR WATCH inside MULTI is not allowed");
        }
        for (String key : keys) {
            watches.watch(client.getId(), state, client.getDbIndex(), key);
        }
    }

    public void unwatch(ClientHandler client) {
        watches.unwatchAll(client.getId());
        client.getMultiState().clearDirtyCas();
    }

    /**
     * Returns the connection to the idle state and releases all of its watches.
     */
    public void discardTransaction(ClientHandler client) {
        client.getMultiState().reset();
        watches.unwatchAll(client.getId());
    }

    public void exec(ClientHandler client) {
        MultiState state = client.getMultiState();
        if (!state.isOpen()) {
            throw new TransactionException("ERR EXEC without MULTI");
        }
        QueuedCommand execCommand = client.getCurrentCommand();
        List<byte[]> execArgs = execCommand != null ? execCommand.getArgs() : EXEC_ARGS;

        if (state.isDirtyExec() || state.isDirtyCas()) {
            if (state.isDirtyExec()) {
                client.sendError("EXECABORT Transaction discarded because of previous errors.");
            } else {
                client.send(Resp.nullArray());
            }
            if (Log.isDebugEnabled()) {
                Log.debug("Client " + client.getId() + " EXEC aborted ("
                        + (state.isDirtyExec() ? "queueing error" : "watched key modified") + ")");
            }
            discardTransaction(client);
            executor.feedMonitors(client, execArgs);
            return;
        }

        // Watches are released before anything runs so the batch cannot dirty itself.
        watches.unwatchAll(client.getId());

        TransactionQueue queue = state.getQueue();
        ByteArrayOutputStream reply = new ByteArrayOutputStream();
        byte[] header = ("*" + queue.size() + "\r\n").getBytes(StandardCharsets.UTF_8);
        reply.write(header, 0, header.length);

        boolean multiPropagated = false;
        for (int i = 0; i < queue.size(); i++) {
            QueuedCommand command = queue.get(i);
            if (!multiPropagated && !command.isReadOnly()) {
                propagator.propagate(client.getDbIndex(), MULTI_ARGS);
                multiPropagated = true;
            }

            ByteArrayOutputStream slot = new ByteArrayOutputStream();
            client.setCaptureBuffer(slot);
            try {
                queue.set(i, executor.call(client, command));
            } catch (RuntimeException e) {
                Log.warn("Command " + command.getName() + " failed inside EXEC: " + e.getMessage());
                slot.reset();
                byte[] err = Resp.error(errorMessage(e));
                slot.write(err, 0, err.length);
            } finally {
                client.setCaptureBuffer(null);
            }

            byte[] out = slot.size() > 0 ? slot.toByteArray() : Resp.nullBulk();
            reply.write(out, 0, out.length);
        }
        client.setCurrentCommand(execCommand);

        discardTransaction(client);
        // Counts as a change so EXEC itself is propagated and closes the block.
        if (multiPropagated) keyspace.incrementDirty();

        client.send(reply.toByteArray());
        executor.feedMonitors(client, execArgs);
    }

    private static String errorMessage(RuntimeException e) {
        String msg = e.getMessage();
        if (msg == null) return "ERR " + e.getClass().getSimpleName();
        if (msg.startsWith("ERR") || msg.startsWith("WRONGTYPE")) return msg;
        return "ERR " + msg;
    }
}
