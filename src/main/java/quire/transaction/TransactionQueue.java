package quire.transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Commands accepted between MULTI and EXEC, in arrival order.
 */
public class TransactionQueue {
    private final List<QueuedCommand> commands = new ArrayList<>();
    private boolean dirty = false;

    public void add(QueuedCommand command) {
        commands.add(command);
    }

    public QueuedCommand get(int index) {
        return commands.get(index);
    }

    // EXEC stores back the command as it was actually propagated.
    public void set(int index, QueuedCommand command) {
        commands.set(index, command);
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public List<QueuedCommand> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    void markDirty() {
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }
}
