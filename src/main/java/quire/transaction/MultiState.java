package quire.transaction;

/**
 * Per-connection transaction state. The queue is present exactly while a MULTI is open;
 * the queueing-error flag lives on the queue and disappears with it. The watch-conflict
 * flag is independent: a watched key can be touched before MULTI is ever issued.
 */
public class MultiState {
    private TransactionQueue queue = null;
    private boolean dirtyCas = false;

    public boolean isOpen() {
        return queue != null;
    }

    public void open() {
        if (queue != null) throw new TransactionException("ERR MULTI calls can not be nested");
        queue = new TransactionQueue();
    }

    public TransactionQueue getQueue() {
        return queue;
    }

    public void enqueue(QueuedCommand command) {
        if (queue == null) throw new IllegalStateException("No transaction is open");
        queue.add(command);
    }

    /** Marks the open transaction as unexecutable. Ignored when no transaction is open. */
    public void flagDirtyExec() {
        if (queue != null) queue.markDirty();
    }

    public boolean isDirtyExec() {
        return queue != null && queue.isDirty();
    }

    public void markDirtyCas() {
        dirtyCas = true;
    }

    public boolean isDirtyCas() {
        return dirtyCas;
    }

    public void clearDirtyCas() {
        dirtyCas = false;
    }

    // Back to idle. Safe to call repeatedly.
    void reset() {
        queue = null;
        dirtyCas = false;
    }
}
