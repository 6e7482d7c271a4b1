package quire.replication;

/**
 * Fixed-size circular buffer holding the most recent propagated bytes.
 * The global offset only grows; the buffer retains {@code [offset - size, offset)}.
 * Writes arrive under the {@link quire.server.Propagator} lock.
 */
public class ReplicationBacklog {
    private final byte[] buffer;
    private final int size;
    private volatile long globalOffset = 0;
    private int writeIndex = 0;

    public ReplicationBacklog(int sizeInBytes) {
        if (sizeInBytes <= 0) throw new IllegalArgumentException("Backlog size must be positive");
        this.size = sizeInBytes;
        this.buffer = new byte[size];
    }

    public synchronized void write(byte[] data) {
        for (byte b : data) {
            buffer[writeIndex] = b;
            writeIndex = (writeIndex + 1) % size;
        }
        globalOffset += data.length;
    }

    public long getGlobalOffset() {
        return globalOffset;
    }

    /** Oldest offset still held. */
    public long getFirstOffset() {
        return Math.max(0, globalOffset - size);
    }

    public int getSize() {
        return size;
    }

    public boolean isValidOffset(long offset) {
        return offset >= getFirstOffset() && offset <= globalOffset;
    }

    /**
     * Reads up to {@code limit} bytes starting at {@code offset}.
     *
     * @return the bytes, or null when the offset has already been overwritten or is in the future
     */
    public synchronized byte[] readFrom(long offset, int limit) {
        if (!isValidOffset(offset)) return null;

        int available = (int) (globalOffset - offset);
        int toRead = Math.min(available, limit);
        byte[] result = new byte[toRead];
        int startIndex = (int) (offset % size);
        for (int i = 0; i < toRead; i++) {
            result[i] = buffer[(startIndex + i) % size];
        }
        return result;
    }
}
