package quire.persistence;

import quire.protocol.Resp;
import quire.utils.Log;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Append-only command log. Writes are buffered and flushed once a second by a daemon thread.
 */
public class CommandLogger {
    private final File file;
    private OutputStream out;
    private final ScheduledExecutorService flusher;

    public CommandLogger(File file) {
        this.file = file;
        try {
            this.out = new BufferedOutputStream(new FileOutputStream(file, true));
        } catch (IOException e) {
            Log.error("Could not open AOF file " + file + ": " + e.getMessage());
        }

        this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "AOF-Flusher");
            t.setDaemon(true);
            return t;
        });
        this.flusher.scheduleAtFixedRate(this::flush, 1, 1, TimeUnit.SECONDS);
    }

    public File getFile() {
        return file;
    }

    public synchronized void log(byte[] resp) {
        if (out == null) return;
        try {
            out.write(resp);
        } catch (IOException e) {
            Log.error("AOF write failed: " + e.getMessage());
        }
    }

    public void log(String... parts) {
        log(Resp.command(parts));
    }

    public synchronized void flush() {
        if (out == null) return;
        try {
            out.flush();
        } catch (IOException e) {
            Log.error("AOF flush failed: " + e.getMessage());
        }
    }

    /**
     * Feeds every command in the file to {@code executor}, in order.
     * A command cut short at the end of the file is dropped with a warning.
     *
     * @return the number of commands replayed
     */
    public long replay(Consumer<List<byte[]>> executor) throws IOException {
        flush();
        if (!file.exists()) return 0;

        long count = 0;
        try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
            while (true) {
                List<byte[]> args;
                try {
                    args = Resp.parse(in);
                } catch (EOFException e) {
                    Log.warn("AOF " + file + " ends with a truncated command; ignoring it");
                    break;
                }
                if (args == null) break;
                if (args.isEmpty()) continue;
                executor.accept(args);
                count++;
            }
        }
        return count;
    }

    public void close() {
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(2, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        synchronized (this) {
            if (out == null) return;
            try {
                out.flush();
                out.close();
            } catch (IOException e) {
                Log.error("AOF close failed: " + e.getMessage());
            }
            out = null;
        }
    }
}
