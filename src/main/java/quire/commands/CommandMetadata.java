package quire.commands;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

public class CommandMetadata {
    public static final String WRITE = "write";
    public static final String READONLY = "readonly";
    public static final String SKIP_MONITOR = "skip_monitor";
    // Never queued by MULTI; runs immediately even inside a transaction.
    public static final String NO_QUEUE = "no_queue";

    private final int arity;
    private final Set<String> flags;
    private final int firstKey;
    private final int lastKey;
    private final int step;

    public CommandMetadata(int arity, Set<String> flags, int firstKey, int lastKey, int step) {
        this.arity = arity;
        this.flags = flags != null ? flags : Collections.emptySet();
        this.firstKey = firstKey;
        this.lastKey = lastKey;
        this.step = step;
    }

    public static CommandMetadata of(int arity, int firstKey, int lastKey, int step, String... flags) {
        return new CommandMetadata(arity, new HashSet<>(Arrays.asList(flags)), firstKey, lastKey, step);
    }

    public int getArity() {
        return arity;
    }

    public Set<String> getFlags() {
        return flags;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public boolean isReadOnly() {
        return flags.contains(READONLY);
    }

    /**
     * Positive arity is an exact argument count (command name included),
     * negative arity is a minimum.
     */
    public boolean acceptsArgCount(int argc) {
        if (arity >= 0) return argc == arity;
        return argc >= -arity;
    }

    public int getFirstKey() {
        return firstKey;
    }

    public int getLastKey() {
        return lastKey;
    }

    public int getStep() {
        return step;
    }
}
