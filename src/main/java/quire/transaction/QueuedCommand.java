package quire.transaction;

import quire.commands.Command;
import quire.commands.CommandContainer;
import quire.commands.CommandMetadata;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A resolved command together with its own copy of the argument vector.
 * Instances never share argument arrays with the network buffers they came from.
 */
public final class QueuedCommand {
    private final CommandContainer container;
    private final List<byte[]> args;

    private QueuedCommand(CommandContainer container, List<byte[]> args) {
        this.container = container;
        this.args = args;
    }

    public static QueuedCommand of(CommandContainer container, List<byte[]> args) {
        List<byte[]> copy = new ArrayList<>(args.size());
        for (byte[] arg : args) {
            copy.add(arg == null ? null : arg.clone());
        }
        return new QueuedCommand(container, Collections.unmodifiableList(copy));
    }

    public CommandContainer getContainer() {
        return container;
    }

    public Command getCommand() {
        return container.getCommand();
    }

    public CommandMetadata getMetadata() {
        return container.getMetadata();
    }

    public String getName() {
        return container.getName();
    }

    public boolean isReadOnly() {
        return container.getMetadata().isReadOnly();
    }

    public List<byte[]> getArgs() {
        return args;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (byte[] arg : args) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(arg == null ? "(nil)" : new String(arg, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
