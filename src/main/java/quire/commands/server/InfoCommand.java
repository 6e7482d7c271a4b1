package quire.commands.server;

import quire.ServerContext;
import quire.commands.Command;
import quire.network.ClientHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

public class InfoCommand implements Command {
    private final ServerContext context;

    public InfoCommand(ServerContext context) {
        this.context = context;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String section = "all";
        if (args.size() > 1) {
            section = new String(args.get(1), StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        }

        StringBuilder info = new StringBuilder();
        boolean all = section.equals("all") || section.equals("default");

        if (all || section.equals("server")) appendServer(info);
        if (all || section.equals("clients")) appendClients(info);
        if (all || section.equals("persistence")) appendPersistence(info);
        if (all || section.equals("stats")) appendStats(info);
        if (all || section.equals("replication")) appendReplication(info);
        if (all || section.equals("keyspace")) appendKeyspace(info);

        client.sendBulkString(info.toString());
    }

    private void appendServer(StringBuilder info) {
        info.append("# Server\r\n");
        info.append("quire_version:").append(context.getVersion()).append("\r\n");
        info.append("os:").append(context.getOsName()).append("\r\n");
        info.append("java_version:").append(context.getJavaVersion()).append("\r\n");
        info.append("tcp_port:").append(context.getPort()).append("\r\n");
        info.append("uptime_in_seconds:").append(context.getUptime() / 1000).append("\r\n");
        info.append("\r\n");
    }

    private void appendClients(StringBuilder info) {
        info.append("# Clients\r\n");
        info.append("connected_clients:").append(context.getConnectedClients()).append("\r\n");
        info.append("monitor_clients:").append(context.getMonitorCount()).append("\r\n");
        info.append("watching_clients:").append(context.getWatchingClients()).append("\r\n");
        info.append("\r\n");
    }

    private void appendPersistence(StringBuilder info) {
        info.append("# Persistence\r\n");
        info.append("aof_enabled:").append(context.isAofEnabled() ? 1 : 0).append("\r\n");
        info.append("\r\n");
    }

    private void appendStats(StringBuilder info) {
        info.append("# Stats\r\n");
        info.append("total_commands_processed:").append(context.getTotalCommandsProcessed()).append("\r\n");
        info.append("expired_keys:").append(context.getExpiredKeys()).append("\r\n");
        info.append("changes_since_start:").append(context.getChangesSinceStart()).append("\r\n");
        info.append("\r\n");
    }

    private void appendReplication(StringBuilder info) {
        info.append("# Replication\r\n");
        info.append("role:master\r\n");
        info.append("master_repl_offset:").append(context.getReplicationOffset()).append("\r\n");
        info.append("repl_backlog_size:").append(context.getReplicationBacklogSize()).append("\r\n");
        info.append("\r\n");
    }

    private void appendKeyspace(StringBuilder info) {
        info.append("# Keyspace\r\n");
        for (int i = 0; i < context.getDbCount(); i++) {
            int size = context.getDbSize(i);
            if (size > 0) info.append("db").append(i).append(":keys=").append(size).append("\r\n");
        }
        info.append("\r\n");
    }
}
