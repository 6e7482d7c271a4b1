package quire;

import java.lang.management.ManagementFactory;

public class QuireServerContext implements ServerContext {

    @Override
    public String getVersion() {
        return Quire.config.version;
    }

    @Override
    public int getPort() {
        return Quire.config.port;
    }

    @Override
    public long getUptime() {
        return ManagementFactory.getRuntimeMXBean().getUptime();
    }

    @Override
    public String getOsName() {
        return System.getProperty("os.name") + " " + System.getProperty("os.arch");
    }

    @Override
    public String getJavaVersion() {
        return System.getProperty("java.version");
    }

    @Override
    public int getConnectedClients() {
        return Quire.connectedClients.size();
    }

    @Override
    public int getMonitorCount() {
        return Quire.monitors.size();
    }

    @Override
    public int getWatchingClients() {
        return Quire.watches.getWatchingClientCount();
    }

    @Override
    public boolean isAofEnabled() {
        return Quire.propagator.getCommandLogger() != null;
    }

    @Override
    public long getChangesSinceStart() {
        return Quire.keyspace.getDirty();
    }

    @Override
    public long getTotalCommandsProcessed() {
        return Quire.executor.getTotalCommands();
    }

    @Override
    public long getExpiredKeys() {
        return Quire.keyspace.getExpiredKeys();
    }

    @Override
    public long getReplicationOffset() {
        return Quire.propagator.getBacklog().getGlobalOffset();
    }

    @Override
    public int getReplicationBacklogSize() {
        return Quire.propagator.getBacklog().getSize();
    }

    @Override
    public int getDbSize(int dbIndex) {
        return Quire.keyspace.size(dbIndex);
    }

    @Override
    public int getDbCount() {
        return Quire.keyspace.getDbCount();
    }
}
