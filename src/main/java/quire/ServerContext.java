package quire;

public interface ServerContext {
    // Server
    String getVersion();
    int getPort();
    long getUptime();
    String getOsName();
    String getJavaVersion();

    // Clients
    int getConnectedClients();
    int getMonitorCount();
    int getWatchingClients();

    // Persistence
    boolean isAofEnabled();
    long getChangesSinceStart();

    // Stats
    long getTotalCommandsProcessed();
    long getExpiredKeys();

    // Replication
    long getReplicationOffset();
    int getReplicationBacklogSize();

    // Keyspace
    int getDbSize(int dbIndex);
    int getDbCount();
}
