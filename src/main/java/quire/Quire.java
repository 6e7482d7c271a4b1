package quire;

import quire.db.Keyspace;
import quire.network.ClientHandler;
import quire.protocol.Resp;
import quire.persistence.CommandLogger;
import quire.protocol.netty.NettyRespDecoder;
import quire.protocol.netty.NettyRespEncoder;
import quire.replication.ReplicationBacklog;
import quire.server.CommandExecutor;
import quire.server.Monitors;
import quire.server.Propagator;
import quire.transaction.ExecutionCoordinator;
import quire.transaction.WatchRegistry;
import quire.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Quire server entry point and holder of the server-wide state.
 */
public class Quire {

    // --- CONFIGURATION ---
    public static Config config;

    // --- STORAGE ENGINE ---
    public static Keyspace keyspace;

    // --- WATCH / TRANSACTIONS ---
    public static WatchRegistry watches;
    public static ExecutionCoordinator transactions;

    // --- EXECUTION / PROPAGATION ---
    public static Propagator propagator;
    public static CommandExecutor executor;
    public static Monitors monitors;

    // Period of the background sweep that removes expired keys nobody reads.
    private static final long ACTIVE_EXPIRE_PERIOD_MS = 100;

    // --- CLIENTS ---
    public static final Map<Long, ClientHandler> connectedClients = new ConcurrentHashMap<>();

    static {
        init(new Config());
    }

    /**
     * (Re)builds the server state from {@code cfg}. Existing data and watches are dropped.
     */
    public static synchronized void init(Config cfg) {
        config = cfg;
        keyspace = new Keyspace(cfg);
        watches = new WatchRegistry(keyspace::containsKey);
        keyspace.setTouchNotifier(watches);
        monitors = new Monitors();
        propagator = new Propagator(new ReplicationBacklog(cfg.replBacklogSize));
        final Propagator expiryPropagator = propagator;
        keyspace.setExpiredKeyHandler((db, key) -> expiryPropagator.propagate(db, Resp.args("DEL", key)));
        executor = new CommandExecutor(keyspace, propagator, monitors);
        transactions = new ExecutionCoordinator(watches, executor, propagator, keyspace);
        connectedClients.clear();
    }

    /**
     * Replays an append-only file into the keyspace through the normal dispatcher, so
     * MULTI/EXEC blocks in the file are applied as units. Nothing is propagated while loading.
     *
     * @return the number of commands read from the file
     */
    public static long loadAppendOnlyFile(CommandLogger logger) throws IOException {
        ReplayClient replayClient = new ReplayClient();
        executor.setLoading(true);
        keyspace.setLoading(true);
        propagator.setEnabled(false);
        try {
            long count = logger.replay(replayClient::processCommand);
            if (replayClient.getMultiState().isOpen()) {
                Log.warn("AOF ends inside MULTI; discarding " + replayClient.getMultiState().getQueue().size()
                        + " queued command(s)");
                transactions.discardTransaction(replayClient);
            }
            Log.info("Loaded " + count + " commands from " + logger.getFile() + " (" + keyspace.size() + " keys)");
            return count;
        } finally {
            propagator.setEnabled(true);
            keyspace.setLoading(false);
            executor.setLoading(false);
        }
    }

    // Connection-less client used for AOF replay; replies are discarded, errors are logged.
    private static class ReplayClient extends ClientHandler {
        @Override
        public void sendError(String msg) {
            Log.warn("AOF replay: " + msg);
        }

        @Override
        protected void deliver(byte[] data) {
        }
    }

    public static void printBanner() {
        Log.info("\n" +
                "   ____       _            \n" +
                "  / __ \\__ __(_)______     \n" +
                " / /_/ / // / / __/ -_)    \n" +
                " \\___\\_\\_,_/_/_/  \\__/     \n" +
                "                           \n" +
                " :: Quire ::        (v" + config.version + ") \n" +
                " :: Engine ::       Java \n");
    }

    public static void main(String[] args) throws Exception {
        init(Config.load(args.length > 0 ? args[0] : "quire.yaml"));
        Log.setDebug(config.debug);

        CommandLogger aof = null;
        if (config.appendOnly) {
            aof = new CommandLogger(new File(config.appendFilename));
            loadAppendOnlyFile(aof);
            propagator.setCommandLogger(aof);
        }
        final CommandLogger aofHandler = aof;

        printBanner();

        // One worker event loop: every command runs on the same thread.
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(1);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder());
                     ch.pipeline().addLast(new NettyRespEncoder());
                     ch.pipeline().addLast(new ClientHandler());
                 }
             });

            // Runs on the worker loop, so it never interleaves with a command.
            workerGroup.next().scheduleAtFixedRate(() -> {
                int expired = keyspace.activeExpireCycle(System.currentTimeMillis());
                if (expired > 0) Log.debug("Expired " + expired + " key(s)");
            }, ACTIVE_EXPIRE_PERIOD_MS, ACTIVE_EXPIRE_PERIOD_MS, TimeUnit.MILLISECONDS);

            ChannelFuture f = b.bind(config.port).sync();
            Log.info("Ready on port " + config.port);
            Log.info("AOF: " + (aofHandler != null ? aofHandler.getFile() : "disabled"));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                Log.info("Shutting down...");
                if (aofHandler != null) aofHandler.close();
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
            }));

            f.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }
}
