package quire.network;

import quire.Quire;
import quire.commands.CommandContainer;
import quire.commands.CommandMetadata;
import quire.commands.CommandRegistry;
import quire.protocol.Resp;
import quire.transaction.MultiState;
import quire.transaction.QueuedCommand;
import quire.utils.Log;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

public class ClientHandler extends ChannelInboundHandlerAdapter {
    private static final AtomicLong ID_GENERATOR = new AtomicLong(0);

    private final long id = ID_GENERATOR.incrementAndGet();
    private ChannelHandlerContext ctx;
    private int dbIndex = 0;
    private boolean isMonitor = false;

    // Transaction State
    private final MultiState multiState = new MultiState();
    private QueuedCommand currentCommand = null;
    private ByteArrayOutputStream captureBuffer = null; // EXEC collects each reply here

    public ClientHandler() {
        // Netty hands us the context in channelActive
    }

    public long getId() {
        return id;
    }

    public int getDbIndex() {
        return dbIndex;
    }

    public void setDbIndex(int dbIndex) {
        this.dbIndex = dbIndex;
    }

    public MultiState getMultiState() {
        return multiState;
    }

    public QueuedCommand getCurrentCommand() {
        return currentCommand;
    }

    public void setCurrentCommand(QueuedCommand command) {
        this.currentCommand = command;
    }

    /**
     * Replaces the command being executed with the form that should be propagated,
     * e.g. SPOP becomes SREM of the popped member.
     */
    public void rewriteCommand(List<byte[]> args) {
        String name = new String(args.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
        CommandContainer container = CommandRegistry.lookup(name);
        if (container == null) throw new IllegalArgumentException("Cannot rewrite to unknown command " + name);
        this.currentCommand = QueuedCommand.of(container, args);
    }

    public void setCaptureBuffer(ByteArrayOutputStream out) {
        this.captureBuffer = out;
    }

    public boolean isMonitor() {
        return isMonitor;
    }

    public void setMonitor(boolean isMonitor) {
        this.isMonitor = isMonitor;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        Quire.connectedClients.put(id, this);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cleanup();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.debug("Client " + id + " connection error: " + cause.getMessage());
        ctx.close();
    }

    @Override
    @SuppressWarnings("unchecked")
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof List) {
            processCommand((List<byte[]>) msg);
        }
    }

    /**
     * Releases everything the server holds on behalf of this connection.
     * A connection that goes away inside MULTI behaves as if it sent DISCARD.
     */
    public void cleanup() {
        Quire.transactions.discardTransaction(this);
        Quire.monitors.remove(this);
        Quire.connectedClients.remove(id);
    }

    public void processCommand(List<byte[]> parts) {
        if (parts.isEmpty()) return;
        String name = new String(parts.get(0), StandardCharsets.UTF_8);
        String cmd = name.toUpperCase(Locale.ROOT);

        // In monitor mode only QUIT is honoured.
        if (isMonitor) {
            if (cmd.equals("QUIT")) close();
            return;
        }

        CommandContainer container = CommandRegistry.lookup(cmd);
        if (container == null) {
            Quire.transactions.flagTransaction(this);
            sendError("ERR unknown command '" + name + "'");
            return;
        }
        if (!container.getMetadata().acceptsArgCount(parts.size())) {
            Quire.transactions.flagTransaction(this);
            sendError("ERR wrong number of arguments for '" + container.getName().toLowerCase(Locale.ROOT) + "' command");
            return;
        }

        QueuedCommand command = QueuedCommand.of(container, parts);
        if (multiState.isOpen() && !container.getMetadata().hasFlag(CommandMetadata.NO_QUEUE)) {
            Quire.transactions.queue(this, command);
            sendSimpleString("QUEUED");
            return;
        }

        try {
            Quire.executor.call(this, command);
        } catch (RuntimeException e) {
            Log.warn("Command " + cmd + " failed: " + e.getMessage());
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            sendError(msg.startsWith("ERR") || msg.startsWith("WRONGTYPE") ? msg : "ERR " + msg);
        }
    }

    public synchronized void send(byte[] data) {
        if (data == null) return;
        if (captureBuffer != null) {
            captureBuffer.write(data, 0, data.length);
            return;
        }
        deliver(data);
    }

    // Writes straight to the socket. Tests override this to record replies.
    protected void deliver(byte[] data) {
        if (ctx != null) ctx.writeAndFlush(data);
    }

    public void sendSimpleString(String msg) {
        send(Resp.simpleString(msg));
    }

    public void sendError(String msg) {
        send(Resp.error(msg));
    }

    public void sendInteger(long i) {
        send(Resp.integer(i));
    }

    public void sendNull() {
        send(Resp.nullBulk());
    }

    public void sendBulkString(String s) {
        send(Resp.bulkString(s));
    }

    public void sendBulkString(byte[] b) {
        send(Resp.bulkString(b));
    }

    public void sendArray(List<byte[]> list) {
        send(Resp.array(list));
    }

    public void sendMixedArray(List<Object> list) {
        send(Resp.mixedArray(list));
    }

    public String getRemoteAddress() {
        if (ctx == null) return "0.0.0.0:0";
        SocketAddress address = ctx.channel().remoteAddress();
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getHostString() + ":" + inet.getPort();
        }
        return address != null ? address.toString() : "0.0.0.0:0";
    }

    public void close() {
        if (ctx != null) ctx.close();
    }
}
