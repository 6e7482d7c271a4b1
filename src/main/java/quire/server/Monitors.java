package quire.server;

import quire.network.ClientHandler;
import quire.protocol.Resp;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connections that issued MONITOR. Each receives one status line per executed command:
 * {@code +<unix time> [<db> <addr>] "cmd" "arg" ...}.
 */
public class Monitors {
    private final Set<ClientHandler> monitors = ConcurrentHashMap.newKeySet();

    public void add(ClientHandler client) {
        monitors.add(client);
    }

    public void remove(ClientHandler client) {
        monitors.remove(client);
    }

    public boolean isEmpty() {
        return monitors.isEmpty();
    }

    public int size() {
        return monitors.size();
    }

    public void feed(ClientHandler source, int dbIndex, List<byte[]> args) {
        if (monitors.isEmpty()) return;
        String line = formatLine(System.currentTimeMillis(), dbIndex, source.getRemoteAddress(), args);
        byte[] payload = Resp.simpleString(line);
        for (ClientHandler monitor : monitors) {
            if (monitor != source) monitor.send(payload);
        }
    }

    static String formatLine(long nowMillis, int dbIndex, String address, List<byte[]> args) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "%.6f", nowMillis / 1000.0));
        sb.append(" [").append(dbIndex).append(' ').append(address).append(']');
        for (byte[] arg : args) {
            sb.append(' ');
            appendQuoted(sb, arg);
        }
        return sb.toString();
    }

    // Quotes an argument so that the line stays printable and on a single line.
    private static void appendQuoted(StringBuilder sb, byte[] arg) {
        sb.append('"');
        if (arg != null) {
            for (byte b : arg) {
                int c = b & 0xff;
                switch (c) {
                    case '\\': sb.append("\\\\"); break;
                    case '"': sb.append("\\\""); break;
                    case '\n': sb.append("\\n"); break;
                    case '\r': sb.append("\\r"); break;
                    case '\t': sb.append("\\t"); break;
                    default:
                        if (c >= 0x20 && c < 0x7f) sb.append((char) c);
                        else sb.append(String.format("\\x%02x", c));
                }
            }
        }
        sb.append('"');
    }
}
