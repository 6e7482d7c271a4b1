package quire.protocol;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.UTF_8);

    // --- SERIALIZATION ---
    public static byte[] simpleString(String s) {
        return ("+" + s + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] error(String s) {
        return ("-" + s + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] integer(long i) {
        return (":" + i + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] bulkString(String s) {
        if (s == null) return NULL_BULK.clone();
        return bulkString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] bulkString(byte[] b) {
        if (b == null) return NULL_BULK.clone();
        ByteArrayOutputStream bos = new ByteArrayOutputStream(b.length + 16);
        writeAscii(bos, "$" + b.length + "\r\n");
        bos.write(b, 0, b.length);
        writeAscii(bos, "\r\n");
        return bos.toByteArray();
    }

    public static byte[] nullBulk() {
        return NULL_BULK.clone();
    }

    // EXEC aborted by a touched WATCH key answers with this.
    public static byte[] nullArray() {
        return NULL_ARRAY.clone();
    }

    public static byte[] array(List<byte[]> list) {
        if (list == null) return NULL_ARRAY.clone();
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeAscii(bos, "*" + list.size() + "\r\n");
        for (byte[] b : list) {
            byte[] encoded = bulkString(b);
            bos.write(encoded, 0, encoded.length);
        }
        return bos.toByteArray();
    }

    @SuppressWarnings("unchecked")
    public static byte[] mixedArray(List<Object> list) {
        if (list == null) return NULL_ARRAY.clone();
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        writeAscii(bos, "*" + list.size() + "\r\n");
        for (Object o : list) {
            byte[] encoded;
            if (o instanceof byte[]) {
                encoded = bulkString((byte[]) o);
            } else if (o instanceof String) {
                encoded = bulkString((String) o);
            } else if (o instanceof Long || o instanceof Integer) {
                encoded = integer(((Number) o).longValue());
            } else if (o instanceof List) {
                encoded = mixedArray((List<Object>) o);
            } else {
                encoded = NULL_BULK;
            }
            bos.write(encoded, 0, encoded.length);
        }
        return bos.toByteArray();
    }

    /**
     * Builds the RESP multi-bulk form of a command, e.g. {@code command("SELECT", "3")}.
     */
    public static byte[] command(String... parts) {
        return array(args(parts));
    }

    public static List<byte[]> args(String... parts) {
        List<byte[]> list = new ArrayList<>(parts.length);
        for (String p : parts) list.add(p.getBytes(StandardCharsets.UTF_8));
        return list;
    }

    private static void writeAscii(ByteArrayOutputStream bos, String s) {
        byte[] b = s.getBytes(StandardCharsets.US_ASCII);
        bos.write(b, 0, b.length);
    }

    // --- PARSING ---

    /**
     * Reads one multi-bulk command from the stream.
     *
     * @return the arguments, or null on a clean end of stream
     * @throws EOFException if the stream ends in the middle of a command
     */
    public static List<byte[]> parse(InputStream in) throws IOException {
        int first = in.read();
        if (first == -1) return null;
        if (first != ARRAY) throw new IOException("Expected '*', got '" + (char) first + "'");

        long count = readLong(in);
        List<byte[]> result = new ArrayList<>((int) Math.max(0, count));
        for (long i = 0; i < count; i++) {
            result.add(readBulkString(in));
        }
        return result;
    }

    private static byte[] readBulkString(InputStream in) throws IOException {
        int b = in.read();
        if (b == -1) throw new EOFException("Unexpected end of stream before bulk string");
        if (b != BULK_STRING) throw new IOException("Expected '$'");

        long len = readLong(in);
        if (len == -1) return null;

        byte[] bytes = new byte[(int) len];
        int read = 0;
        while (read < len) {
            int r = in.read(bytes, read, (int) len - read);
            if (r == -1) throw new EOFException("Unexpected end of stream in bulk string");
            read += r;
        }
        int cr = in.read();
        int lf = in.read();
        if (cr == -1 || lf == -1) throw new EOFException("Unexpected end of stream after bulk string");
        if (cr != '\r' || lf != '\n') throw new IOException("Expected CRLF after bulk string");
        return bytes;
    }

    private static long readLong(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        int b;
        while (true) {
            b = in.read();
            if (b == -1) throw new EOFException("Unexpected end of stream in length line");
            if (b == '\r') {
                if (in.read() != '\n') throw new IOException("Expected LF after CR");
                break;
            }
            sb.append((char) b);
        }
        try {
            return Long.parseLong(sb.toString());
        } catch (NumberFormatException e) {
            throw new IOException("Invalid length: " + sb);
        }
    }
}
