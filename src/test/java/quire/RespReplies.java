package quire;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes server replies for assertions. Simple and bulk strings become {@code String},
 * integers {@code Long}, arrays {@code List<Object>}, errors {@link ErrorReply};
 * nil bulk strings and nil arrays become {@code null}.
 */
public final class RespReplies {

    public static final class ErrorReply {
        public final String message;

        ErrorReply(String message) {
            this.message = message;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ErrorReply && ((ErrorReply) o).message.equals(message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }

    private final byte[] data;
    private int pos = 0;

    private RespReplies(byte[] data) {
        this.data = data;
    }

    public static Object parse(byte[] data) {
        RespReplies reader = new RespReplies(data);
        Object reply = reader.next();
        if (reader.pos != data.length) {
            throw new IllegalStateException("Trailing bytes after reply: " + new String(data, StandardCharsets.UTF_8));
        }
        return reply;
    }

    /** Splits a buffer holding several concatenated replies. */
    public static List<Object> parseAll(byte[] data) {
        RespReplies reader = new RespReplies(data);
        List<Object> replies = new ArrayList<>();
        while (reader.pos < data.length) replies.add(reader.next());
        return replies;
    }

    private Object next() {
        char type = (char) data[pos++];
        String line = readLine();
        switch (type) {
            case '+':
                return line;
            case '-':
                return new ErrorReply(line);
            case ':':
                return Long.parseLong(line);
            case '$': {
                int len = Integer.parseInt(line);
                if (len < 0) return null;
                String s = new String(data, pos, len, StandardCharsets.UTF_8);
                pos += len + 2;
                return s;
            }
            case '*': {
                int count = Integer.parseInt(line);
                if (count < 0) return null;
                List<Object> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) items.add(next());
                return items;
            }
            default:
                throw new IllegalStateException("Unknown reply type '" + type + "'");
        }
    }

    private String readLine() {
        int start = pos;
        while (!(data[pos] == '\r' && data[pos + 1] == '\n')) pos++;
        String line = new String(data, start, pos - start, StandardCharsets.UTF_8);
        pos += 2;
        return line;
    }
}
