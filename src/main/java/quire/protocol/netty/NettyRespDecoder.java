package quire.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the inbound byte stream into commands, one {@code List<byte[]>} per request.
 * Accepts RESP multi-bulk requests and plain inline lines ({@code PING\r\n}).
 * A malformed length header closes the channel.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private enum State {
        READ_TYPE,
        READ_LINE,
        READ_BULK_LENGTH,
        READ_BULK_CONTENT
    }

    private static final int INLINE = -1;
    private static final int MAX_MULTIBULK = 1024 * 1024;
    private static final int MAX_BULK = 512 * 1024 * 1024;

    private State state = State.READ_TYPE;

    private int multiBulkLength = 0;
    private List<byte[]> currentArray = null;
    private int currentBulkLength = 0;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (true) {
            if (state == State.READ_TYPE) {
                if (!in.isReadable()) return;

                if (currentArray == null) {
                    if (in.getByte(in.readerIndex()) == '*') {
                        in.skipBytes(1);
                        multiBulkLength = 0;
                    } else {
                        multiBulkLength = INLINE;
                    }
                    state = State.READ_LINE;
                } else {
                    byte type = in.readByte();
                    if (type == '$') {
                        state = State.READ_BULK_LENGTH;
                    } else {
                        // Simple strings or integers inside a request are taken verbatim.
                        state = State.READ_LINE;
                    }
                }
            }

            if (state == State.READ_LINE) {
                String line = readLine(in);
                if (line == null) return;

                if (currentArray == null && multiBulkLength == 0) {
                    int count;
                    try {
                        count = Integer.parseInt(line);
                    } catch (NumberFormatException e) {
                        reject(ctx, in);
                        return;
                    }
                    if (count <= 0) {
                        state = State.READ_TYPE;
                        continue;
                    }
                    if (count > MAX_MULTIBULK) {
                        reject(ctx, in);
                        return;
                    }
                    multiBulkLength = count;
                    currentArray = new ArrayList<>(Math.min(count, 1024));
                    state = State.READ_TYPE;
                } else if (multiBulkLength == INLINE) {
                    List<byte[]> args = new ArrayList<>();
                    for (String part : line.trim().split("\\s+")) {
                        if (!part.isEmpty()) args.add(part.getBytes(StandardCharsets.UTF_8));
                    }
                    multiBulkLength = 0;
                    state = State.READ_TYPE;
                    if (!args.isEmpty()) out.add(args);
                } else {
                    currentArray.add(line.getBytes(StandardCharsets.UTF_8));
                    completeElement(out);
                }
                continue;
            }

            if (state == State.READ_BULK_LENGTH) {
                String line = readLine(in);
                if (line == null) return;
                try {
                    currentBulkLength = Integer.parseInt(line);
                } catch (NumberFormatException e) {
                    reject(ctx, in);
                    return;
                }
                if (currentBulkLength > MAX_BULK) {
                    reject(ctx, in);
                    return;
                }
                if (currentBulkLength < 0) {
                    currentArray.add(null);
                    completeElement(out);
                } else {
                    state = State.READ_BULK_CONTENT;
                }
                continue;
            }

            if (state == State.READ_BULK_CONTENT) {
                if (in.readableBytes() < currentBulkLength + 1) return;
                int terminator = in.getByte(in.readerIndex() + currentBulkLength) == '\r' ? 2 : 1;
                if (in.readableBytes() < currentBulkLength + terminator) return;

                byte[] content = new byte[currentBulkLength];
                in.readBytes(content);
                in.skipBytes(terminator);
                currentArray.add(content);
                completeElement(out);
            }
        }
    }

    private void reject(ChannelHandlerContext ctx, ByteBuf in) {
        in.skipBytes(in.readableBytes());
        currentArray = null;
        multiBulkLength = 0;
        state = State.READ_TYPE;
        ctx.close();
    }

    private void completeElement(List<Object> out) {
        if (currentArray.size() == multiBulkLength) {
            out.add(currentArray);
            currentArray = null;
            multiBulkLength = 0;
        }
        state = State.READ_TYPE;
    }

    // Consumes a line ending in \n or \r\n; null when the terminator has not arrived yet.
    private static String readLine(ByteBuf in) {
        int start = in.readerIndex();
        int end = in.writerIndex();
        for (int i = start; i < end; i++) {
            if (in.getByte(i) == '\n') {
                int contentEnd = (i > start && in.getByte(i - 1) == '\r') ? i - 1 : i;
                String line = in.toString(start, contentEnd - start, StandardCharsets.UTF_8);
                in.readerIndex(i + 1);
                return line;
            }
        }
        return null;
    }
}
