package quire.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Writes replies that were already serialized by {@link quire.protocol.Resp}.
 * Accepts {@code byte[]}, {@link ByteBuf} and pre-formatted {@code String}s.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Object> {

    @Override
    public boolean acceptOutboundMessage(Object msg) {
        return msg instanceof byte[] || msg instanceof ByteBuf || msg instanceof String;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, ByteBuf out) {
        if (msg instanceof ByteBuf) {
            out.writeBytes((ByteBuf) msg);
        } else if (msg instanceof byte[]) {
            out.writeBytes((byte[]) msg);
        } else {
            out.writeBytes(((String) msg).getBytes(StandardCharsets.UTF_8));
        }
    }
}
