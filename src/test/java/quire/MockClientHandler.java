package quire;

import quire.network.ClientHandler;
import quire.protocol.Resp;
import java.util.ArrayList;
import java.util.List;

public class MockClientHandler extends ClientHandler {
    public final List<Object> replies = new ArrayList<>();
    public Object lastReply;
    public String lastError;

    @Override
    protected void deliver(byte[] data) {
        Object reply = RespReplies.parse(data);
        replies.add(reply);
        lastReply = reply;
        lastError = reply instanceof RespReplies.ErrorReply ? ((RespReplies.ErrorReply) reply).message : null;
    }

    // Sends one command through the dispatcher and returns its reply.
    public Object run(String... parts) {
        int before = replies.size();
        processCommand(Resp.args(parts));
        return replies.size() > before ? lastReply : null;
    }
}
