package quire.commands;

import quire.QuireServerContext;
import quire.commands.connection.*;
import quire.commands.generic.*;
import quire.commands.hash.*;
import quire.commands.list.*;
import quire.commands.server.*;
import quire.commands.set.*;
import quire.commands.string.*;
import quire.commands.transaction.*;
import quire.commands.zset.*;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static quire.commands.CommandMetadata.NO_QUEUE;
import static quire.commands.CommandMetadata.READONLY;
import static quire.commands.CommandMetadata.SKIP_MONITOR;
import static quire.commands.CommandMetadata.WRITE;

public class CommandRegistry {
    private static final Map<String, CommandContainer> commands = new HashMap<>();

    static {
        // String
        register("GET", new GetCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("SET", new SetCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("SETNX", new SetNxCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("GETSET", new GetSetCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("APPEND", new AppendCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("STRLEN", new StrLenCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("INCR", new IncrCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));
        register("DECR", new DecrCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));
        register("INCRBY", new IncrByCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("DECRBY", new DecrByCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("INCRBYFLOAT", new IncrByFloatCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("MGET", new MGetCommand(), CommandMetadata.of(-2, 1, -1, 1, READONLY));
        register("MSET", new MSetCommand(), CommandMetadata.of(-3, 1, -1, 2, WRITE));

        // Generic
        register("DEL", new DelCommand(), CommandMetadata.of(-2, 1, -1, 1, WRITE));
        register("EXISTS", new ExistsCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("TYPE", new TypeCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("RENAME", new RenameCommand(), CommandMetadata.of(3, 1, 2, 1, WRITE));
        register("RENAMENX", new RenameCommand(true), CommandMetadata.of(3, 1, 2, 1, WRITE));
        register("MOVE", new MoveCommand(), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("KEYS", new KeysCommand(), CommandMetadata.of(2, 0, 0, 0, READONLY));
        register("RANDOMKEY", new RandomKeyCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY));
        register("EXPIRE", new ExpireCommand(1000, false), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("PEXPIRE", new ExpireCommand(1, false), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("EXPIREAT", new ExpireCommand(1000, true), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("PEXPIREAT", new ExpireCommand(1, true), CommandMetadata.of(3, 1, 1, 1, WRITE));
        register("TTL", new TtlCommand(false), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("PTTL", new TtlCommand(true), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("PERSIST", new PersistCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));

        // List
        register("LPUSH", new LPushCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("RPUSH", new RPushCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("LPOP", new LPopCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));
        register("RPOP", new RPopCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));
        register("LLEN", new LLenCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("LRANGE", new LRangeCommand(), CommandMetadata.of(4, 1, 1, 1, READONLY));

        // Hash
        register("HSET", new HSetCommand(), CommandMetadata.of(4, 1, 1, 1, WRITE));
        register("HGET", new HGetCommand(), CommandMetadata.of(3, 1, 1, 1, READONLY));
        register("HDEL", new HDelCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("HGETALL", new HGetAllCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));

        // Set
        register("SADD", new SAddCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("SREM", new SRemCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("SMEMBERS", new SMembersCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("SISMEMBER", new SIsMemberCommand(), CommandMetadata.of(3, 1, 1, 1, READONLY));
        register("SCARD", new SCardCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("SPOP", new SPopCommand(), CommandMetadata.of(2, 1, 1, 1, WRITE));

        // Sorted set
        register("ZADD", new ZAddCommand(), CommandMetadata.of(-4, 1, 1, 1, WRITE));
        register("ZREM", new ZRemCommand(), CommandMetadata.of(-3, 1, 1, 1, WRITE));
        register("ZSCORE", new ZScoreCommand(), CommandMetadata.of(3, 1, 1, 1, READONLY));
        register("ZCARD", new ZCardCommand(), CommandMetadata.of(2, 1, 1, 1, READONLY));
        register("ZRANGE", new ZRangeCommand(), CommandMetadata.of(-4, 1, 1, 1, READONLY));

        // Server
        register("DBSIZE", new DbSizeCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY));
        register("FLUSHDB", new FlushDbCommand(), CommandMetadata.of(1, 0, 0, 0, WRITE));
        register("FLUSHALL", new FlushAllCommand(), CommandMetadata.of(1, 0, 0, 0, WRITE));
        register("MONITOR", new MonitorCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY, SKIP_MONITOR));
        register("INFO", new InfoCommand(new QuireServerContext()), CommandMetadata.of(-1, 0, 0, 0, READONLY));

        // Connection
        register("PING", new PingCommand(), CommandMetadata.of(-1, 0, 0, 0, READONLY));
        register("ECHO", new EchoCommand(), CommandMetadata.of(2, 0, 0, 0, READONLY));
        register("SELECT", new SelectCommand(), CommandMetadata.of(2, 0, 0, 0, READONLY));
        register("QUIT", new QuitCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY, NO_QUEUE, SKIP_MONITOR));

        // Transactions
        register("MULTI", new MultiCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY, NO_QUEUE));
        register("EXEC", new ExecCommand(), CommandMetadata.of(1, 0, 0, 0, NO_QUEUE, SKIP_MONITOR));
        register("DISCARD", new DiscardCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY, NO_QUEUE));
        register("WATCH", new WatchCommand(), CommandMetadata.of(-2, 1, -1, 1, READONLY, NO_QUEUE));
        register("UNWATCH", new UnwatchCommand(), CommandMetadata.of(1, 0, 0, 0, READONLY));
    }

    /**
     * @throws IllegalArgumentException if a queueable command is not exactly one of
     *         read-only or write; EXEC relies on that split to place MULTI
     */
    public static void register(String name, Command command, CommandMetadata metadata) {
        validate(name, metadata);
        commands.put(name, new CommandContainer(name, command, metadata));
    }

    static void validate(String name, CommandMetadata metadata) {
        if (metadata.hasFlag(NO_QUEUE)) return;
        if (metadata.hasFlag(READONLY) == metadata.hasFlag(WRITE)) {
            throw new IllegalArgumentException(name + " must be flagged either readonly or write");
        }
    }

    public static CommandContainer lookup(String name) {
        return commands.get(name);
    }

    public static Collection<CommandContainer> all() {
        return Collections.unmodifiableCollection(commands.values());
    }
}
