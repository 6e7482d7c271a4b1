package quire.transaction;

/**
 * A transaction command used out of order (nested MULTI, EXEC or DISCARD without MULTI,
 * WATCH inside MULTI). The message is the full error reply.
 */
public class TransactionException extends RuntimeException {
    public TransactionException(String message) {
        super(message);
    }
}
