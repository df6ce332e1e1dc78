package com.couchreplicator.exception;

public class ReplicatorException extends RuntimeException {

    public ReplicatorException(String message) {
        super(message);
    }

    public ReplicatorException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getReplicatorMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // <exception name> : <exception message> -> <cause> ...
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        if (depth > 0) {
            sb.append(" -> ");
        }
        sb.append("%s : %s".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof ReplicatorException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getReplicatorMessage();
    }
}
