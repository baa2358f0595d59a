package org.overf;

public class OverflowBlocksException extends RuntimeException {

    public OverflowBlocksException(String message) {
        super(message);
    }

    public OverflowBlocksException(String message, Throwable cause) {
        super(message, cause);
    }
}
