package com.flagship.general_ledger.exception;

/**
 * A reversal was refused: the original is missing, already reversed, is itself
 * a reversal, or its period no longer accepts reversals.
 */
public class ReversalException extends LedgerException {

    public ReversalException(String message) {
        super(ErrorCode.REVERSAL_REJECTED, message);
    }

    public ReversalException(String message, Throwable cause) {
        super(ErrorCode.REVERSAL_REJECTED, message, cause);
    }
}
