package com.flagship.general_ledger.exception;

/**
 * Stored balances and the journal history disagree.
 *
 * The integrity checker never throws this; it is raised by operations that
 * must not proceed on drifted data, such as closing a period.
 */
public class IntegrityException extends LedgerException {

    private final int issueCount;

    public IntegrityException(String message, int issueCount) {
        super(ErrorCode.INTEGRITY_VIOLATION, message);
        this.issueCount = issueCount;
    }

    public int getIssueCount() {
        return issueCount;
    }
}
