package com.wealthdesk.exception;

import java.util.Map;

/**
 * A fill the ledger refuses to apply (no holding to sell, oversell, cash would go
 * negative). The executor turns it into a FAILED order; nothing has been mutated
 * when it is thrown.
 */
public class LedgerException extends BaseException {

    public LedgerException(String message) {
        super(ErrorCode.LEDGER_REFUSED, message);
    }

    public LedgerException(String message, Map<String, Object> details) {
        super(ErrorCode.LEDGER_REFUSED, message, details);
    }
}
