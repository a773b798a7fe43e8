package com.tony.auctionDraft.exception;

public class DraftRuleViolationException extends RuntimeException {
    public DraftRuleViolationException(String message) {
        super(message);
    }
}
