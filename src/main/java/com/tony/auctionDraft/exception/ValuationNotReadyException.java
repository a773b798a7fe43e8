package com.tony.auctionDraft.exception;

public class ValuationNotReadyException extends RuntimeException {
    public ValuationNotReadyException(String message) {
        super(message);
    }
}
