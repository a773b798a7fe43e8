package com.tony.auctionDraft.exception;

import lombok.Getter;

/**
 * Le recalcul a été demandé sur un état de draft qui n'est plus le dernier état commité.
 * Signal de retry pour l'appelant : le moteur ne devine jamais quel état est le bon.
 */
@Getter
public class DraftTransactionConflictException extends RuntimeException {
    private final long expectedSeq;
    private final long actualSeq;

    public DraftTransactionConflictException(long expectedSeq, long actualSeq) {
        super(String.format("État du draft obsolète : transaction attendue #%d, état courant #%d. Réessayez.",
                expectedSeq, actualSeq));
        this.expectedSeq = expectedSeq;
        this.actualSeq = actualSeq;
    }
}
