package com.tony.auctionDraft.model.dto;

import com.tony.auctionDraft.model.DraftState;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DraftStateView {
    private String leagueName;
    private Integer numTeams;
    private Integer budgetPerTeam;
    private Integer currentPick;
    private boolean active;
    private Long transactionSeq;
    private Long valuationEpoch;
    private boolean valuesStale;

    public static DraftStateView from(DraftState state) {
        return new DraftStateView(state.getLeagueName(), state.getNumTeams(), state.getBudgetPerTeam(),
                state.getCurrentPick(), state.isActive(), state.getTransactionSeq(), state.getValuationEpoch(),
                state.valuesStale());
    }
}
