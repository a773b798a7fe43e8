package com.tony.auctionDraft.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * État global du draft (une seule ligne).
 * transactionSeq avance à chaque pick / undo ; valuationEpoch indique la transaction que reflètent les valeurs stockées.
 */
@Entity
@Table(name = "draft_state")
@Data
@NoArgsConstructor
public class DraftState {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String leagueName;
    private Integer numTeams;
    private Integer budgetPerTeam;

    @Column(nullable = false)
    private Integer currentPick = 0;

    private boolean active = false;

    @Column(nullable = false)
    private Long transactionSeq = 0L;

    // null = aucune valorisation complète encore faite
    private Long valuationEpoch;

    // Verrou optimiste : deux transactions de draft concurrentes ne peuvent pas commiter toutes les deux
    @Version
    private Long version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public DraftState(String leagueName, Integer numTeams, Integer budgetPerTeam) {
        this.leagueName = leagueName;
        this.numTeams = numTeams;
        this.budgetPerTeam = budgetPerTeam;
        this.active = true;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public boolean valuesStale() {
        return valuationEpoch == null || !valuationEpoch.equals(transactionSeq);
    }

    /** Un pick ou un undo vient d'être appliqué : l'époque courante est invalidée. */
    public long nextTransaction() {
        transactionSeq = transactionSeq + 1;
        updatedAt = LocalDateTime.now();
        return transactionSeq;
    }
}
