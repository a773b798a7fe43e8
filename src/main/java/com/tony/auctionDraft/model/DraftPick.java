package com.tony.auctionDraft.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Une transaction de draft. Le journal est en ajout seul : un undo supprime l'entrée.
 */
@Entity
@Table(name = "draft_picks", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"player_id"})
})
@Getter @Setter @NoArgsConstructor
public class DraftPick {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "team_id")
    private FantasyTeam team;

    @ManyToOne(optional = false)
    @JoinColumn(name = "player_id")
    private Player player;

    @Column(nullable = false)
    private Integer price;

    // Ordre dans lequel le joueur a été drafté
    @Column(nullable = false)
    private Integer pickNumber;

    private LocalDateTime timestamp;

    public DraftPick(FantasyTeam team, Player player, Integer price, Integer pickNumber) {
        this.team = team;
        this.player = player;
        this.price = price;
        this.pickNumber = pickNumber;
        this.timestamp = LocalDateTime.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DraftPick)) return false;
        return id != null && id.equals(((DraftPick) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
