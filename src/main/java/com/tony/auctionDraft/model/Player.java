package com.tony.auctionDraft.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tony.auctionDraft.model.valuation.PlayerValuation;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "players")
@Getter @Setter @NoArgsConstructor
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String proTeam;

    // Liste séparée par des virgules : "SS,2B"
    private String positions;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PlayerType playerType;

    // Projections importées (jamais modifiées ensuite) : "hr" -> 32.0, "ab" -> 580.0...
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "player_projections", joinColumns = @JoinColumn(name = "player_id"))
    @MapKeyColumn(name = "stat")
    @Column(name = "stat_value")
    private Map<String, Double> projections = new HashMap<>();

    // --- CHAMPS DÉRIVÉS (écrasés en bloc à chaque passe de valorisation) ---
    private Double sgp;
    private Double dollarValue;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "player_sgp_breakdown", joinColumns = @JoinColumn(name = "player_id"))
    @MapKeyColumn(name = "category")
    @Column(name = "sgp_value")
    private Map<String, Double> sgpBreakdown = new HashMap<>();

    // Ligne de remplacement utilisée (ex: "C", "SS" ou "HITTER" en mode global)
    private String valuedPosition;

    // Époque qui a écrit les champs dérivés (null = jamais valorisé)
    private Long valuationEpoch;

    // --- DRAFT ---
    @Column(nullable = false)
    private boolean drafted = false;

    private String note;

    public Player(String name, String proTeam, String positions, PlayerType playerType, Map<String, Double> projections) {
        this.name = name;
        this.proTeam = proTeam;
        this.positions = positions;
        this.playerType = playerType;
        this.projections = new HashMap<>(projections);
    }

    @JsonIgnore
    public StatLine getStatLine() {
        return new StatLine(projections, playerType);
    }

    @JsonIgnore
    public List<String> getPositionList() {
        if (positions == null || positions.isBlank()) return List.of();
        return Arrays.stream(positions.split("[,/]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @JsonIgnore
    public boolean isValued() {
        return valuationEpoch != null;
    }

    public void applyValuation(PlayerValuation valuation, long epoch) {
        this.sgp = valuation.sgp();
        this.dollarValue = valuation.dollarValue();
        this.sgpBreakdown.clear();
        this.sgpBreakdown.putAll(valuation.breakdown());
        this.valuedPosition = valuation.valuedPosition();
        this.valuationEpoch = epoch;
    }

    // Même logique que les autres entités : égalité par ID
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id != null && id.equals(((Player) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Player{" + name + " (" + positions + ")}";
    }
}
