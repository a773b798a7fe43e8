package com.tony.auctionDraft.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "fantasy_teams")
@Getter @Setter @NoArgsConstructor
public class FantasyTeam {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Integer budget;

    private boolean userTeam = false;

    public FantasyTeam(String name, Integer budget, boolean userTeam) {
        this.name = name;
        this.budget = budget;
        this.userTeam = userTeam;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FantasyTeam)) return false;
        return id != null && id.equals(((FantasyTeam) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
