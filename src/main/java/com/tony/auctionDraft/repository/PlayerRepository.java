package com.tony.auctionDraft.repository;

import com.tony.auctionDraft.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    List<Player> findByDraftedFalse();

    // Joueurs disponibles triés par valeur ($ décroissante), les non valorisés en dernier
    @Query("SELECT p FROM Player p WHERE p.drafted = false ORDER BY p.dollarValue DESC NULLS LAST, p.name ASC")
    List<Player> findAvailableOrderByValue();

    // Remise à zéro des flags de draft (nouveau draft)
    @Modifying
    @Query("UPDATE Player p SET p.drafted = false")
    int resetDraftedFlags();
}
