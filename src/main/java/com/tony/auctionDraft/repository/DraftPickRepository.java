package com.tony.auctionDraft.repository;

import com.tony.auctionDraft.model.DraftPick;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DraftPickRepository extends JpaRepository<DraftPick, Long> {

    // Journal complet dans l'ordre du draft (sert au calcul des slots restants)
    List<DraftPick> findAllByOrderByPickNumberAsc();

    // Historique : du plus récent au plus ancien
    List<DraftPick> findAllByOrderByPickNumberDesc();

    List<DraftPick> findAllByOrderByPickNumberDesc(Pageable pageable);

    Optional<DraftPick> findFirstByOrderByPickNumberDesc();

    List<DraftPick> findByTeamIdOrderByPickNumberAsc(Long teamId);

    @Query("SELECT COALESCE(SUM(p.price), 0) FROM DraftPick p WHERE p.team.id = :teamId")
    int sumPriceByTeam(@Param("teamId") Long teamId);
}
