package com.tony.auctionDraft.repository;

import com.tony.auctionDraft.model.FantasyTeam;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FantasyTeamRepository extends JpaRepository<FantasyTeam, Long> {
}
