package com.tony.auctionDraft.repository;

import com.tony.auctionDraft.model.DraftState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DraftStateRepository extends JpaRepository<DraftState, Long> {
    Optional<DraftState> findFirstByOrderByIdAsc();
}
