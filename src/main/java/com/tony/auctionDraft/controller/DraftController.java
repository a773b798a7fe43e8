package com.tony.auctionDraft.controller;

import com.tony.auctionDraft.config.LeagueSettings;
import com.tony.auctionDraft.model.DraftPick;
import com.tony.auctionDraft.model.dto.DraftHistoryEntry;
import com.tony.auctionDraft.model.dto.DraftPickRequest;
import com.tony.auctionDraft.model.dto.DraftStateView;
import com.tony.auctionDraft.model.valuation.ValuationEpoch;
import com.tony.auctionDraft.service.DraftService;
import com.tony.auctionDraft.service.RecalculationCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/draft")
@RequiredArgsConstructor
@Slf4j
public class DraftController {

    private final DraftService draftService;
    private final RecalculationCoordinator recalculationCoordinator;
    private final LeagueSettings settings;

    @PostMapping("/init")
    public ResponseEntity<DraftStateView> initializeDraft(@RequestParam(required = false) String userTeamName) {
        String name = (userTeamName != null && !userTeamName.isBlank()) ? userTeamName : settings.getUserTeamName();
        return ResponseEntity.ok(DraftStateView.from(draftService.initializeDraft(name)));
    }

    @GetMapping("/state")
    public ResponseEntity<DraftStateView> getState() {
        return draftService.getDraftState()
                .map(state -> ResponseEntity.ok(DraftStateView.from(state)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/picks")
    public ResponseEntity<DraftHistoryEntry> draftPlayer(@Valid @RequestBody DraftPickRequest request) {
        DraftPick pick = draftService.draftPlayer(request.getPlayerId(), request.getTeamId(), request.getPrice());
        return ResponseEntity.ok(DraftHistoryEntry.from(pick));
    }

    @GetMapping("/picks")
    public ResponseEntity<List<DraftHistoryEntry>> getHistory(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(draftService.getDraftHistory(limit));
    }

    @DeleteMapping("/picks/last")
    public ResponseEntity<?> undoLastPick() {
        return draftService.undoLastPick()
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(Map.of("message", p.getName() + " est de retour dans le pool")))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/picks/{pickId}")
    public ResponseEntity<?> undoPick(@PathVariable Long pickId) {
        return draftService.undoPick(pickId)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(Map.of("message", p.getName() + " est de retour dans le pool")))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Recalcul manuel. Avec expectedSeq, échoue en 409 si l'état a changé entre-temps.
     */
    @PostMapping("/recalculate")
    public ResponseEntity<Map<String, Object>> recalculate(@RequestParam(required = false) Long expectedSeq) {
        log.info("🔄 Recalcul manuel demandé (transaction attendue : {})", expectedSeq);
        ValuationEpoch epoch = expectedSeq != null
                ? recalculationCoordinator.recalculate(expectedSeq)
                : recalculationCoordinator.recalculate();
        return ResponseEntity.ok(Map.of("epoch", epoch.getEpoch(), "playersValued", epoch.size()));
    }
}
