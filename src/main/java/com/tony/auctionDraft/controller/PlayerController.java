package com.tony.auctionDraft.controller;

import com.tony.auctionDraft.model.Player;
import com.tony.auctionDraft.model.PlayerType;
import com.tony.auctionDraft.model.dto.PlayerNoteRequest;
import com.tony.auctionDraft.model.dto.PlayerValueBreakdown;
import com.tony.auctionDraft.service.PlayerValueService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/players")
@RequiredArgsConstructor
public class PlayerController {

    private final PlayerValueService playerValueService;

    // Joueurs disponibles triés par valeur, filtres optionnels (?type=HITTER&position=CI)
    @GetMapping
    public ResponseEntity<List<Player>> getAvailablePlayers(
            @RequestParam(required = false) PlayerType type,
            @RequestParam(required = false) String position) {
        return ResponseEntity.ok(playerValueService.availablePlayers(type, position));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PlayerValueBreakdown> getBreakdown(@PathVariable Long id) {
        return ResponseEntity.ok(playerValueService.breakdown(id));
    }

    @GetMapping("/{id}/value")
    public ResponseEntity<Map<String, Object>> getValue(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("playerId", id, "dollarValue", playerValueService.value(id)));
    }

    @PutMapping("/{id}/note")
    public ResponseEntity<Player> updateNote(@PathVariable Long id, @RequestBody PlayerNoteRequest request) {
        return ResponseEntity.ok(playerValueService.updateNote(id, request.getNote()));
    }

    @GetMapping("/{id}/surplus")
    public ResponseEntity<Map<String, Double>> getCategorySurplus(@PathVariable Long id, @RequestParam int price) {
        return ResponseEntity.ok(playerValueService.categorySurplus(id, price));
    }
}
