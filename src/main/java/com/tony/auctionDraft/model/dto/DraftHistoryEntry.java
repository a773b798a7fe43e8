package com.tony.auctionDraft.model.dto;

import com.tony.auctionDraft.model.DraftPick;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class DraftHistoryEntry {
    private Long pickId;
    private Integer pickNumber;
    private Long playerId;
    private String playerName;
    private Long teamId;
    private String teamName;
    private Integer price;
    private LocalDateTime timestamp;

    public static DraftHistoryEntry from(DraftPick pick) {
        return new DraftHistoryEntry(
                pick.getId(),
                pick.getPickNumber(),
                pick.getPlayer().getId(),
                pick.getPlayer().getName(),
                pick.getTeam().getId(),
                pick.getTeam().getName(),
                pick.getPrice(),
                pick.getTimestamp());
    }
}
