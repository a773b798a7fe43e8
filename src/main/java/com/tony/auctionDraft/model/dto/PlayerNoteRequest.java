package com.tony.auctionDraft.model.dto;

import lombok.Data;

// Note libre de draft ("blessure", "sleeper", "à éviter"...). null ou vide = effacer
@Data
public class PlayerNoteRequest {
    private String note;
}
