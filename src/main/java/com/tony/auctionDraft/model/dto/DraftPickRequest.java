package com.tony.auctionDraft.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DraftPickRequest {
    @NotNull(message = "Le joueur est requis")
    private Long playerId;

    @NotNull(message = "L'équipe est requise")
    private Long teamId;

    @NotNull(message = "Le prix est requis")
    @Min(value = 0, message = "Le prix ne peut pas être négatif")
    private Integer price;
}
