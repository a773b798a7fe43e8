package com.tony.auctionDraft.config;

import com.tony.auctionDraft.model.DraftState;
import com.tony.auctionDraft.service.DraftService;
import com.tony.auctionDraft.service.RecalculationCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {
    private final LeagueSettings settings;
    private final DraftService draftService;
    private final RecalculationCoordinator recalculationCoordinator;

    @Override
    public void run(String... args) {
        Optional<DraftState> state = draftService.getDraftState();

        // Premier démarrage : on crée le draft
        if (state.isEmpty()) {
            log.info("🌱 Aucun draft en base, initialisation de {} ({} équipes)", settings.getName(), settings.getNumTeams());
            draftService.initializeDraft(settings.getUserTeamName());
            return;
        }

        // Valeurs en retard sur le journal des picks (arrêt pendant un recalcul)
        if (state.get().valuesStale()) {
            log.info("🔄 Valeurs périmées (époque {} / transaction {}), recalcul...",
                    state.get().getValuationEpoch(), state.get().getTransactionSeq());
            recalculationCoordinator.recalculate(state.get().getTransactionSeq());
            log.info("✅ Recalcul terminé.");
        }
    }
}
