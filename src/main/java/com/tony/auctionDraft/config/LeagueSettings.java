package com.tony.auctionDraft.config;

import com.tony.auctionDraft.exception.LeagueConfigurationException;
import com.tony.auctionDraft.model.PlayerType;
import com.tony.auctionDraft.model.RosterDemand;
import com.tony.auctionDraft.model.RosterSlot;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "league")
@Data
public class LeagueSettings {

    private static final double FRACTION_TOLERANCE = 1e-6;

    // --- Ligue ---
    private String name = "My League";
    private String userTeamName = "My Team";

    private int numTeams = 12;
    private int budgetPerTeam = 260;
    private int minBid = 1;

    // --- Répartition du budget (doit faire 1.0) ---
    private double hitterBudgetFraction = 0.68;
    private double pitcherBudgetFraction = 0.32;

    // --- Méthode de remplacement ---
    private ReplacementMode replacementMode = ReplacementMode.POSITIONAL;

    // --- Roster (par équipe) ---
    private Map<String, Integer> rosterSpots = defaultRosterSpots();

    // --- Catégories 5x5 standard ---
    private List<CategoryDefinition> hittingCategories = new ArrayList<>(List.of(
            CategoryDefinition.counting("r"),
            CategoryDefinition.counting("hr"),
            CategoryDefinition.counting("rbi"),
            CategoryDefinition.counting("sb"),
            CategoryDefinition.rate("avg", "h", "ab")
    ));

    private List<CategoryDefinition> pitchingCategories = new ArrayList<>(List.of(
            CategoryDefinition.counting("w"),
            CategoryDefinition.counting("sv"),
            CategoryDefinition.counting("k"),
            CategoryDefinition.ratio("era", "ip"),
            CategoryDefinition.ratio("whip", "ip")
    ));

    private static Map<String, Integer> defaultRosterSpots() {
        Map<String, Integer> spots = new LinkedHashMap<>();
        spots.put("C", 1);
        spots.put("1B", 1);
        spots.put("2B", 1);
        spots.put("3B", 1);
        spots.put("SS", 1);
        spots.put("CI", 0);
        spots.put("MI", 0);
        spots.put("OF", 3);
        spots.put("UTIL", 1);
        spots.put("SP", 2);
        spots.put("RP", 2);
        spots.put("P", 2);
        spots.put("BN", 3);
        return spots;
    }

    public double totalLeagueBudget() {
        return (double) numTeams * budgetPerTeam;
    }

    public List<CategoryDefinition> categoriesFor(PlayerType type) {
        return type == PlayerType.HITTER ? hittingCategories : pitchingCategories;
    }

    public double budgetFractionFor(PlayerType type) {
        return type == PlayerType.HITTER ? hitterBudgetFraction : pitcherBudgetFraction;
    }

    /**
     * Besoin de roster d'UNE équipe, slots résolus (le banc est exclu).
     */
    public RosterDemand rosterDemandPerTeam() {
        Map<RosterSlot, Integer> counts = new EnumMap<>(RosterSlot.class);
        rosterSpots.forEach((label, count) -> {
            RosterSlot slot = RosterSlot.fromLabel(label)
                    .orElseThrow(() -> new LeagueConfigurationException("Slot de roster inconnu : " + label));
            if (!slot.isBench() && count != null) {
                counts.merge(slot, count, Integer::sum);
            }
        });
        return new RosterDemand(counts);
    }

    public int activeRosterSpots() {
        return rosterDemandPerTeam().total();
    }

    /**
     * Contrôle complet des paramètres de ligue.
     * Appelé au démarrage et avant chaque passe de valorisation : on échoue vite, jamais de correction silencieuse.
     */
    @PostConstruct
    public void validate() {
        if (numTeams <= 0) {
            throw new LeagueConfigurationException("Le nombre d'équipes doit être positif (reçu " + numTeams + ")");
        }
        if (budgetPerTeam <= 0) {
            throw new LeagueConfigurationException("Le budget par équipe doit être positif (reçu " + budgetPerTeam + ")");
        }
        if (minBid < 0) {
            throw new LeagueConfigurationException("L'enchère minimum ne peut pas être négative (reçu " + minBid + ")");
        }

        // 1. Budget : fractions >= 0 et somme = 1
        if (hitterBudgetFraction < 0 || pitcherBudgetFraction < 0) {
            throw new LeagueConfigurationException(String.format(
                    "Les fractions de budget doivent être >= 0 (frappeurs=%s, lanceurs=%s)",
                    hitterBudgetFraction, pitcherBudgetFraction));
        }
        if (Math.abs(hitterBudgetFraction + pitcherBudgetFraction - 1.0) > FRACTION_TOLERANCE) {
            throw new LeagueConfigurationException(String.format(
                    "Les fractions de budget doivent faire 1 (frappeurs=%s + lanceurs=%s)",
                    hitterBudgetFraction, pitcherBudgetFraction));
        }

        // 2. Roster : labels connus, comptes positifs
        if (rosterSpots == null || rosterSpots.isEmpty()) {
            throw new LeagueConfigurationException("Aucun slot de roster configuré");
        }
        rosterSpots.forEach((label, count) -> {
            if (count == null || count < 0) {
                throw new LeagueConfigurationException("Nombre de slots négatif ou vide pour " + label + " : " + count);
            }
        });
        int activeSpots = activeRosterSpots(); // lève l'exception si un label est inconnu
        if (activeSpots == 0) {
            throw new LeagueConfigurationException("Le roster ne contient aucun slot actif (hors banc)");
        }
        if ((long) minBid * activeSpots > budgetPerTeam) {
            throw new LeagueConfigurationException(String.format(
                    "Budget insuffisant : %d slots x $%d minimum > $%d par équipe", activeSpots, minBid, budgetPerTeam));
        }

        // 3. Catégories
        validateCategories("frappeurs", hittingCategories);
        validateCategories("lanceurs", pitchingCategories);
    }

    private void validateCategories(String label, List<CategoryDefinition> categories) {
        if (categories == null || categories.isEmpty()) {
            throw new LeagueConfigurationException("Aucune catégorie configurée pour les " + label);
        }
        Set<String> seen = new HashSet<>();
        for (CategoryDefinition category : categories) {
            String key = Optional.ofNullable(category.getKey()).map(String::trim).orElse("");
            if (key.isEmpty()) {
                throw new LeagueConfigurationException("Catégorie sans clé pour les " + label);
            }
            if (!seen.add(key.toLowerCase())) {
                throw new LeagueConfigurationException("Catégorie en double pour les " + label + " : " + key);
            }
            if (category.getKind() == null) {
                throw new LeagueConfigurationException("Catégorie " + key + " sans classification");
            }
            switch (category.getKind()) {
                case RATE -> {
                    if (isBlank(category.getNumerator()) || isBlank(category.getDenominator())) {
                        throw new LeagueConfigurationException("La catégorie RATE " + key + " exige un numérateur et un dénominateur");
                    }
                }
                case RATIO -> {
                    if (isBlank(category.getDenominator())) {
                        throw new LeagueConfigurationException("La catégorie RATIO " + key + " exige un dénominateur");
                    }
                }
                default -> { }
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
