package models;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Raportul de performanță: câte o listă de sumare pentru fiecare divizie
 * (toate cele patru chei sunt prezente, chiar dacă lista e goală) plus statisticile generale.
 */
@Getter
@AllArgsConstructor
public class PerformanceReport {
    private final Map<Division, List<PerformanceSummary>> divisions;
    private final OverallStats overallStats;

    public List<PerformanceSummary> getDivision(Division division) {
        return divisions.get(division);
    }
}
