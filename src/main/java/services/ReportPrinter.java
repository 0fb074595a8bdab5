package services;

import models.Division;
import models.OverallStats;
import models.PerformanceReport;
import models.PerformanceSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Formatează raportul de performanță ca text pentru consolă.
 */
public final class ReportPrinter {

    private ReportPrinter() {
    }

    public static List<String> render(PerformanceReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.add("=== TECH INNOVATION HUB PERFORMANCE REPORT ===");
        lines.add("");

        // Diviziile goale nu apar în text
        for (Division division : Division.values()) {
            List<PerformanceSummary> summaries = report.getDivision(division);
            if (summaries == null || summaries.isEmpty()) continue;

            lines.add("");
            lines.add("--- " + division.getLabel().toUpperCase() + " DIVISION (" + summaries.size() + " attachees) ---");
            for (PerformanceSummary s : summaries) {
                lines.add("");
                lines.add("Name: " + s.getName());
                lines.add("Performance Score: " + s.getPerformanceScore() + "/100");
                lines.add("Tasks: " + s.getTasksCompleted() + "/" + s.getTasksAssigned() + " completed");
                lines.add("Feedback Entries: " + s.getFeedbackCount());
            }
        }

        OverallStats stats = report.getOverallStats();
        lines.add("");
        lines.add("=== OVERALL STATISTICS ===");
        lines.add("Total Attachees: " + stats.getTotalAttachees());
        lines.add("Average Performance Score: " + stats.getAverageScore());
        lines.add("Highest Score: " + stats.getHighestScore());
        lines.add("Lowest Score: " + stats.getLowestScore());
        return lines;
    }
}
