package services;

import models.Attachee;
import models.Division;
import models.InvalidDivisionException;
import models.OverallStats;
import models.PerformanceReport;
import models.PerformanceSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HubManagerTests {

    private static final String OMAR = "omarhaitham@example.com";
    private static final String MARTIN = "martin@example.com";
    private static final String MARY = "maryb@example.com";

    private HubManager hub;

    @BeforeEach
    void setUp() {
        hub = new HubManager(Clock.fixed(Instant.parse("2023-06-08T09:00:00Z"), ZoneOffset.UTC));
    }

    private void addExampleAttachees() {
        hub.addAttachee("Omar Haitham", OMAR, "Engineering");
        hub.addAttachee("Martin John", MARTIN, "Engineering");
        hub.addAttachee("Mary Brown", MARY, "Tech Programs");
    }

    @Test
    void addAttacheePropagatesInvalidDivisionTest() {
        assertThrows(InvalidDivisionException.class,
                () -> hub.addAttachee("Ann", "ann@example.com", "Marketing"));
        assertTrue(hub.getAttachees().isEmpty());
    }

    @Test
    void feedbackUsesInjectedClockTest() {
        addExampleAttachees();
        hub.addFeedbackToAttachee(OMAR, "Excellent", 95, "Supervisor A");

        Attachee omar = hub.findByEmail(OMAR).orElseThrow();
        assertEquals(Instant.parse("2023-06-08T09:00:00Z"), omar.getFeedback().get(0).getCreatedAt());
    }

    @Test
    void removeAttacheeTest() {
        addExampleAttachees();
        hub.removeAttachee(MARTIN);

        assertEquals(2, hub.getAttachees().size());
        assertTrue(hub.findByEmail(MARTIN).isEmpty());
    }

    @Test
    void removeUnknownAttacheeIsNoOpTest() {
        addExampleAttachees();
        hub.removeAttachee("nobody@example.com");
        assertEquals(3, hub.getAttachees().size());
    }

    @Test
    void removeAttacheeDropsEveryMatchingRecordTest() {
        hub.addAttachee("Omar Haitham", OMAR, "Engineering");
        hub.addAttachee("Omar Duplicate", OMAR, "Hub Support");
        hub.removeAttachee(OMAR);
        assertTrue(hub.getAttachees().isEmpty());
    }

    @Test
    void attacheeWithoutEmailDoesNotBreakLookupsTest() {
        hub.addAttachee("No Mail", null, "Engineering");
        hub.addAttachee("Omar Haitham", OMAR, "Engineering");

        hub.addFeedbackToAttachee(OMAR, "Excellent", 95, "Supervisor A");
        hub.assignTaskToAttachee(OMAR, "Review code", "2023-06-10", 3);
        hub.completeTaskForAttachee(OMAR, 1, "2023-06-09");

        Attachee omar = hub.findByEmail(OMAR).orElseThrow();
        assertEquals(95, omar.getPerformanceScore());
        assertTrue(omar.getTasks().get(0).isCompleted());
        assertEquals("No Mail", hub.findByEmail(null).orElseThrow().getName());

        hub.removeAttachee(OMAR);
        assertEquals(1, hub.getAttachees().size());
        hub.removeAttachee(null);
        assertTrue(hub.getAttachees().isEmpty());
    }

    @Test
    void reportCannotBeModifiedByCallersTest() {
        addExampleAttachees();
        PerformanceReport report = hub.generatePerformanceReport();

        assertThrows(UnsupportedOperationException.class,
                () -> report.getDivisions().put(Division.ENGINEERING, List.of()));
        assertThrows(UnsupportedOperationException.class,
                () -> report.getDivision(Division.ENGINEERING).clear());
        assertThrows(UnsupportedOperationException.class,
                () -> report.getDivision(Division.HUB_SUPPORT).add(report.getDivision(Division.TECH_PROGRAMS).get(0)));
        assertEquals(2, hub.generatePerformanceReport().getDivision(Division.ENGINEERING).size());
    }

    @Test
    void attacheesByDivisionKeepRosterOrderTest() {
        addExampleAttachees();

        List<Attachee> engineering = hub.getAttacheesByDivision(Division.ENGINEERING);
        assertEquals(2, engineering.size());
        assertEquals(OMAR, engineering.get(0).getEmail());
        assertEquals(MARTIN, engineering.get(1).getEmail());

        assertEquals(1, hub.getAttacheesByDivision("Tech Programs").size());
        assertTrue(hub.getAttacheesByDivision("Radio Support").isEmpty());
        assertTrue(hub.getAttacheesByDivision("Marketing").isEmpty());
    }

    @Test
    void findByEmailReturnsFirstMatchTest() {
        addExampleAttachees();
        assertEquals("Mary Brown", hub.findByEmail(MARY).orElseThrow().getName());
        assertTrue(hub.findByEmail("nobody@example.com").isEmpty());
    }

    @Test
    void taskIdsArePerAttacheeTest() {
        addExampleAttachees();
        hub.assignTaskToDivision("Engineering", "Develop API endpoint", "2023-06-15", 4);
        hub.assignTaskToAttachee(OMAR, "Review code quality standards", "2023-06-10", 3);
        hub.assignTaskToAttachee(MARY, "Prepare workshop", "2023-06-20", 2);

        Attachee omar = hub.findByEmail(OMAR).orElseThrow();
        Attachee martin = hub.findByEmail(MARTIN).orElseThrow();
        Attachee mary = hub.findByEmail(MARY).orElseThrow();

        assertEquals(1, omar.getTasks().get(0).getId());
        assertEquals(2, omar.getTasks().get(1).getId());
        assertEquals(1, martin.getTasks().get(0).getId());
        assertEquals(1, mary.getTasks().get(0).getId());
    }

    @Test
    void assignTaskToUnknownDivisionIsNoOpTest() {
        addExampleAttachees();
        hub.assignTaskToDivision("Marketing", "Nothing", "2023-06-15", 1);
        hub.getAttachees().forEach(a -> assertTrue(a.getTasks().isEmpty()));
    }

    @Test
    void unknownEmailIsIgnoredTest() {
        addExampleAttachees();
        hub.assignTaskToAttachee("nobody@example.com", "Lost task", "2023-06-10", 3);
        hub.addFeedbackToAttachee("nobody@example.com", "Lost feedback", 10, "Supervisor");
        hub.completeTaskForAttachee("nobody@example.com", 1, "2023-06-10");

        assertEquals(3, hub.getAttachees().size());
        for (Attachee a : hub.getAttachees()) {
            assertTrue(a.getTasks().isEmpty());
            assertTrue(a.getFeedback().isEmpty());
            assertEquals(0, a.getPerformanceScore());
        }
    }

    @Test
    void emptyRosterReportIsAllZeroTest() {
        PerformanceReport report = hub.generatePerformanceReport();
        OverallStats stats = report.getOverallStats();

        assertEquals(0, stats.getTotalAttachees());
        assertEquals(0, stats.getAverageScore());
        assertEquals(0, stats.getHighestScore());
        assertEquals(0, stats.getLowestScore());
        for (Division division : Division.values()) {
            assertTrue(report.getDivision(division).isEmpty());
        }
    }

    @Test
    void reportAlwaysHasAllFourDivisionsTest() {
        hub.addAttachee("Diana Charles", "diana@example.com", "Radio Support");
        PerformanceReport report = hub.generatePerformanceReport();

        assertEquals(4, report.getDivisions().size());
        assertEquals(1, report.getDivision(Division.RADIO_SUPPORT).size());
        assertTrue(report.getDivision(Division.ENGINEERING).isEmpty());
    }

    @Test
    void allPerfectScoresReportLowestOfHundredTest() {
        addExampleAttachees();
        hub.addFeedbackToAttachee(OMAR, "Perfect", 100, "A");
        hub.addFeedbackToAttachee(MARTIN, "Perfect", 100, "B");
        hub.addFeedbackToAttachee(MARY, "Perfect", 100, "C");

        OverallStats stats = hub.generatePerformanceReport().getOverallStats();
        assertEquals(100, stats.getAverageScore());
        assertEquals(100, stats.getHighestScore());
        assertEquals(100, stats.getLowestScore());
    }

    @Test
    void attacheeWithoutFeedbackCountsAsZeroTest() {
        addExampleAttachees();
        hub.addFeedbackToAttachee(OMAR, "Excellent", 95, "A");

        OverallStats stats = hub.generatePerformanceReport().getOverallStats();
        assertEquals(3, stats.getTotalAttachees());
        assertEquals(32, stats.getAverageScore());
        assertEquals(95, stats.getHighestScore());
        assertEquals(0, stats.getLowestScore());
    }

    @Test
    void averageScoreHalfRoundsUpTest() {
        hub.addAttachee("Omar Haitham", OMAR, "Engineering");
        hub.addAttachee("Martin John", MARTIN, "Engineering");
        hub.addFeedbackToAttachee(OMAR, "Excellent", 95, "A");
        hub.addFeedbackToAttachee(MARTIN, "Good", 82, "B");

        // (95 + 82) / 2 = 88.5
        assertEquals(89, hub.generatePerformanceReport().getOverallStats().getAverageScore());
    }

    @Test
    void endToEndExampleTest() {
        addExampleAttachees();
        hub.assignTaskToDivision("Engineering", "Develop API endpoint for user management", "2023-06-15", 4);
        hub.assignTaskToAttachee(OMAR, "Review code quality standards", "2023-06-10", 3);

        Attachee omar = hub.findByEmail(OMAR).orElseThrow();
        omar.completeTask(1, "2023-06-08");
        omar.completeTask(2, "2023-06-09");

        hub.addFeedbackToAttachee(OMAR, "Excellent work on the API development!", 95, "Supervisor A");
        hub.addFeedbackToAttachee(MARTIN, "Good progress, needs more attention to detail", 82, "Supervisor B");
        hub.addFeedbackToAttachee(MARY, "Outstanding contribution to the tech program", 98, "Supervisor C");

        PerformanceSummary omarSummary = omar.getPerformanceSummary();
        assertEquals(95, omarSummary.getPerformanceScore());
        assertEquals(2, omarSummary.getTasksAssigned());
        assertEquals(2, omarSummary.getTasksCompleted());
        assertEquals(0, omarSummary.getTasksPending());

        PerformanceReport report = hub.generatePerformanceReport();
        List<PerformanceSummary> engineering = report.getDivision(Division.ENGINEERING);
        assertEquals(2, engineering.size());
        assertEquals("Omar Haitham", engineering.get(0).getName());
        assertEquals("Martin John", engineering.get(1).getName());
        assertEquals(1, engineering.get(1).getTasksPending());
        assertEquals("Mary Brown", report.getDivision(Division.TECH_PROGRAMS).get(0).getName());

        OverallStats stats = report.getOverallStats();
        assertEquals(3, stats.getTotalAttachees());
        assertEquals(92, stats.getAverageScore());
        assertEquals(98, stats.getHighestScore());
        assertEquals(82, stats.getLowestScore());
    }
}
