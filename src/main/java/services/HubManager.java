package services;

import lombok.extern.slf4j.Slf4j;
import models.Attachee;
import models.Division;
import models.OverallStats;
import models.PerformanceReport;
import models.PerformanceSummary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Gestionează toți attachee-ii din cele patru divizii.
 * Operațiile pe un email inexistent nu fac nimic.
 */
@Slf4j
public class HubManager {
    private final Clock clock;
    private List<Attachee> attachees = new ArrayList<>();

    public HubManager() {
        this(Clock.systemUTC());
    }

    public HubManager(Clock clock) {
        this.clock = clock;
    }

    public synchronized List<Attachee> getAttachees() {
        return Collections.unmodifiableList(new ArrayList<>(attachees));
    }

    public synchronized Attachee addAttachee(String name, String email, String division) {
        Attachee attachee = new Attachee(name, email, division, clock);
        attachees.add(attachee);
        log.debug("Added attachee {} to {}", email, attachee.getDivision());
        return attachee;
    }

    public synchronized void removeAttachee(String email) {
        int before = attachees.size();
        attachees = attachees.stream()
                .filter(a -> !Objects.equals(a.getEmail(), email))
                .collect(Collectors.toCollection(ArrayList::new));
        log.debug("Removed {} attachee(s) with email {}", before - attachees.size(), email);
    }

    public synchronized List<Attachee> getAttacheesByDivision(Division division) {
        return attachees.stream()
                .filter(a -> a.getDivision() == division)
                .collect(Collectors.toList());
    }

    public synchronized List<Attachee> getAttacheesByDivision(String division) {
        return Division.find(division)
                .map(d -> getAttacheesByDivision(d))
                .orElseGet(ArrayList::new);
    }

    public synchronized Optional<Attachee> findByEmail(String email) {
        return attachees.stream().filter(a -> Objects.equals(a.getEmail(), email)).findFirst();
    }

    public synchronized void assignTaskToDivision(String division, String description, String deadline, int priority) {
        List<Attachee> members = getAttacheesByDivision(division);
        for (Attachee attachee : members) {
            attachee.assignTask(description, deadline, priority);
        }
        log.debug("Assigned '{}' to {} attachee(s) in {}", description, members.size(), division);
    }

    public synchronized void assignTaskToAttachee(String email, String description, String deadline, int priority) {
        Optional<Attachee> attachee = findByEmail(email);
        if (attachee.isEmpty()) {
            log.debug("assignTask ignored, no attachee with email {}", email);
            return;
        }
        attachee.get().assignTask(description, deadline, priority);
    }

    public synchronized void completeTaskForAttachee(String email, int taskId, String completionDate) {
        Optional<Attachee> attachee = findByEmail(email);
        if (attachee.isEmpty()) {
            log.debug("completeTask ignored, no attachee with email {}", email);
            return;
        }
        attachee.get().completeTask(taskId, completionDate);
    }

    public synchronized void addFeedbackToAttachee(String email, String feedbackText, int score, String reviewer) {
        Optional<Attachee> attachee = findByEmail(email);
        if (attachee.isEmpty()) {
            log.debug("addFeedback ignored, no attachee with email {}", email);
            return;
        }
        attachee.get().addFeedback(feedbackText, score, reviewer);
    }

    /**
     * Construiește raportul într-o singură trecere peste attachee-i.
     * Minimul pornește de la 100, deci pentru o listă goală statisticile se resetează la 0.
     */
    public synchronized PerformanceReport generatePerformanceReport() {
        Map<Division, List<PerformanceSummary>> byDivision = new EnumMap<>(Division.class);
        for (Division division : Division.values()) {
            byDivision.put(division, new ArrayList<>());
        }

        int totalScore = 0;
        int count = 0;
        int highest = 0;
        int lowest = 100;

        for (Attachee attachee : attachees) {
            PerformanceSummary summary = attachee.getPerformanceSummary();
            byDivision.get(attachee.getDivision()).add(summary);

            totalScore += summary.getPerformanceScore();
            count++;
            if (summary.getPerformanceScore() > highest) highest = summary.getPerformanceScore();
            if (summary.getPerformanceScore() < lowest) lowest = summary.getPerformanceScore();
        }

        int average;
        if (count > 0) {
            average = (int) Math.round((double) totalScore / count);
        } else {
            average = 0;
            highest = 0;
            lowest = 0;
        }

        for (Division division : Division.values()) {
            byDivision.put(division, Collections.unmodifiableList(byDivision.get(division)));
        }
        return new PerformanceReport(Collections.unmodifiableMap(byDivision), new OverallStats(attachees.size(), average, highest, lowest));
    }
}
