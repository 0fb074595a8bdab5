package models;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Un attachee (intern) din hub, identificat prin email.
 * Scorul de performanță este media rotunjită a scorurilor din feedback
 * și se recalculează la fiecare feedback nou.
 */
@Getter
public class Attachee {
    private final String name;
    private final String email;
    private final Division division;
    private final List<Task> tasks = new ArrayList<>();
    private final List<FeedbackEntry> feedback = new ArrayList<>();
    private int performanceScore = 0;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    public Attachee(String name, String email, String division) {
        this(name, email, Division.fromLabel(division), Clock.systemUTC());
    }

    public Attachee(String name, String email, String division, Clock clock) {
        this(name, email, Division.fromLabel(division), clock);
    }

    public Attachee(String name, String email, Division division, Clock clock) {
        this.name = name;
        this.email = email;
        this.division = division;
        this.clock = clock;
    }

    public List<Task> getTasks() {
        return Collections.unmodifiableList(tasks);
    }

    public List<FeedbackEntry> getFeedback() {
        return Collections.unmodifiableList(feedback);
    }

    /**
     * Adaugă o sarcină nouă. Prioritatea nu este validată aici.
     */
    public Task assignTask(String description, String deadline, int priority) {
        Task task = new Task(tasks.size() + 1, description, deadline, priority);
        tasks.add(task);
        return task;
    }

    public Optional<Task> findTask(int taskId) {
        return tasks.stream().filter(t -> t.getId() == taskId).findFirst();
    }

    /**
     * Marchează sarcina ca terminată. Un id inexistent este ignorat.
     */
    public void completeTask(int taskId, String completionDate) {
        findTask(taskId).ifPresent(t -> t.complete(completionDate));
    }

    public FeedbackEntry addFeedback(String text, int score, String reviewer) {
        FeedbackEntry entry = new FeedbackEntry(text, score, reviewer, Instant.now(clock));
        feedback.add(entry);
        calculatePerformanceScore();
        return entry;
    }

    private void calculatePerformanceScore() {
        if (feedback.isEmpty()) {
            performanceScore = 0;
            return;
        }
        int total = 0;
        for (FeedbackEntry entry : feedback) {
            total += entry.getScore();
        }
        performanceScore = (int) Math.round((double) total / feedback.size());
    }

    public PerformanceSummary getPerformanceSummary() {
        int completed = (int) tasks.stream().filter(Task::isCompleted).count();
        return new PerformanceSummary(name, division, performanceScore,
                tasks.size(), completed, tasks.size() - completed, feedback.size());
    }
}
