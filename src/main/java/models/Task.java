package models;

import lombok.Getter;

/**
 * Sarcină atribuită unui attachee. Id-ul este unic doar în lista attachee-ului.
 */
@Getter
public class Task {
    private final int id;
    private final String description;
    private final String deadline;
    private final int priority; // 1-5, 5 = cea mai mare
    private boolean completed;
    private String completionDate;

    public Task(int id, String description, String deadline, int priority) {
        this.id = id;
        this.description = description;
        this.deadline = deadline;
        this.priority = priority;
        this.completed = false;
        this.completionDate = null;
    }

    public void complete(String date) {
        this.completed = true;
        this.completionDate = date;
    }
}
