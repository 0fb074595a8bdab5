package models;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PerformanceSummary {
    private final String name;
    private final Division division;
    private final int performanceScore;
    private final int tasksAssigned;
    private final int tasksCompleted;
    private final int tasksPending;
    private final int feedbackCount;
}
