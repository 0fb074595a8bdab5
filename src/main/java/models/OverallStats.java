package models;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OverallStats {
    private final int totalAttachees;
    private final int averageScore;
    private final int highestScore;
    private final int lowestScore;
}
