package commands;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommandInput {
    private String command;

    // --- Attachee ---
    private String name;
    private String email;
    private String division;

    // --- Task ---
    private String description;
    private String deadline;
    private Integer priority;
    private Integer taskId;
    private String completionDate;

    // --- Feedback ---
    private String feedback;
    private Integer score;
    private String reviewer;
}
