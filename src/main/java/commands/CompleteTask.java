package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;

import java.util.List;

public class CompleteTask extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        hub.completeTaskForAttachee(input.getEmail(), intOrZero(input.getTaskId()), input.getCompletionDate());
    }
}
