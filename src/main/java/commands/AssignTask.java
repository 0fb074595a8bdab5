package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;

import java.util.List;

public class AssignTask extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        hub.assignTaskToAttachee(input.getEmail(), input.getDescription(),
                input.getDeadline(), intOrZero(input.getPriority()));
    }
}
