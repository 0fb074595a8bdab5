package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;

import java.util.List;

public class AddFeedback extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        hub.addFeedbackToAttachee(input.getEmail(), input.getFeedback(),
                intOrZero(input.getScore()), input.getReviewer());
    }
}
