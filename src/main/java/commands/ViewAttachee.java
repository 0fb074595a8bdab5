package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import models.Attachee;
import services.HubManager;

import java.util.List;
import java.util.Optional;

public class ViewAttachee extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        Optional<Attachee> found = hub.findByEmail(input.getEmail());
        if (found.isEmpty()) {
            addError(outputs, input.getCommand(), input.getEmail(),
                    "The attachee " + input.getEmail() + " does not exist.");
            return;
        }
        Attachee attachee = found.get();

        ObjectNode an = mapper.createObjectNode();
        an.put("name", attachee.getName());
        an.put("email", attachee.getEmail());
        an.put("division", attachee.getDivision().getLabel());
        an.put("performanceScore", attachee.getPerformanceScore());
        // Task și FeedbackEntry se serializează direct prin getteri
        an.set("tasks", mapper.valueToTree(attachee.getTasks()));
        an.set("feedback", mapper.valueToTree(attachee.getFeedback()));

        ObjectNode res = mapper.createObjectNode();
        res.put("command", "viewAttachee");
        res.put("email", attachee.getEmail());
        res.set("attachee", an);
        outputs.add(res);
    }
}
