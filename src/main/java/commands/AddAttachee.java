package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import models.InvalidDivisionException;
import services.HubManager;

import java.util.List;

public class AddAttachee extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        try {
            hub.addAttachee(input.getName(), input.getEmail(), input.getDivision());
        } catch (InvalidDivisionException e) {
            addError(outputs, input.getCommand(), input.getEmail(), e.getMessage());
        }
    }
}
