package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;

import java.util.List;

public interface Command {
    void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs);
}
