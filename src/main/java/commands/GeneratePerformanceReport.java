package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;

import java.util.List;

public class GeneratePerformanceReport extends BaseCommand {

    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        ObjectNode res = mapper.createObjectNode();
        res.put("command", "generatePerformanceReport");
        res.set("report", reportObject(hub.generatePerformanceReport()));
        outputs.add(res);
    }
}
