package commands;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import services.HubManager;
import services.ReportPrinter;

import java.util.List;

public class DisplayPerformanceReport extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        ArrayNode lines = mapper.createArrayNode();
        for (String line : ReportPrinter.render(hub.generatePerformanceReport())) {
            lines.add(line);
        }

        ObjectNode res = mapper.createObjectNode();
        res.put("command", "displayPerformanceReport");
        res.set("lines", lines);
        outputs.add(res);
    }
}
