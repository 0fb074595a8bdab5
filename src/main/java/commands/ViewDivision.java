package commands;

import com.fasterxml.jackson.databind.node.ObjectNode;
import models.Attachee;
import models.Division;
import models.PerformanceSummary;
import services.HubManager;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class ViewDivision extends BaseCommand {
    public void execute(HubManager hub, CommandInput input, List<ObjectNode> outputs) {
        Optional<Division> division = Division.find(input.getDivision());
        if (division.isEmpty()) {
            addError(outputs, input.getCommand(), null,
                    "Invalid division. Must be one of: " + Division.validLabels());
            return;
        }

        List<PerformanceSummary> summaries = hub.getAttacheesByDivision(division.get()).stream()
                .map(Attachee::getPerformanceSummary)
                .collect(Collectors.toList());

        ObjectNode res = mapper.createObjectNode();
        res.put("command", "viewDivision");
        res.put("division", division.get().getLabel());
        res.set("attachees", summaryArray(summaries));
        outputs.add(res);
    }
}
