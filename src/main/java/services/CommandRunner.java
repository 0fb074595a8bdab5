package services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import commands.AddAttachee;
import commands.AddFeedback;
import commands.AssignTask;
import commands.AssignTaskToDivision;
import commands.Command;
import commands.CommandInput;
import commands.CompleteTask;
import commands.DisplayPerformanceReport;
import commands.GeneratePerformanceReport;
import commands.RemoveAttachee;
import commands.ViewAttachee;
import commands.ViewDivision;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import utils.Utils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class CommandRunner {
    @Getter
    private final HubManager hub;
    private final ObjectMapper mapper;
    private final Map<String, Command> commands = new HashMap<>();

    public CommandRunner(HubManager hub) {
        this.hub = hub;
        this.mapper = Utils.createMapper();

        commands.put("addAttachee", new AddAttachee());
        commands.put("removeAttachee", new RemoveAttachee());
        commands.put("assignTaskToDivision", new AssignTaskToDivision());
        commands.put("assignTask", new AssignTask());
        commands.put("completeTask", new CompleteTask());
        commands.put("addFeedback", new AddFeedback());
        commands.put("viewDivision", new ViewDivision());
        commands.put("viewAttachee", new ViewAttachee());
        commands.put("generatePerformanceReport", new GeneratePerformanceReport());
        commands.put("displayPerformanceReport", new DisplayPerformanceReport());
    }

    public void execute(CommandInput input, List<ObjectNode> outputs) {
        Command command = input.getCommand() == null ? null : commands.get(input.getCommand());
        if (command == null) {
            log.warn("Unknown command {}", input.getCommand());
            ObjectNode res = mapper.createObjectNode();
            res.put("command", input.getCommand());
            res.put("error", "Unknown command " + input.getCommand() + ".");
            outputs.add(res);
            return;
        }
        command.execute(hub, input, outputs);
    }
}
