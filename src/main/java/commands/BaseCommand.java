package commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import models.Division;
import models.OverallStats;
import models.PerformanceReport;
import models.PerformanceSummary;
import utils.Utils;

import java.util.List;

public abstract class BaseCommand implements Command {
    protected final ObjectMapper mapper = Utils.createMapper();

    protected void addError(List<ObjectNode> outputs, String command, String email, String message) {
        ObjectNode res = mapper.createObjectNode();
        res.put("command", command);
        if (email != null) res.put("email", email);
        res.put("error", message);
        outputs.add(res);
    }

    protected ObjectNode summaryObject(PerformanceSummary s) {
        ObjectNode sn = mapper.createObjectNode();
        sn.put("name", s.getName());
        sn.put("division", s.getDivision().getLabel());
        sn.put("performanceScore", s.getPerformanceScore());
        sn.put("tasksAssigned", s.getTasksAssigned());
        sn.put("tasksCompleted", s.getTasksCompleted());
        sn.put("tasksPending", s.getTasksPending());
        sn.put("feedbackCount", s.getFeedbackCount());
        return sn;
    }

    protected ArrayNode summaryArray(List<PerformanceSummary> summaries) {
        ArrayNode arr = mapper.createArrayNode();
        for (PerformanceSummary s : summaries) {
            arr.add(summaryObject(s));
        }
        return arr;
    }

    protected ObjectNode reportObject(PerformanceReport report) {
        ObjectNode rn = mapper.createObjectNode();
        // Cheile sunt numele diviziilor, în ordinea enum-ului
        for (Division division : Division.values()) {
            rn.set(division.getLabel(), summaryArray(report.getDivision(division)));
        }

        OverallStats stats = report.getOverallStats();
        ObjectNode statsNode = mapper.createObjectNode();
        statsNode.put("totalAttachees", stats.getTotalAttachees());
        statsNode.put("averageScore", stats.getAverageScore());
        statsNode.put("highestScore", stats.getHighestScore());
        statsNode.put("lowestScore", stats.getLowestScore());
        rn.set("overallStats", statsNode);
        return rn;
    }

    protected int intOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
