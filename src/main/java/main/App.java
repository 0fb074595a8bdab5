package main;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import commands.CommandInput;
import lombok.extern.slf4j.Slf4j;
import services.CommandRunner;
import services.HubManager;
import services.ReportPrinter;
import utils.Utils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * App citește comenzile, le rulează pe un HubManager nou
 * și scrie rezultatele JSON în fișierul de ieșire.
 */
@Slf4j
public final class App {

    private App() {
    }

    static final String DEMO_COMMANDS_RESOURCE = "/demo/commands.json";
    static final String DEFAULT_OUTPUT_PATH = "output/report.json";

    private static final ObjectMapper MAPPER = Utils.createMapper();

    // JSON-ul final frumos formatat
    private static final ObjectWriter WRITER = MAPPER.writer().withDefaultPrettyPrinter();

    /**
     * Fără argumente rulează scenariul demo din resurse.
     * Altfel: {@code <input.json> [output.json]}.
     */
    public static void main(final String[] args) {
        String outputPath = args.length > 1 ? args[1] : DEFAULT_OUTPUT_PATH;
        HubManager hub = args.length > 0
                ? run(new File(args[0]), new File(outputPath), Clock.systemUTC())
                : runDemo(new File(outputPath));

        ReportPrinter.render(hub.generatePerformanceReport()).forEach(System.out::println);
    }

    public static HubManager runDemo(final File outputFile) {
        HubManager hub = new HubManager(Clock.systemUTC());
        try (InputStream in = App.class.getResourceAsStream(DEMO_COMMANDS_RESOURCE)) {
            if (in == null) {
                log.error("Demo resource {} is missing", DEMO_COMMANDS_RESOURCE);
                return hub;
            }
            List<CommandInput> commands = MAPPER.readValue(in, new TypeReference<List<CommandInput>>() {});
            write(outputFile, process(hub, commands));
        } catch (IOException e) {
            log.error("Failed to run demo commands", e);
        }
        return hub;
    }

    /**
     * Rulează comenzile din {@code inputFile} și scrie rezultatul în {@code outputFile}.
     *
     * @return hub-ul după executarea tuturor comenzilor
     */
    public static HubManager run(final File inputFile, final File outputFile, final Clock clock) {
        HubManager hub = new HubManager(clock);
        List<ObjectNode> outputs = new ArrayList<>();
        try {
            List<CommandInput> commands = MAPPER.readValue(inputFile, new TypeReference<List<CommandInput>>() {});
            outputs = process(hub, commands);
        } catch (IOException e) {
            log.error("Failed to read commands from {}", inputFile, e);
        }

        // Fișierul de ieșire se scrie și dacă citirea a eșuat
        try {
            write(outputFile, outputs);
        } catch (IOException e) {
            log.error("Failed to write output to {}", outputFile, e);
        }
        return hub;
    }

    private static List<ObjectNode> process(HubManager hub, List<CommandInput> commands) {
        List<ObjectNode> outputs = new ArrayList<>();
        CommandRunner commandRunner = new CommandRunner(hub);
        for (CommandInput command : commands) {
            commandRunner.execute(command, outputs);
        }
        log.info("Processed {} command(s), {} output(s)", commands.size(), outputs.size());
        return outputs;
    }

    private static void write(File outputFile, List<ObjectNode> outputs) throws IOException {
        if (outputFile.getParentFile() != null) {
            outputFile.getParentFile().mkdirs();
        }
        WRITER.writeValue(outputFile, outputs);
    }
}
