package im.arun.nexusoutline.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.nexusoutline.buffer.InMemoryTextBuffer;
import im.arun.nexusoutline.config.ConfigLoader;
import im.arun.nexusoutline.config.OutlineConfig;
import im.arun.nexusoutline.model.OutlineDocument;
import im.arun.nexusoutline.service.OutlineService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for inspecting and editing outline files.
 */
@Command(
    name = "nexus-outline",
    description = "Parse an outline file into its grouped tree, toggle a node's common state, or check whether a node sits inside a variant",
    mixinStandardHelpOptions = true,
    version = "nexus-outline 1.0"
)
public class OutlineCLI implements Callable<Integer> {

    enum Action { PARSE, TOGGLE, CHECK }

    @Option(names = {"--input"}, description = "Path to the outline file", required = true)
    private String inputPath;

    @Option(names = {"--action"}, description = "parse, toggle or check (default: ${DEFAULT-VALUE})", defaultValue = "PARSE")
    private Action action;

    @Option(names = {"--line"}, description = "0-based line index of the node to toggle or check")
    private Integer line;

    @Option(names = {"--config"}, description = "Path to a nexus-outline.yaml")
    private String configPath;

    @Option(names = {"--indent-width"}, description = "Spaces per indentation level")
    private Integer indentWidth;

    @Option(names = {"--with-aux-blocks"}, description = "Include blocks after the --- separator (yes/no)")
    private String withAuxBlocks;

    @Option(names = {"--output"}, description = "Output file path (parse: JSON, toggle: outline text; defaults to stdout / in place)")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            System.err.println("Error: input file not found: " + inputPath);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (indentWidth != null) overrides.put("indentWidth", indentWidth);
        if (withAuxBlocks != null) overrides.put("includeAuxiliaryBlocks", withAuxBlocks);
        OutlineConfig config = new ConfigLoader(configPath).load(overrides);
        OutlineService service = new OutlineService(config);

        String text = Files.readString(input, StandardCharsets.UTF_8);

        if (action == Action.TOGGLE) {
            return toggle(service, text, input);
        }
        if (action == Action.CHECK) {
            return check(service, text);
        }

        OutlineDocument document = service.parseDocument(input.getFileName().toString(), text);
        ObjectMapper mapper = new ObjectMapper();
        if (config.isPrettyPrint()) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        String jsonOutput = mapper.writeValueAsString(document);

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput, StandardCharsets.UTF_8);
            System.out.println("Output written to: " + outputPath);
        } else {
            System.out.println(jsonOutput);
        }
        return 0;
    }

    private int toggle(OutlineService service, String text, Path input) throws Exception {
        if (line == null || line < 0) {
            System.err.println("Error: --line is required for toggle and must be >= 0");
            return 1;
        }

        InMemoryTextBuffer buffer = new InMemoryTextBuffer(text);
        if (!service.toggleCommonAtLine(buffer, line)) {
            System.err.println("No change: no node on line " + line + " or nothing to toggle");
            return 1;
        }

        Path target = outputPath != null ? Paths.get(outputPath) : input;
        Files.writeString(target, buffer.read(), StandardCharsets.UTF_8);
        System.out.println("Toggled common state of line " + line + ", written to: " + target);
        return 0;
    }

    private int check(OutlineService service, String text) {
        if (line == null || line < 0) {
            System.err.println("Error: --line is required for check and must be >= 0");
            return 1;
        }
        boolean inside = service.isInsideVariantAtLine(text, line);
        System.out.println("Line " + line + (inside ? " is" : " is not") + " inside a variant");
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OutlineCLI())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }
}
