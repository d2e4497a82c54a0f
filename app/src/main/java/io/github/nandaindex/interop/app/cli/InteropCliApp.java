package io.github.nandaindex.interop.app.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.github.nandaindex.interop.infra.config.InteropConfiguration;
import io.github.nandaindex.interop.infra.config.InteropConfigurationLoader;
import io.github.nandaindex.interop.runtime.AgentRecordTranslator;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import io.github.nandaindex.interop.runtime.model.NandaEntry;
import io.github.nandaindex.interop.runtime.model.OasfRecord;
import io.github.nandaindex.interop.runtime.translate.OasfTranslator;
import io.github.nandaindex.interop.runtime.translate.TranslationException;
import io.github.nandaindex.interop.runtime.translate.TranslationResult;
import io.github.nandaindex.interop.runtime.validation.SchemaLoadException;
import io.github.nandaindex.interop.runtime.validation.ValidationError;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command line front end for translating agent records between the registry, AgentFacts and OASF shapes.
 */
@Command(
        name = "interop",
        mixinStandardHelpOptions = true,
        description = "Translate agent records between Nanda registry, AgentFacts and OASF formats")
public final class InteropCliApp implements Runnable {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final ObjectWriter WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    @Option(names = "--taxonomy-dir", description = "OASF schema directory containing skill_categories.json and skills/")
    Path taxonomyDir;

    @Option(names = "--schema", description = "AgentFacts JSON schema file (defaults to the bundled schema)")
    Path schemaPath;

    private final InteropConfiguration baseConfiguration;
    private final Function<InteropConfiguration, AgentRecordTranslator> translatorFactory;

    InteropCliApp(
            InteropConfiguration baseConfiguration,
            Function<InteropConfiguration, AgentRecordTranslator> translatorFactory) {
        this.baseConfiguration = baseConfiguration;
        this.translatorFactory = translatorFactory;
    }

    public static void main(String[] args) {
        int exitCode = commandLineInstance(new InteropConfigurationLoader().load()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance(InteropConfiguration configuration) {
        CommandLine cmd = new CommandLine(new InteropCliApp(configuration, AgentRecordTranslator::create));
        cmd.addSubcommand("to-agentfacts", new ToAgentFactsCommand());
        cmd.addSubcommand("to-registry", new ToRegistryCommand());
        cmd.addSubcommand("export", new ExportCommand());
        cmd.addSubcommand("sync", new SyncCommand());
        cmd.addSubcommand("match", new MatchCommand());
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    InteropConfiguration effectiveConfiguration() {
        InteropConfiguration configuration = baseConfiguration;
        if (taxonomyDir != null) {
            configuration = configuration.withTaxonomyDirectory(taxonomyDir);
        }
        if (schemaPath != null) {
            configuration = configuration.withSchemaPath(schemaPath);
        }
        return configuration;
    }

    AgentRecordTranslator translator() {
        return translatorFactory.apply(effectiveConfiguration());
    }

    static JsonNode readJson(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new IllegalStateException("input file not found: " + input);
        }
        try {
            return MAPPER.readTree(input.toFile());
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read " + input + ": " + ex.getMessage(), ex);
        }
    }

    static String toJson(Object value) {
        try {
            return WRITER.writeValueAsString(value);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to serialise output", ex);
        }
    }

    /** Shared plumbing: runs the body and maps failures to exit code 1 with a message on stderr. */
    abstract static class InteropCommand implements Callable<Integer> {

        @ParentCommand
        InteropCliApp parent;

        @Spec
        CommandSpec commandSpec;

        @Override
        public Integer call() {
            try {
                return execute();
            } catch (TranslationException
                    | SchemaLoadException
                    | IllegalStateException
                    | IllegalArgumentException ex) {
                err().println("Error: " + ex.getMessage());
                return 1;
            }
        }

        abstract int execute();

        PrintWriter out() {
            return commandSpec.commandLine().getOut();
        }

        PrintWriter err() {
            return commandSpec.commandLine().getErr();
        }
    }

    @Command(name = "to-agentfacts", description = "Translate a registry entry into an AgentFacts record")
    static final class ToAgentFactsCommand extends InteropCommand {

        @Option(names = "--input", required = true, description = "Registry entry JSON file")
        Path input;

        @Option(names = "--no-validate", description = "Skip schema validation of the result")
        boolean skipValidation;

        @Override
        int execute() {
            AgentRecordTranslator translator = parent.translator();
            JsonNode entry = readJson(input);
            if (skipValidation) {
                out().println(toJson(translator.toAgentFacts(entry)));
                return 0;
            }
            TranslationResult result = translator.translateAndValidate(entry);
            out().println(toJson(result.record()));
            if (!result.valid()) {
                for (ValidationError error : result.validation().errors()) {
                    err().println("Invalid: " + error.path() + " " + error.rule() + ": " + error.message());
                }
                return 1;
            }
            return 0;
        }
    }

    @Command(name = "to-registry", description = "Translate an AgentFacts record back into a registry entry")
    static final class ToRegistryCommand extends InteropCommand {

        @Option(names = "--input", required = true, description = "AgentFacts JSON file")
        Path input;

        @Override
        int execute() {
            out().println(toJson(parent.translator().toRegistryEntry(readJson(input))));
            return 0;
        }
    }

    @Command(name = "export", description = "Export registry agents as OASF record files")
    static final class ExportCommand extends InteropCommand {

        @Option(names = "--input", required = true, description = "Registry agent JSON file, a single object or an array")
        Path input;

        @Option(names = "--out-dir", required = true, description = "Directory receiving <name>.record.json files")
        Path outDir;

        @Option(names = "--dry-run", description = "Print the records instead of writing them")
        boolean dryRun;

        @Override
        int execute() {
            AgentRecordTranslator translator = parent.translator();
            JsonNode source = readJson(input);
            List<JsonNode> agents = new ArrayList<>();
            if (source.isArray()) {
                source.forEach(agents::add);
            } else {
                agents.add(source);
            }
            int failures = 0;
            for (JsonNode agent : agents) {
                OasfRecord record;
                try {
                    record = translator.toOasfRecord(agent);
                } catch (TranslationException ex) {
                    err().println("Skipped: " + ex.getMessage());
                    failures++;
                    continue;
                }
                Path target = outDir.resolve(OasfTranslator.recordFileName(record));
                if (dryRun) {
                    out().println("Would write " + target);
                    out().println(toJson(record));
                } else {
                    write(target, toJson(record));
                    out().println("Wrote " + target);
                }
            }
            out().printf("Exported %d of %d agent(s)%n", agents.size() - failures, agents.size());
            return failures == 0 ? 0 : 1;
        }

        private static void write(Path target, String json) {
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, json + System.lineSeparator());
            } catch (IOException ex) {
                throw new IllegalStateException("failed to write " + target + ": " + ex.getMessage(), ex);
            }
        }
    }

    @Command(name = "sync", description = "Translate OASF record files into Nanda registry entries")
    static final class SyncCommand extends InteropCommand {

        @Option(names = "--records-path", required = true, description = "Directory scanned for *.record.json files")
        Path recordsPath;

        @Option(names = "--limit", description = "Maximum number of record files to process")
        Integer limit;

        @Override
        int execute() {
            if (!Files.isDirectory(recordsPath)) {
                throw new IllegalStateException("records directory not found: " + recordsPath);
            }
            AgentRecordTranslator translator = parent.translator();
            List<Path> files = recordFiles();
            if (limit != null && limit >= 0 && files.size() > limit) {
                files = files.subList(0, limit);
            }
            ArrayNode entries = MAPPER.createArrayNode();
            for (Path file : files) {
                try {
                    NandaEntry entry = translator.toNandaEntry(readJson(file));
                    entries.add(MAPPER.valueToTree(entry));
                } catch (TranslationException | IllegalStateException ex) {
                    err().println("Skipped " + file.getFileName() + ": " + ex.getMessage());
                }
            }
            out().println(toJson(entries));
            return 0;
        }

        private List<Path> recordFiles() {
            try (Stream<Path> stream = Files.walk(recordsPath)) {
                return stream.filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().endsWith(OasfTranslator.RECORD_FILE_SUFFIX))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException ex) {
                throw new IllegalStateException("failed to scan " + recordsPath + ": " + ex.getMessage(), ex);
            }
        }
    }

    @Command(name = "match", description = "Resolve a capability string against the taxonomy")
    static final class MatchCommand extends InteropCommand {

        @Parameters(arity = "1..*", paramLabel = "TEXT", description = "Capability text")
        List<String> words;

        @Override
        int execute() {
            String capability = String.join(" ", words);
            Optional<CapabilityMatch> match = parent.translator().matchCapability(capability);
            if (match.isEmpty()) {
                out().println("no match");
                return 0;
            }
            out().println(toJson(match.get()));
            return 0;
        }
    }
}
