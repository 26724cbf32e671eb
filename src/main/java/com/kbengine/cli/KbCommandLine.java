package com.kbengine.cli;

import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.KbEngineException;
import com.kbengine.exception.PipelineException;
import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.exception.ValidationException;
import com.kbengine.graph.GraphQueryService;
import com.kbengine.indexing.IndexRepositoryResult;
import com.kbengine.indexing.IndexationOrchestrator;
import com.kbengine.indexing.RepositoryConfig;
import com.kbengine.indexing.SyncResult;
import com.kbengine.model.RetrievalMode;
import com.kbengine.model.RetrievalResponse;
import com.kbengine.model.SearchFilters;
import com.kbengine.model.SearchRequest;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.retrieval.RetrievalPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line surface: {@code index}, {@code search}, {@code sync} and {@code graph} subcommands.
 * Returns 0 on success and 1 on any failure, including batches that reported per-file errors.
 */
@Slf4j
@Component
public class KbCommandLine {

    static final String USAGE = """
        Usage:
          index <path> [--name <repo>] [--json]
          search <query> [--mode vector|graph|hybrid] [--limit N] [--threshold T] [--domain D] [--json]
          sync <path> --since <revision> [--name <repo>] [--json]
          graph ls [--kind entity|concept|event]
          graph inspect <node-id> [--depth N]
          graph path <from-id> <to-id> [--max-depth N]
          graph impact <document-id>
          graph provenance <node-id>
          graph stats
          graph delete <node-id> --force
          graph query <raw-query>
        """;

    private final IndexationOrchestrator orchestrator;
    private final RetrievalPipeline retrievalPipeline;
    private final GraphQueryService graphQueryService;
    private final CommandOutput output;

    public KbCommandLine(IndexationOrchestrator orchestrator, RetrievalPipeline retrievalPipeline,
                         GraphQueryService graphQueryService, CommandOutput output) {
        this.orchestrator = orchestrator;
        this.retrievalPipeline = retrievalPipeline;
        this.graphQueryService = graphQueryService;
        this.output = output;
    }

    public int execute(String[] rawArguments) {
        CommandLineArguments arguments = new CommandLineArguments(rawArguments);
        boolean json = arguments.flag("json");
        List<String> words = arguments.positional();
        if (words.isEmpty() || arguments.flag("help")) {
            output.usage(USAGE);
            return words.isEmpty() && !arguments.flag("help") ? 1 : 0;
        }

        try {
            return switch (words.get(0)) {
                case "index" -> index(arguments, json);
                case "search" -> search(arguments, json);
                case "sync" -> sync(arguments, json);
                case "graph" -> graph(arguments, json);
                default -> throw new ValidationException("Unknown command: " + words.get(0));
            };
        } catch (KbEngineException e) {
            output.error(e.getMessage(), details(e), json);
            return 1;
        } catch (RuntimeException e) {
            log.error("Command failed", e);
            output.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), Map.of(), json);
            return 1;
        }
    }

    private int index(CommandLineArguments arguments, boolean json) {
        Path path = Path.of(arguments.positional(1, "path"));
        IndexRepositoryResult result = arguments.option("name").isPresent()
            ? orchestrator.indexRepository(repository(path, arguments))
            : orchestrator.indexPath(path);
        output.indexResult(result, json);
        return result.failed() > 0 ? 1 : 0;
    }

    private int search(CommandLineArguments arguments, boolean json) {
        String query = arguments.remainder(1, "query");
        SearchFilters filters = new SearchFilters(arguments.option("domain").orElse(null), null, null, null);
        SearchRequest request = new SearchRequest(
            query,
            RetrievalMode.fromValue(arguments.option("mode").orElse(null)),
            filters,
            arguments.intOption("limit"),
            arguments.doubleOption("threshold")
        );
        RetrievalResponse response = retrievalPipeline.search(request);
        output.searchResult(response, json);
        return 0;
    }

    private int sync(CommandLineArguments arguments, boolean json) {
        Path path = Path.of(arguments.positional(1, "path"));
        String since = arguments.option("since")
            .orElseThrow(() -> new ValidationException("Option --since <revision> is required"));
        SyncResult result = orchestrator.syncRepository(repository(path, arguments), since);
        output.syncResult(result, json);
        return result.errors().isEmpty() ? 0 : 1;
    }

    private int graph(CommandLineArguments arguments, boolean json) {
        String subcommand = arguments.positional(1, "subcommand");
        switch (subcommand) {
            case "ls" -> output.value(graphQueryService.listNodes(
                arguments.option("kind").map(NodeKind::fromValue).orElse(null)), json);
            case "inspect" -> output.value(graphQueryService.inspect(
                arguments.positional(2, "node-id"), intOr(arguments, "depth", 1)), json);
            case "path" -> output.value(graphQueryService.path(
                arguments.positional(2, "from-id"), arguments.positional(3, "to-id"),
                intOr(arguments, "max-depth", 5)), json);
            case "impact" -> output.value(graphQueryService.impact(arguments.positional(2, "document-id")), json);
            case "provenance" -> output.value(graphQueryService.provenance(arguments.positional(2, "node-id")), json);
            case "stats" -> output.value(graphQueryService.stats(), json);
            case "delete" -> {
                String nodeId = arguments.positional(2, "node-id");
                if (!arguments.flag("force")) {
                    throw new ValidationException("Refusing to delete " + nodeId + " without --force");
                }
                graphQueryService.deleteNode(nodeId);
                output.value(Map.of("deleted", nodeId), json);
            }
            case "query" -> output.value(graphQueryService.query(arguments.remainder(2, "raw-query"), Map.of()), json);
            default -> throw new ValidationException("Unknown graph command: " + subcommand);
        }
        return 0;
    }

    private static RepositoryConfig repository(Path path, CommandLineArguments arguments) {
        Path root = path.toAbsolutePath().normalize();
        String defaultName = root.getFileName() == null ? "root" : root.getFileName().toString();
        return RepositoryConfig.builder()
            .name(arguments.option("name").orElse(defaultName))
            .localPath(root.toString())
            .build();
    }

    private static int intOr(CommandLineArguments arguments, String name, int defaultValue) {
        Integer value = arguments.intOption(name);
        return value == null ? defaultValue : value;
    }

    private static Map<String, Object> details(KbEngineException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", e.getClass().getSimpleName());
        if (e instanceof PipelineException pipeline && pipeline.getDocumentId() != null) {
            details.put("document_id", pipeline.getDocumentId());
        }
        if (e instanceof StoreUnavailableException store) {
            details.put("store", store.getStore());
        }
        if (e instanceof EntityNotFoundException notFound) {
            details.put("id", notFound.getEntityId());
        }
        return details;
    }
}
