package work.lcod.thoughts.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.thoughts.compare.PathComparator;
import work.lcod.thoughts.compare.PathDiff;
import work.lcod.thoughts.document.DocumentReport;
import work.lcod.thoughts.document.ErrorReports;
import work.lcod.thoughts.document.MergedGraph;
import work.lcod.thoughts.document.MergedGraphBuilder;
import work.lcod.thoughts.document.ReasoningDocumentProcessor;
import work.lcod.thoughts.eval.ConsistencyChecker;
import work.lcod.thoughts.eval.Verification;
import work.lcod.thoughts.graph.Leveling;
import work.lcod.thoughts.graph.TopologicalLeveler;
import work.lcod.thoughts.path.ReasoningPath;
import work.lcod.thoughts.path.StepExtractor;
import work.lcod.thoughts.simplify.Simplifier;

/**
 * Public entry point: extraction, simplification, leveling and verification of computations,
 * plus reasoning-document processing.
 */
public final class ThoughtGraphAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(ThoughtGraphAnalyzer.class);

    private final AnalyzerConfiguration configuration;
    private final StepExtractor extractor;
    private final ConsistencyChecker checker;

    public ThoughtGraphAnalyzer() {
        this(AnalyzerConfiguration.defaults());
    }

    public ThoughtGraphAnalyzer(AnalyzerConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.extractor = new StepExtractor(configuration.entryFunction());
        this.checker = new ConsistencyChecker(configuration.tolerance());
    }

    public AnalyzerConfiguration configuration() {
        return configuration;
    }

    public AnalysisResult analyze(String source) {
        return analyze(source, Map.of());
    }

    /**
     * Analyzes one computation. Names in {@code binding} are declared parameters in addition to
     * those of the function header; when verification is enabled and a binding is given, the
     * simplified path is evaluated against the extracted one. Never throws.
     */
    public AnalysisResult analyze(String source, Map<String, ?> binding) {
        Map<String, ?> values = binding == null ? Map.of() : binding;
        try {
            var extraction = extractor.extractDetailed(source, values.keySet());
            ReasoningPath extracted = extraction.path();
            ReasoningPath path = configuration.simplify() ? Simplifier.simplify(extracted) : extracted;
            Leveling leveling = TopologicalLeveler.levels(path);

            Optional<Verification> verification = Optional.empty();
            if (configuration.verify() && configuration.simplify() && !values.isEmpty()) {
                verification = Optional.of(checker.compare(extracted, path, values));
            }

            boolean degraded = !leveling.isComplete()
                || verification.map(result -> !result.isConsistent()).orElse(false);
            var status = degraded ? AnalysisResult.Status.WARNING : AnalysisResult.Status.SUCCESS;
            LOG.debug("Analyzed computation: {} steps, {} after simplification, status {}", extracted.size(), path.size(), status);
            return new AnalysisResult(status, extracted, path, leveling, extraction.skipped(), verification, Map.of());
        } catch (RuntimeException ex) {
            var error = ErrorReports.normalize(ex);
            LOG.warn("Analysis failed: {}", error.get("message"));
            return AnalysisResult.failure(error);
        }
    }

    /**
     * Diffs two computations after extraction (and simplification when enabled).
     *
     * @throws work.lcod.thoughts.expr.SourceParseException when either source does not parse
     */
    public PathDiff compare(String firstSource, String secondSource) {
        return PathComparator.compare(prepare(firstSource), prepare(secondSource));
    }

    public DocumentReport processDocument(JsonNode document) {
        return new ReasoningDocumentProcessor(extractor, configuration.simplify(), configuration.verify() ? checker : null)
            .process(document);
    }

    public MergedGraph mergedGraph(JsonNode annotatedDocument) {
        return MergedGraphBuilder.build(annotatedDocument);
    }

    private ReasoningPath prepare(String source) {
        ReasoningPath path = extractor.extract(source);
        return configuration.simplify() ? Simplifier.simplify(path) : path;
    }
}
