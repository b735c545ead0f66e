package uiscope.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import uiscope.config.EngineConfig;
import uiscope.discovery.DiscoveredElement;
import uiscope.discovery.DiscoveryEngine;
import uiscope.discovery.DiscoveryOptions;
import uiscope.discovery.DiscoveryResult;
import uiscope.discovery.ElementLabeler;
import uiscope.hierarchy.HierarchyAnalysisResult;
import uiscope.hierarchy.HierarchyBuilder;
import uiscope.hierarchy.HierarchyNode;
import uiscope.hierarchy.HierarchyValidationReport;
import uiscope.hierarchy.Slf4jHierarchyTracer;
import uiscope.model.ScreenDumpIO;
import uiscope.model.UIElement;
import uiscope.quality.ElementQuality;
import uiscope.quality.QualityScorer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line inspector for flattened screen dumps.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code uiscope tree}      print the reconstructed hierarchy with statistics</li>
 *   <li>{@code uiscope discover}  related elements of one element, as text or JSON</li>
 *   <li>{@code uiscope quality}   automation-reliability scores</li>
 *   <li>{@code uiscope clickable} nearest clickable ancestor of an element</li>
 *   <li>{@code uiscope validate}  structural self-check of the hierarchy</li>
 *   <li>{@code uiscope version}   print build version</li>
 * </ul>
 *
 * <p>Exit code 0 on success, 1 on unreadable input, unknown ids or an invalid tree.
 */
@Command(
        name        = "uiscope",
        description = "Hierarchy reconstruction and element discovery for Android screen dumps",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                InspectorCLI.TreeCommand.class,
                InspectorCLI.DiscoverCommand.class,
                InspectorCLI.QualityCommand.class,
                InspectorCLI.ClickableCommand.class,
                InspectorCLI.ValidateCommand.class,
                InspectorCLI.VersionCommand.class
        }
)
public class InspectorCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectorCLI.class);

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new InspectorCLI()).execute(args);
        System.exit(exit);
    }

    // ── Shared plumbing ─────────────────────────────────────────────────────

    /** Reads a dump and builds its hierarchy; prints the problem and returns null on failure. */
    static HierarchyAnalysisResult loadHierarchy(Path dumpFile, EngineConfig config) {
        if (!Files.exists(dumpFile)) {
            System.err.println("Dump file not found: " + dumpFile.toAbsolutePath());
            return null;
        }
        List<UIElement> elements;
        try {
            elements = ScreenDumpIO.read(dumpFile);
        } catch (IOException | ScreenDumpIO.SchemaValidationException e) {
            log.warn("Cannot load dump {}: {}", dumpFile, e.getMessage());
            System.err.println("Cannot read dump " + dumpFile + ": " + e.getMessage());
            return null;
        }
        HierarchyBuilder builder = new HierarchyBuilder(config.toHierarchySettings(), new Slf4jHierarchyTracer());
        return builder.analyzeHierarchy(elements);
    }

    static String describe(HierarchyNode node) {
        return String.format("%s [%s] %s", ElementLabeler.label(node.getElement()), node.getId(), node.getBounds());
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /** Prints the reconstructed tree, indented by depth, followed by statistics. */
    @Command(
            name        = "tree",
            description = "Print the reconstructed hierarchy of a screen dump",
            mixinStandardHelpOptions = true
    )
    static class TreeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to screen dump JSON file")
        Path dumpFile;

        @Override
        public Integer call() {
            HierarchyAnalysisResult hierarchy = loadHierarchy(dumpFile, new EngineConfig());
            if (hierarchy == null) return 1;
            if (hierarchy.isEmpty()) {
                System.out.println("Dump contains no elements.");
                return 0;
            }
            print(hierarchy.getRoot());
            System.out.println();
            System.out.println("Statistics: " + hierarchy.statistics());
            if (!hierarchy.getDroppedDuplicateIds().isEmpty()) {
                System.out.println("Dropped duplicate ids: " + hierarchy.getDroppedDuplicateIds());
            }
            return 0;
        }

        private static void print(HierarchyNode node) {
            String kind = node.getAttachment() == null ? "" : " (" + node.getAttachment().name().toLowerCase(Locale.ROOT) + ")";
            System.out.println("  ".repeat(node.getDepth()) + describe(node) + kind);
            for (HierarchyNode child : node.getChildren()) {
                print(child);
            }
        }
    }

    /** Runs discovery for one element id. */
    @Command(
            name        = "discover",
            description = "List parents, children, siblings and recommended targets of an element",
            mixinStandardHelpOptions = true
    )
    static class DiscoverCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to screen dump JSON file")
        Path dumpFile;

        @Parameters(index = "1", description = "Element id to analyse")
        String elementId;

        @Option(names = {"--json"}, description = "Print the result as JSON")
        boolean json;

        @Option(names = {"-d", "--max-depth"}, description = "Ancestor/descendant levels to walk (default: from config)")
        Integer maxDepth;

        @Option(names = {"--no-text-priority"}, description = "Do not list text-bearing results first")
        boolean noTextPriority;

        @Override
        public Integer call() throws Exception {
            EngineConfig config = new EngineConfig();
            HierarchyAnalysisResult hierarchy = loadHierarchy(dumpFile, config);
            if (hierarchy == null) return 1;

            DiscoveryOptions.Builder options = config.toDiscoveryOptions().toBuilder();
            if (maxDepth != null) options.maxDepth(maxDepth);
            if (noTextPriority)   options.prioritizeText(false);

            DiscoveryEngine engine = new DiscoveryEngine(config.toDiscoveryOptions(), new QualityScorer(config.toVocabulary()));
            DiscoveryResult result = engine.discover(hierarchy, elementId, options.build());

            if (json) {
                System.out.println(ScreenDumpIO.toJson(result));
            } else {
                printText(result);
            }
            return result.isFound() ? 0 : 1;
        }

        private static void printText(DiscoveryResult result) {
            if (!result.isFound()) {
                System.err.println(result.getMessage());
                return;
            }
            DiscoveredElement self = result.getSelf();
            System.out.printf("Target     : %s [%s]%n", ElementLabeler.label(self.getElement()), self.getId());
            if (result.isPromoted()) {
                System.out.printf("Promoted   : %s%n", self.getReason());
            }
            printGroup("Parents", result.getParents());
            printGroup("Children", result.getChildren());
            printGroup("Siblings", result.getSiblings());
            printGroup("Recommended", result.getRecommended());
            if (result.getMessage() != null) {
                System.out.println(result.getMessage());
            }
        }

        private static void printGroup(String title, List<DiscoveredElement> group) {
            System.out.printf("%n%s (%d)%n", title, group.size());
            for (DiscoveredElement d : group) {
                System.out.printf("  %.2f  %-18s %s [%s]%n", d.getConfidence(), d.getLabel(),
                        ElementLabeler.label(d.getElement()), d.getId());
                if (d.getPath() != null) {
                    System.out.printf("        path: %s%n", d.getPath());
                }
            }
        }
    }

    /** Prints quality scores for one element, or the best-scoring elements of the dump. */
    @Command(
            name        = "quality",
            description = "Score elements for automation reliability",
            mixinStandardHelpOptions = true
    )
    static class QualityCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to screen dump JSON file")
        Path dumpFile;

        @Parameters(index = "1", arity = "0..1", description = "Element id (default: rank all elements)")
        String elementId;

        @Option(names = {"-n", "--top"}, description = "Number of ranked elements to print (default: 10)", defaultValue = "10")
        int top;

        @Override
        public Integer call() {
            EngineConfig config = new EngineConfig();
            HierarchyAnalysisResult hierarchy = loadHierarchy(dumpFile, config);
            if (hierarchy == null) return 1;
            QualityScorer scorer = new QualityScorer(config.toVocabulary());

            if (elementId != null) {
                HierarchyNode node = hierarchy.findNode(elementId);
                if (node == null) {
                    System.err.println("Element not found: " + elementId);
                    return 1;
                }
                ElementQuality q = scorer.calculateQuality(node);
                System.out.printf("%s [%s]%n", ElementLabeler.label(node.getElement()), node.getId());
                System.out.printf("  text         : %d%n", q.getTextScore());
                System.out.printf("  uniqueness   : %d%n", q.getUniquenessScore());
                System.out.printf("  stability    : %d%n", q.getStabilityScore());
                System.out.printf("  matchability : %d%n", q.getMatchabilityScore());
                System.out.printf("  total        : %.1f%n", q.getTotalScore());
                return 0;
            }

            List<ElementQuality> ranked = scorer.rank(hierarchy.getNodeMap().values());
            int shown = Math.min(Math.max(top, 0), ranked.size());
            System.out.printf("Top %d of %d elements by quality:%n", shown, ranked.size());
            for (ElementQuality q : ranked.subList(0, shown)) {
                HierarchyNode node = hierarchy.findNode(q.getElementId());
                System.out.printf("  %5.1f  %s%n", q.getTotalScore(), describe(node));
            }
            return 0;
        }
    }

    /** Resolves the nearest clickable ancestor of an element. */
    @Command(
            name        = "clickable",
            description = "Find the nearest clickable ancestor of an element (or the element itself)",
            mixinStandardHelpOptions = true
    )
    static class ClickableCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to screen dump JSON file")
        Path dumpFile;

        @Parameters(index = "1", description = "Element id")
        String elementId;

        @Override
        public Integer call() {
            EngineConfig config = new EngineConfig();
            HierarchyAnalysisResult hierarchy = loadHierarchy(dumpFile, config);
            if (hierarchy == null) return 1;
            if (hierarchy.findNode(elementId) == null) {
                System.err.println("Element not found: " + elementId);
                return 1;
            }
            UIElement clickable = new DiscoveryEngine(config.toDiscoveryOptions(), new QualityScorer())
                    .findNearestClickableAncestor(hierarchy, elementId);
            if (clickable == null) {
                System.out.println("No clickable ancestor for " + elementId);
            } else {
                System.out.println(describe(hierarchy.findNode(clickable.getId())));
            }
            return 0;
        }
    }

    /** Checks the structural invariants of the reconstructed tree. */
    @Command(
            name        = "validate",
            description = "Check the reconstructed hierarchy for structural problems",
            mixinStandardHelpOptions = true
    )
    static class ValidateCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to screen dump JSON file")
        Path dumpFile;

        @Override
        public Integer call() {
            HierarchyAnalysisResult hierarchy = loadHierarchy(dumpFile, new EngineConfig());
            if (hierarchy == null) return 1;
            HierarchyValidationReport report = hierarchy.validate();
            System.out.println(report.summary());
            return report.isValid() ? 0 : 1;
        }
    }

    /** Prints build version. */
    @Command(
            name        = "version",
            description = "Print build version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("uiscope 1.0.0-SNAPSHOT");
            System.out.println("Java " + System.getProperty("java.version"));
            return 0;
        }
    }
}
