package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.enums.RequirementType;
import io.mersel.services.xsltanalyzer.application.enums.VariableScope;
import io.mersel.services.xsltanalyzer.application.enums.VariableType;
import io.mersel.services.xsltanalyzer.application.interfaces.IExecutionPathAnalyzer;
import io.mersel.services.xsltanalyzer.application.models.ConditionalLogic;
import io.mersel.services.xsltanalyzer.application.models.CoverageGap;
import io.mersel.services.xsltanalyzer.application.models.CoverageReport;
import io.mersel.services.xsltanalyzer.application.models.ExecutionAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.ExecutionGraph;
import io.mersel.services.xsltanalyzer.application.models.ExecutionNode;
import io.mersel.services.xsltanalyzer.application.models.ExecutionPath;
import io.mersel.services.xsltanalyzer.application.models.PathEnumerationLimits;
import io.mersel.services.xsltanalyzer.application.models.PathStatistics;
import io.mersel.services.xsltanalyzer.application.models.SemanticPattern;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.TestDataRequirement;
import io.mersel.services.xsltanalyzer.application.models.TestScenario;
import io.mersel.services.xsltanalyzer.application.models.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Yürütme yolu analizi implementasyonu.
 * <p>
 * Akış:
 * <ol>
 *   <li>Yürütme grafiği kurulur ({@link ExecutionGraphBuilder})</li>
 *   <li>Giriş noktaları belirlenir: {@code match} şablonları, yoksa {@code root/main/transform}
 *       adlı şablonlar, yoksa hiçbir şablonun çağırmadığı şablonlar</li>
 *   <li>Yollar sınırlı olarak numaralandırılır ({@link ExecutionPathEnumerator})</li>
 *   <li>Her yol için koşullar, değişkenler, şablonlar, çıktılar ve test verisi gereksinimleri türetilir</li>
 *   <li>Kapsama, yol istatistikleri ve test senaryoları üretilir</li>
 * </ol>
 */
@Service
public class ExecutionPathAnalyzer implements IExecutionPathAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPathAnalyzer.class);

    private static final Set<String> ENTRY_TEMPLATE_NAMES = Set.of("root", "main", "transform");

    private static final int CRITICAL_COMPLEXITY = 10;
    private static final int CRITICAL_CONDITIONS = 3;
    private static final int HEAVY_VARIABLES = 5;
    private static final int COMPLEX_CONDITION_LENGTH = 30;
    private static final int SIMPLE_COMPLEXITY = 5;

    private static final int MAX_CRITICAL_SCENARIOS = 5;
    private static final int MAX_CONDITIONAL_SCENARIOS = 3;
    private static final int MAX_HAPPY_SCENARIOS = 2;
    private static final int MAX_RECURSIVE_SCENARIOS = 3;

    private final ExecutionGraphBuilder graphBuilder = new ExecutionGraphBuilder();
    private final ExecutionPathEnumerator enumerator = new ExecutionPathEnumerator();

    @Override
    public ExecutionAnalysisResult analyze(Map<String, Template> templates,
                                           Map<String, Variable> variables,
                                           List<SemanticPattern> patterns,
                                           PathEnumerationLimits limits) {
        ExecutionGraph graph = graphBuilder.build(templates);
        List<String> entryPoints = identifyEntryPoints(templates);
        log.debug("Giriş noktaları: {}", entryPoints);

        List<Integer> startNodes = entryPoints.stream()
                .map(graph::startNodeOf)
                .flatMap(Optional::stream)
                .map(ExecutionNode::id)
                .toList();

        ExecutionPathEnumerator.Enumeration enumeration = enumerator.enumerate(graph, startNodes, limits);

        List<ExecutionPath> paths = new ArrayList<>(enumeration.paths().size());
        for (List<Integer> nodes : enumeration.paths()) {
            paths.add(toPath("path_" + paths.size(), nodes, graph));
        }

        CoverageReport coverage = analyzeCoverage(templates, graph, paths, enumeration.truncated());
        PathStatistics statistics = statistics(paths, enumeration.truncated());
        List<TestScenario> scenarios = testScenarios(paths, templates, variables, patterns, graph);

        log.info("Yürütme yolu analizi tamamlandı: {} düğüm, {} yol, düğüm kapsamı %{}{}",
                graph.size(), paths.size(), coverage.nodeCoveragePercentage(),
                enumeration.truncated() ? " (kısmi)" : "");

        return new ExecutionAnalysisResult(graph, paths, entryPoints, coverage, statistics, scenarios);
    }

    // ── Giriş noktaları ─────────────────────────────────────────────

    List<String> identifyEntryPoints(Map<String, Template> templates) {
        List<String> entries = templates.values().stream()
                .filter(t -> t.getMatchPattern() != null)
                .map(Template::getKey)
                .toList();
        if (!entries.isEmpty()) {
            return entries;
        }

        entries = templates.keySet().stream()
                .filter(key -> ENTRY_TEMPLATE_NAMES.contains(key.toLowerCase(Locale.ROOT)))
                .toList();
        if (!entries.isEmpty()) {
            return entries;
        }

        Set<String> called = new HashSet<>();
        for (Template template : templates.values()) {
            template.getCallsTemplates().stream()
                    .filter(target -> !target.equals(template.getKey()))
                    .forEach(called::add);
        }
        return templates.keySet().stream().filter(key -> !called.contains(key)).toList();
    }

    // ── Yol türetme ─────────────────────────────────────────────────

    private ExecutionPath toPath(String pathId, List<Integer> nodes, ExecutionGraph graph) {
        List<String> conditions = new ArrayList<>();
        Set<String> variablesUsed = new LinkedHashSet<>();
        Set<String> templatesInvolved = new LinkedHashSet<>();
        Set<String> outputElements = new LinkedHashSet<>();
        int complexity = 0;

        for (int id : nodes) {
            ExecutionNode node = graph.node(id);
            if (node.condition() != null) {
                conditions.add(node.condition());
            }
            variablesUsed.addAll(node.variablesRead());
            variablesUsed.addAll(node.variablesWritten());
            templatesInvolved.add(node.templateKey());
            outputElements.addAll(node.outputElements());
            complexity += node.complexityWeight();
        }

        List<TestDataRequirement> requirements = testDataRequirements(complexity, conditions,
                variablesUsed, outputElements);

        return new ExecutionPath(pathId, List.copyOf(nodes), List.copyOf(conditions),
                Collections.unmodifiableSet(variablesUsed),
                Collections.unmodifiableSet(templatesInvolved),
                Collections.unmodifiableSet(outputElements),
                1.0 / (conditions.size() + 1), complexity, List.copyOf(requirements));
    }

    private static List<TestDataRequirement> testDataRequirements(int complexity, List<String> conditions,
                                                                  Set<String> variables, Set<String> outputs) {
        List<TestDataRequirement> requirements = new ArrayList<>();
        if (complexity > CRITICAL_COMPLEXITY || conditions.size() > CRITICAL_CONDITIONS) {
            requirements.add(TestDataRequirement.of(RequirementType.CRITICAL_PATH,
                    "Yüksek karmaşıklıklı yürütme yolu", PriorityLevel.HIGH));
        }
        if (variables.size() > HEAVY_VARIABLES) {
            requirements.add(TestDataRequirement.of(RequirementType.VARIABLE_HEAVY,
                    "Yol çok sayıda değişken kullanıyor", PriorityLevel.MEDIUM));
        }
        if (conditions.stream().anyMatch(c -> c.length() > COMPLEX_CONDITION_LENGTH)) {
            requirements.add(TestDataRequirement.of(RequirementType.COMPLEX_CONDITIONS,
                    "Yolda karmaşık koşul mantığı var", PriorityLevel.HIGH));
        }

        requirements.add(TestDataRequirement.inputVariables(List.copyOf(variables)));
        for (String condition : conditions) {
            requirements.add(TestDataRequirement.conditionData(condition));
        }
        if (!outputs.isEmpty()) {
            requirements.add(TestDataRequirement.outputVerification(List.copyOf(outputs)));
        }
        return requirements;
    }

    // ── Kapsama ─────────────────────────────────────────────────────

    CoverageReport analyzeCoverage(Map<String, Template> templates, ExecutionGraph graph,
                                   List<ExecutionPath> paths, boolean truncated) {
        Set<Integer> coveredNodes = new HashSet<>();
        Set<String> coveredTemplates = new HashSet<>();
        Set<String> testedConditions = new HashSet<>();
        for (ExecutionPath path : paths) {
            coveredNodes.addAll(path.nodes());
            coveredTemplates.addAll(path.templatesInvolved());
            testedConditions.addAll(path.conditions());
        }

        List<Integer> uncoveredNodes = graph.nodes().stream()
                .map(ExecutionNode::id)
                .filter(id -> !coveredNodes.contains(id))
                .toList();
        List<String> uncoveredTemplates = templates.keySet().stream()
                .filter(key -> !coveredTemplates.contains(key))
                .toList();

        Set<String> allConditions = new LinkedHashSet<>();
        for (Template template : templates.values()) {
            for (ConditionalLogic conditional : template.getConditionalLogic()) {
                String condition = conditional.pathCondition();
                if (condition != null) {
                    allConditions.add(condition);
                }
            }
        }
        List<String> untestedConditions = allConditions.stream()
                .filter(c -> !testedConditions.contains(c))
                .toList();

        List<CoverageGap> gaps = new ArrayList<>();
        if (!uncoveredTemplates.isEmpty()) {
            gaps.add(new CoverageGap("unexecuted_templates", "Hiçbir yolda yürütülmeyen şablonlar",
                    uncoveredTemplates, PriorityLevel.HIGH));
        }
        if (!untestedConditions.isEmpty()) {
            gaps.add(new CoverageGap("untested_conditions", "Hiçbir yolda test edilmeyen koşullar",
                    untestedConditions, PriorityLevel.MEDIUM));
        }

        return new CoverageReport(
                percentage(coveredNodes.size(), graph.size()),
                percentage(templates.size() - uncoveredTemplates.size(), templates.size()),
                graph.size(),
                coveredNodes.size(),
                uncoveredNodes.size(),
                uncoveredNodes,
                uncoveredTemplates,
                untestedConditions,
                gaps,
                truncated);
    }

    private static double percentage(int part, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(part * 10000.0 / total) / 100.0;
    }

    // ── İstatistikler ───────────────────────────────────────────────

    PathStatistics statistics(List<ExecutionPath> paths, boolean truncated) {
        if (paths.isEmpty()) {
            return new PathStatistics(0, 0.0, 0, 0.0, 0, 0.0, 0, null, truncated);
        }
        int totalComplexity = 0;
        int maxComplexity = 0;
        int totalLength = 0;
        int maxLength = 0;
        int totalConditions = 0;
        int withConditions = 0;
        ExecutionPath mostComplex = paths.get(0);

        for (ExecutionPath path : paths) {
            totalComplexity += path.complexityScore();
            maxComplexity = Math.max(maxComplexity, path.complexityScore());
            totalLength += path.nodes().size();
            maxLength = Math.max(maxLength, path.nodes().size());
            totalConditions += path.conditions().size();
            if (!path.conditions().isEmpty()) {
                withConditions++;
            }
            if (path.complexityScore() > mostComplex.complexityScore()) {
                mostComplex = path;
            }
        }

        int count = paths.size();
        return new PathStatistics(count,
                (double) totalComplexity / count, maxComplexity,
                (double) totalLength / count, maxLength,
                (double) totalConditions / count, withConditions,
                mostComplex.pathId(), truncated);
    }

    // ── Test senaryoları ────────────────────────────────────────────

    List<TestScenario> testScenarios(List<ExecutionPath> paths, Map<String, Template> templates,
                                     Map<String, Variable> variables, List<SemanticPattern> patterns,
                                     ExecutionGraph graph) {
        List<TestScenario> scenarios = new ArrayList<>();
        Optional<TestDataRequirement> stylesheetParameters = stylesheetParameters(variables);

        paths.stream()
                .filter(p -> p.complexityScore() > CRITICAL_COMPLEXITY)
                .limit(MAX_CRITICAL_SCENARIOS)
                .forEach(p -> scenarios.add(scenario("critical_path", p,
                        "Karmaşıklığı " + p.complexityScore() + " olan kritik yürütme yolunu test et",
                        PriorityLevel.HIGH, stylesheetParameters)));

        paths.stream()
                .filter(p -> !p.conditions().isEmpty())
                .limit(MAX_CONDITIONAL_SCENARIOS)
                .forEach(p -> scenarios.add(scenario("conditional_logic", p,
                        p.conditions().size() + " koşullu yolu test et",
                        PriorityLevel.HIGH, stylesheetParameters)));

        paths.stream()
                .filter(p -> p.complexityScore() <= SIMPLE_COMPLEXITY)
                .limit(MAX_HAPPY_SCENARIOS)
                .forEach(p -> scenarios.add(scenario("happy_path", p,
                        "Basit/olağan yürütme yolunu test et",
                        PriorityLevel.MEDIUM, stylesheetParameters)));

        // Özyineleme kalıbı varsa döngüyle kapanan yollar sonlanma testi için seçilir
        List<String> recursiveTemplates = patterns.stream()
                .filter(p -> p.patternType() == PatternType.RECURSIVE_PROCESSING)
                .flatMap(p -> p.templatesInvolved().stream())
                .filter(templates::containsKey)
                .toList();
        for (String templateKey : recursiveTemplates) {
            if (scenarios.stream().filter(s -> s.scenarioType().equals("recursive_path")).count()
                    >= MAX_RECURSIVE_SCENARIOS) {
                break;
            }
            paths.stream()
                    .filter(p -> closesCycleAt(p, templateKey, graph))
                    .findFirst()
                    .ifPresent(p -> scenarios.add(scenario("recursive_path", p,
                            "Özyinelemeli şablonun sonlanmasını test et: " + templateKey,
                            PriorityLevel.HIGH, stylesheetParameters)));
        }
        return scenarios;
    }

    private static boolean closesCycleAt(ExecutionPath path, String templateKey, ExecutionGraph graph) {
        List<Integer> nodes = path.nodes();
        int last = nodes.get(nodes.size() - 1);
        return nodes.indexOf(last) < nodes.size() - 1 && graph.node(last).templateKey().equals(templateKey);
    }

    private static TestScenario scenario(String type, ExecutionPath path, String description,
                                         PriorityLevel priority, Optional<TestDataRequirement> parameters) {
        List<TestDataRequirement> requirements = new ArrayList<>(path.testDataRequirements());
        parameters.ifPresent(requirements::add);
        return new TestScenario(type, path.pathId(), description, List.copyOf(path.templatesInvolved()),
                path.conditions(), List.copyOf(requirements), priority);
    }

    /**
     * Stylesheet seviyesindeki {@code xsl:param} tanımları dönüşümün dış girdileridir;
     * her senaryoya ortak bir girdi gereksinimi olarak eklenir.
     */
    private static Optional<TestDataRequirement> stylesheetParameters(Map<String, Variable> variables) {
        List<String> names = variables.values().stream()
                .filter(v -> v.scope() == VariableScope.GLOBAL && v.variableType() == VariableType.PARAMETER)
                .map(Variable::name)
                .sorted(Comparator.naturalOrder())
                .toList();
        if (names.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TestDataRequirement(RequirementType.INPUT_VARIABLES,
                "Stylesheet parametreleri için girdi değerleri", PriorityLevel.HIGH, names, null, null));
    }
}
