package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.DataFlowNodeType;
import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.interfaces.ISemanticAnalyzer;
import io.mersel.services.xsltanalyzer.application.models.ConditionalLogic;
import io.mersel.services.xsltanalyzer.application.models.DataFlowGraph;
import io.mersel.services.xsltanalyzer.application.models.DataFlowNode;
import io.mersel.services.xsltanalyzer.application.models.GraphEdge;
import io.mersel.services.xsltanalyzer.application.models.Hotspot;
import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.SemanticPattern;
import io.mersel.services.xsltanalyzer.application.models.SemanticSummary;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.TemplateInteractionReport;
import io.mersel.services.xsltanalyzer.application.models.TestImplication;
import io.mersel.services.xsltanalyzer.application.models.Variable;
import io.mersel.services.xsltanalyzer.application.models.VariableScopeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Kural tabanlı semantik analiz implementasyonu.
 * <p>
 * Veri akışı grafiği, altı sabit kalıp kuralı, değişken kapsamı ve şablon etkileşimi
 * teşhisleri ile sıcak nokta sıralamasını üretir. Kalıp güven skorları kurala göre sabittir
 * ({@link PatternType#confidence()}).
 */
@Service
public class SemanticAnalyzer implements ISemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final List<String> AGGREGATION_KEYWORDS =
            List.of("sum", "count", "avg", "max", "min", "distinct-values");
    private static final List<String> ERROR_KEYWORDS =
            List.of("error", "exception", "fallback", "default", "fail");

    private static final double HIGH_CONFIDENCE_THRESHOLD = 0.8;
    private static final int HOTSPOT_THRESHOLD = 5;
    private static final int HIGH_RISK_THRESHOLD = 8;
    private static final int LONG_XPATH_LENGTH = 50;

    @Override
    public SemanticAnalysisResult analyze(Map<String, Template> templates, Map<String, Variable> variables) {
        Map<String, Variable> resolvedVariables = resolveVariableUsage(templates, variables);
        DataFlowGraph dataFlowGraph = buildDataFlowGraph(templates);
        List<SemanticPattern> patterns = detectPatterns(templates);
        VariableScopeReport variableReport = analyzeVariableScopes(resolvedVariables);
        TemplateInteractionReport interactionReport = analyzeInteractions(templates);
        List<Hotspot> hotspots = findHotspots(templates);
        List<TestImplication> implications = testImplications(patterns);

        SemanticSummary summary = new SemanticSummary(
                patterns.size(),
                patterns.stream().map(SemanticPattern::patternType).distinct().toList(),
                (int) patterns.stream().filter(p -> p.confidenceScore() > HIGH_CONFIDENCE_THRESHOLD).count(),
                dataFlowGraph.nodes().size(),
                templates.values().stream().mapToInt(Template::getComplexityScore).sum(),
                implications.size());

        log.info("Semantik analiz tamamlandı: {} kalıp, {} veri akışı düğümü, {} sıcak nokta",
                patterns.size(), dataFlowGraph.nodes().size(), hotspots.size());

        return new SemanticAnalysisResult(dataFlowGraph, patterns, variableReport, interactionReport,
                hotspots, implications, summary, resolvedVariables);
    }

    // ── Değişken kullanımı ──────────────────────────────────────────

    /**
     * {@code usedByTemplates} alanını doldurur. Global değişken, adını kullanan her şablon
     * tarafından; şablon kapsamlı değişken yalnızca kendi şablonu kullanıyorsa kullanılmış sayılır.
     */
    Map<String, Variable> resolveVariableUsage(Map<String, Template> templates, Map<String, Variable> variables) {
        Map<String, Variable> resolved = new LinkedHashMap<>();
        for (var entry : variables.entrySet()) {
            Variable variable = entry.getValue();
            List<String> usedBy = switch (variable.scope()) {
                case GLOBAL -> templates.values().stream()
                        .filter(t -> t.getUsesVariables().contains(variable.name()))
                        .map(Template::getKey)
                        .toList();
                case TEMPLATE -> {
                    Template owner = variable.ownerTemplate() != null ? templates.get(variable.ownerTemplate()) : null;
                    yield owner != null && owner.getUsesVariables().contains(variable.name())
                            ? List.of(owner.getKey())
                            : List.of();
                }
                case LOCAL -> List.of();
            };
            resolved.put(entry.getKey(), variable.withUsedByTemplates(usedBy));
        }
        return resolved;
    }

    // ── Veri akışı grafiği ──────────────────────────────────────────

    DataFlowGraph buildDataFlowGraph(Map<String, Template> templates) {
        List<DataFlowNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        for (Template template : templates.values()) {
            int firstNode = nodes.size();
            String key = template.getKey();

            for (String variable : template.getDefinesVariables()) {
                nodes.add(new DataFlowNode(nodes.size(), DataFlowNodeType.VARIABLE_ASSIGNMENT, key,
                        template.getLineStart(), variable, null, null, null));
            }
            for (String call : template.getCallsTemplates()) {
                nodes.add(new DataFlowNode(nodes.size(), DataFlowNodeType.TEMPLATE_CALL, key,
                        template.getLineStart(), null, null, null, call));
            }
            for (ConditionalLogic conditional : template.getConditionalLogic()) {
                nodes.add(new DataFlowNode(nodes.size(), DataFlowNodeType.CONDITIONAL_BRANCH, key,
                        conditional.line(), null, conditional.conditionText(), null, null));
            }
            for (String xpath : template.getXpathExpressions()) {
                nodes.add(new DataFlowNode(nodes.size(), DataFlowNodeType.XPATH_SELECTION, key,
                        template.getLineStart(), null, null, xpath, null));
            }

            // Şablon içi kaba yaklaşım: kullanılan değişkenin ataması, şablondaki diğer tüm düğümlere bağlanır
            int lastNode = nodes.size();
            for (int from = firstNode; from < lastNode; from++) {
                DataFlowNode node = nodes.get(from);
                if (node.nodeType() != DataFlowNodeType.VARIABLE_ASSIGNMENT
                        || !template.getUsesVariables().contains(node.variableName())) {
                    continue;
                }
                for (int to = firstNode; to < lastNode; to++) {
                    if (to != from) {
                        edges.add(new GraphEdge(from, to));
                    }
                }
            }
        }
        return new DataFlowGraph(nodes, edges);
    }

    // ── Kalıp tespiti ───────────────────────────────────────────────

    List<SemanticPattern> detectPatterns(Map<String, Template> templates) {
        List<SemanticPattern> patterns = new ArrayList<>();

        List<String> pipeline = keysMatching(templates,
                t -> !t.getCallsTemplates().isEmpty() && !t.getOutputElements().isEmpty());
        if (pipeline.size() >= 2) {
            patterns.add(pattern(PatternType.TRANSFORMATION_PIPELINE,
                    "Veri dönüşüm hattı: " + pipeline.size() + " aşama", pipeline, List.of(
                            "Her hat aşamasını bağımsız test et",
                            "Hattın tamamını farklı veri girdileriyle test et",
                            "Aşamalar boyunca veri bütünlüğünü doğrula")));
        }

        List<String> conditional = keysMatching(templates, t -> !t.getConditionalLogic().isEmpty());
        if (!conditional.isEmpty()) {
            patterns.add(pattern(PatternType.CONDITIONAL_PROCESSING,
                    conditional.size() + " şablonda koşullu işleme", conditional, List.of(
                            "Tüm koşul dallarını test et",
                            "Koşul ifadelerinin sınır durumlarını test et",
                            "Varsayılan/yedek davranışı doğrula")));
        }

        List<String> recursive = keysMatching(templates, Template::isRecursive);
        if (!recursive.isEmpty()) {
            patterns.add(pattern(PatternType.RECURSIVE_PROCESSING,
                    "Özyinelemeli işleme: " + String.join(", ", recursive), recursive, List.of(
                            "Özyinelemenin temel durumlarını test et",
                            "Özyineleme sonlanma koşullarını test et",
                            "Özyineleme derinlik sınırlarını test et",
                            "Özyinelemeli veri yapılarının işlenmesini doğrula")));
        }

        List<String> aggregation = keysMatching(templates, t -> t.getXpathExpressions().stream()
                .map(x -> x.toLowerCase(Locale.ROOT))
                .anyMatch(x -> AGGREGATION_KEYWORDS.stream().anyMatch(x::contains)));
        if (!aggregation.isEmpty()) {
            patterns.add(pattern(PatternType.DATA_AGGREGATION,
                    "Veri toplama: " + String.join(", ", aggregation), aggregation, List.of(
                            "Boş veri kümeleriyle test et",
                            "Tek ve çok elemanlı verilerle test et",
                            "Toplama sonuçlarının doğruluğunu doğrula",
                            "Sınır koşullarını test et")));
        }

        List<String> orchestration = keysMatching(templates, t -> t.getCallsTemplates().size() >= 2);
        if (!orchestration.isEmpty()) {
            patterns.add(pattern(PatternType.TEMPLATE_ORCHESTRATION,
                    "Şablon orkestrasyonu: " + String.join(", ", orchestration), orchestration, List.of(
                            "Şablon çağrı sıralarını test et",
                            "Şablonlar arası parametre aktarımını doğrula",
                            "Orkestrasyon hata durumlarını test et")));
        }

        List<String> errorHandling = keysMatching(templates, t -> {
            String content = t.getContent().toLowerCase(Locale.ROOT);
            return ERROR_KEYWORDS.stream().anyMatch(content::contains);
        });
        if (!errorHandling.isEmpty()) {
            patterns.add(pattern(PatternType.ERROR_HANDLING,
                    "Hata yönetimi: " + String.join(", ", errorHandling), errorHandling, List.of(
                            "Hata koşullarını ve sınır durumlarını test et",
                            "Hata mesajı içeriğini doğrula",
                            "Yedek mekanizmaları test et")));
        }

        log.debug("Tespit edilen kalıplar: {}", patterns.stream().map(SemanticPattern::patternType).toList());
        return patterns;
    }

    private static SemanticPattern pattern(PatternType type, String description, List<String> templates,
                                           List<String> implications) {
        return new SemanticPattern(type, description, templates, type.confidence(), implications);
    }

    private static List<String> keysMatching(Map<String, Template> templates, Predicate<Template> predicate) {
        return templates.values().stream().filter(predicate).map(Template::getKey).toList();
    }

    // ── Değişken kapsamı ────────────────────────────────────────────

    VariableScopeReport analyzeVariableScopes(Map<String, Variable> variables) {
        List<String> global = new ArrayList<>();
        List<String> template = new ArrayList<>();
        List<String> local = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        Set<String> conflicts = new LinkedHashSet<>();
        List<String> unused = new ArrayList<>();

        for (var entry : variables.entrySet()) {
            Variable variable = entry.getValue();
            switch (variable.scope()) {
                case GLOBAL -> global.add(entry.getKey());
                case TEMPLATE -> template.add(entry.getKey());
                case LOCAL -> local.add(entry.getKey());
            }
            if (!seenNames.add(variable.name())) {
                conflicts.add(variable.name());
            }
            if (variable.usedByTemplates().isEmpty()) {
                unused.add(entry.getKey());
            }
        }
        return new VariableScopeReport(global, template, local, List.copyOf(conflicts), unused);
    }

    // ── Şablon etkileşimi ───────────────────────────────────────────

    TemplateInteractionReport analyzeInteractions(Map<String, Template> templates) {
        Map<String, List<String>> callGraph = new LinkedHashMap<>();
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        Set<String> called = new HashSet<>();
        for (Template template : templates.values()) {
            callGraph.put(template.getKey(), template.getCalledByTemplates());
            outgoing.put(template.getKey(), template.getCallsTemplates());
            called.addAll(template.getCallsTemplates());
        }

        List<String> orphaned = templates.values().stream()
                .filter(t -> t.getMatchPattern() == null && !called.contains(t.getKey()))
                .map(Template::getKey)
                .toList();

        return new TemplateInteractionReport(callGraph, outgoing, findCycles(templates), orphaned);
    }

    /**
     * Çağrı grafiğinde derinlik öncelikli arama ile döngüleri bulur.
     * Her döngü, tekrar eden şablondan itibaren yol + kapanış şablonu olarak raporlanır.
     */
    private static List<List<String>> findCycles(Map<String, Template> templates) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String key : templates.keySet()) {
            if (!visited.contains(key)) {
                visitForCycles(key, new ArrayList<>(), visited, templates, cycles);
            }
        }
        return cycles;
    }

    private static void visitForCycles(String key, List<String> path, Set<String> visited,
                                       Map<String, Template> templates, List<List<String>> cycles) {
        int index = path.indexOf(key);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(key);
            cycles.add(List.copyOf(cycle));
            return;
        }
        if (!visited.add(key)) {
            return;
        }
        path.add(key);
        for (String target : templates.get(key).getCallsTemplates()) {
            if (templates.containsKey(target)) {
                visitForCycles(target, path, visited, templates, cycles);
            }
        }
        path.remove(path.size() - 1);
    }

    // ── Sıcak noktalar ──────────────────────────────────────────────

    List<Hotspot> findHotspots(Map<String, Template> templates) {
        List<Hotspot> hotspots = new ArrayList<>();
        for (Template template : templates.values()) {
            int score = 0;
            List<String> reasons = new ArrayList<>();

            if (template.getComplexityScore() > 10) {
                score += 3;
                reasons.add("Yüksek karmaşıklık skoru");
            }
            if (template.getConditionalLogic().size() > 3) {
                score += 2;
                reasons.add("Çok sayıda koşul dalı");
            }
            if (template.isRecursive()) {
                score += 3;
                reasons.add("Özyinelemeli işleme");
            }
            if (template.getCallsTemplates().size() > 5) {
                score += 2;
                reasons.add("Çok sayıda şablon çağrısı");
            }
            if (template.getXpathExpressions().stream().anyMatch(x -> x.length() > LONG_XPATH_LENGTH)) {
                score += 2;
                reasons.add("Karmaşık XPath ifadeleri");
            }

            if (score >= HOTSPOT_THRESHOLD) {
                hotspots.add(new Hotspot(template.getKey(), score, List.copyOf(reasons),
                        score >= HIGH_RISK_THRESHOLD ? PriorityLevel.HIGH : PriorityLevel.MEDIUM));
            }
        }
        hotspots.sort(Comparator.comparingInt(Hotspot::hotspotScore).reversed());
        return hotspots;
    }

    // ── Test çıkarımları ────────────────────────────────────────────

    private static List<TestImplication> testImplications(List<SemanticPattern> patterns) {
        List<TestImplication> implications = new ArrayList<>();
        for (SemanticPattern pattern : patterns) {
            PriorityLevel priority = pattern.confidenceScore() > HIGH_CONFIDENCE_THRESHOLD
                    ? PriorityLevel.HIGH
                    : PriorityLevel.MEDIUM;
            for (String requirement : pattern.testImplications()) {
                implications.add(new TestImplication(pattern.patternType(), pattern.templatesInvolved(),
                        requirement, priority));
            }
        }
        return implications;
    }
}
