package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.models.AnalysisRecommendations;
import io.mersel.services.xsltanalyzer.application.models.AnalysisSummary;
import io.mersel.services.xsltanalyzer.application.models.CoverageStrategy;
import io.mersel.services.xsltanalyzer.application.models.ExecutionAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.ExecutionPath;
import io.mersel.services.xsltanalyzer.application.models.OptimizationSuggestion;
import io.mersel.services.xsltanalyzer.application.models.ParseSummary;
import io.mersel.services.xsltanalyzer.application.models.RiskAssessment;
import io.mersel.services.xsltanalyzer.application.models.SemanticAnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.TestPrioritization;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tek dosya analiz sonuçlarından özet ve test üretim önerileri türetir.
 */
@Component
public class RecommendationEngine {

    private static final int PRIORITY_THRESHOLD = 5;
    private static final int HIGH_PRIORITY_THRESHOLD = 7;
    private static final int HIGH_RISK_COMPLEXITY = 15;
    private static final int COMPLEX_PATH = 10;

    private static final Map<String, Integer> COVERAGE_TARGETS;

    static {
        Map<String, Integer> targets = new LinkedHashMap<>();
        targets.put("template_coverage", 100);
        targets.put("branch_coverage", 85);
        targets.put("path_coverage", 70);
        COVERAGE_TARGETS = Collections.unmodifiableMap(targets);
    }

    private static final List<String> COVERAGE_PRIORITIES = List.of(
            "Kritik yürütme yolları",
            "Hata yönetimi yolları",
            "Koşul dalları",
            "Özyinelemeli şablon çağrıları");

    public AnalysisSummary summarize(ParseSummary parseSummary, SemanticAnalysisResult semantic,
                                     ExecutionAnalysisResult execution) {
        int overallComplexity = (int) (parseSummary.avgComplexity() * 10 + semantic.semanticPatterns().size() * 5);
        return new AnalysisSummary(parseSummary, semantic.analysisSummary(), execution.pathStatistics(),
                overallComplexity, testGenerationPriority(semantic, execution), keyFindings(semantic, execution));
    }

    public AnalysisRecommendations recommend(Map<String, Template> templates, SemanticAnalysisResult semantic,
                                             ExecutionAnalysisResult execution) {
        return new AnalysisRecommendations(
                prioritizeTests(templates),
                assessRisks(templates),
                suggestOptimizations(templates),
                new CoverageStrategy(COVERAGE_TARGETS, COVERAGE_PRIORITIES),
                testGenerationPriority(semantic, execution));
    }

    /**
     * Genel test üretim önceliği: 3'ten fazla yüksek güvenli kalıp veya 5'ten fazla karmaşık
     * yol varsa high; 1'den fazla kalıp veya 2'den fazla karmaşık yol varsa medium; aksi halde low.
     */
    PriorityLevel testGenerationPriority(SemanticAnalysisResult semantic, ExecutionAnalysisResult execution) {
        int highConfidence = semantic.analysisSummary().highConfidencePatterns();
        long complexPaths = execution.executionPaths().stream()
                .filter(p -> p.complexityScore() > COMPLEX_PATH)
                .count();
        if (highConfidence > 3 || complexPaths > 5) {
            return PriorityLevel.HIGH;
        }
        if (highConfidence > 1 || complexPaths > 2) {
            return PriorityLevel.MEDIUM;
        }
        return PriorityLevel.LOW;
    }

    List<TestPrioritization> prioritizeTests(Map<String, Template> templates) {
        List<TestPrioritization> priorities = new ArrayList<>();
        for (Template template : templates.values()) {
            int score = 0;
            List<String> reasons = new ArrayList<>();
            if (template.getComplexityScore() > 10) {
                score += 3;
                reasons.add("Yüksek karmaşıklık");
            }
            if (template.isRecursive()) {
                score += 3;
                reasons.add("Özyinelemeli şablon");
            }
            if (template.getConditionalLogic().size() > 2) {
                score += 2;
                reasons.add("Karmaşık koşul mantığı");
            }
            if (score >= PRIORITY_THRESHOLD) {
                priorities.add(new TestPrioritization(template.getKey(),
                        score >= HIGH_PRIORITY_THRESHOLD ? PriorityLevel.HIGH : PriorityLevel.MEDIUM,
                        score, List.copyOf(reasons)));
            }
        }
        priorities.sort(Comparator.comparingInt(TestPrioritization::priorityScore).reversed());
        return priorities;
    }

    List<RiskAssessment> assessRisks(Map<String, Template> templates) {
        List<RiskAssessment> risks = new ArrayList<>();

        List<String> highComplexity = templates.values().stream()
                .filter(t -> t.getComplexityScore() > HIGH_RISK_COMPLEXITY)
                .map(Template::getKey)
                .toList();
        if (!highComplexity.isEmpty()) {
            risks.add(new RiskAssessment("high_complexity", PriorityLevel.HIGH,
                    highComplexity.size() + " şablonun karmaşıklığı çok yüksek", highComplexity,
                    "Birden çok senaryo ile kapsamlı test"));
        }

        List<String> recursive = templates.values().stream()
                .filter(Template::isRecursive)
                .map(Template::getKey)
                .toList();
        if (!recursive.isEmpty()) {
            risks.add(new RiskAssessment("recursion", PriorityLevel.MEDIUM,
                    recursive.size() + " özyinelemeli şablon tespit edildi", recursive,
                    "Özyineleme sınırlarını ve sonlanma koşullarını test et"));
        }
        return risks;
    }

    List<OptimizationSuggestion> suggestOptimizations(Map<String, Template> templates) {
        Set<String> called = new HashSet<>();
        templates.values().forEach(t -> called.addAll(t.getCallsTemplates()));

        List<String> unused = templates.values().stream()
                .filter(t -> t.getName() != null && t.getMatchPattern() == null)
                .filter(t -> !called.contains(t.getName()))
                .map(Template::getKey)
                .toList();

        if (unused.isEmpty()) {
            return List.of();
        }
        return List.of(new OptimizationSuggestion("unused_templates",
                unused.size() + " muhtemelen kullanılmayan şablon kaldırılabilir", unused, "code_cleanup"));
    }

    private static List<String> keyFindings(SemanticAnalysisResult semantic, ExecutionAnalysisResult execution) {
        List<String> findings = new ArrayList<>();
        if (!semantic.semanticPatterns().isEmpty()) {
            findings.add(semantic.semanticPatterns().size() + " semantik kalıp tespit edildi");
        }
        if (!execution.executionPaths().isEmpty()) {
            int max = execution.executionPaths().stream().mapToInt(ExecutionPath::complexityScore).max().orElse(0);
            findings.add("En yüksek yürütme yolu karmaşıklığı: " + max);
        }
        if (!semantic.transformationHotspots().isEmpty()) {
            findings.add(semantic.transformationHotspots().size() + " dönüşüm sıcak noktası bulundu");
        }
        if (execution.coverageAnalysis().truncated()) {
            findings.add("Yol numaralandırma sınıra ulaştı, kapsama kısmidir");
        }
        return findings;
    }
}
