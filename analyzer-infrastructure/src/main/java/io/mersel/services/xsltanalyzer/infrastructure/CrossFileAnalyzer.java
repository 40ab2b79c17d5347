package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.PatternType;
import io.mersel.services.xsltanalyzer.application.enums.PriorityLevel;
import io.mersel.services.xsltanalyzer.application.models.AggregatedStatistics;
import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;
import io.mersel.services.xsltanalyzer.application.models.CommonPattern;
import io.mersel.services.xsltanalyzer.application.models.CrossFileAnalysis;
import io.mersel.services.xsltanalyzer.application.models.CrossFileDependency;
import io.mersel.services.xsltanalyzer.application.models.IntegrationRequirement;
import io.mersel.services.xsltanalyzer.application.models.SemanticPattern;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.TemplateCaller;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Toplu analizde başarılı dosya sonuçları üzerinden çapraz dosya analizi ve istatistik toplama.
 * <p>
 * Dosya başına sonuçlar değiştirilmez; yalnızca okunur ve yeni bir özet üretilir.
 */
@Component
public class CrossFileAnalyzer {

    private static final int HIGH_CALLER_COUNT = 3;
    private static final int HIGH_COMMONALITY = 3;

    public CrossFileAnalysis analyze(List<AnalysisResult> results) {
        Map<String, List<TemplateCaller>> callers = new LinkedHashMap<>();
        Map<PatternType, Integer> patternCounts = new LinkedHashMap<>();
        int totalTemplates = 0;

        for (AnalysisResult result : results) {
            totalTemplates += result.getTemplates().size();
            for (Template template : result.getTemplates().values()) {
                for (String target : template.getCallsTemplates()) {
                    callers.computeIfAbsent(target, k -> new ArrayList<>())
                            .add(new TemplateCaller(result.getFilePath(), template.getKey()));
                }
            }
            for (SemanticPattern pattern : result.getSemanticAnalysis().semanticPatterns()) {
                patternCounts.merge(pattern.patternType(), 1, Integer::sum);
            }
        }

        List<CrossFileDependency> dependencies = new ArrayList<>();
        for (var entry : callers.entrySet()) {
            long distinctFiles = entry.getValue().stream().map(TemplateCaller::callingFile).distinct().count();
            if (distinctFiles > 1) {
                dependencies.add(new CrossFileDependency(entry.getKey(), List.copyOf(entry.getValue()),
                        entry.getValue().size() > HIGH_CALLER_COUNT ? PriorityLevel.HIGH : PriorityLevel.MEDIUM));
            }
        }

        List<CommonPattern> commonPatterns = new ArrayList<>();
        patternCounts.forEach((type, count) -> {
            if (count > 1) {
                commonPatterns.add(new CommonPattern(type, count,
                        count > HIGH_COMMONALITY ? PriorityLevel.HIGH : PriorityLevel.MEDIUM));
            }
        });

        List<IntegrationRequirement> requirements = dependencies.stream()
                .map(dep -> new IntegrationRequirement("cross_file_integration",
                        "Şablon entegrasyonunu test et: " + dep.template(),
                        dep.callers().stream().map(TemplateCaller::callingFile).distinct().toList(),
                        dep.complexity(),
                        List.of("Şablonu her dosyadan çağırarak test et",
                                "Parametre aktarım tutarlılığını test et",
                                "Hata yayılımını test et")))
                .toList();

        return new CrossFileAnalysis(totalTemplates, dependencies, commonPatterns, requirements);
    }

    /**
     * @param results    Başarılı dosya sonuçları
     * @param totalFiles Toplu analizdeki toplam dosya sayısı (başarısızlar dahil)
     */
    public AggregatedStatistics aggregate(List<AnalysisResult> results, int totalFiles) {
        int templates = 0;
        int complexity = 0;
        int patterns = 0;
        int paths = 0;
        for (AnalysisResult result : results) {
            templates += result.getTemplates().size();
            complexity += result.getSemanticAnalysis().analysisSummary().transformationComplexity();
            patterns += result.getSemanticAnalysis().analysisSummary().totalPatterns();
            paths += result.getExecutionAnalysis().pathStatistics().totalPaths();
        }
        double average = results.isEmpty() ? 0.0 : (double) complexity / results.size();
        double completion = totalFiles == 0 ? 0.0 : results.size() * 100.0 / totalFiles;
        return new AggregatedStatistics(templates, complexity, patterns, paths, average, completion);
    }
}
