package io.mersel.services.xsltanalyzer.application.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tek bir XSLT dosyasının birleşik analiz sonucu.
 * <p>
 * Aşağı akıştaki test üretici veya kalıcılık katmanı hiçbir şeyi yeniden türetmeden
 * bu nesneyi tüketebilir; alan alan JSON'a serileştirilebilir.
 */
public class AnalysisResult {

    private final String analysisId;
    private final String fileId;
    private final String filePath;
    private final String contentHash;
    private final Instant analyzedAt;
    private final long durationMs;
    private final Map<String, Template> templates;
    private final Map<String, Variable> variables;
    private final SemanticAnalysisResult semanticAnalysis;
    private final ExecutionAnalysisResult executionAnalysis;
    private final AnalysisSummary summary;
    private final AnalysisRecommendations recommendations;
    private final List<String> compilationIssues;
    private final PathEnumerationLimits pathLimits;

    private AnalysisResult(Builder builder) {
        this.analysisId = builder.analysisId;
        this.fileId = builder.fileId;
        this.filePath = builder.filePath;
        this.contentHash = builder.contentHash;
        this.analyzedAt = builder.analyzedAt;
        this.durationMs = builder.durationMs;
        this.templates = builder.templates;
        this.variables = builder.variables;
        this.semanticAnalysis = builder.semanticAnalysis;
        this.executionAnalysis = builder.executionAnalysis;
        this.summary = builder.summary;
        this.recommendations = builder.recommendations;
        this.compilationIssues = List.copyOf(builder.compilationIssues);
        this.pathLimits = builder.pathLimits;
    }

    /** {@code analysis_<fileId>_<epochMillis>}. */
    public String getAnalysisId() {
        return analysisId;
    }

    /** Kalıcılık katmanı için opak dosya kimliği. */
    public String getFileId() {
        return fileId;
    }

    public String getFilePath() {
        return filePath;
    }

    /** Kaynak metnin özeti; değişmemiş dosyaların yeniden analizini atlamak için kullanılır. */
    public String getContentHash() {
        return contentHash;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Map<String, Template> getTemplates() {
        return templates;
    }

    /** Semantik analizde {@code usedByTemplates} alanı doldurulmuş değişkenler. */
    public Map<String, Variable> getVariables() {
        return variables;
    }

    public SemanticAnalysisResult getSemanticAnalysis() {
        return semanticAnalysis;
    }

    public ExecutionAnalysisResult getExecutionAnalysis() {
        return executionAnalysis;
    }

    public AnalysisSummary getSummary() {
        return summary;
    }

    public AnalysisRecommendations getRecommendations() {
        return recommendations;
    }

    /** Saxon statik derleme sorunları. Doğrulama kapalıysa veya sorun yoksa boş. */
    public List<String> getCompilationIssues() {
        return compilationIssues;
    }

    /** Yol numaralandırmasında kullanılan sınırlar. */
    public PathEnumerationLimits getPathLimits() {
        return pathLimits;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String analysisId;
        private String fileId;
        private String filePath;
        private String contentHash;
        private Instant analyzedAt;
        private long durationMs;
        private Map<String, Template> templates = Map.of();
        private Map<String, Variable> variables = Map.of();
        private SemanticAnalysisResult semanticAnalysis;
        private ExecutionAnalysisResult executionAnalysis;
        private AnalysisSummary summary;
        private AnalysisRecommendations recommendations;
        private List<String> compilationIssues = List.of();
        private PathEnumerationLimits pathLimits;

        private Builder() {
        }

        public Builder analysisId(String analysisId) {
            this.analysisId = analysisId;
            return this;
        }

        public Builder fileId(String fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder analyzedAt(Instant analyzedAt) {
            this.analyzedAt = analyzedAt;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder templates(Map<String, Template> templates) {
            this.templates = templates;
            return this;
        }

        public Builder variables(Map<String, Variable> variables) {
            this.variables = variables;
            return this;
        }

        public Builder semanticAnalysis(SemanticAnalysisResult semanticAnalysis) {
            this.semanticAnalysis = semanticAnalysis;
            return this;
        }

        public Builder executionAnalysis(ExecutionAnalysisResult executionAnalysis) {
            this.executionAnalysis = executionAnalysis;
            return this;
        }

        public Builder summary(AnalysisSummary summary) {
            this.summary = summary;
            return this;
        }

        public Builder recommendations(AnalysisRecommendations recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder compilationIssues(List<String> compilationIssues) {
            this.compilationIssues = compilationIssues;
            return this;
        }

        public Builder pathLimits(PathEnumerationLimits pathLimits) {
            this.pathLimits = pathLimits;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
