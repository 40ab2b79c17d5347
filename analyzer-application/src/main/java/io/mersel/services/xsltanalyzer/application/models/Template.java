package io.mersel.services.xsltanalyzer.application.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ayrıştırılmış bir {@code xsl:template} tanımı.
 * <p>
 * Anahtar ({@link #getKey()}) dosya içinde benzersizdir: açık {@code name},
 * yoksa {@code match} deseni (mode varsa {@code " mode=<m>"} eki ile),
 * hiçbiri yoksa sentetik {@code anonymous_<n>}.
 * <p>
 * Ayrıştırıcı aşaması tamamlandıktan sonra değiştirilmez. {@code calledByTemplates}
 * ve {@code recursive} ikinci geçişte, tüm şablonlar bilindiğinde doldurulur.
 */
public class Template {

    private final String key;
    private final String name;
    private final String matchPattern;
    private final String mode;
    private final Double priority;
    private final int lineStart;
    private final int lineEnd;
    private final String content;
    private final String contentHash;
    private final int complexityScore;
    private final boolean recursive;
    private final List<String> callsTemplates;
    private final List<String> calledByTemplates;
    private final List<String> usesVariables;
    private final List<String> definesVariables;
    private final List<String> xpathExpressions;
    private final List<ConditionalLogic> conditionalLogic;
    private final List<String> outputElements;

    private Template(Builder builder) {
        this.key = builder.key;
        this.name = builder.name;
        this.matchPattern = builder.matchPattern;
        this.mode = builder.mode;
        this.priority = builder.priority;
        this.lineStart = builder.lineStart;
        this.lineEnd = builder.lineEnd;
        this.content = builder.content;
        this.contentHash = builder.contentHash;
        this.complexityScore = builder.complexityScore;
        this.recursive = builder.recursive;
        this.callsTemplates = List.copyOf(builder.callsTemplates);
        this.calledByTemplates = List.copyOf(builder.calledByTemplates);
        this.usesVariables = List.copyOf(builder.usesVariables);
        this.definesVariables = List.copyOf(builder.definesVariables);
        this.xpathExpressions = List.copyOf(builder.xpathExpressions);
        this.conditionalLogic = List.copyOf(builder.conditionalLogic);
        this.outputElements = List.copyOf(builder.outputElements);
    }

    /** Dosya içinde benzersiz şablon anahtarı. */
    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getMatchPattern() {
        return matchPattern;
    }

    public String getMode() {
        return mode;
    }

    /** {@code priority} attribute'u; yoksa veya sayı değilse {@code null}. */
    public Double getPriority() {
        return priority;
    }

    public int getLineStart() {
        return lineStart;
    }

    public int getLineEnd() {
        return lineEnd;
    }

    /** Şablonun serileştirilmiş ham içeriği. */
    public String getContent() {
        return content;
    }

    /** Ham içeriğin kararlı özeti (SHA-256, ilk 16 hex karakter). Değişiklik tespiti için. */
    public String getContentHash() {
        return contentHash;
    }

    public int getComplexityScore() {
        return complexityScore;
    }

    /** Şablon kendi anahtarını doğrudan çağırıyor mu? Karşılıklı özyineleme tespit edilmez. */
    @JsonProperty("is_recursive")
    public boolean isRecursive() {
        return recursive;
    }

    public List<String> getCallsTemplates() {
        return callsTemplates;
    }

    public List<String> getCalledByTemplates() {
        return calledByTemplates;
    }

    public List<String> getUsesVariables() {
        return usesVariables;
    }

    public List<String> getDefinesVariables() {
        return definesVariables;
    }

    public List<String> getXpathExpressions() {
        return xpathExpressions;
    }

    public List<ConditionalLogic> getConditionalLogic() {
        return conditionalLogic;
    }

    public List<String> getOutputElements() {
        return outputElements;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String key;
        private String name;
        private String matchPattern;
        private String mode;
        private Double priority;
        private int lineStart;
        private int lineEnd;
        private String content = "";
        private String contentHash = "";
        private int complexityScore;
        private boolean recursive;
        private List<String> callsTemplates = List.of();
        private List<String> calledByTemplates = List.of();
        private List<String> usesVariables = List.of();
        private List<String> definesVariables = List.of();
        private List<String> xpathExpressions = List.of();
        private List<ConditionalLogic> conditionalLogic = List.of();
        private List<String> outputElements = List.of();

        private Builder() {
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder matchPattern(String matchPattern) {
            this.matchPattern = matchPattern;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder priority(Double priority) {
            this.priority = priority;
            return this;
        }

        public Builder lineStart(int lineStart) {
            this.lineStart = lineStart;
            return this;
        }

        public Builder lineEnd(int lineEnd) {
            this.lineEnd = lineEnd;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder complexityScore(int complexityScore) {
            this.complexityScore = complexityScore;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder callsTemplates(List<String> callsTemplates) {
            this.callsTemplates = callsTemplates;
            return this;
        }

        public Builder calledByTemplates(List<String> calledByTemplates) {
            this.calledByTemplates = calledByTemplates;
            return this;
        }

        public Builder usesVariables(List<String> usesVariables) {
            this.usesVariables = usesVariables;
            return this;
        }

        public Builder definesVariables(List<String> definesVariables) {
            this.definesVariables = definesVariables;
            return this;
        }

        public Builder xpathExpressions(List<String> xpathExpressions) {
            this.xpathExpressions = xpathExpressions;
            return this;
        }

        public Builder conditionalLogic(List<ConditionalLogic> conditionalLogic) {
            this.conditionalLogic = conditionalLogic;
            return this;
        }

        public Builder outputElements(List<String> outputElements) {
            this.outputElements = outputElements;
            return this;
        }

        public Template build() {
            return new Template(this);
        }
    }
}
