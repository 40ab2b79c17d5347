package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.VariableScope;
import io.mersel.services.xsltanalyzer.application.enums.VariableType;
import io.mersel.services.xsltanalyzer.application.interfaces.ITemplateParser;
import io.mersel.services.xsltanalyzer.application.interfaces.StylesheetParseException;
import io.mersel.services.xsltanalyzer.application.models.ConditionalLogic;
import io.mersel.services.xsltanalyzer.application.models.ParseResult;
import io.mersel.services.xsltanalyzer.application.models.ParseSummary;
import io.mersel.services.xsltanalyzer.application.models.Template;
import io.mersel.services.xsltanalyzer.application.models.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DOM tabanlı XSLT şablon/değişken ayrıştırıcısı.
 * <p>
 * İki geçişte çalışır:
 * <ol>
 *   <li>Her {@code xsl:template} için çağrılar, değişken kullanımları ve tanımları,
 *       XPath ifadeleri, koşullar ve çıktı elementleri toplanır. Global ve şablon
 *       kapsamlı değişkenler çıkarılır.</li>
 *   <li>Tüm şablonlar bilindikten sonra {@code calledByTemplates}, {@code recursive}
 *       ve karmaşıklık skoru hesaplanır.</li>
 * </ol>
 * İyi biçimli fakat eksik XSLT (ör. olmayan bir şablona çağrı) reddedilmez, olduğu gibi kaydedilir.
 */
@Service
public class XsltTemplateParser implements ITemplateParser {

    private static final Logger log = LoggerFactory.getLogger(XsltTemplateParser.class);

    public static final String XSLT_NAMESPACE = "http://www.w3.org/1999/XSL/Transform";
    private static final String DEFAULT_XSLT_PREFIX = "xsl";

    private static final Pattern VARIABLE_REFERENCE = Pattern.compile("\\$([a-zA-Z_][a-zA-Z0-9_-]*)");
    private static final List<String> XPATH_ATTRIBUTES = List.of("select", "test", "match");

    private final LineAwareDocumentLoader loader = new LineAwareDocumentLoader();

    @Override
    public ParseResult parse(Path file) throws StylesheetParseException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StylesheetParseException("XSLT dosyası okunamadı: " + file + " (" + e.getMessage() + ")", e);
        }
        return parse(source);
    }

    @Override
    public ParseResult parse(String source) throws StylesheetParseException {
        Document document = loader.load(source);
        Element root = document.getDocumentElement();

        // ── 1. geçiş: şablon ve değişken çıkarımı ──
        Map<String, TemplateDraft> drafts = new LinkedHashMap<>();
        Map<String, Variable> variables = new LinkedHashMap<>();

        extractGlobalVariables(root, variables);

        NodeList templateElements = document.getElementsByTagNameNS(XSLT_NAMESPACE, "template");
        for (int i = 0; i < templateElements.getLength(); i++) {
            Element element = (Element) templateElements.item(i);
            TemplateDraft draft = readTemplate(element);
            draft.key = uniqueKey(baseKey(draft, drafts.size()), drafts);
            drafts.put(draft.key, draft);
            extractTemplateVariables(element, draft.key, variables);
            log.debug("Şablon okundu: {} (satır {}-{})", draft.key, draft.lineStart, draft.lineEnd);
        }

        // ── 2. geçiş: ilişkiler ve karmaşıklık ──
        for (TemplateDraft caller : drafts.values()) {
            for (String target : caller.calls) {
                TemplateDraft callee = drafts.get(target);
                if (callee != null) {
                    callee.calledBy.add(caller.key);
                }
            }
        }

        Map<String, Template> templates = new LinkedHashMap<>();
        for (TemplateDraft draft : drafts.values()) {
            boolean recursive = draft.calls.contains(draft.key);
            if (recursive) {
                log.debug("Kendini çağıran şablon tespit edildi: {}", draft.key);
            }
            templates.put(draft.key, draft.toTemplate(recursive));
        }

        ParseSummary summary = summarize(templates, variables, resolveXsltPrefix(root));
        log.info("Ayrıştırma tamamlandı: {} şablon, {} değişken, ortalama karmaşıklık {}",
                summary.totalTemplates(), summary.totalVariables(), summary.avgComplexity());
        return new ParseResult(templates, variables, summary);
    }

    /**
     * Şablon karmaşıklık skoru.
     * <p>
     * {@code 1 + 2×koşul + kullanılan değişken + XPath + çağrı + 5 (özyinelemeli)
     * + 2 (içerik > 1000 karakter) veya 1 (içerik > 500 karakter)}.
     */
    static int complexityScore(int conditionals, int usedVariables, int xpathExpressions,
                               int calls, boolean recursive, int contentLength) {
        int score = 1;
        score += conditionals * 2;
        score += usedVariables;
        score += xpathExpressions;
        score += calls;
        if (recursive) {
            score += 5;
        }
        if (contentLength > 1000) {
            score += 2;
        } else if (contentLength > 500) {
            score += 1;
        }
        return score;
    }

    // ── Şablon okuma ────────────────────────────────────────────────

    private TemplateDraft readTemplate(Element element) {
        TemplateDraft draft = new TemplateDraft();
        draft.name = attribute(element, "name");
        draft.matchPattern = attribute(element, "match");
        draft.mode = attribute(element, "mode");
        draft.priority = parsePriority(element);
        draft.lineStart = LineAwareDocumentLoader.lineStart(element);
        draft.lineEnd = LineAwareDocumentLoader.lineEnd(element);
        draft.content = LineAwareDocumentLoader.serialize(element);
        draft.contentHash = Digests.contentHash(draft.content);

        Matcher matcher = VARIABLE_REFERENCE.matcher(draft.content);
        while (matcher.find()) {
            draft.usesVariables.add(matcher.group(1));
        }

        collectXpath(element, draft.xpathExpressions);

        NodeList descendants = element.getElementsByTagName("*");
        for (int i = 0; i < descendants.getLength(); i++) {
            Element child = (Element) descendants.item(i);
            collectXpath(child, draft.xpathExpressions);

            if (!isXslt(child)) {
                draft.outputElements.add(child.getLocalName() != null ? child.getLocalName() : child.getTagName());
                continue;
            }

            switch (child.getLocalName()) {
                case "call-template" -> {
                    String target = attribute(child, "name");
                    if (target != null) {
                        draft.calls.add(target);
                    }
                }
                case "apply-templates" -> {
                    String mode = attribute(child, "mode");
                    String select = attribute(child, "select");
                    if (mode != null) {
                        draft.calls.add("mode:" + mode);
                    } else if (select != null) {
                        draft.calls.add("select:" + select);
                    }
                }
                case "variable", "param" -> {
                    String name = attribute(child, "name");
                    if (name != null) {
                        draft.definesVariables.add(name);
                    }
                }
                case "if" -> {
                    String test = attribute(child, "test");
                    if (test != null) {
                        draft.conditionals.add(ConditionalLogic.ifCondition(test, LineAwareDocumentLoader.lineStart(child)));
                    }
                }
                case "choose" -> draft.conditionals.add(
                        ConditionalLogic.choose(whenTests(child), LineAwareDocumentLoader.lineStart(child)));
                case "element" -> {
                    String name = attribute(child, "name");
                    if (name != null) {
                        draft.outputElements.add(name);
                    }
                }
                default -> {
                    // Diğer XSLT talimatları yalnızca XPath ifadeleriyle katkı sağlar
                }
            }
        }
        return draft;
    }

    private static List<String> whenTests(Element choose) {
        List<String> tests = new ArrayList<>();
        for (Node child = choose.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element when && isXslt(when) && "when".equals(when.getLocalName())) {
                String test = attribute(when, "test");
                if (test != null) {
                    tests.add(test);
                }
            }
        }
        return tests;
    }

    private static void collectXpath(Element element, Set<String> target) {
        for (String attr : XPATH_ATTRIBUTES) {
            String value = attribute(element, attr);
            if (value != null) {
                target.add(value);
            }
        }
    }

    private Double parsePriority(Element element) {
        String raw = attribute(element, "priority");
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Geçersiz şablon önceliği yok sayıldı: '{}' (satır {})",
                    raw, LineAwareDocumentLoader.lineStart(element));
            return null;
        }
    }

    // ── Anahtar üretimi ─────────────────────────────────────────────

    private static String baseKey(TemplateDraft draft, int index) {
        if (draft.name != null) {
            return draft.name;
        }
        if (draft.matchPattern != null) {
            return draft.mode != null ? draft.matchPattern + " mode=" + draft.mode : draft.matchPattern;
        }
        return "anonymous_" + index;
    }

    private static String uniqueKey(String base, Map<String, TemplateDraft> existing) {
        if (!existing.containsKey(base)) {
            return base;
        }
        int suffix = 2;
        while (existing.containsKey(base + "#" + suffix)) {
            suffix++;
        }
        return base + "#" + suffix;
    }

    // ── Değişkenler ─────────────────────────────────────────────────

    private void extractGlobalVariables(Element root, Map<String, Variable> variables) {
        for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && isVariableDeclaration(element)) {
                Variable variable = readVariable(element, VariableScope.GLOBAL, null);
                variables.put(variable.name(), variable);
            }
        }
    }

    private void extractTemplateVariables(Element template, String templateKey, Map<String, Variable> variables) {
        NodeList descendants = template.getElementsByTagName("*");
        for (int i = 0; i < descendants.getLength(); i++) {
            Element element = (Element) descendants.item(i);
            if (isVariableDeclaration(element)) {
                Variable variable = readVariable(element, VariableScope.TEMPLATE, templateKey);
                variables.put(variable.name() + "_" + variable.lineNumber(), variable);
            }
        }
    }

    private Variable readVariable(Element element, VariableScope scope, String ownerTemplate) {
        String name = attribute(element, "name");
        if (name == null) {
            name = "";
        }
        String select = attribute(element, "select");
        String content = select == null ? element.getTextContent().strip() : "";
        int line = LineAwareDocumentLoader.lineStart(element);
        VariableType type = "param".equals(element.getLocalName()) ? VariableType.PARAMETER : VariableType.VARIABLE;
        String key = scope == VariableScope.GLOBAL ? name : name + "_" + line;
        return new Variable(key, name, type, select, content, scope, line, ownerTemplate, List.of());
    }

    private static boolean isVariableDeclaration(Element element) {
        return isXslt(element)
                && ("variable".equals(element.getLocalName()) || "param".equals(element.getLocalName()));
    }

    // ── Yardımcılar ─────────────────────────────────────────────────

    private static boolean isXslt(Element element) {
        return XSLT_NAMESPACE.equals(element.getNamespaceURI());
    }

    private static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isBlank() ? null : value;
    }

    private static String resolveXsltPrefix(Element root) {
        String prefix = root.lookupPrefix(XSLT_NAMESPACE);
        return prefix != null ? prefix : DEFAULT_XSLT_PREFIX;
    }

    private static ParseSummary summarize(Map<String, Template> templates, Map<String, Variable> variables,
                                          String prefix) {
        int named = 0;
        int match = 0;
        int recursive = 0;
        int totalComplexity = 0;
        Template mostComplex = null;
        for (Template template : templates.values()) {
            if (template.getName() != null) {
                named++;
            }
            if (template.getMatchPattern() != null) {
                match++;
            }
            if (template.isRecursive()) {
                recursive++;
            }
            totalComplexity += template.getComplexityScore();
            if (mostComplex == null || template.getComplexityScore() > mostComplex.getComplexityScore()) {
                mostComplex = template;
            }
        }
        double avg = templates.isEmpty() ? 0.0 : Math.round(totalComplexity * 100.0 / templates.size()) / 100.0;
        return new ParseSummary(templates.size(), named, match, recursive, variables.size(), avg,
                mostComplex != null ? mostComplex.getKey() : null, prefix);
    }

    /**
     * Birinci geçişte doldurulan, ikinci geçişte {@link Template}'e dönüştürülen ara model.
     */
    private static final class TemplateDraft {
        private String key;
        private String name;
        private String matchPattern;
        private String mode;
        private Double priority;
        private int lineStart;
        private int lineEnd;
        private String content;
        private String contentHash;
        private final Set<String> calls = new LinkedHashSet<>();
        private final List<String> calledBy = new ArrayList<>();
        private final Set<String> usesVariables = new LinkedHashSet<>();
        private final List<String> definesVariables = new ArrayList<>();
        private final Set<String> xpathExpressions = new LinkedHashSet<>();
        private final List<ConditionalLogic> conditionals = new ArrayList<>();
        private final Set<String> outputElements = new LinkedHashSet<>();

        Template toTemplate(boolean recursive) {
            return Template.builder()
                    .key(key)
                    .name(name)
                    .matchPattern(matchPattern)
                    .mode(mode)
                    .priority(priority)
                    .lineStart(lineStart)
                    .lineEnd(lineEnd)
                    .content(content)
                    .contentHash(contentHash)
                    .complexityScore(complexityScore(conditionals.size(), usesVariables.size(),
                            xpathExpressions.size(), calls.size(), recursive, content.length()))
                    .recursive(recursive)
                    .callsTemplates(List.copyOf(calls))
                    .calledByTemplates(calledBy)
                    .usesVariables(List.copyOf(usesVariables))
                    .definesVariables(definesVariables)
                    .xpathExpressions(List.copyOf(xpathExpressions))
                    .conditionalLogic(conditionals)
                    .outputElements(List.copyOf(outputElements))
                    .build();
        }
    }
}
