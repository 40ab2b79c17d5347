package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.enums.ExecutionNodeType;
import io.mersel.services.xsltanalyzer.application.models.ConditionalLogic;
import io.mersel.services.xsltanalyzer.application.models.ExecutionGraph;
import io.mersel.services.xsltanalyzer.application.models.ExecutionNode;
import io.mersel.services.xsltanalyzer.application.models.Template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Şablonlardan yürütme grafiği kurar.
 * <p>
 * Her şablon için sabit sırada düz bir zincir oluşur:
 * başlangıç → değişken atamaları → koşullar → şablon çağrıları → çıktı → bitiş.
 * {@code choose/when} dallanması modellenmez; bir {@code choose} tek koşul düğümüdür.
 * <p>
 * Zincir kurulduktan sonra, hedefi bilinen her çağrı düğümüne hedef şablonun başlangıç
 * düğümü ikinci ardıl olarak eklenir. Özyinelemeli şablonlar böylece grafikte döngü oluşturur.
 */
final class ExecutionGraphBuilder {

    private static final Pattern VARIABLE_REFERENCE = Pattern.compile("\\$([a-zA-Z_][a-zA-Z0-9_-]*)");

    ExecutionGraph build(Map<String, Template> templates) {
        List<NodeDraft> drafts = new ArrayList<>();
        Map<String, Integer> startNodes = new HashMap<>();
        List<NodeDraft> callNodes = new ArrayList<>();

        for (Template template : templates.values()) {
            String key = template.getKey();

            NodeDraft current = add(drafts, ExecutionNodeType.TEMPLATE_START, key, template.getLineStart(),
                    "Şablon başlangıcı: " + key);
            startNodes.put(key, current.id);

            for (String variable : template.getDefinesVariables()) {
                NodeDraft node = add(drafts, ExecutionNodeType.VARIABLE_ASSIGNMENT, key, template.getLineStart(),
                        "Değişken ataması: " + variable);
                node.variablesWritten.add(variable);
                current = link(current, node);
            }

            for (ConditionalLogic conditional : template.getConditionalLogic()) {
                NodeDraft node = add(drafts, ExecutionNodeType.CONDITION, key, conditional.line(),
                        "Koşul: " + conditional.conditionText());
                node.condition = conditional.pathCondition();
                if (node.condition != null) {
                    Matcher matcher = VARIABLE_REFERENCE.matcher(node.condition);
                    while (matcher.find()) {
                        node.variablesRead.add(matcher.group(1));
                    }
                }
                current = link(current, node);
            }

            for (String target : template.getCallsTemplates()) {
                NodeDraft node = add(drafts, ExecutionNodeType.TEMPLATE_CALL, key, template.getLineStart(),
                        "Şablon çağrısı: " + target);
                node.callTarget = target;
                callNodes.add(node);
                current = link(current, node);
            }

            if (!template.getOutputElements().isEmpty()) {
                NodeDraft node = add(drafts, ExecutionNodeType.OUTPUT_GENERATION, key, template.getLineEnd(),
                        "Çıktı elementleri üretimi");
                node.outputElements.addAll(template.getOutputElements());
                current = link(current, node);
            }

            NodeDraft end = add(drafts, ExecutionNodeType.TEMPLATE_END, key, template.getLineEnd(),
                    "Şablon bitişi: " + key);
            link(current, end);
        }

        for (NodeDraft call : callNodes) {
            Integer target = startNodes.get(call.callTarget);
            if (target != null) {
                link(call, drafts.get(target));
            }
        }

        return new ExecutionGraph(drafts.stream().map(NodeDraft::toNode).toList());
    }

    private static NodeDraft add(List<NodeDraft> drafts, ExecutionNodeType type, String templateKey,
                                 int line, String description) {
        NodeDraft draft = new NodeDraft(drafts.size(), type, templateKey, line, description);
        drafts.add(draft);
        return draft;
    }

    private static NodeDraft link(NodeDraft from, NodeDraft to) {
        from.successors.add(to.id);
        to.predecessors.add(from.id);
        return to;
    }

    private static final class NodeDraft {
        private final int id;
        private final ExecutionNodeType type;
        private final String templateKey;
        private final int line;
        private final String description;
        private String condition;
        private String callTarget;
        private final Set<String> variablesRead = new LinkedHashSet<>();
        private final Set<String> variablesWritten = new LinkedHashSet<>();
        private final Set<String> outputElements = new LinkedHashSet<>();
        private final List<Integer> predecessors = new ArrayList<>();
        private final List<Integer> successors = new ArrayList<>();

        NodeDraft(int id, ExecutionNodeType type, String templateKey, int line, String description) {
            this.id = id;
            this.type = type;
            this.templateKey = templateKey;
            this.line = line;
            this.description = description;
        }

        ExecutionNode toNode() {
            return new ExecutionNode(id, type, templateKey, line, description, condition,
                    variablesRead, variablesWritten, outputElements, predecessors, successors, 1.0, 1);
        }
    }
}
