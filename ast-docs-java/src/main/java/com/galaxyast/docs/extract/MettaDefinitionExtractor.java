package com.galaxyast.docs.extract;

import com.galaxyast.docs.metta.MettaNode;
import com.galaxyast.docs.metta.NodeKind;
import com.galaxyast.docs.model.MettaDefinitions;
import com.galaxyast.docs.model.MettaExecution;
import com.galaxyast.docs.model.MettaExpression;
import com.galaxyast.docs.model.MettaFact;
import com.galaxyast.docs.model.MettaFunction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies a MeTTa syntax tree into functions, executions, facts and expressions.
 *
 * Two passes: the first collects every variable and atomspace reference, the second
 * classifies nodes. Both descend into every child, including the bodies of
 * definitions and executed forms.
 */
public class MettaDefinitionExtractor {

    public MettaDefinitions extract(MettaNode root) {
        Set<String> variables = new HashSet<>();
        Set<String> atomspaces = new HashSet<>();
        collectReferences(root, variables, atomspaces);

        Classification result = new Classification();
        classify(root, result);

        return new MettaDefinitions(
            result.functions, result.executions, result.facts, result.expressions,
            variables, atomspaces);
    }

    private void collectReferences(MettaNode node, Set<String> variables, Set<String> atomspaces) {
        if (node.is(NodeKind.VARIABLE)) {
            variables.add(node.value());
        } else if (node.is(NodeKind.ATOMSPACE_REF)) {
            atomspaces.add(node.value());
        }
        for (MettaNode child : node.children()) {
            collectReferences(child, variables, atomspaces);
        }
    }

    private void classify(MettaNode node, Classification result) {
        switch (node.kind()) {
            case FUNCTION_DEFINITION -> {
                MettaFunction function = toFunction(node);
                if (function != null) {
                    result.functions.add(function);
                }
            }
            case EXECUTION -> {
                if (!node.children().isEmpty()) {
                    MettaNode executed = node.children().get(0);
                    result.executions.add(new MettaExecution(node.startLine(), signatureOf(executed)));
                }
            }
            case EXPRESSION -> {
                String signature = signatureOf(node);
                if (isFact(node)) {
                    result.facts.add(new MettaFact(node.startLine(), signature, node.children().get(0).value()));
                } else {
                    result.expressions.add(new MettaExpression(node.startLine(), signature));
                }
            }
            default -> { }
        }

        for (MettaNode child : node.children()) {
            classify(child, result);
        }
    }

    /** Returns null when the definition has no signature child. */
    private MettaFunction toFunction(MettaNode definition) {
        MettaNode signature = null;
        for (MettaNode child : definition.children()) {
            if (child.is(NodeKind.FUNCTION_SIGNATURE)) {
                signature = child;
                break;
            }
        }
        if (signature == null) {
            return null;
        }

        List<String> parameters = new ArrayList<>();
        for (MettaNode child : signature.children()) {
            if (child.is(NodeKind.VARIABLE)) {
                parameters.add(child.value());
            }
        }
        return new MettaFunction(signature.value(), definition.startLine(), definition.endLine(), parameters);
    }

    /** A fact has exactly three children and starts with a plain atom. */
    static boolean isFact(MettaNode expression) {
        List<MettaNode> children = expression.children();
        return children.size() == 3 && children.get(0).is(NodeKind.ATOM);
    }

    /**
     * Readable signature of a form: {@code head(n args)}, or just the head when there
     * are no arguments. A leaf yields its own value, or {@code empty} if it has none.
     */
    static String signatureOf(MettaNode node) {
        List<MettaNode> children = node.children();
        if (children.isEmpty()) {
            return node.value().isEmpty() ? "empty" : node.value();
        }
        String head = children.get(0).value();
        int argCount = children.size() - 1;
        return argCount > 0 ? head + "(" + argCount + " args)" : head;
    }

    private static final class Classification {
        final List<MettaFunction> functions = new ArrayList<>();
        final List<MettaExecution> executions = new ArrayList<>();
        final List<MettaFact> facts = new ArrayList<>();
        final List<MettaExpression> expressions = new ArrayList<>();
    }
}
