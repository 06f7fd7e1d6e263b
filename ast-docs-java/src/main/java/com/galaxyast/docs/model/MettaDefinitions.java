package com.galaxyast.docs.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Definitions of a MeTTa file.
 *
 * Variables and atomspace references are unique and kept sorted. The summary is
 * computed from the collections when the record is built and is never set directly.
 */
public final class MettaDefinitions implements Definitions {

    private final List<MettaFunction> functions;
    private final List<MettaExecution> executions;
    private final List<MettaFact> facts;
    private final List<MettaExpression> expressions;
    private final List<String> variables;
    private final List<String> atomspaces;
    private final MettaSummary summary;

    public MettaDefinitions(
            List<MettaFunction> functions,
            List<MettaExecution> executions,
            List<MettaFact> facts,
            List<MettaExpression> expressions,
            Collection<String> variables,
            Collection<String> atomspaces) {
        this.functions = List.copyOf(functions);
        this.executions = List.copyOf(executions);
        this.facts = List.copyOf(facts);
        this.expressions = List.copyOf(expressions);
        this.variables = List.copyOf(new TreeSet<>(variables));
        this.atomspaces = List.copyOf(new TreeSet<>(atomspaces));
        this.summary = new MettaSummary(
            this.functions.size(),
            this.expressions.size(),
            this.executions.size(),
            this.facts.size(),
            this.variables.size(),
            this.atomspaces.size());
    }

    public List<MettaFunction> functions()     { return functions; }
    public List<MettaExecution> executions()   { return executions; }
    public List<MettaFact> facts()             { return facts; }
    public List<MettaExpression> expressions() { return expressions; }
    public List<String> variables()            { return variables; }
    public List<String> atomspaces()           { return atomspaces; }
    public MettaSummary summary()              { return summary; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MettaDefinitions)) return false;
        MettaDefinitions that = (MettaDefinitions) o;
        return functions.equals(that.functions)
            && executions.equals(that.executions)
            && facts.equals(that.facts)
            && expressions.equals(that.expressions)
            && variables.equals(that.variables)
            && atomspaces.equals(that.atomspaces);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functions, executions, facts, expressions, variables, atomspaces);
    }

    @Override
    public String toString() {
        return "MettaDefinitions" + summary;
    }
}
