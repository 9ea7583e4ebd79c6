package com.vidnyan.codegraph.query;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.exception.GraphQueryException;
import com.vidnyan.codegraph.query.ast.Bindings;
import com.vidnyan.codegraph.query.ast.Comparison;
import com.vidnyan.codegraph.query.ast.Expression;
import com.vidnyan.codegraph.query.ast.FunctionCall;
import com.vidnyan.codegraph.query.ast.InList;
import com.vidnyan.codegraph.query.ast.IsNull;
import com.vidnyan.codegraph.query.ast.ListExpression;
import com.vidnyan.codegraph.query.ast.Logical;
import com.vidnyan.codegraph.query.ast.MatchQuery;
import com.vidnyan.codegraph.query.ast.Negate;
import com.vidnyan.codegraph.query.ast.NodePattern;
import com.vidnyan.codegraph.query.ast.Not;
import com.vidnyan.codegraph.query.ast.OrderItem;
import com.vidnyan.codegraph.query.ast.PathPattern;
import com.vidnyan.codegraph.query.ast.PropertyAccess;
import com.vidnyan.codegraph.query.ast.RelationshipPattern;
import com.vidnyan.codegraph.query.ast.ReturnItem;
import com.vidnyan.codegraph.query.ast.StringPredicate;
import com.vidnyan.codegraph.query.ast.Values;
import com.vidnyan.codegraph.query.ast.VariableRef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates parsed queries against an indexed, read-only view of a graph.
 * Pattern matching is a backtracking search; relationships are not reused
 * within one match.
 */
final class QueryExecutor {

    static final int MAX_MATCHES = 500_000;

    private final List<GraphNode> allNodes;
    private final Map<NodeLabel, List<GraphNode>> nodesByLabel = new EnumMap<>(NodeLabel.class);
    private final Map<String, List<GraphRelationship>> outgoing = new HashMap<>();
    private final Map<String, List<GraphRelationship>> incoming = new HashMap<>();
    private final Map<String, GraphNode> nodesById = new HashMap<>();

    /** Variables bound so far plus the relationships already used. */
    private record Match(Map<String, Object> variables, Set<String> usedRelationships) implements Bindings {

        Match extend(String variable, Object value, String relationshipId) {
            Map<String, Object> vars = new LinkedHashMap<>(variables);
            if (variable != null) {
                vars.put(variable, value);
            }
            Set<String> used = relationshipId == null ? usedRelationships : new HashSet<>(usedRelationships);
            if (relationshipId != null) {
                used.add(relationshipId);
            }
            return new Match(vars, used);
        }

        @Override
        public Object get(String variable) {
            if (!variables.containsKey(variable)) {
                throw new GraphQueryException("Unknown variable: " + variable);
            }
            return variables.get(variable);
        }
    }

    private record Row(List<Object> values, Match match) {}

    QueryExecutor(KnowledgeGraph graph) {
        this.allNodes = List.copyOf(graph.nodes());
        for (GraphNode node : allNodes) {
            nodesById.put(node.id(), node);
            nodesByLabel.computeIfAbsent(node.label(), l -> new ArrayList<>()).add(node);
        }
        for (GraphRelationship rel : graph.relationships()) {
            outgoing.computeIfAbsent(rel.sourceId(), k -> new ArrayList<>()).add(rel);
            incoming.computeIfAbsent(rel.targetId(), k -> new ArrayList<>()).add(rel);
        }
    }

    int nodeCount() {
        return allNodes.size();
    }

    QueryResult execute(MatchQuery query) {
        long start = System.currentTimeMillis();
        validateVariables(query);

        List<Match> matches = List.of(new Match(Map.of(), Set.of()));
        for (PathPattern pattern : query.patterns()) {
            List<Match> next = new ArrayList<>();
            for (Match match : matches) {
                matchPath(pattern, match, next);
            }
            matches = next;
        }

        if (query.where() != null) {
            List<Match> filtered = new ArrayList<>();
            for (Match match : matches) {
                if (Boolean.TRUE.equals(Values.toBoolean(query.where().evaluate(match)))) {
                    filtered.add(match);
                }
            }
            matches = filtered;
        }

        List<Row> rows = query.isAggregating() ? aggregate(query, matches) : project(query, matches);
        if (query.distinct()) {
            rows = distinct(rows);
        }
        if (!query.orderBy().isEmpty()) {
            rows = order(query, rows);
        }

        long from = Math.min(query.skip(), rows.size());
        long to = query.limit() == null ? rows.size() : Math.min(rows.size(), from + query.limit());
        List<QueryRow> result = new ArrayList<>();
        for (Row row : rows.subList((int) from, (int) to)) {
            result.add(QueryRow.of(row.values()));
        }
        List<String> columns = query.returnItems().stream().map(ReturnItem::alias).toList();
        return new QueryResult(columns, result, System.currentTimeMillis() - start);
    }

    // Pattern matching

    private void matchPath(PathPattern pattern, Match match, List<Match> out) {
        NodePattern first = pattern.nodes().get(0);
        for (GraphNode node : startCandidates(first, match)) {
            if (nodeMatches(first, node, match)) {
                extend(pattern, 0, node, match.extend(first.variable(), node, null), out);
            }
        }
    }

    private void extend(PathPattern pattern, int step, GraphNode current, Match match, List<Match> out) {
        if (step == pattern.relationships().size()) {
            if (out.size() >= MAX_MATCHES) {
                throw new GraphQueryException("Query matches more than " + MAX_MATCHES + " rows; add a LIMIT or narrow the pattern");
            }
            out.add(match);
            return;
        }
        RelationshipPattern relPattern = pattern.relationships().get(step);
        NodePattern nextPattern = pattern.nodes().get(step + 1);
        Optional<Set<RelationshipType>> types = relationshipTypes(relPattern);
        if (types.isEmpty()) {
            return;
        }

        for (GraphRelationship rel : candidateRelationships(current, relPattern.direction())) {
            if (!types.get().isEmpty() && !types.get().contains(rel.type())) {
                continue;
            }
            if (match.usedRelationships().contains(rel.id()) || !boundConsistently(relPattern.variable(), rel, match)) {
                continue;
            }
            String otherId = rel.sourceId().equals(current.id()) && relPattern.direction() != RelationshipPattern.Direction.INCOMING
                    ? rel.targetId() : rel.sourceId();
            GraphNode other = nodesById.get(otherId);
            if (other == null) {
                continue;
            }
            Match withRel = match.extend(relPattern.variable(), rel, rel.id());
            if (nodeMatches(nextPattern, other, withRel)) {
                extend(pattern, step + 1, other, withRel.extend(nextPattern.variable(), other, null), out);
            }
        }
    }

    private List<GraphRelationship> candidateRelationships(GraphNode node, RelationshipPattern.Direction direction) {
        List<GraphRelationship> out = outgoing.getOrDefault(node.id(), List.of());
        List<GraphRelationship> in = incoming.getOrDefault(node.id(), List.of());
        return switch (direction) {
            case OUTGOING -> out;
            case INCOMING -> in;
            case EITHER -> {
                List<GraphRelationship> both = new ArrayList<>(out);
                // self-loops are already in the outgoing list
                in.stream().filter(r -> !r.sourceId().equals(r.targetId())).forEach(both::add);
                yield both;
            }
        };
    }

    /**
     * Empty optional when a named type does not exist, so nothing can match.
     */
    private static Optional<Set<RelationshipType>> relationshipTypes(RelationshipPattern pattern) {
        Set<RelationshipType> types = EnumSet.noneOf(RelationshipType.class);
        boolean anyKnown = pattern.types().isEmpty();
        for (String name : pattern.types()) {
            Optional<RelationshipType> type = RelationshipType.find(name);
            if (type.isPresent()) {
                types.add(type.get());
                anyKnown = true;
            }
        }
        return anyKnown ? Optional.of(types) : Optional.empty();
    }

    private List<GraphNode> startCandidates(NodePattern pattern, Match match) {
        if (pattern.variable() != null && match.variables().containsKey(pattern.variable())) {
            Object bound = match.variables().get(pattern.variable());
            if (!(bound instanceof GraphNode node)) {
                throw new GraphQueryException("Variable '" + pattern.variable() + "' is not a node");
            }
            return List.of(node);
        }
        if (pattern.label() != null) {
            return NodeLabel.find(pattern.label())
                    .map(label -> nodesByLabel.getOrDefault(label, List.of()))
                    .orElse(List.of());
        }
        return allNodes;
    }

    private boolean nodeMatches(NodePattern pattern, GraphNode node, Match match) {
        if (pattern.label() != null) {
            Optional<NodeLabel> label = NodeLabel.find(pattern.label());
            if (label.isEmpty() || label.get() != node.label()) {
                return false;
            }
        }
        if (!boundConsistently(pattern.variable(), node, match)) {
            return false;
        }
        for (Map.Entry<String, Expression> property : pattern.properties().entrySet()) {
            Object expected = property.getValue().evaluate(match);
            if (!Values.equal(Values.property(node, property.getKey()), expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean boundConsistently(String variable, Object value, Match match) {
        if (variable == null || !match.variables().containsKey(variable)) {
            return true;
        }
        Object bound = match.variables().get(variable);
        if (bound != null && bound.getClass() != value.getClass()) {
            throw new GraphQueryException("Variable '" + variable + "' is bound to a " + Values.describe(bound));
        }
        return value.equals(bound);
    }

    // Projection

    private static List<Row> project(MatchQuery query, List<Match> matches) {
        List<Row> rows = new ArrayList<>(matches.size());
        for (Match match : matches) {
            List<Object> values = new ArrayList<>();
            for (ReturnItem item : query.returnItems()) {
                values.add(item.expression().evaluate(match));
            }
            rows.add(new Row(values, match));
        }
        return rows;
    }

    private static List<Row> aggregate(MatchQuery query, List<Match> matches) {
        List<ReturnItem> items = query.returnItems();
        for (ReturnItem item : items) {
            if (!item.expression().isAggregate() && containsAggregate(item.expression())) {
                throw new GraphQueryException("count() must be a whole RETURN item: " + item.alias());
            }
        }

        Map<List<Object>, List<Match>> groups = new LinkedHashMap<>();
        for (Match match : matches) {
            List<Object> key = new ArrayList<>();
            for (ReturnItem item : items) {
                if (!item.expression().isAggregate()) {
                    key.add(item.expression().evaluate(match));
                }
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(match);
        }
        boolean allAggregates = items.stream().allMatch(i -> i.expression().isAggregate());
        if (groups.isEmpty() && allAggregates) {
            groups.put(List.of(), List.of());
        }

        List<Row> rows = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Match>> group : groups.entrySet()) {
            List<Object> values = new ArrayList<>();
            int keyIndex = 0;
            for (ReturnItem item : items) {
                if (item.expression().isAggregate()) {
                    values.add(count((FunctionCall) item.expression(), group.getValue()));
                } else {
                    values.add(group.getKey().get(keyIndex++));
                }
            }
            rows.add(new Row(values, null));
        }
        return rows;
    }

    private static long count(FunctionCall call, List<Match> group) {
        if (call.star()) {
            return group.size();
        }
        Expression argument = call.arguments().get(0);
        if (call.distinct()) {
            Set<Object> seen = new HashSet<>();
            for (Match match : group) {
                Object value = argument.evaluate(match);
                if (value != null) {
                    seen.add(value);
                }
            }
            return seen.size();
        }
        long count = 0;
        for (Match match : group) {
            if (argument.evaluate(match) != null) {
                count++;
            }
        }
        return count;
    }

    private static List<Row> distinct(List<Row> rows) {
        Map<List<Object>, Row> unique = new LinkedHashMap<>();
        for (Row row : rows) {
            unique.putIfAbsent(row.values(), row);
        }
        return new ArrayList<>(unique.values());
    }

    private static List<Row> order(MatchQuery query, List<Row> rows) {
        List<String> aliases = query.returnItems().stream().map(ReturnItem::alias).toList();
        List<Comparator<Row>> comparators = new ArrayList<>();

        for (OrderItem item : query.orderBy()) {
            int column = aliases.indexOf(item.text());
            if (column < 0 && item.expression() instanceof VariableRef ref) {
                column = aliases.indexOf(ref.name());
            }
            Comparator<Row> comparator;
            if (column >= 0) {
                int index = column;
                comparator = (a, b) -> Values.sortCompare(a.values().get(index), b.values().get(index));
            } else if (!query.isAggregating() && !query.distinct()) {
                comparator = (a, b) -> Values.sortCompare(
                        item.expression().evaluate(a.match()), item.expression().evaluate(b.match()));
            } else {
                throw new GraphQueryException("ORDER BY expression must appear in RETURN: " + item.text());
            }
            comparators.add(item.descending() ? comparator.reversed() : comparator);
        }

        Comparator<Row> combined = comparators.get(0);
        for (int i = 1; i < comparators.size(); i++) {
            combined = combined.thenComparing(comparators.get(i));
        }
        List<Row> sorted = new ArrayList<>(rows);
        sorted.sort(combined);
        return sorted;
    }

    // Validation

    private static void validateVariables(MatchQuery query) {
        Set<String> declared = new LinkedHashSet<>();
        for (PathPattern pattern : query.patterns()) {
            for (NodePattern node : pattern.nodes()) {
                if (node.variable() != null) {
                    declared.add(node.variable());
                }
            }
            for (RelationshipPattern rel : pattern.relationships()) {
                if (rel.variable() != null) {
                    declared.add(rel.variable());
                }
            }
        }
        Set<String> used = new LinkedHashSet<>();
        collectVariables(query.where(), used);
        query.returnItems().forEach(item -> collectVariables(item.expression(), used));

        Set<String> orderUsed = new LinkedHashSet<>();
        query.orderBy().forEach(item -> collectVariables(item.expression(), orderUsed));
        query.returnItems().forEach(item -> orderUsed.remove(item.alias()));
        used.addAll(orderUsed);

        for (String variable : used) {
            if (!declared.contains(variable)) {
                throw new GraphQueryException("Unknown variable: " + variable);
            }
        }
    }

    private static boolean containsAggregate(Expression expression) {
        if (expression == null) {
            return false;
        }
        if (expression.isAggregate()) {
            return true;
        }
        List<Expression> children = new ArrayList<>();
        childrenOf(expression, children);
        return children.stream().anyMatch(QueryExecutor::containsAggregate);
    }

    private static void collectVariables(Expression expression, Set<String> out) {
        if (expression == null) {
            return;
        }
        if (expression instanceof VariableRef ref) {
            out.add(ref.name());
            return;
        }
        List<Expression> children = new ArrayList<>();
        childrenOf(expression, children);
        children.forEach(child -> collectVariables(child, out));
    }

    private static void childrenOf(Expression expression, List<Expression> out) {
        if (expression instanceof PropertyAccess e) {
            out.add(e.target());
        } else if (expression instanceof Comparison e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expression instanceof Logical e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expression instanceof Not e) {
            out.add(e.operand());
        } else if (expression instanceof Negate e) {
            out.add(e.operand());
        } else if (expression instanceof StringPredicate e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expression instanceof InList e) {
            out.add(e.element());
            out.add(e.list());
        } else if (expression instanceof IsNull e) {
            out.add(e.operand());
        } else if (expression instanceof ListExpression e) {
            out.addAll(e.elements());
        } else if (expression instanceof FunctionCall e) {
            out.addAll(e.arguments());
        }
    }
}
