package ai.bigo.analyzer.signals;

import static ai.bigo.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.bigo.analyzer.ASTTraversalUtils.field;
import static ai.bigo.analyzer.ASTTraversalUtils.isAbsent;
import static ai.bigo.analyzer.ASTTraversalUtils.namedChildren;
import static ai.bigo.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.bigo.analyzer.ASTTraversalUtils;
import ai.bigo.analyzer.FunctionUnit;
import ai.bigo.analyzer.SourceContent;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Computes a {@link SignalProfile} for one function with a single recursive walk over its body.
 *
 * <p>Nesting state travels down the walk in an immutable {@link TraversalContext}; maxima are gathered in an
 * accumulator that lives for one {@link #collect} call. The collector itself holds no state, so one instance can
 * serve any number of threads.
 */
public final class SignalCollector {
    private static final Logger logger = LogManager.getLogger(SignalCollector.class);

    /** Methods that grow the receiver in place. */
    private static final Set<String> GROWTH_METHODS =
            Set.of("append", "extend", "add", "insert", "appendleft", "update", "setdefault", "push");

    private static final Set<String> BUILTIN_FUNCTIONS = Set.of("sorted", "min", "max", "sum", "any", "all", "reversed");

    private static final Set<String> BUILTIN_MODULES = Set.of("heapq", "bisect");

    private static final Set<String> SELF_RECEIVERS = Set.of("self", "cls");

    /**
     * Nesting state at a point in the walk.
     *
     * @param loopDepth loops enclosing this point, counting loops of enclosing nested scopes
     * @param scopeLoopDepth loops enclosing this point within the innermost function scope
     * @param conditionalInLoop a conditional sits between this point and the innermost loop of the current scope
     * @param nameShadowed the analyzed function's name is rebound here, so calls to it are not self-calls
     */
    record TraversalContext(int loopDepth, int scopeLoopDepth, boolean conditionalInLoop, boolean nameShadowed) {
        static TraversalContext root(boolean nameShadowed) {
            return new TraversalContext(0, 0, false, nameShadowed);
        }

        TraversalContext enterLoops(int levels) {
            return new TraversalContext(loopDepth + levels, scopeLoopDepth + levels, false, nameShadowed);
        }

        TraversalContext enterConditional() {
            return scopeLoopDepth > 0 && !conditionalInLoop
                    ? new TraversalContext(loopDepth, scopeLoopDepth, true, nameShadowed)
                    : this;
        }

        TraversalContext enterScope(boolean shadows) {
            return new TraversalContext(loopDepth, 0, false, nameShadowed || shadows);
        }
    }

    private static final class Accumulator {
        int maxLoopDepth;
        int recursiveCalls;
        int recursiveCallLoopDepth;
        int allocationLoopDepth;
        boolean earlyTermination;
        boolean halvingLoop;
        final Set<String> builtins = new LinkedHashSet<>();

        void observeLoopDepth(int depth) {
            maxLoopDepth = Math.max(maxLoopDepth, depth);
        }

        void observeAllocation(int depth) {
            allocationLoopDepth = Math.max(allocationLoopDepth, depth);
        }

        SignalProfile toProfile() {
            return new SignalProfile(
                    maxLoopDepth,
                    recursiveCalls,
                    allocationLoopDepth > 0,
                    earlyTermination,
                    allocationLoopDepth,
                    recursiveCallLoopDepth,
                    new ArrayList<>(builtins),
                    halvingLoop);
        }
    }

    public SignalProfile collect(FunctionUnit unit) {
        var acc = new Accumulator();
        var walker = new Walker(unit, acc);
        var ctx = TraversalContext.root(unit.parametersShadowName());
        for (var statement : unit.body()) {
            walker.visit(statement, ctx);
        }
        var profile = acc.toProfile();
        logger.trace("Signals for {}: {}", unit.qualifiedName(), profile);
        return profile;
    }

    private static final class Walker {
        private final FunctionUnit unit;
        private final SourceContent source;
        private final Accumulator acc;

        Walker(FunctionUnit unit, Accumulator acc) {
            this.unit = unit;
            this.source = unit.source();
            this.acc = acc;
        }

        void visit(TSNode node, TraversalContext ctx) {
            switch (NodeKind.of(node)) {
                case LOOP -> visitLoop(node, ctx);
                case COMPREHENSION -> visitComprehension(node, ctx);
                case CONDITIONAL -> visitChildren(node, ctx.enterConditional());
                case CALL -> {
                    visitCall(node, ctx);
                    visitChildren(node, ctx);
                }
                case SCOPE -> visitChildren(node, ctx.enterScope(shadowsName(node)));
                case EXIT -> {
                    if (ctx.scopeLoopDepth() > 0 && ctx.conditionalInLoop()) {
                        acc.earlyTermination = true;
                    }
                    visitChildren(node, ctx);
                }
                case AUGMENTED_ASSIGNMENT -> {
                    if (ctx.loopDepth() > 0 && appendsList(node)) {
                        acc.observeAllocation(ctx.loopDepth());
                    }
                    visitChildren(node, ctx);
                }
                case BLOCK, OTHER -> visitChildren(node, ctx);
            }
        }

        private void visitChildren(TSNode node, TraversalContext ctx) {
            for (int i = 0; i < node.getChildCount(); i++) {
                var child = node.getChild(i);
                if (!isAbsent(child)) {
                    visit(child, ctx);
                }
            }
        }

        private void visitLoop(TSNode loop, TraversalContext ctx) {
            var inner = ctx.enterLoops(1);
            acc.observeLoopDepth(inner.loopDepth());
            if (!acc.halvingLoop && isHalvingLoop(loop)) {
                acc.halvingLoop = true;
            }
            // the iterable, the condition and the else clause run at the enclosing depth
            var body = field(loop, FIELD_BODY);
            for (int i = 0; i < loop.getChildCount(); i++) {
                var child = loop.getChild(i);
                if (isAbsent(child)) {
                    continue;
                }
                visit(child, body != null && sameNode(child, body) ? inner : ctx);
            }
        }

        private void visitComprehension(TSNode comprehension, TraversalContext ctx) {
            int clauses = (int) namedChildren(comprehension).stream()
                    .filter(c -> FOR_IN_CLAUSE.equals(c.getType()))
                    .count();
            var inner = ctx.enterLoops(clauses);
            acc.observeLoopDepth(inner.loopDepth());
            if (clauses > 0 && !GENERATOR_EXPRESSION.equals(comprehension.getType())) {
                acc.observeAllocation(inner.loopDepth());
            }
            visitChildren(comprehension, inner);
        }

        private void visitCall(TSNode call, TraversalContext ctx) {
            var callee = field(call, FIELD_FUNCTION);
            if (callee == null) {
                return;
            }
            if (IDENTIFIER.equals(callee.getType())) {
                var name = text(callee);
                // a bare name in a method body never resolves to the method itself
                if (!unit.method() && !ctx.nameShadowed() && name.equals(unit.name())) {
                    recordSelfCall(ctx);
                }
                if (BUILTIN_FUNCTIONS.contains(name)) {
                    acc.builtins.add(name);
                }
            } else if (ATTRIBUTE.equals(callee.getType())) {
                var receiver = field(callee, FIELD_OBJECT);
                var attribute = text(field(callee, FIELD_ATTRIBUTE));
                var receiverName = receiver != null && IDENTIFIER.equals(receiver.getType()) ? text(receiver) : "";

                if (unit.method() && SELF_RECEIVERS.contains(receiverName) && attribute.equals(unit.name())) {
                    recordSelfCall(ctx);
                }
                if (ctx.loopDepth() > 0 && GROWTH_METHODS.contains(attribute)) {
                    acc.observeAllocation(ctx.loopDepth());
                }
                if ("sort".equals(attribute)) {
                    acc.builtins.add(".sort");
                } else if (BUILTIN_MODULES.contains(receiverName)) {
                    acc.builtins.add(receiverName + "." + attribute);
                }
            }
        }

        private void recordSelfCall(TraversalContext ctx) {
            acc.recursiveCalls++;
            acc.recursiveCallLoopDepth = Math.max(acc.recursiveCallLoopDepth, ctx.loopDepth());
        }

        /** A nested def or lambda hides the analyzed name when it is that name or binds it as a parameter. */
        private boolean shadowsName(TSNode scope) {
            var type = scope.getType();
            if (CLASS_DEFINITION.equals(type)) {
                return false;
            }
            if (FUNCTION_DEFINITION.equals(type) && text(field(scope, FIELD_NAME)).equals(unit.name())) {
                return true;
            }
            return parameterNames(field(scope, FIELD_PARAMETERS)).contains(unit.name());
        }

        private List<String> parameterNames(@Nullable TSNode parameters) {
            var names = new ArrayList<String>();
            for (var param : namedChildren(parameters)) {
                if (IDENTIFIER.equals(param.getType())) {
                    names.add(text(param));
                } else {
                    var nameNode = field(param, FIELD_NAME);
                    if (nameNode == null) {
                        nameNode = ASTTraversalUtils.findNodeRecursive(param, n -> IDENTIFIER.equals(n.getType()));
                    }
                    if (nameNode != null) {
                        names.add(text(nameNode));
                    }
                }
            }
            return names;
        }

        /** {@code xs += [...]} or {@code xs += [... for ...]}. */
        private boolean appendsList(TSNode augmented) {
            var operator = field(augmented, FIELD_OPERATOR);
            var right = field(augmented, FIELD_RIGHT);
            if (operator == null || right == null || !"+=".equals(text(operator))) {
                return false;
            }
            return LIST.equals(right.getType()) || LIST_COMPREHENSION.equals(right.getType());
        }

        /**
         * Detects loops that shrink their range geometrically: {@code n //= 2}, {@code n >>= 1}, or a midpoint
         * {@code mid = (lo + hi) // 2} together with a bound moved to {@code mid ± 1}.
         */
        private boolean isHalvingLoop(TSNode loop) {
            var body = field(loop, FIELD_BODY);
            if (body == null) {
                return false;
            }
            var assignments = ASTTraversalUtils.findAllNodesRecursive(
                    body,
                    n -> ASSIGNMENT.equals(n.getType()) || AUGMENTED_ASSIGNMENT.equals(n.getType()),
                    n -> NodeKind.of(n) != NodeKind.SCOPE && NodeKind.of(n) != NodeKind.LOOP);

            var midpoints = new LinkedHashSet<String>();
            var boundSources = new LinkedHashSet<String>();
            for (var assignment : assignments) {
                var right = field(assignment, FIELD_RIGHT);
                if (right == null) {
                    continue;
                }
                if (AUGMENTED_ASSIGNMENT.equals(assignment.getType())) {
                    var op = text(field(assignment, FIELD_OPERATOR));
                    if (op.equals("//=") || op.equals(">>=") || op.equals("/=")) {
                        return true;
                    }
                    continue;
                }
                var left = field(assignment, FIELD_LEFT);
                if (left == null || !IDENTIFIER.equals(left.getType())) {
                    continue;
                }
                if (isHalving(right)) {
                    midpoints.add(text(left));
                } else {
                    boundSources.add(boundSource(right));
                }
            }
            return midpoints.stream().anyMatch(boundSources::contains);
        }

        /** {@code expr // 2} or {@code expr >> 1}. */
        private boolean isHalving(TSNode expr) {
            var node = unwrapParentheses(expr);
            if (!BINARY_OPERATOR.equals(node.getType())) {
                return false;
            }
            var op = text(field(node, FIELD_OPERATOR));
            var right = field(node, FIELD_RIGHT);
            if (right == null || !INTEGER.equals(right.getType())) {
                return false;
            }
            var divisor = text(right);
            return (op.equals("//") && divisor.equals("2")) || (op.equals(">>") && divisor.equals("1"));
        }

        /** For {@code mid + 1}, {@code mid - 1} or plain {@code mid}, the variable the bound is taken from. */
        private String boundSource(TSNode expr) {
            var node = unwrapParentheses(expr);
            if (IDENTIFIER.equals(node.getType())) {
                return text(node);
            }
            if (BINARY_OPERATOR.equals(node.getType())) {
                var op = text(field(node, FIELD_OPERATOR));
                var left = field(node, FIELD_LEFT);
                if ((op.equals("+") || op.equals("-")) && left != null && IDENTIFIER.equals(left.getType())) {
                    return text(left);
                }
            }
            return "";
        }

        private static boolean sameNode(TSNode a, TSNode b) {
            return a.getStartByte() == b.getStartByte()
                    && a.getEndByte() == b.getEndByte()
                    && a.getType().equals(b.getType());
        }

        private TSNode unwrapParentheses(TSNode expr) {
            var node = expr;
            while (PARENTHESIZED_EXPRESSION.equals(node.getType()) && node.getNamedChildCount() == 1) {
                node = node.getNamedChild(0);
            }
            return node;
        }

        private String text(@Nullable TSNode node) {
            return extractNodeText(node, source);
        }
    }
}
