package ai.bigo.analyzer.signals;

import static ai.bigo.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.bigo.analyzer.python.PythonTreeSitterNodeTypes;
import org.treesitter.TSNode;

/** The coarse shape of a syntax node, as far as complexity signals are concerned. */
enum NodeKind {
    /** {@code for} and {@code while}; the body runs one level deeper. */
    LOOP,
    /** List, set and dict comprehensions and generator expressions; one level per {@code for} clause. */
    COMPREHENSION,
    /** {@code if} and {@code match}. */
    CONDITIONAL,
    CALL,
    /** Nested {@code def}, {@code lambda} or {@code class}: a new name scope. */
    SCOPE,
    /** {@code break} and {@code return}. */
    EXIT,
    AUGMENTED_ASSIGNMENT,
    BLOCK,
    OTHER;

    static NodeKind of(TSNode node) {
        return switch (node.getType()) {
            case FOR_STATEMENT, WHILE_STATEMENT -> LOOP;
            case LIST_COMPREHENSION, SET_COMPREHENSION, DICTIONARY_COMPREHENSION, GENERATOR_EXPRESSION ->
                COMPREHENSION;
            case IF_STATEMENT, MATCH_STATEMENT -> CONDITIONAL;
            case PythonTreeSitterNodeTypes.CALL -> CALL;
            case FUNCTION_DEFINITION, LAMBDA, CLASS_DEFINITION -> SCOPE;
            case BREAK_STATEMENT, RETURN_STATEMENT -> EXIT;
            case PythonTreeSitterNodeTypes.AUGMENTED_ASSIGNMENT -> AUGMENTED_ASSIGNMENT;
            case PythonTreeSitterNodeTypes.BLOCK -> BLOCK;
            default -> OTHER;
        };
    }
}
