package ai.bigo.analyzer;

import java.util.List;
import java.util.Objects;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * One function definition found by {@link PythonFunctionExtractor}.
 *
 * @param name the simple name as written after {@code def}
 * @param qualifiedName the name qualified by enclosing classes and functions, e.g. {@code Solver.solve.helper}
 * @param parameters parameter names in declaration order
 * @param method true when the function is defined directly in a class body
 * @param body the statements of the function body, in source order
 * @param sourceText the full definition text, decorators included
 * @param span 1-based line range of the definition
 * @param source the parsed file the nodes belong to
 * @param tree the syntax tree owning {@code body}; the native tree is freed once this is unreachable, so every unit
 *     keeps a reference for as long as its nodes may be read
 */
public record FunctionUnit(
        String name,
        String qualifiedName,
        List<String> parameters,
        boolean method,
        List<TSNode> body,
        String sourceText,
        SourceSpan span,
        SourceContent source,
        TSTree tree) {

    /** Qualified name of the unit standing for module-level code in a file without definitions. */
    public static final String MODULE_UNIT_NAME = "<main>";

    public FunctionUnit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
        Objects.requireNonNull(tree, "tree");
    }

    /** True when the function's own parameters rebind its name, hiding it from calls in the body. */
    public boolean parametersShadowName() {
        return parameters.contains(name);
    }

    /** 1-based, inclusive line range. */
    public record SourceSpan(int startLine, int endLine) {
        public SourceSpan {
            if (startLine < 1 || endLine < startLine) {
                throw new IllegalArgumentException("Invalid span " + startLine + ".." + endLine);
            }
        }
    }
}
