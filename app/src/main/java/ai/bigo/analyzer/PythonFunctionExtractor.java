package ai.bigo.analyzer;

import static ai.bigo.analyzer.ASTTraversalUtils.extractNodeText;
import static ai.bigo.analyzer.ASTTraversalUtils.field;
import static ai.bigo.analyzer.ASTTraversalUtils.isAbsent;
import static ai.bigo.analyzer.ASTTraversalUtils.namedChildren;
import static ai.bigo.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.bigo.analyzer.FunctionUnit.SourceSpan;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.lang.ref.Reference;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Parses Python source with tree-sitter and enumerates every function definition: module-level functions, methods
 * and functions nested inside other functions.
 *
 * <p>Units come back in document order, so an enclosing function always precedes the functions defined inside it.
 * A file with statements but no function or class definitions yields a single {@value FunctionUnit#MODULE_UNIT_NAME}
 * unit covering the module-level code. Tree-sitter recovers from syntax errors instead of failing, so any {@code ERROR} or missing node in the tree is
 * turned into a {@link PythonParseException} here; a partially recovered tree is never analyzed.
 */
public final class PythonFunctionExtractor {
    private static final Logger logger = LogManager.getLogger(PythonFunctionExtractor.class);

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    public List<FunctionUnit> extract(String sourceText) throws PythonParseException {
        return extract(SourceContent.of(sourceText));
    }

    public List<FunctionUnit> extract(SourceContent source) throws PythonParseException {
        var tree = PARSER.get().parseString(null, source.text());
        var root = tree.getRootNode();
        if (isAbsent(root)) {
            throw new PythonParseException("Parser produced no syntax tree", 1, 1);
        }
        if (root.hasError()) {
            try {
                throw syntaxError(root, source);
            } finally {
                // the error walk reads nodes of a tree nothing else references yet
                Reference.reachabilityFence(tree);
            }
        }

        var file = new ParsedFile(source, tree);
        var units = new ArrayList<FunctionUnit>();
        collect(root, List.of(), false, file, units);
        if (units.isEmpty() && !containsClass(root)) {
            moduleUnit(root, file).ifPresent(units::add);
        }
        logger.debug("Extracted {} function(s) from {} bytes of source", units.size(), source.byteLength());
        return units;
    }

    /** The source text and the tree parsed from it; units hold both so the tree outlives their nodes. */
    private record ParsedFile(SourceContent source, TSTree tree) {}

    private void collect(TSNode node, List<String> scope, boolean classBody, ParsedFile file, List<FunctionUnit> out) {
        for (var child : namedChildren(node)) {
            switch (child.getType()) {
                case FUNCTION_DEFINITION -> {
                    var unit = toUnit(child, child, scope, classBody, file);
                    out.add(unit);
                    collect(bodyOf(child), append(scope, unit.name()), false, file, out);
                }
                case DECORATED_DEFINITION -> {
                    var definition = field(child, FIELD_DEFINITION);
                    if (definition == null) {
                        continue;
                    }
                    if (FUNCTION_DEFINITION.equals(definition.getType())) {
                        var unit = toUnit(definition, child, scope, classBody, file);
                        out.add(unit);
                        collect(bodyOf(definition), append(scope, unit.name()), false, file, out);
                    } else if (CLASS_DEFINITION.equals(definition.getType())) {
                        collectClass(definition, scope, file, out);
                    }
                }
                case CLASS_DEFINITION -> collectClass(child, scope, file, out);
                // functions can hide inside if/try/with blocks at any level
                default -> collect(child, scope, classBody, file, out);
            }
        }
    }

    private void collectClass(TSNode classNode, List<String> scope, ParsedFile file, List<FunctionUnit> out) {
        var className = extractNodeText(field(classNode, FIELD_NAME), file.source());
        collect(bodyOf(classNode), append(scope, className), true, file, out);
    }

    private FunctionUnit toUnit(
            TSNode definition, TSNode outermost, List<String> scope, boolean method, ParsedFile file) {
        var source = file.source();
        var name = extractNodeText(field(definition, FIELD_NAME), source);
        var qualifiedName = Joiner.on('.').join(append(scope, name));
        var span = new SourceSpan(
                outermost.getStartPoint().getRow() + 1, outermost.getEndPoint().getRow() + 1);
        return new FunctionUnit(
                name,
                qualifiedName,
                parameterNames(field(definition, FIELD_PARAMETERS), source),
                method,
                namedChildren(bodyOf(definition)),
                source.substringFrom(outermost),
                span,
                source,
                file.tree());
    }

    private static boolean containsClass(TSNode root) {
        return ASTTraversalUtils.findNodeRecursive(root, n -> CLASS_DEFINITION.equals(n.getType())) != null;
    }

    /** Module-level statements as one unit, or empty when the file holds nothing but comments. */
    private static Optional<FunctionUnit> moduleUnit(TSNode root, ParsedFile file) {
        var statements = namedChildren(root).stream()
                .filter(n -> !COMMENT.equals(n.getType()))
                .toList();
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        var first = statements.get(0);
        var last = statements.get(statements.size() - 1);
        var span = new SourceSpan(first.getStartPoint().getRow() + 1, last.getEndPoint().getRow() + 1);
        return Optional.of(new FunctionUnit(
                FunctionUnit.MODULE_UNIT_NAME,
                FunctionUnit.MODULE_UNIT_NAME,
                List.of(),
                false,
                statements,
                file.source().text(),
                span,
                file.source(),
                file.tree()));
    }

    /** Names bound by a {@code parameters} or {@code lambda_parameters} node. */
    static List<String> parameterNames(@Nullable TSNode parameters, SourceContent source) {
        var names = new ArrayList<String>();
        for (var param : namedChildren(parameters)) {
            var nameNode = switch (param.getType()) {
                case IDENTIFIER -> param;
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> field(param, FIELD_NAME);
                case TYPED_PARAMETER, LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> firstIdentifier(param);
                default -> null;
            };
            if (nameNode != null) {
                names.add(extractNodeText(nameNode, source));
            }
        }
        return names;
    }

    private static @Nullable TSNode firstIdentifier(TSNode node) {
        for (var child : namedChildren(node)) {
            if (IDENTIFIER.equals(child.getType())) {
                return child;
            }
            var nested = firstIdentifier(child);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static @Nullable TSNode bodyOf(TSNode definition) {
        return field(definition, FIELD_BODY);
    }

    private static List<String> append(List<String> scope, String name) {
        var extended = new ArrayList<String>(scope.size() + 1);
        extended.addAll(scope);
        extended.add(name);
        return List.copyOf(extended);
    }

    private static PythonParseException syntaxError(TSNode root, SourceContent source) {
        var offending = ASTTraversalUtils.findNodeRecursive(root, n -> ERROR.equals(n.getType()) || n.isMissing());
        var at = offending != null ? offending : root;
        int line = at.getStartPoint().getRow() + 1;
        int column = at.getStartPoint().getColumn() + 1;
        String message;
        if (offending != null && offending.isMissing()) {
            message = "Syntax error at line %d, column %d: missing '%s'".formatted(line, column, offending.getType());
        } else {
            var snippet = Splitter.on('\n').splitToList(extractNodeText(at, source)).get(0).strip();
            message = snippet.isEmpty()
                    ? "Syntax error at line %d, column %d".formatted(line, column)
                    : "Syntax error at line %d, column %d near '%s'".formatted(line, column, abbreviate(snippet));
        }
        logger.debug(message);
        return new PythonParseException(message, line, column);
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }
}
