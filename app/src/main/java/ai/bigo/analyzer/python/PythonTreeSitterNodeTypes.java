package ai.bigo.analyzer.python;

/** Constants for Python TreeSitter node type and field names. */
public final class PythonTreeSitterNodeTypes {

    // Definitions
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String LAMBDA = "lambda";
    public static final String BLOCK = "block";

    // Parameters
    public static final String IDENTIFIER = "identifier";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";

    // Loops
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String FOR_IN_CLAUSE = "for_in_clause";
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String SET_COMPREHENSION = "set_comprehension";
    public static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    public static final String GENERATOR_EXPRESSION = "generator_expression";

    // Conditionals
    public static final String IF_STATEMENT = "if_statement";
    public static final String MATCH_STATEMENT = "match_statement";

    // Exits
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String RETURN_STATEMENT = "return_statement";

    // Expressions
    public static final String CALL = "call";
    public static final String ATTRIBUTE = "attribute";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String LIST = "list";
    public static final String INTEGER = "integer";

    // Error recovery
    public static final String ERROR = "ERROR";

    // Trivia
    public static final String COMMENT = "comment";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_OPERATOR = "operator";

    private PythonTreeSitterNodeTypes() {}
}
