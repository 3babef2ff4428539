package ai.designerkit.analyzer.csharp;

/** Constants for the tree-sitter C# node type and field names a designer file touches. */
public final class CSharpTreeSitterNodeTypes {

    // Declarations
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String NAMESPACE_DECLARATION = "namespace_declaration";
    public static final String FILE_SCOPED_NAMESPACE_DECLARATION = "file_scoped_namespace_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";

    // Statements and expressions
    public static final String BLOCK = "block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String MEMBER_ACCESS_EXPRESSION = "member_access_expression";
    public static final String OBJECT_CREATION_EXPRESSION = "object_creation_expression";
    public static final String INVOCATION_EXPRESSION = "invocation_expression";
    public static final String ARGUMENT = "argument";
    public static final String IDENTIFIER = "identifier";
    public static final String COMMENT = "comment";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_EXPRESSION = "expression";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";

    public static final String THIS_KEYWORD = "this";

    private CSharpTreeSitterNodeTypes() {}
}
