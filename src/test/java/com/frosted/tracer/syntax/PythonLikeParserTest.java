package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.IfNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.UnsupportedNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PythonLikeParserTest {

    private final SyntaxParser parser = new SyntaxParser();

    private ParseResult parse(String text) {
        return parser.parse(text, Language.PYTHON_LIKE);
    }

    @Test
    void parsesFunctionAndCall() {
        ParseResult result = parse("def add(a, b):\n    return a + b\n\nprint(add(1, 2))\n");

        assertThat(result.hasErrors()).isFalse();
        SyntaxTree tree = result.getTree();
        assertThat(tree.getRoot().getStatements()).hasSize(2);
        FunctionDeclNode function = tree.findAll(FunctionDeclNode.class).get(0);
        assertThat(function.getName()).isEqualTo("add");
        assertThat(function.getParameters()).containsExactly("a", "b");
        assertThat(function.getStartLine()).isEqualTo(1);
        assertThat(function.getEndLine()).isEqualTo(2);
        assertThat(tree.contains(NodeKind.RETURN)).isTrue();
    }

    @Test
    @DisplayName("elif becomes a nested if in the else branch")
    void elifChain() {
        ParseResult result = parse("if x > 1:\n    y = 1\nelif x > 0:\n    y = 2\nelse:\n    y = 3\n");

        assertThat(result.hasErrors()).isFalse();
        SyntaxTree tree = result.getTree();
        IfNode outer = tree.node(tree.getRoot().getStatements().get(0), IfNode.class);
        Node elseBranch = tree.node(outer.getElseBranch());
        assertThat(elseBranch).isInstanceOf(IfNode.class);
        assertThat(((IfNode) elseBranch).hasElse()).isTrue();
    }

    @Test
    @DisplayName("A missing ':' is reported and the body is still parsed")
    void missingColon() {
        ParseResult result = parse("if x > 1\n    print(x)\n");

        List<StaticError> errors = result.getErrors();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.MISSING_DELIMITER);
        assertThat(errors.get(0).getLine()).isEqualTo(1);
        assertThat(result.getTree().contains(NodeKind.EXPRESSION_CALL)).isTrue();
    }

    @Test
    void printWithoutParentheses() {
        ParseResult result = parse("print 'hello'\n");

        assertThat(result.getErrors()).extracting(StaticError::getKind).containsExactly(ErrorKind.MISSING_DELIMITER);
    }

    @Test
    @DisplayName("Parsing continues after an error on an earlier line")
    void recoversOnNextLine() {
        ParseResult result = parse("x = = 1\ny = 2\n");

        assertThat(result.getErrors()).isNotEmpty();
        assertThat(result.getErrors().get(0).getLine()).isEqualTo(1);
        SyntaxTree tree = result.getTree();
        assertThat(tree.getLineIndex().nodesAt(2))
                .anyMatch(id -> tree.node(id).kind() == NodeKind.ASSIGNMENT);
    }

    @Test
    void elseWithoutIf() {
        ParseResult result = parse("x = 1\nelse:\n    x = 2\n");

        assertThat(result.getErrors()).extracting(StaticError::getKind).containsExactly(ErrorKind.UNEXPECTED_TOKEN);
        assertThat(result.getErrors().get(0).getLine()).isEqualTo(2);
    }

    @Test
    @DisplayName("Constructs the tracer cannot run parse into unsupported nodes without errors")
    void unsupportedConstructs() {
        ParseResult result = parse("import math\nclass Point:\n    pass\nx = 1\n");

        assertThat(result.hasErrors()).isFalse();
        List<UnsupportedNode> unsupported = result.getTree().findAll(UnsupportedNode.class);
        assertThat(unsupported).extracting(UnsupportedNode::getConstruct)
                .containsExactlyInAnyOrder("import statement", "class definition");
    }

    @Test
    void missingIndentedBlock() {
        ParseResult result = parse("while True:\nx = 1\n");

        assertThat(result.getErrors()).extracting(StaticError::getKind).contains(ErrorKind.BAD_INDENTATION);
    }

    @Test
    void oneLineBody() {
        ParseResult result = parse("for i in range(3): print(i)\n");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.getTree().contains(NodeKind.FOR_EACH)).isTrue();
    }
}
