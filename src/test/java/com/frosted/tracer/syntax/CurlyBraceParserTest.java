package com.frosted.tracer.syntax;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.node.BlockNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.UnsupportedNode;
import com.frosted.tracer.syntax.node.VariableDeclNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CurlyBraceParserTest {

    private final SyntaxParser parser = new SyntaxParser();

    @Nested
    class JavaScript {

        private ParseResult parse(String text) {
            return parser.parse(text, Language.JAVASCRIPT_LIKE);
        }

        @Test
        void parsesFunctionAndLoop() {
            ParseResult result = parse("function add(a, b) {\n  return a + b;\n}\n"
                    + "for (let i = 0; i < 3; i++) {\n  console.log(add(i, 1));\n}\n");

            assertThat(result.hasErrors()).isFalse();
            SyntaxTree tree = result.getTree();
            assertThat(tree.findAll(FunctionDeclNode.class)).extracting(FunctionDeclNode::getName).containsExactly("add");
            assertThat(tree.contains(NodeKind.FOR)).isTrue();
        }

        @Test
        @DisplayName("Semicolons are optional at line ends")
        void optionalSemicolons() {
            ParseResult result = parse("let a = 1\nlet b = a + 1\nconsole.log(b)\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().getRoot().getStatements()).hasSize(3);
        }

        @Test
        void constIsRecordedAsConstant() {
            ParseResult result = parse("const limit = 10;\nlet count = 0;\n");

            assertThat(result.getTree().findAll(VariableDeclNode.class))
                    .extracting(VariableDeclNode::getName, VariableDeclNode::isConstant)
                    .containsExactly(org.assertj.core.groups.Tuple.tuple("limit", true),
                            org.assertj.core.groups.Tuple.tuple("count", false));
        }

        @Test
        void arrowFunctionIsUnsupported() {
            ParseResult result = parse("let f = (x) => x * 2;\n");

            assertThat(result.getTree().findAll(UnsupportedNode.class)).isNotEmpty();
        }

        @Test
        @DisplayName("An unclosed brace is closed at the end of input and reported at the opener")
        void unclosedBrace() {
            ParseResult result = parse("if (x > 1) {\n  x = 2;\n");

            assertThat(result.getErrors()).extracting(StaticError::getKind).contains(ErrorKind.UNMATCHED_BRACKET);
            assertThat(result.getErrors().get(0).getLine()).isEqualTo(1);
        }

        @Test
        @DisplayName("An unclosed call is closed at its semicolon and the following statements survive")
        void unclosedCallRecoversAtSemicolon() {
            ParseResult result = parse("let x = foo(1, 2;\nlet y = 3;\nconsole.log(y);\n");

            assertThat(result.getErrors()).extracting(StaticError::getKind, StaticError::getLine)
                    .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNMATCHED_BRACKET, 1));
            SyntaxTree tree = result.getTree();
            assertThat(tree.getRoot().getStatements()).hasSize(3);
            assertThat(tree.getRoot().getStatements()).extracting(id -> tree.node(id).getStartLine())
                    .containsExactly(1, 2, 3);
            assertThat(tree.findAll(VariableDeclNode.class)).extracting(VariableDeclNode::getName)
                    .containsExactly("x", "y");
        }

        @Test
        void unclosedCallIsClosedBeforeTheNextStatementLine() {
            ParseResult result = parse("console.log(1\nlet y = 3\n");

            assertThat(result.getErrors()).extracting(StaticError::getKind).containsExactly(ErrorKind.UNMATCHED_BRACKET);
            assertThat(result.getTree().getRoot().getStatements()).hasSize(2);
        }

        @Test
        void callArgumentsMayContinueOnTheNextLine() {
            ParseResult result = parse("console.log(1,\n  2);\nlet y = 3;\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().getRoot().getStatements()).hasSize(2);
        }

        @Test
        void bodyWithoutBracesIsNotDelimited() {
            ParseResult result = parse("if (x > 1)\n  x = 2;\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().findAll(BlockNode.class)).anyMatch(block -> !block.isDelimited());
        }
    }

    @Nested
    class Java {

        private ParseResult parse(String text) {
            return parser.parse(text, Language.JAVA_LIKE);
        }

        @Test
        @DisplayName("The wrapper class is transparent: its methods land in the program")
        void classWrapper() {
            ParseResult result = parse("public class Main {\n"
                    + "    static int square(int n) {\n"
                    + "        return n * n;\n"
                    + "    }\n"
                    + "    public static void main(String[] args) {\n"
                    + "        int x = square(3);\n"
                    + "        System.out.println(x);\n"
                    + "    }\n"
                    + "}\n");

            assertThat(result.hasErrors()).isFalse();
            SyntaxTree tree = result.getTree();
            assertThat(tree.findAll(FunctionDeclNode.class))
                    .extracting(FunctionDeclNode::getName)
                    .containsExactly("square", "main");
            FunctionDeclNode main = tree.findAll(FunctionDeclNode.class).get(1);
            assertThat(main.isVoid()).isTrue();
            assertThat(main.getParameters()).containsExactly("args");
            assertThat(main.getParameterType(0)).isEqualTo("String[]");
            FunctionDeclNode square = tree.findAll(FunctionDeclNode.class).get(0);
            assertThat(square.getReturnType()).isEqualTo("int");
            assertThat(square.getParameterType(0)).isEqualTo("int");
        }

        @Test
        void typedDeclarations() {
            ParseResult result = parse("int count = 0;\nfinal double rate = 1.5;\nString name;\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().findAll(VariableDeclNode.class))
                    .extracting(VariableDeclNode::getDeclaredType)
                    .containsExactly("int", "double", "String");
            assertThat(result.getTree().findAll(VariableDeclNode.class).get(1).isConstant()).isTrue();
        }

        @Test
        @DisplayName("A missing ';' is reported after the statement")
        void missingSemicolon() {
            ParseResult result = parse("int x = 5\nint y = 6;\n");

            assertThat(result.getErrors()).hasSize(1);
            StaticError error = result.getErrors().get(0);
            assertThat(error.getKind()).isEqualTo(ErrorKind.MISSING_DELIMITER);
            assertThat(error.getLine()).isEqualTo(1);
            assertThat(result.getTree().findAll(VariableDeclNode.class)).hasSize(2);
        }

        @Test
        void switchIsUnsupported() {
            ParseResult result = parse("int x = 1;\nswitch (x) {\n  case 1: break;\n}\n");

            assertThat(result.getTree().findAll(UnsupportedNode.class))
                    .extracting(UnsupportedNode::getConstruct)
                    .contains("switch statement");
        }

        @Test
        void unclosedParenthesisStaysOnItsOwnLine() {
            ParseResult result = parse("int x = (1 + 2;\nSystem.out.println(x);\n");

            assertThat(result.getErrors()).extracting(StaticError::getKind, StaticError::getLine)
                    .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNMATCHED_BRACKET, 1));
            assertThat(result.getTree().getRoot().getStatements()).hasSize(2);
        }

        @Test
        void semicolonsInsideForHeaderDoNotCloseIt() {
            ParseResult result = parse("int s = 0;\nfor (int i = 0; i < 3; i++) {\n  s += i;\n}\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().contains(NodeKind.FOR)).isTrue();
        }

        @Test
        void enhancedForLoop() {
            ParseResult result = parse("int[] xs = {1, 2, 3};\nfor (int x : xs) {\n  System.out.println(x);\n}\n");

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getTree().contains(NodeKind.FOR_EACH)).isTrue();
        }
    }
}
