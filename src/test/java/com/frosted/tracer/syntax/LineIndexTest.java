package com.frosted.tracer.syntax;

import com.frosted.tracer.model.Language;
import com.frosted.tracer.syntax.node.BinaryOpNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.WhileNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class LineIndexTest {

    private final SyntaxParser parser = new SyntaxParser();

    @Test
    void everyNodeIsListedOnEachLineItSpans() {
        SyntaxTree tree = parser.parse("x = 0\nwhile x < 3:\n    x += 1\nprint(x)\n", Language.PYTHON_LIKE).getTree();
        LineIndex index = tree.getLineIndex();
        WhileNode loop = tree.findAll(WhileNode.class).get(0);

        assertThat(index.lineCount()).isEqualTo(4);
        assertThat(index.nodesAt(2)).contains(loop.getId());
        assertThat(index.nodesAt(3)).contains(loop.getId());
        assertThat(index.nodesAt(4)).doesNotContain(loop.getId());
        for (int line = 1; line <= 4; line++) {
            assertThat(index.covers(line)).isTrue();
            assertThat(index.nodesAt(line)).contains(tree.getRoot().getId());
        }
    }

    @Test
    void idsAreAscendingSoInnermostComesFirst() {
        SyntaxTree tree = parser.parse("y = (1 + 2) * 3\n", Language.PYTHON_LIKE).getTree();
        List<Integer> ids = tree.getLineIndex().nodesAt(1);

        assertThat(ids).isSorted();
        Node innermost = tree.node(ids.get(0));
        assertThat(innermost.kind()).isIn(NodeKind.LITERAL, NodeKind.IDENTIFIER);
    }

    @Test
    void linesOutsideTheSourceAreEmpty() {
        LineIndex index = parser.parse("x = 1\n", Language.PYTHON_LIKE).getLineIndex();

        assertThat(index.nodesAt(0)).isEmpty();
        assertThat(index.nodesAt(2)).isEmpty();
        assertThat(index.covers(2)).isFalse();
    }

    static Stream<Arguments> snippets() {
        return Stream.of(
                Arguments.of(Language.PYTHON_LIKE,
                        "def f(n):\n    if n > 0:\n        return n\n    return 0\nprint(f(2))\n"),
                Arguments.of(Language.JAVASCRIPT_LIKE,
                        "function f(n) {\n  if (n > 0) {\n    return n;\n  }\n  return 0;\n}\nconsole.log(f(2));\n"),
                Arguments.of(Language.JAVA_LIKE,
                        "class Main {\n  public static void main(String[] args) {\n    int[] xs = new int[3];\n"
                                + "    for (int i = 0; i < 3; i++) {\n      xs[i] = i;\n    }\n  }\n}\n"),
                Arguments.of(Language.JAVA_LIKE, "length +\n static\n"),
                Arguments.of(Language.JAVASCRIPT_LIKE, "let a = 1 +\nreturn;\n"),
                Arguments.of(Language.JAVASCRIPT_LIKE, "let x = foo(1, 2;\nlet y = 3;\nconsole.log(y);\n"),
                Arguments.of(Language.PYTHON_LIKE, "xs = [1 /\n]\nprint(xs)\n"),
                Arguments.of(Language.PYTHON_LIKE, "if x\n    y = 1\nwhile\n"));
    }

    @ParameterizedTest
    @MethodSource("snippets")
    @DisplayName("Every child's lines lie within its parent's lines")
    void childrenStayInsideTheirParent(Language language, String code) {
        SyntaxTree tree = parser.parse(code, language).getTree();

        for (Node parent : tree.walk()) {
            for (Node child : tree.children(parent.getId())) {
                assertThat(child.getStartLine()).as("%s inside %s", child, parent)
                        .isGreaterThanOrEqualTo(parent.getStartLine());
                assertThat(child.getEndLine()).as("%s inside %s", child, parent)
                        .isLessThanOrEqualTo(parent.getEndLine());
            }
        }
    }

    @Test
    void operatorMissingItsRightOperandReachesTheNextLine() {
        SyntaxTree tree = parser.parse("length +\n static\n", Language.JAVA_LIKE).getTree();
        BinaryOpNode sum = tree.findAll(BinaryOpNode.class).get(0);

        assertThat(sum.getStartLine()).isEqualTo(1);
        assertThat(sum.getEndLine()).isEqualTo(2);
    }
}
