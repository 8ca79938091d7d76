package com.frosted.tracer.check;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.Severity;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.SyntaxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StaticRuleCheckerTest {

    private final SyntaxParser parser = new SyntaxParser();
    private final StaticRuleChecker checker = new StaticRuleChecker();

    private List<StaticError> check(String code, Language language) {
        return checker.check(parser.parse(code, language).getTree());
    }

    @Test
    @DisplayName("Undefined name suggests a close existing one")
    void undefinedNameWithSuggestion() {
        List<StaticError> errors = check("total = 0\nprint(totl)\n", Language.PYTHON_LIKE);

        assertThat(errors).hasSize(1);
        StaticError error = errors.get(0);
        assertThat(error.getKind()).isEqualTo(ErrorKind.UNDEFINED_VARIABLE);
        assertThat(error.getLine()).isEqualTo(2);
        assertThat(error.getColumn()).isEqualTo(7);
        assertThat(error.getSuggestedFix()).isEqualTo("Did you mean 'total'?");
    }

    @Test
    void compoundAssignmentNeedsExistingVariable() {
        List<StaticError> errors = check("count += 1\n", Language.PYTHON_LIKE);

        assertThat(errors).extracting(StaticError::getKind).containsExactly(ErrorKind.UNDEFINED_VARIABLE);
    }

    @Test
    @DisplayName("Functions may call functions defined further down")
    void laterFunctionsAreVisibleInBodies() {
        List<StaticError> errors = check("def f():\n    return g()\n\ndef g():\n    return 1\n\nprint(f())\n",
                Language.PYTHON_LIKE);

        assertThat(errors).isEmpty();
    }

    @Test
    void missingReturnOnSomePath() {
        List<StaticError> errors = check("def sign(n):\n    if n > 0:\n        return 1\n", Language.PYTHON_LIKE);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.MISSING_RETURN);
        assertThat(errors.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(errors.get(0).getLine()).isEqualTo(1);
    }

    @Test
    void codeAfterReturnIsUnreachable() {
        List<StaticError> errors = check("def f():\n    return 1\n    print(2)\n", Language.PYTHON_LIKE);

        assertThat(errors).extracting(StaticError::getKind, StaticError::getLine)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNREACHABLE_CODE, 3));
    }

    @Test
    void returnOutsideFunction() {
        List<StaticError> errors = check("x = 1\nreturn x\n", Language.PYTHON_LIKE);

        assertThat(errors).extracting(StaticError::getKind).containsExactly(ErrorKind.RETURN_OUTSIDE_FUNCTION);
    }

    @Test
    void constReassignment() {
        List<StaticError> errors = check("const limit = 1;\nlimit = 2;\n", Language.JAVASCRIPT_LIKE);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.CONST_REASSIGNMENT);
        assertThat(errors.get(0).getLine()).isEqualTo(2);
    }

    @Test
    @DisplayName("Assigning an undeclared name is a warning in JavaScript and an error in Java")
    void undeclaredAssignment() {
        List<StaticError> javaScript = check("count = 1;\n", Language.JAVASCRIPT_LIKE);
        List<StaticError> java = check("count = 1;\n", Language.JAVA_LIKE);

        assertThat(javaScript).extracting(StaticError::getKind, StaticError::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNDEFINED_VARIABLE, Severity.WARNING));
        assertThat(java).extracting(StaticError::getKind, StaticError::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNDEFINED_VARIABLE, Severity.ERROR));
    }

    @Test
    @DisplayName("Java declarations end with their block")
    void javaBlockScope() {
        List<StaticError> errors = check("if (true) {\n    int y = 1;\n}\nSystem.out.println(y);\n", Language.JAVA_LIKE);

        assertThat(errors).extracting(StaticError::getKind, StaticError::getLine)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(ErrorKind.UNDEFINED_VARIABLE, 4));
    }

    @Test
    void bracelessBodyIsFlagged() {
        List<StaticError> errors = check("let x = 3;\nif (x > 1)\n    x = 2;\n", Language.JAVASCRIPT_LIKE);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.MISSING_DELIMITER);
        assertThat(errors.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(errors.get(0).getLine()).isEqualTo(2);
    }

    @Test
    void nonVoidJavaMethodWithoutReturn() {
        List<StaticError> errors = check("static int f() {\n    int x = 1;\n}\n", Language.JAVA_LIKE);

        assertThat(errors).extracting(StaticError::getKind).containsExactly(ErrorKind.MISSING_RETURN);
    }

    @Test
    void cleanProgramHasNoFindings() {
        String code = "def fact(n):\n    if n <= 1:\n        return 1\n    return n * fact(n - 1)\n\nprint(fact(5))\n";

        assertThat(check(code, Language.PYTHON_LIKE)).isEmpty();
    }

    @Test
    void findingsAreOrdered() {
        List<StaticError> errors = check("print(a)\nprint(b)\nprint(c)\n", Language.PYTHON_LIKE);

        assertThat(errors).extracting(StaticError::getLine).containsExactly(1, 2, 3);
    }
}
