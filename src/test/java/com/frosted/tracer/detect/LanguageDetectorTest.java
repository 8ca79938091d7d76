package com.frosted.tracer.detect;

import com.frosted.tracer.model.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    static Stream<Arguments> snippets() {
        return Stream.of(
                Arguments.of("def greet(name):\n    print('hi', name)\n", Language.PYTHON_LIKE),
                Arguments.of("for i in range(3):\n    print(i)\n", Language.PYTHON_LIKE),
                Arguments.of("let total = 0;\nconsole.log(total);\n", Language.JAVASCRIPT_LIKE),
                Arguments.of("function f(x) {\n  return x * 2;\n}\n", Language.JAVASCRIPT_LIKE),
                Arguments.of("public class Main {\n  public static void main(String[] args) {\n"
                        + "    System.out.println(1);\n  }\n}\n", Language.JAVA_LIKE),
                Arguments.of("int x = 5;\nSystem.out.println(x);\n", Language.JAVA_LIKE));
    }

    @ParameterizedTest
    @MethodSource("snippets")
    void detectsTypicalSnippets(String code, Language expected) {
        assertThat(detector.detect(code)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Weak evidence keeps the previous language")
    void previousLanguageBreaksTies() {
        assertThat(detector.detect("x = 1", Language.JAVA_LIKE)).isEqualTo(Language.JAVA_LIKE);
        assertThat(detector.detect("x = 1")).isEqualTo(Language.PYTHON_LIKE);
    }

    @Test
    void blankTextFallsBack() {
        assertThat(detector.detect("   \n", Language.JAVASCRIPT_LIKE)).isEqualTo(Language.JAVASCRIPT_LIKE);
        assertThat(detector.detect(null)).isEqualTo(Language.PYTHON_LIKE);
    }

    @Test
    void signalsCountOncePerLine() {
        assertThat(detector.scores("console.log(1); console.log(2);").get(Language.JAVASCRIPT_LIKE)).isEqualTo(6);
    }
}
