package com.frosted.tracer.detect;

import com.frosted.tracer.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guesses the language of a snippet from weighted lexical signals, one score per language.
 * Each signal counts once per line. The best score wins when it reaches {@link #THRESHOLD} and
 * is not tied; otherwise the caller's previous language is kept, or Python-like when there is
 * none.
 */
public final class LanguageDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageDetector.class);

    public static final int THRESHOLD = 3;

    private static final Signal[] SIGNALS = {
            new Signal(Language.PYTHON_LIKE, 4, "^\\s*def\\s+\\w+\\s*\\("),
            new Signal(Language.PYTHON_LIKE, 2, "^\\s*(if|elif|else|for|while|def)\\b.*:\\s*(#.*)?$"),
            new Signal(Language.PYTHON_LIKE, 4, "^\\s*elif\\b"),
            new Signal(Language.PYTHON_LIKE, 2, "\\b(True|False|None)\\b"),
            new Signal(Language.PYTHON_LIKE, 1, "^[^;]*\\bprint\\s*\\([^;]*$"),
            new Signal(Language.PYTHON_LIKE, 2, "\\brange\\s*\\("),
            new Signal(Language.PYTHON_LIKE, 1, "^\\s*#"),
            new Signal(Language.PYTHON_LIKE, 1, "\\s(and|or|not)\\s"),

            new Signal(Language.JAVASCRIPT_LIKE, 4, "\\bfunction\\b"),
            new Signal(Language.JAVASCRIPT_LIKE, 3, "^\\s*(let|const|var)\\s+[\\w$\\[{]"),
            new Signal(Language.JAVASCRIPT_LIKE, 5, "\\bconsole\\s*\\.\\s*log\\b"),
            new Signal(Language.JAVASCRIPT_LIKE, 3, "===|!=="),
            new Signal(Language.JAVASCRIPT_LIKE, 2, "=>"),
            new Signal(Language.JAVASCRIPT_LIKE, 1, "\\b(null|undefined)\\b"),
            new Signal(Language.JAVASCRIPT_LIKE, 1, ";\\s*(//.*)?$"),

            new Signal(Language.JAVA_LIKE, 3, "\\b(public|private)\\b"),
            new Signal(Language.JAVA_LIKE, 2, "\\bclass\\s+\\w+"),
            new Signal(Language.JAVA_LIKE, 2, "\\bstatic\\b"),
            new Signal(Language.JAVA_LIKE, 3, "\\bvoid\\b"),
            new Signal(Language.JAVA_LIKE, 5, "\\bSystem\\s*\\.\\s*out\\s*\\.\\s*print"),
            new Signal(Language.JAVA_LIKE, 3, "\\bString\\s*\\[\\s*\\]"),
            new Signal(Language.JAVA_LIKE, 2,
                    "^\\s*(final\\s+)?(int|double|boolean|char|long|float|String)(\\s*\\[\\s*\\])?\\s+\\w+\\s*[=;,]"),
            new Signal(Language.JAVA_LIKE, 1, ";\\s*(//.*)?$")
    };

    public Language detect(String text) {
        return detect(text, null);
    }

    /**
     * @param previous language detected earlier in the learner's session, used when the scores
     *                 do not decide; may be {@code null}
     */
    public Language detect(String text, Language previous) {
        Language fallback = previous != null ? previous : Language.PYTHON_LIKE;
        if (text == null || text.isBlank()) {
            return fallback;
        }
        Map<Language, Integer> scores = scores(text);
        Language best = null;
        int bestScore = -1;
        boolean tied = false;
        for (Map.Entry<Language, Integer> entry : scores.entrySet()) {
            int score = entry.getValue();
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
                tied = false;
            } else if (score == bestScore) {
                tied = true;
            }
        }
        Language detected = tied || bestScore < THRESHOLD ? fallback : best;
        LOGGER.debug("Language scores {} -> {}", scores, detected);
        return detected;
    }

    /** Score of every language for the text, in declaration order of {@link Language}. */
    public Map<Language, Integer> scores(String text) {
        Map<Language, Integer> scores = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            scores.put(language, 0);
        }
        if (text == null) {
            return scores;
        }
        for (String line : text.replace("\r\n", "\n").split("\n")) {
            if (line.isBlank()) continue;
            for (Signal signal : SIGNALS) {
                if (signal.pattern.matcher(line).find()) {
                    scores.merge(signal.language, signal.weight, Integer::sum);
                }
            }
        }
        return scores;
    }

    private static final class Signal {
        final Language language;
        final int weight;
        final Pattern pattern;

        Signal(Language language, int weight, String regex) {
            this.language = language;
            this.weight = weight;
            this.pattern = Pattern.compile(regex);
        }
    }
}
