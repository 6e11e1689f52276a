package com.barlang.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pattern-based English to rule text translation.
 *
 * <p>The text is lower-cased, rewritten through an ordered list of regex substitutions
 * (synonyms, indicator phrases, volume suffixes, comparison phrases), then split into
 * sentences. Each sentence becomes an ENTRY or EXIT condition depending on its keywords;
 * a sentence with neither kind of keyword is an entry condition.</p>
 */
public class PatternRuleTranslator implements RuleTranslator {

    private static final Logger log = LoggerFactory.getLogger(PatternRuleTranslator.class);

    private static final List<Rewrite> REWRITES = List.of(
        // Price synonyms; the longer phrases go first
        rewrite("\\bclosing price\\b", "close"),
        rewrite("\\bclose price\\b", "close"),
        rewrite("\\bprice\\b", "close"),

        // Moving averages
        rewrite("\\b(\\d+)[-\\s]?day moving average\\b", "SMA(close,$1)"),
        rewrite("\\b(\\d+)[-\\s]?day sma\\b", "SMA(close,$1)"),
        rewrite("\\bmoving average[-\\s]?(\\d+)\\b", "SMA(close,$1)"),
        rewrite("\\bsma[-\\s]?\\(?(\\d+)\\)?", "SMA(close,$1)"),
        rewrite("\\bma[-\\s]?(\\d+)\\b", "SMA(close,$1)"),

        // RSI, default period 14
        rewrite("\\brsi[-\\s]?\\(?(\\d+)\\)?", "RSI(close,$1)"),
        rewrite("\\brsi\\b(?!\\()", "RSI(close,14)"),

        // Volume suffixes
        rewrite("\\b(\\d+(?:\\.\\d+)?)\\s*million\\b", "$1M"),
        rewrite("\\b(\\d+(?:\\.\\d+)?)\\s*m\\b(?!\\w)", "$1M"),
        rewrite("\\b(\\d+(?:\\.\\d+)?)\\s*thousand\\b", "$1K"),
        rewrite("\\b(\\d+(?:\\.\\d+)?)\\s*k\\b(?!\\w)", "$1K"),

        // Crosses
        rewrite("\\bcross(?:es)? (?:above|over)\\b", "crosses above"),
        rewrite("\\bcross(?:es)? (?:below|under)\\b", "crosses below"),

        // Comparison phrases; "crosses above/below" must stay intact
        rewrite("\\b(?:is )?(?:greater than or equal to|at least)\\b", ">="),
        rewrite("\\b(?:is )?(?:less than or equal to|at most)\\b", "<="),
        rewrite("(?<!crosses )\\b(?:is )?(?:greater than|more than|higher than|above|over|exceeds)\\b", ">"),
        rewrite("(?<!crosses )\\b(?:is )?(?:less than|lower than|below|under)\\b", "<"),
        rewrite("\\b(?:is )?(?:equal to|equals)\\b", "=="),

        rewrite("\\bvol\\b", "volume"),

        rewrite("\\band\\b", "AND"),
        rewrite("\\bor\\b", "OR")
    );

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?;]\\s+|[.!?;]$");
    private static final Pattern ENTRY_KEYWORDS = Pattern.compile("\\b(?:buy|enter|entry|go long|long)\\b");
    private static final Pattern EXIT_KEYWORDS = Pattern.compile(
        "\\b(?:exit|sell|stop|close (?:the |my )?position|close out)\\b");
    private static final Pattern FILLER = Pattern.compile("\\b(?:the|a|an|my|position)\\b");
    private static final Pattern LEADING_CONJUNCTION = Pattern.compile("^(?:(?:when|if|once|whenever|then)\\s+)+");
    // Commas between clauses; argument commas inside SMA(close,20) have no space after them
    private static final Pattern CLAUSE_COMMA = Pattern.compile(",(?=\\s|$)");
    private static final Pattern DANGLING_LOGICAL = Pattern.compile("^(?:(?:AND|OR)\\s+)+|(?:\\s+(?:AND|OR))+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // "crosses" with no subject: at the start, or right after AND/OR
    private static final Pattern BARE_CROSS = Pattern.compile("(^|\\b(?:AND|OR) )crosses (above|below)\\b");

    @Override
    public String translate(String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Nothing to translate");
        }

        String text = normalize(description);
        for (Rewrite r : REWRITES) {
            text = r.pattern().matcher(text).replaceAll(r.replacement());
        }

        List<String> entry = new ArrayList<>();
        List<String> exit = new ArrayList<>();
        for (String sentence : SENTENCE_BREAK.split(text)) {
            boolean isEntry = ENTRY_KEYWORDS.matcher(sentence).find();
            boolean isExit = !isEntry && EXIT_KEYWORDS.matcher(sentence).find();

            String condition = toCondition(sentence);
            if (condition.isEmpty()) {
                continue;
            }
            (isExit ? exit : entry).add(condition);
        }

        StringBuilder rule = new StringBuilder();
        if (!entry.isEmpty()) {
            rule.append("ENTRY: ").append(String.join(" AND ", entry));
        }
        if (!exit.isEmpty()) {
            if (rule.length() > 0) {
                rule.append('\n');
            }
            rule.append("EXIT: ").append(String.join(" AND ", exit));
        }

        String result = rule.length() > 0 ? rule.toString() : "ENTRY: " + text;
        log.debug("Translated '{}' to '{}'", description, result);
        return result;
    }

    private static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String toCondition(String sentence) {
        String s = ENTRY_KEYWORDS.matcher(sentence).replaceAll(" ");
        s = EXIT_KEYWORDS.matcher(s).replaceAll(" ");
        s = FILLER.matcher(s).replaceAll(" ");
        s = CLAUSE_COMMA.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        s = LEADING_CONJUNCTION.matcher(s).replaceFirst("");
        s = DANGLING_LOGICAL.matcher(s).replaceAll("");
        return BARE_CROSS.matcher(s).replaceAll("$1close crosses $2");
    }

    private static Rewrite rewrite(String regex, String replacement) {
        return new Rewrite(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    private record Rewrite(Pattern pattern, String replacement) {}
}
