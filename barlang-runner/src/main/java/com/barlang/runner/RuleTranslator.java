package com.barlang.runner;

/**
 * Turns a free-form English description of a trading rule into rule text
 * the parser accepts. Output is not guaranteed to parse; callers parse it.
 */
public interface RuleTranslator {

    /**
     * @throws IllegalArgumentException if the description is blank
     */
    String translate(String description);
}
