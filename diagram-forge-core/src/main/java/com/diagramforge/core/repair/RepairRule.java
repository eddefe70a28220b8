package com.diagramforge.core.repair;

/**
 * One textual correction in the auto-fix pipeline.
 *
 * <p>Rules are pure: they take the whole document text and return the rewritten text,
 * plus a description when they changed anything.
 *
 * @see RepairRules#defaults()
 */
public interface RepairRule {

    /**
     * Returns a stable, kebab-case rule name.
     *
     * @return rule name
     */
    String name();

    /**
     * Applies the rule.
     *
     * @param xml document text, never {@code null}
     * @return rewritten text and optional fix description
     */
    RepairStep apply(String xml);
}
