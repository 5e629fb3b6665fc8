package me.christianrobert.synthdb.semantic.service;

import me.christianrobert.synthdb.semantic.model.SemanticCategory;

import java.util.function.Predicate;

/**
 * One name-based classification rule: a predicate over a {@link ColumnName} and the category
 * it assigns when the predicate holds.
 *
 * <p>Rules are built declaratively:</p>
 * <pre>
 * ClassificationRule.named("street address")
 *     .whenContains("address", "street")
 *     .unlessToken("mac", "ip")
 *     .unlessContains("email")
 *     .classifyAs(SemanticCategory.STREET_ADDRESS);
 * </pre>
 *
 * <p>Match conditions ({@code when*}) are OR-combined, requirements ({@code require*}) are
 * AND-combined with them, and any exclusion ({@code unless*}) vetoes the rule.</p>
 */
public final class ClassificationRule {

    private final String name;
    private final Predicate<ColumnName> condition;
    private final SemanticCategory category;

    private ClassificationRule(String name, Predicate<ColumnName> condition, SemanticCategory category) {
        this.name = name;
        this.condition = condition;
        this.category = category;
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public boolean matches(ColumnName columnName) {
        return condition.test(columnName);
    }

    public String getName() {
        return name;
    }

    public SemanticCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return "ClassificationRule{" + name + " -> " + category + "}";
    }

    public static final class Builder {
        private final String name;
        private Predicate<ColumnName> match = c -> false;
        private Predicate<ColumnName> requirement = c -> true;
        private Predicate<ColumnName> exclusion = c -> false;

        private Builder(String name) {
            this.name = name;
        }

        /** Matches when any of the tokens is present. */
        public Builder whenToken(String... tokens) {
            match = match.or(c -> c.hasToken(tokens));
            return this;
        }

        /** Matches when the compact name contains any of the fragments. */
        public Builder whenContains(String... fragments) {
            match = match.or(c -> c.contains(fragments));
            return this;
        }

        /** Matches when the compact name equals one of the names. */
        public Builder whenNamed(String... names) {
            match = match.or(c -> c.is(names));
            return this;
        }

        public Builder when(Predicate<ColumnName> predicate) {
            match = match.or(predicate);
            return this;
        }

        public Builder requireTemporalMarker() {
            requirement = requirement.and(ColumnName::hasTemporalMarker);
            return this;
        }

        /** Requires the owning table name to carry one of the tokens. */
        public Builder requireTable(String... tableTokens) {
            requirement = requirement.and(c -> c.tableHasToken(tableTokens));
            return this;
        }

        public Builder unlessToken(String... tokens) {
            exclusion = exclusion.or(c -> c.hasToken(tokens));
            return this;
        }

        public Builder unlessContains(String... fragments) {
            exclusion = exclusion.or(c -> c.contains(fragments));
            return this;
        }

        public Builder unless(Predicate<ColumnName> predicate) {
            exclusion = exclusion.or(predicate);
            return this;
        }

        public ClassificationRule classifyAs(SemanticCategory category) {
            Predicate<ColumnName> m = match;
            Predicate<ColumnName> r = requirement;
            Predicate<ColumnName> x = exclusion;
            return new ClassificationRule(name, c -> m.test(c) && r.test(c) && !x.test(c), category);
        }
    }
}
