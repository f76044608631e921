package com.arccatalog.repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of named mutation steps executed on one connection inside one transaction.
 * If a step fails, every earlier step of the plan is rolled back and a {@link DatabaseException}
 * naming the failed step is raised.
 */
public final class CascadePlan {

    @FunctionalInterface
    public interface Step {
        void apply(Connection conn) throws SQLException;
    }

    private static final class NamedStep {
        private final String description;
        private final Step step;

        private NamedStep(String description, Step step) {
            this.description = description;
            this.step = step;
        }
    }

    private final String name;
    private final List<NamedStep> steps = new ArrayList<>();

    private CascadePlan(String name) {
        this.name = name;
    }

    public static CascadePlan named(String name) {
        return new CascadePlan(name);
    }

    public CascadePlan step(String description, Step step) {
        steps.add(new NamedStep(description, step));
        return this;
    }

    public String getName() {
        return name;
    }

    public List<String> getStepDescriptions() {
        List<String> descriptions = new ArrayList<>(steps.size());
        for (NamedStep step : steps) {
            descriptions.add(step.description);
        }
        return Collections.unmodifiableList(descriptions);
    }

    /**
     * Runs the plan in its own transaction.
     */
    public void execute(CatalogDatabaseManager db) {
        db.inTransaction("Cascade '" + name + "'", conn -> {
            executeOn(conn);
            return null;
        });
    }

    /**
     * Runs the steps on a connection whose transaction is owned by the caller.
     * Used to nest one plan inside another.
     */
    void executeOn(Connection conn) {
        for (NamedStep step : steps) {
            try {
                step.step.apply(conn);
            } catch (DatabaseException e) {
                throw e;
            } catch (SQLException | RuntimeException e) {
                throw new DatabaseException("Cascade '" + name + "' failed at step: " + step.description, e);
            }
        }
    }

    @Override
    public String toString() {
        return "CascadePlan{" + name + ", steps=" + getStepDescriptions() + '}';
    }
}
