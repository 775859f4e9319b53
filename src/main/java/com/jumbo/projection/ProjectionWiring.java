package com.jumbo.projection;

import com.jumbo.bus.EventBus;
import com.jumbo.projection.architecture.ArchitectureProjectionHandler;
import com.jumbo.projection.architecture.ArchitectureProjectionStore;
import com.jumbo.projection.architecture.ArchitectureReader;
import com.jumbo.projection.component.ComponentProjectionHandler;
import com.jumbo.projection.component.ComponentProjectionStore;
import com.jumbo.projection.component.ComponentReader;
import com.jumbo.projection.decision.DecisionProjectionHandler;
import com.jumbo.projection.decision.DecisionProjectionStore;
import com.jumbo.projection.decision.DecisionReader;
import com.jumbo.projection.dependency.DependencyProjectionHandler;
import com.jumbo.projection.dependency.DependencyProjectionStore;
import com.jumbo.projection.dependency.DependencyReader;
import com.jumbo.projection.goal.GoalProjectionHandler;
import com.jumbo.projection.goal.GoalProjectionStore;
import com.jumbo.projection.goal.GoalReader;
import com.jumbo.projection.guideline.GuidelineProjectionHandler;
import com.jumbo.projection.guideline.GuidelineProjectionStore;
import com.jumbo.projection.guideline.GuidelineReader;
import com.jumbo.projection.invariant.InvariantProjectionHandler;
import com.jumbo.projection.invariant.InvariantProjectionStore;
import com.jumbo.projection.invariant.InvariantReader;
import com.jumbo.projection.session.SessionProjectionHandler;
import com.jumbo.projection.session.SessionProjectionStore;
import com.jumbo.projection.session.SessionReader;
import com.jumbo.projection.summary.SessionSummaryProjectionHandler;
import com.jumbo.projection.summary.SessionSummaryProjectionStore;
import com.jumbo.projection.summary.SessionSummaryReader;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Builds every projection store against one database and subscribes its handler to a bus.
 *
 * <p>Registration order matters for the sequential replay bus: the primary projections come
 * first and the session summary, which reads them, comes last. Normal operation and rebuild
 * both go through here so they cannot drift apart.
 */
public final class ProjectionWiring {

    private final GoalProjectionStore goals;
    private final SessionProjectionStore sessions;
    private final DecisionProjectionStore decisions;
    private final ComponentProjectionStore components;
    private final ArchitectureProjectionStore architecture;
    private final DependencyProjectionStore dependencies;
    private final GuidelineProjectionStore guidelines;
    private final InvariantProjectionStore invariants;
    private final SessionSummaryProjectionStore sessionSummaries;

    private ProjectionWiring(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.goals = new GoalProjectionStore(jdbcTemplate, json);
        this.sessions = new SessionProjectionStore(jdbcTemplate, json);
        this.decisions = new DecisionProjectionStore(jdbcTemplate, json);
        this.components = new ComponentProjectionStore(jdbcTemplate, json);
        this.architecture = new ArchitectureProjectionStore(jdbcTemplate, json);
        this.dependencies = new DependencyProjectionStore(jdbcTemplate, json);
        this.guidelines = new GuidelineProjectionStore(jdbcTemplate, json);
        this.invariants = new InvariantProjectionStore(jdbcTemplate, json);
        this.sessionSummaries = new SessionSummaryProjectionStore(jdbcTemplate, json);
    }

    public static ProjectionWiring wire(JdbcTemplate jdbcTemplate, JsonColumns json, EventBus bus) {
        ProjectionWiring wiring = new ProjectionWiring(jdbcTemplate, json);
        new GoalProjectionHandler(wiring.goals, json).subscribe(bus);
        new SessionProjectionHandler(wiring.sessions).subscribe(bus);
        new DecisionProjectionHandler(wiring.decisions, json).subscribe(bus);
        new ComponentProjectionHandler(wiring.components).subscribe(bus);
        new ArchitectureProjectionHandler(wiring.architecture, json).subscribe(bus);
        new DependencyProjectionHandler(wiring.dependencies).subscribe(bus);
        new GuidelineProjectionHandler(wiring.guidelines, json).subscribe(bus);
        new InvariantProjectionHandler(wiring.invariants).subscribe(bus);
        new SessionSummaryProjectionHandler(wiring.sessionSummaries, wiring.goals, wiring.decisions).subscribe(bus);
        return wiring;
    }

    public GoalReader goals() {
        return goals;
    }

    public SessionReader sessions() {
        return sessions;
    }

    public DecisionReader decisions() {
        return decisions;
    }

    public ComponentReader components() {
        return components;
    }

    public ArchitectureReader architecture() {
        return architecture;
    }

    public DependencyReader dependencies() {
        return dependencies;
    }

    public GuidelineReader guidelines() {
        return guidelines;
    }

    public InvariantReader invariants() {
        return invariants;
    }

    public SessionSummaryReader sessionSummaries() {
        return sessionSummaries;
    }
}
