package in.leanvibe.infrastructure.resilience;

import java.util.List;

/**
 * An upstream dependency that can serve requests through one of several ranked strategies,
 * e.g. a local model, a lighter fallback model, then a canned responder.
 */
public interface StrategyBackedDependency {

    String name();

    /**
     * Strategy names, best first. The first entry is the primary strategy.
     */
    List<String> rankedStrategies();

    HealthReport health();

    String currentStrategy();

    void switchStrategy(String strategy);
}
