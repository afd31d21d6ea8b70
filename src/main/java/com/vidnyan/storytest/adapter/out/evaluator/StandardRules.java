package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.rule.RuleRegistry;

/**
 * The built-in rule catalog.
 */
public final class StandardRules {

    public static final String STORY_INTEGRITY = "StoryIntegrity";
    public static final String CONCEPTUAL = "Conceptual";

    private StandardRules() {
    }

    public static RuleRegistry registry(BodyPatternAnalyzer analyzer) {
        return RuleRegistry.builder()
                .phase(STORY_INTEGRITY,
                        new StubBodyRule(analyzer),
                        new MinimalBodyRule(analyzer),
                        new DebugOnlyRule(),
                        new PhantomPropertyRule(),
                        new ColdMethodRule(analyzer),
                        new PrematureCelebrationRule(analyzer),
                        new UnusedParameterRule(analyzer),
                        new DeadCodeRule())
                .phase(CONCEPTUAL,
                        new IncompleteClassRule(),
                        new UnsealedAbstractRule(),
                        new HollowEnumRule(),
                        new EmptyInterfaceRule(),
                        new HollowStructRule())
                .build();
    }
}
