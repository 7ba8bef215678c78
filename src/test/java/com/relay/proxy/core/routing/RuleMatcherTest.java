package com.relay.proxy.core.routing;

import com.relay.proxy.entity.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleMatcherTest {

    private final Rule test = new Rule("/test", List.of("dummy"));
    private final Rule api = new Rule("/api", List.of("api"));
    private final Rule catchAll = new Rule("/", List.of("jsonplaceholder"));

    @Test
    void match_returnsFirstRuleInDeclarationOrder() {
        List<Rule> rules = List.of(test, api, catchAll);

        assertThat(RuleMatcher.match(rules, "/test/x")).isSameAs(test);
        assertThat(RuleMatcher.match(rules, "/api/users?id=1")).isSameAs(api);
        assertThat(RuleMatcher.match(rules, "/other")).isSameAs(catchAll);
    }

    @Test
    void match_catchAllDeclaredFirstShadowsLaterRules() {
        List<Rule> rules = List.of(catchAll, test);

        assertThat(RuleMatcher.match(rules, "/test/x")).isSameAs(catchAll);
    }

    @Test
    void match_isPlainPrefixComparison() {
        List<Rule> rules = List.of(test);

        assertThat(RuleMatcher.match(rules, "/testing")).isSameAs(test);
        assertThat(RuleMatcher.match(rules, "/tes")).isNull();
        assertThat(RuleMatcher.match(rules, "/TEST")).isNull();
    }

    @Test
    void match_emptyAndNullPathsAreTreatedAsRoot() {
        List<Rule> rules = List.of(test, catchAll);

        assertThat(RuleMatcher.match(rules, "")).isSameAs(catchAll);
        assertThat(RuleMatcher.match(rules, null)).isSameAs(catchAll);
        assertThat(RuleMatcher.normalize("")).isEqualTo("/");
        assertThat(RuleMatcher.normalize("/a")).isEqualTo("/a");
    }

    @Test
    void match_withoutCatchAllReturnsNull() {
        assertThat(RuleMatcher.match(List.of(test, api), "/unmatched")).isNull();
        assertThat(RuleMatcher.match(List.of(), "/")).isNull();
        assertThat(RuleMatcher.match(null, "/")).isNull();
    }
}
