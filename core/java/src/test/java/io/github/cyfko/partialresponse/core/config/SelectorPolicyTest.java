package io.github.cyfko.partialresponse.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SelectorPolicy Tests")
class SelectorPolicyTest {

    @Test
    @DisplayName("Should expose the preset limits")
    void shouldExposePresets() {
        assertEquals(new SelectorPolicy("DEFAULT_POLICY", 2000, 32), SelectorPolicy.defaults());
        assertEquals(new SelectorPolicy("STRICT_POLICY", 500, 8), SelectorPolicy.strict());
        assertEquals(new SelectorPolicy("RELAXED_POLICY", 10000, 128), SelectorPolicy.relaxed());
    }

    @Test
    @DisplayName("Should start custom policies from the default limits")
    void shouldBuildCustomPolicy() {
        SelectorPolicy policy = SelectorPolicy.builder().maxDepth(4).build();

        assertEquals(SelectorPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
        assertEquals(2000, policy.maxSelectorLength());
        assertEquals(4, policy.maxDepth());
    }

    @Test
    @DisplayName("Should reject invalid limits")
    void shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> SelectorPolicy.builder().maxSelectorLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> SelectorPolicy.builder().maxDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SelectorPolicy.builder().policyName(" ").build());
    }

    @Test
    @DisplayName("Should cap the nesting depth")
    void shouldCapDepth() {
        assertEquals(SelectorPolicy.MAX_DEPTH_CEILING,
                SelectorPolicy.builder().maxDepth(SelectorPolicy.MAX_DEPTH_CEILING).build().maxDepth());
        assertThrows(IllegalArgumentException.class,
                () -> SelectorPolicy.builder().maxDepth(SelectorPolicy.MAX_DEPTH_CEILING + 1).build());
    }
}
