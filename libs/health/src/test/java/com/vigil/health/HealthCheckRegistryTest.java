package com.vigil.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.health.testing.InMemoryHealthCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HealthCheckRegistry} and {@link HistoryStore} bookkeeping.
 */
@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private HealthCheckRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HealthCheckRegistry();
    }

    @Test
    @DisplayName("should keep first-registration order when an entry is replaced")
    void shouldKeepOrderOnReplace() {
        registry.register(new ServiceRegistration("a", new InMemoryHealthCheck(), "A", null));
        registry.register(new ServiceRegistration("b", new InMemoryHealthCheck(), "B", null));

        var replaced = registry.register(new ServiceRegistration("a", new InMemoryHealthCheck(), "A2", null));

        assertThat(replaced).hasValueSatisfying(r -> assertThat(r.displayName()).isEqualTo("A"));
        assertThat(registry.all()).extracting(ServiceRegistration::displayName).containsExactly("A2", "B");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject null registrations")
    void shouldRejectNull() {
        assertThatThrownBy(() -> registry.register(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registration");
    }

    @Test
    @DisplayName("should start a fresh history on reset")
    void shouldResetHistory() {
        HistoryStore store = new HistoryStore(2);
        store.append("svc", CheckResult.ok("one"));
        store.append("svc", CheckResult.ok("two"));
        store.append("svc", CheckResult.ok("three"));

        assertThat(store.history("svc")).hasValueSatisfying(h -> assertThat(h.size()).isEqualTo(2));

        store.reset("svc");
        assertThat(store.history("svc")).hasValueSatisfying(h -> assertThat(h.isEmpty()).isTrue());
        assertThat(store.history("other")).isEmpty();
    }
}
