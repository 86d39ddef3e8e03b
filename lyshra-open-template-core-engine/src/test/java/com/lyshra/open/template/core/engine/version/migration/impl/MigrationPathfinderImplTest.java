package com.lyshra.open.template.core.engine.version.migration.impl;

import com.lyshra.open.template.integration.contract.version.migration.IMigrationPath;
import com.lyshra.open.template.integration.contract.version.migration.IMigrationScript;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import com.lyshra.open.template.integration.models.version.migration.MigrationScripts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MigrationPathfinderImpl}.
 */
class MigrationPathfinderImplTest {

    private MigrationRegistryImpl registry;
    private MigrationPathfinderImpl pathfinder;

    @BeforeEach
    void setUp() {
        registry = new MigrationRegistryImpl();
        pathfinder = new MigrationPathfinderImpl(registry);
    }

    private void register(String templateId, String id, String from, String to) {
        registry.register(templateId, MigrationScripts.create(id, from, to, "", Mono::just));
    }

    private static List<String> stepIds(IMigrationPath path) {
        return path.getSteps().stream().map(IMigrationScript::getId).collect(Collectors.toList());
    }

    // ========================================================================
    // PATH DISCOVERY TESTS
    // ========================================================================

    @Nested
    @DisplayName("Path discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("should chain migrations from source to target")
        void shouldChain() {
            // Given
            registry.register("t", MigrationScripts.create("a", "1.0.0", "1.1.0", "",
                    Mono::just, Mono::just, Duration.ofSeconds(1)));
            registry.register("t", MigrationScripts.create("b", "1.1.0", "2.0.0", "",
                    Mono::just, Mono::just, Duration.ofSeconds(3)));

            // When
            IMigrationPath path = pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("2.0.0")).orElseThrow();

            // Then
            assertEquals(List.of("a", "b"), stepIds(path));
            assertTrue(path.isReversible());
            assertEquals(Duration.ofSeconds(4), path.getTotalDuration());
            assertEquals("1.0.0", path.getFrom().toVersionString());
            assertEquals("2.0.0", path.getTo().toVersionString());
        }

        @Test
        @DisplayName("same source and target should yield an empty path")
        void sameVersion() {
            register("t", "a", "1.0.0", "1.1.0");

            IMigrationPath path = pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.1.0"), SemanticVersion.parse("1.1.0")).orElseThrow();

            assertEquals(0, path.getStepCount());
            assertTrue(path.isReversible());
            assertEquals(Duration.ZERO, path.getTotalDuration());
        }

        @Test
        @DisplayName("first registered edge should win when several leave a version")
        void firstEdgeWins() {
            register("t", "direct", "1.0.0", "2.0.0");
            register("t", "minor", "1.0.0", "1.5.0");
            register("t", "finish", "1.5.0", "2.0.0");

            IMigrationPath path = pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("2.0.0")).orElseThrow();

            assertEquals(List.of("direct"), stepIds(path));
        }

        @Test
        @DisplayName("canMigrate should mirror path discovery")
        void canMigrate() {
            register("t", "a", "1.0.0", "1.1.0");

            assertTrue(pathfinder.canMigrate("t", SemanticVersion.parse("1.0.0"), SemanticVersion.parse("1.1.0")));
            assertFalse(pathfinder.canMigrate("t", SemanticVersion.parse("1.1.0"), SemanticVersion.parse("1.2.0")));
        }
    }

    // ========================================================================
    // FAILURE TESTS
    // ========================================================================

    @Nested
    @DisplayName("No path")
    class NoPathTests {

        @Test
        @DisplayName("unknown template should have no path")
        void unknownTemplate() {
            assertTrue(pathfinder.findMigrationPath("ghost",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("1.0.0")).isEmpty());
        }

        @Test
        @DisplayName("missing edge should have no path")
        void missingEdge() {
            register("t", "a", "1.0.0", "1.1.0");
            register("t", "c", "1.2.0", "2.0.0");

            assertTrue(pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("2.0.0")).isEmpty());
        }

        @Test
        @DisplayName("overshooting the target should have no path")
        void overshoot() {
            register("t", "a", "1.0.0", "3.0.0");

            assertTrue(pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("2.0.0")).isEmpty());
        }

        @Test
        @DisplayName("cycles should terminate with no path")
        void cycle() {
            registry.register("t", MigrationScripts.create("loop", "1.0.0", "1.0.0", "", Mono::just));

            assertTrue(pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("1.0.0"), SemanticVersion.parse("2.0.0")).isEmpty());
        }

        @Test
        @DisplayName("downgrade targets should have no path")
        void downgrade() {
            register("t", "a", "1.0.0", "2.0.0");

            assertTrue(pathfinder.findMigrationPath("t",
                    SemanticVersion.parse("2.0.0"), SemanticVersion.parse("1.0.0")).isEmpty());
        }
    }
}
