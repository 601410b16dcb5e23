package com.itiac.core.validation;

import com.itiac.core.SnapshotTestBase;
import com.itiac.core.model.ComponentType;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.DependencyType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DependencyValidator}.
 */
class DependencyValidatorTest extends SnapshotTestBase {

    @Test
    void validate_plausibleEdge_isValid() {
        ValidationResult result = DependencyValidator.validate(edge("a", "b"), edges("b", "c"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void validate_selfLoop_reportsSelfDependencyAndCycle() {
        ValidationResult result = DependencyValidator.validate(edge("a", "a"), List.of());

        assertThat(result.errors()).containsExactly(
            "A component cannot depend on itself",
            "This dependency would create a circular dependency");
    }

    @Test
    void validate_duplicate_isRejected() {
        ValidationResult result = DependencyValidator.validate(edge("a", "b"),
            List.of(new Dependency("existing", "a", "b", null, null, null)));

        assertThat(result.errors()).containsExactly("This dependency already exists");
    }

    @Test
    void validate_editingTheSameDependency_isNotADuplicate() {
        Dependency stored = new Dependency("d1", "a", "b", DependencyType.USES, null, null);
        Dependency edited = new Dependency("d1", "a", "b", DependencyType.REQUIRES, null, null);

        assertThat(DependencyValidator.validate(edited, List.of(stored)).isValid()).isTrue();
    }

    @Test
    void validate_closingACycle_isRejected() {
        ValidationResult result = DependencyValidator.validate(edge("c", "a"), edges("a", "b", "b", "c"));

        assertThat(result.errors()).containsExactly("This dependency would create a circular dependency");
    }

    @Test
    void wouldCreateCycle_unrelatedEdge_isFalse() {
        assertThat(DependencyValidator.wouldCreateCycle(edge("x", "y"), edges("a", "b", "b", "c"))).isFalse();
    }

    @Test
    void detectAllCycles_reportsClosedPaths() {
        List<List<String>> cycles = DependencyValidator.detectAllCycles(
            edges("a", "b", "b", "c", "c", "a", "d", "d", "e", "f"));

        assertThat(cycles).containsExactly(
            List.of("a", "b", "c", "a"),
            List.of("d", "d"));
    }

    @Test
    void detectAllCycles_acyclicGraph_isEmpty() {
        assertThat(DependencyValidator.detectAllCycles(edges("a", "b", "a", "c", "b", "c"))).isEmpty();
    }

    @Test
    void singlePointsOfFailure_highFanOutLowFanIn() {
        List<Dependency> dependencies = edges("hub", "x", "hub", "y", "up", "hub", "busy", "x", "busy", "y",
            "in1", "busy", "in2", "busy");

        assertThat(DependencyValidator.singlePointsOfFailure(dependencies, 2)).containsExactly("hub");
        assertThat(DependencyValidator.singlePointsOfFailure(dependencies, 3)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(quoteCharacter = '"', value = {
        "API, NETWORK, REQUIRES, api typically doesn't require network",
        "APPLICATION, FIREWALL, USES, application typically doesn't use firewall",
        "LOAD_BALANCER, DATABASE, FEEDS, load-balancer typically doesn't feed database",
        "DATABASE, API, MONITORS, database typically doesn't monitor api"
    })
    void validateDependencyType_implausibleCombination_warns(ComponentType source, ComponentType target,
                                                             DependencyType type, String expected) {
        assertThat(DependencyValidator.validateDependencyType(source, target, type)).containsExactly(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "API, DATABASE, REQUIRES",
        "LOAD_BALANCER, SERVER, FEEDS",
        "DATABASE, SERVER, MONITORS",
        "API, DATABASE, FEEDS",
        "SERVER, LICENSE, REQUIRES"
    })
    void validateDependencyType_plausibleOrUncovered_isSilent(ComponentType source, ComponentType target,
                                                              DependencyType type) {
        assertThat(DependencyValidator.validateDependencyType(source, target, type)).isEmpty();
    }
}
