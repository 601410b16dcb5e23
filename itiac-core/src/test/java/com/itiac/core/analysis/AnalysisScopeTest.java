package com.itiac.core.analysis;

import com.itiac.core.SnapshotTestBase;
import com.itiac.core.model.Component;
import com.itiac.core.model.ComponentStatus;
import com.itiac.core.model.Criticality;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AnalysisScope}.
 */
class AnalysisScopeTest extends SnapshotTestBase {

    private final List<Component> components = List.of(
        online("a"),
        offline("b"),
        component("c", ComponentStatus.MAINTENANCE, Criticality.LOW),
        component("d", ComponentStatus.WARNING, Criticality.LOW));

    @Test
    void select_nonOnline_includesEveryNonOnlineStatus() {
        assertThat(AnalysisScope.nonOnline().select(components)).containsExactly("b", "c", "d");
    }

    @Test
    void select_allComponents_keepsSnapshotOrder() {
        assertThat(AnalysisScope.allComponents().select(components)).containsExactly("a", "b", "c", "d");
    }

    @Test
    void select_single_returnsIdEvenWhenUnknown() {
        assertThat(AnalysisScope.single("zzz").select(components)).containsExactly("zzz");
    }

    @Test
    void constructor_singleWithoutId_isRejected() {
        assertThatThrownBy(() -> new AnalysisScope(AnalysisScope.Mode.SINGLE, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_idWithoutSingleMode_isRejected() {
        assertThatThrownBy(() -> new AnalysisScope(AnalysisScope.Mode.ALL_COMPONENTS, "a"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
