package com.itiac.core.snapshot;

import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.snapshot.SnapshotDocument.ComponentDocument;
import com.itiac.core.snapshot.SnapshotDocument.StepDocument;
import com.itiac.core.snapshot.SnapshotDocument.WorkflowDocument;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SnapshotConverter}.
 */
class SnapshotConverterTest {

    private final SnapshotConverter converter = new SnapshotConverter();

    private static ComponentDocument componentDoc(String id, String status, String lastModified) {
        return new ComponentDocument(id, id, "server", status, "medium", null, null, null, null, lastModified, null);
    }

    @Test
    void convert_nullDocument_isRejected() {
        assertThatThrownBy(() -> converter.convert(null))
            .isInstanceOf(SnapshotValidationException.class)
            .hasMessageContaining("document is empty");
    }

    @Test
    void convert_missingSections_yieldEmptySnapshot() {
        InfrastructureSnapshot snapshot = converter.convert(new SnapshotDocument(null, null, null));

        assertThat(snapshot).isEqualTo(InfrastructureSnapshot.empty());
    }

    @Test
    void convert_statusIsCaseInsensitive() {
        InfrastructureSnapshot snapshot = converter.convert(
            new SnapshotDocument(List.of(componentDoc("a", "OFFLINE", null)), null, null));

        assertThat(snapshot.offlineComponentIds()).containsExactly("a");
    }

    @Test
    void convert_nonIsoTimestamp_isAViolation() {
        SnapshotDocument document = new SnapshotDocument(
            List.of(componentDoc("a", "online", "yesterday")), null, null);

        assertThatThrownBy(() -> converter.convert(document))
            .isInstanceOf(SnapshotValidationException.class)
            .hasMessage("Invalid snapshot (1 violation(s)): components[0].lastModified: not an ISO-8601 instant: yesterday");
    }

    @Test
    void convert_nullEntries_areViolations() {
        SnapshotDocument document = new SnapshotDocument(
            Arrays.asList(componentDoc("a", "online", null), null), null,
            List.of(new WorkflowDocument("w", "W", null, null, "low", null, null,
                Arrays.asList((StepDocument) null))));

        assertThatThrownBy(() -> converter.convert(document))
            .isInstanceOf(SnapshotValidationException.class)
            .hasMessageContaining("components[1]: entry is null")
            .hasMessageContaining("workflows[0].steps[0]: entry is null");
    }

    @Test
    void convert_nullOrBlankStepComponentIds_areViolations() {
        StepDocument step = new StepDocument("s", "S", null, 1, null,
            Arrays.asList("a", null), List.of(" "), null);
        SnapshotDocument document = new SnapshotDocument(null, null,
            List.of(new WorkflowDocument("w", "W", null, null, "low", null, null, List.of(step))));

        SnapshotValidationException exception = catchThrowableOfType(
            () -> converter.convert(document), SnapshotValidationException.class);

        assertThat(exception.violations()).containsExactly(
            "workflows[0].steps[0].primaryComponentIds[1]: null entry",
            "workflows[0].steps[0].alternativeComponentIds[0]: blank entry");
    }

    @Test
    void convert_blankRequiredString_isMissing() {
        SnapshotDocument document = new SnapshotDocument(List.of(componentDoc(" ", "online", null)), null, null);

        assertThatThrownBy(() -> converter.convert(document))
            .hasMessageContaining("components[0].id: required field is missing");
    }
}
