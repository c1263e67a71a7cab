package treelock.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OperationRequest validation and normalization.
 */
class OperationRequestTest {

    @Test
    void normalizesVerbAndTarget() {
        OperationRequest request = OperationRequest.builder()
                .verb("  Worktree Add ")
                .target("  ")
                .callerId("main")
                .build();

        assertEquals("worktree", request.verb());
        assertNull(request.targetScopeHint());
        assertEquals(OperationRequest.DEFAULT_PRIORITY, request.priority());
        assertNotNull(request.id());
        assertNotNull(request.submittedAt());
    }

    @Test
    void rejectsPriorityOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> OperationRequest.builder()
                .verb("commit").callerId("wt1").priority(0).build());
        assertThrows(IllegalArgumentException.class, () -> OperationRequest.builder()
                .verb("commit").callerId("wt1").priority(11).build());
    }

    @Test
    void requiresVerbAndCaller() {
        assertThrows(NullPointerException.class, () -> OperationRequest.builder().callerId("wt1").build());
        assertThrows(IllegalArgumentException.class, () -> OperationRequest.builder()
                .verb("   ").callerId("wt1").build());
        assertThrows(IllegalArgumentException.class, () -> OperationRequest.builder()
                .verb("commit").callerId(" ").build());
    }
}
