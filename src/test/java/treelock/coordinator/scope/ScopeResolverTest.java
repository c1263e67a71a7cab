package treelock.coordinator.scope;

import org.junit.jupiter.api.Test;
import treelock.coordinator.model.OperationRequest;
import treelock.coordinator.model.Scope;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the verb to scope table.
 */
class ScopeResolverTest {

    private final ScopeResolver resolver = new ScopeResolver();

    @Test
    void sharedRefVerbsAreGlobal() {
        for (String verb : new String[] {"merge", "pull", "fetch", "push", "branch", "tag", "worktree", "gc"}) {
            assertEquals(Scope.global(), resolver.resolve(verb, "wt1"), verb);
        }
    }

    @Test
    void worktreeVerbsUseTheTarget() {
        for (String verb : new String[] {"add", "commit", "checkout", "reset", "status", "diff"}) {
            assertEquals(Scope.worktree("wt1"), resolver.resolve(verb, "wt1"), verb);
        }
    }

    @Test
    void normalizesVerbs() {
        assertEquals(Scope.worktree("wt1"), resolver.resolve("  COMMIT -m x", "wt1"));
        assertEquals(Scope.global(), resolver.resolve("Worktree add", "wt1"));
    }

    @Test
    void unknownOrUntargetedFallsBackToGlobal() {
        assertEquals(Scope.global(), resolver.resolve("frobnicate", "wt1"));
        assertEquals(Scope.global(), resolver.resolve("commit", null));
        assertEquals(Scope.global(), resolver.resolve("commit", "bad/id"));
        assertEquals(Scope.global(), resolver.resolve(null, "wt1"));
        assertEquals(Scope.global(), resolver.resolve("", "wt1"));
        assertFalse(resolver.isKnownVerb("frobnicate"));
        assertTrue(resolver.isKnownVerb("Commit"));
    }

    @Test
    void resolvesRequests() {
        OperationRequest request = OperationRequest.builder().verb("commit").target("feature-2").callerId("x").build();
        assertEquals(Scope.worktree("feature-2"), resolver.resolve(request));
    }
}
