package com.vidnyan.codegraph.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DiffResultTest {

    @Test
    void build_ShouldFoldAddedAndDeletedPathIntoModified() {
        DiffResult diff = DiffResult.builder()
                .deleted("src/a.ts")
                .added("src/a.ts")
                .added("src/c.ts")
                .build();

        assertEquals(Set.of("src/a.ts"), diff.modified());
        assertEquals(Set.of("src/c.ts"), diff.added());
        assertTrue(diff.deleted().isEmpty());
        assertEquals(2, diff.totalChanges());
    }

    @Test
    void setsShouldBePairwiseDisjoint() {
        DiffResult diff = DiffResult.builder()
                .added("x.py")
                .modified("x.py")
                .deleted("y.py")
                .modified("y.py")
                .build();

        assertEquals(Set.of("x.py", "y.py"), diff.modified());
        assertTrue(diff.added().isEmpty());
        assertTrue(diff.deleted().isEmpty());
    }

    @Test
    void addedOrModified_ShouldBeSorted() {
        DiffResult diff = DiffResult.builder().added("b.ts").modified("a.ts").deleted("c.ts").build();

        assertEquals(List.of("a.ts", "b.ts"), List.copyOf(diff.addedOrModified()));
        assertEquals(Set.of("a.ts", "c.ts"), diff.changedOrDeleted());
    }

    @Test
    void empty_ShouldHaveNoChanges() {
        DiffResult diff = DiffResult.empty(true);

        assertTrue(diff.isEmpty());
        assertTrue(diff.isGitRepo());
        assertEquals(0, diff.totalChanges());
    }
}
