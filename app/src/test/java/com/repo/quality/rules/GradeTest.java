package com.repo.quality.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradeTest {

    @Test
    void testLowerBoundsAreInclusive() {
        assertEquals(Grade.S, Grade.fromTotal(100));
        assertEquals(Grade.S, Grade.fromTotal(90));
        assertEquals(Grade.A, Grade.fromTotal(89.9));
        assertEquals(Grade.A, Grade.fromTotal(80));
        assertEquals(Grade.B, Grade.fromTotal(79.99));
        assertEquals(Grade.B, Grade.fromTotal(70));
        assertEquals(Grade.C, Grade.fromTotal(69));
        assertEquals(Grade.C, Grade.fromTotal(60));
        assertEquals(Grade.D, Grade.fromTotal(59.9));
        assertEquals(Grade.D, Grade.fromTotal(0));
    }

    @Test
    void testEveryGradeIsDescribed() {
        for (Grade grade : Grade.values()) {
            assertFalse(grade.getDescription().isBlank(), grade.name());
        }
        assertEquals(90, Grade.S.getMinTotal());
    }
}
