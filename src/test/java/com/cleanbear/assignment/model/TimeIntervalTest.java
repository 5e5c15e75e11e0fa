package com.cleanbear.assignment.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimeIntervalTest {

    @Test
    void testTouchingIntervalsDoNotOverlapWithoutBuffer() {
        assertFalse(new TimeInterval(540, 600).overlaps(new TimeInterval(600, 660), 0));
    }

    @Test
    void testBufferWidensBothSides() {
        TimeInterval booked = new TimeInterval(600, 720);

        assertTrue(new TimeInterval(740, 800).overlaps(booked, 30));
        assertFalse(new TimeInterval(750, 800).overlaps(booked, 30));
        assertTrue(new TimeInterval(500, 580).overlaps(booked, 30));
        assertFalse(new TimeInterval(500, 570).overlaps(booked, 30));
    }

    @Test
    void testRejectsBackwardsInterval() {
        assertThrows(IllegalArgumentException.class, () -> new TimeInterval(600, 540));
    }

    @Test
    void testToStringUsesClockTime() {
        assertEquals("09:00-25:30", new TimeInterval(540, 1530).toString());
    }

    @Test
    void testSlotTypeParsing() {
        assertEquals(SlotType.MORNING, SlotType.parse("오전"));
        assertEquals(SlotType.AFTERNOON, SlotType.parse(" afternoon "));
        assertEquals(SlotType.ALLDAY, SlotType.parse("상관없음"));
        assertNull(SlotType.parse("새벽"));
    }
}
