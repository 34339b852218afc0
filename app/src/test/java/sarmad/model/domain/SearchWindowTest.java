package sarmad.model.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static sarmad.model.Fixtures.at;

class SearchWindowTest {

    private final SearchWindow window = new SearchWindow(at("14:00"), at("15:00"));

    @Test
    void containsIsHalfOpen() {
        assertTrue(window.contains(at("14:00")));
        assertTrue(window.contains(at("14:59")));
        assertFalse(window.contains(at("15:00")));
        assertFalse(window.contains(null));
    }

    @Test
    void halvesShareTheMidpoint() {
        assertEquals(at("14:30"), window.midpoint());
        assertEquals(new SearchWindow(at("14:00"), at("14:30")), window.leftHalf());
        assertEquals(new SearchWindow(at("14:30"), at("15:00")), window.rightHalf());
        assertTrue(window.leftHalf().within(window));
        assertEquals(Duration.ofMinutes(30), window.rightHalf().duration());
    }

    @Test
    void rejectsEmptyOrInvertedWindow() {
        assertThrows(IllegalArgumentException.class, () -> new SearchWindow(at("15:00"), at("15:00")));
        assertThrows(IllegalArgumentException.class, () -> new SearchWindow(at("15:00"), at("14:00")));
    }
}
