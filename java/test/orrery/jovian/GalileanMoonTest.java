package orrery.jovian;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GalileanMoonTest {

    @Test
    void fromNameTest() {
        assertEquals(GalileanMoon.IO, GalileanMoon.fromName("Io"));
        assertEquals(GalileanMoon.GANYMEDE, GalileanMoon.fromName("ganymede"));
        assertEquals(GalileanMoon.CALLISTO, GalileanMoon.fromName("CALLISTO"));
        assertThrows(IllegalArgumentException.class, () -> GalileanMoon.fromName("Amalthea"));
    }
}
