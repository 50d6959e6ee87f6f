package orrery.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RefractionTest {

    @Test
    void horizonRefractionTest() {
        assertEquals(0.483, Refraction.apparentFromTrue(0.0), 0.001);
    }

    @Test
    void inverseConsistencyTest() {
        double apparent = Refraction.apparentFromTrue(10.0);
        assertEquals(10.0, Refraction.trueFromApparent(apparent), 0.005);
    }

    @Test
    void belowLimitUnchangedTest() {
        assertEquals(-5.0, Refraction.apparentFromTrue(-5.0), 0.0);
        assertEquals(-5.0, Refraction.trueFromApparent(-5.0), 0.0);
    }
}
