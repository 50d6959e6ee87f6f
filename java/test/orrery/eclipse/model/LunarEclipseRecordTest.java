package orrery.eclipse.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LunarEclipseRecordTest {

    @Test
    void packedDateTest() {
        LunarEclipseRecord r = LunarEclipseRecord.builder(LunarEclipseRecord.packDate(1997, 9, 16),
                                                          LunarEclipseType.TOTAL).build();
        assertEquals(1997, r.getYear());
        assertEquals(9, r.getMonth());
        assertEquals(16, r.getDay());
        assertEquals("16-09-1997", r.formatDate());
    }

    @Test
    void typeCodeTest() {
        assertEquals(LunarEclipseType.PENUMBRAL, LunarEclipseType.fromCode(0));
        assertEquals(LunarEclipseType.PARTIAL, LunarEclipseType.fromCode(1));
        assertEquals(LunarEclipseType.TOTAL, LunarEclipseType.fromCode(2));
        assertEquals("Total", LunarEclipseType.TOTAL.getDisplayName());
        assertThrows(IllegalArgumentException.class, () -> LunarEclipseType.fromCode(5));
    }
}
