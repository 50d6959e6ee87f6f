package orrery.eclipse;

import orrery.eclipse.model.LunarEclipseRecord;
import orrery.eclipse.model.LunarEclipseType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LunarEclipseCanonReaderTest {

    private final LunarEclipseCanonReader reader = new LunarEclipseCanonReader();

    @Test
    void readFileTest(@TempDir Path dir) throws IOException {
        List<LunarEclipseRecord> canon = Arrays.asList(TestCanon.total2022(), TestCanon.penumbral2023());
        Path file = dir.resolve("lunar.bin");
        Files.write(file, LunarEclipseCanonReader.encode(canon));
        assertEquals(2 * LunarEclipseCanonReader.RECORD_SIZE, Files.size(file));

        List<LunarEclipseRecord> records = reader.read(file);
        assertEquals(2, records.size());
        LunarEclipseRecord total = records.get(0);
        assertEquals(2022, total.getYear());
        assertEquals(11, total.getMonth());
        assertEquals(8, total.getDay());
        assertEquals(LunarEclipseType.TOTAL, total.getType());
        assertEquals(39551.0f, total.getGreatestEclipseTd());
        assertEquals(70, total.getDeltaT());
        assertEquals((short) 136, total.getSaros());
        assertEquals(84.9f, total.getTotalDuration());
        assertEquals((short) -169, total.getZenithLongitude());
        assertEquals(LunarEclipseType.PENUMBRAL, records.get(1).getType());
    }

    @Test
    void trailingBytesIgnoredTest() throws IOException {
        byte[] encoded = LunarEclipseCanonReader.encode(Collections.singletonList(TestCanon.partial2023()));
        byte[] padded = Arrays.copyOf(encoded, encoded.length + 7);
        List<LunarEclipseRecord> records = reader.read(new ByteArrayInputStream(padded));
        assertEquals(1, records.size());
        assertEquals(LunarEclipseType.PARTIAL, records.get(0).getType());
    }

    @Test
    void corruptTypeTest() {
        byte[] encoded = LunarEclipseCanonReader.encode(Collections.singletonList(TestCanon.total2022()));
        // 类型字节位于 date(4) + td(4) + deltaT(4) + saros(2) 之后
        encoded[14] = 7;
        assertThrows(IOException.class, () -> reader.read(new ByteArrayInputStream(encoded)));
    }

    @Test
    void missingFileTest(@TempDir Path dir) {
        assertThrows(IOException.class, () -> reader.read(dir.resolve("absent.bin")));
    }
}
