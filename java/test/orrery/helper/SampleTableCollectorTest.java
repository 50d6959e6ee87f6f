package orrery.helper;

import orrery.ephemeris.BodySample;
import orrery.ephemeris.EphemerisFileReader;
import orrery.ephemeris.EphemerisFileWriter;
import orrery.ephemeris.EphemerisStore;
import orrery.ephemeris.OutOfRangeException;
import orrery.provider.BodyState;
import orrery.provider.EphemerisBodyStateProvider;
import orrery.provider.KeplerianBodyStateProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SampleTableCollectorTest {

    private static final double START = 2460676.5;
    private static final List<String> BODIES = Arrays.asList("Sun", "Mars", "Jupiter");

    private final KeplerianBodyStateProvider keplerian = new KeplerianBodyStateProvider();

    @Test
    void collectRowsTest() {
        SampleTableCollector collector = new SampleTableCollector(keplerian, BODIES);
        assertEquals(61, collector.collect(START, START + 60.0, 1.0));
        assertEquals(61, collector.getCount());

        double[][] rows = collector.getResults();
        assertEquals(1 + 3 * EphemerisStore.CHANNEL_COUNT, rows[0].length);
        assertEquals(START + 60.0, rows[60][0], 1e-9);
        // 太阳的日心通道写 0
        assertEquals(0.0, rows[0][1 + EphemerisStore.DIST_SUN], 0.0);
        assertEquals(0.0, rows[0][1 + EphemerisStore.ECLIPTIC_LON], 0.0);

        Map<String, List<BodySample>> samples = collector.getSamples();
        assertEquals(BODIES, new ArrayList<>(samples.keySet()));
        BodyState mars = keplerian.getBodyState("Mars", START + 10.0);
        assertEquals(mars.getRa(), samples.get("Mars").get(10).getRa(), 1e-12);
        assertEquals(mars.getDistSun(), samples.get("Mars").get(10).getDistSun(), 1e-12);

        collector.clear();
        assertEquals(0, collector.getCount());
    }

    @Test
    void interpolatedMatchesSourceTest() {
        SampleTableCollector collector = new SampleTableCollector(keplerian, BODIES);
        collector.collect(START, START + 60.0, 1.0);
        EphemerisStore store = new EphemerisStore();
        collector.loadInto(store);

        EphemerisBodyStateProvider interpolated = new EphemerisBodyStateProvider(store);
        double jd = START + 30.5;
        assertEquals(keplerian.getBodyState("Jupiter", jd).getRa(), interpolated.getBodyState("Jupiter", jd).getRa(), 1e-4);
        assertEquals(keplerian.getBodyState("Mars", jd).getDec(), interpolated.getBodyState("Mars", jd).getDec(), 1e-4);
        assertEquals(keplerian.getBodyState("Earth", jd).getDistSun(),
                     interpolated.getBodyState("Earth", jd).getDistSun(), 1e-6);
        assertThrows(OutOfRangeException.class, () -> interpolated.getBodyState("Mars", START + 61.0));
    }

    @Test
    void fileRoundTripTest(@TempDir Path dir) throws IOException {
        SampleTableCollector collector = new SampleTableCollector(keplerian, BODIES);
        collector.collect(START, START + 10.0, 0.5);
        Path file = dir.resolve("planets.bin");
        new EphemerisFileWriter(BODIES).write(file, collector.getSamples());

        EphemerisStore store = new EphemerisStore();
        assertEquals(21, new EphemerisFileReader(BODIES).read(file, store));
        assertEquals(collector.getSamples().get("Jupiter").get(7), store.getSample("Jupiter", 7));
    }

    @Test
    void invalidArgumentsTest() {
        assertThrows(IllegalArgumentException.class, () -> new SampleTableCollector(keplerian, Collections.emptyList()));
        SampleTableCollector collector = new SampleTableCollector(keplerian, BODIES);
        assertThrows(IllegalArgumentException.class, () -> collector.collect(START, START + 1.0, 0.0));
    }
}
