package orrery.ephemeris;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * 星历二进制文件读取器
 *
 * 文件为无文件头的小端 f64 序列，每条记录：1 个儒略日 + 每个天体 6 个通道。
 * 天体列表与通道数由调用方给出；记录数由文件长度推算。
 */
public class EphemerisFileReader {

    private static final Logger logger = Logger.getLogger(EphemerisFileReader.class.getName());

    /** 行星星历文件中的天体顺序 */
    public static final List<String> PLANET_FILE_BODIES = Collections.unmodifiableList(Arrays.asList(
            "Sun", "Mercury", "Venus", "Mars", "Jupiter", "Saturn", "Uranus", "Neptune", "Halley"));

    /** 月球星历文件中的天体 */
    public static final List<String> MOON_FILE_BODIES = Collections.singletonList("Moon");

    private final List<String> bodies;

    /**
     * @param bodies 文件中天体的列顺序
     */
    public EphemerisFileReader(List<String> bodies) {
        if (bodies.isEmpty()) {
            throw new IllegalArgumentException("At least one body is required");
        }
        this.bodies = new ArrayList<>(bodies);
    }

    /**
     * 每条记录的 double 数
     */
    public int getDoublesPerRecord() {
        return 1 + bodies.size() * EphemerisStore.CHANNEL_COUNT;
    }

    /**
     * 读取文件并载入存储
     *
     * @param path 文件路径
     * @param store 目标存储
     * @return 读取的记录数
     * @throws IOException 读取失败
     */
    public int read(Path path, EphemerisStore store) throws IOException {
        return read(Files.readAllBytes(path), store, path.toString());
    }

    /**
     * 从流读取并载入存储（流由调用方关闭）
     */
    public int read(InputStream in, EphemerisStore store) throws IOException {
        return read(in.readAllBytes(), store, "stream");
    }

    private int read(byte[] bytes, EphemerisStore store, String source) {
        DoubleBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer();

        int perRecord = getDoublesPerRecord();
        int records = buffer.capacity() / perRecord;
        long trailingBytes = bytes.length - (long) records * perRecord * Double.BYTES;
        if (trailingBytes > 0) {
            logger.warning(source + ": ignoring " + trailingBytes + " trailing bytes (partial record)");
        }

        double[] times = new double[records];
        double[][][] channels = new double[bodies.size()][records][EphemerisStore.CHANNEL_COUNT];
        for (int r = 0; r < records; r++) {
            times[r] = buffer.get();
            for (int b = 0; b < bodies.size(); b++) {
                buffer.get(channels[b][r]);
            }
        }

        for (int b = 0; b < bodies.size(); b++) {
            store.load(bodies.get(b), times, channels[b]);
        }
        logger.info(String.format("%s: loaded %d records for %d bodies", source, records, bodies.size()));
        return records;
    }
}
