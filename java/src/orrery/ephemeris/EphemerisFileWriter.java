package orrery.ephemeris;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 星历二进制文件写出器
 *
 * 写出与 {@link EphemerisFileReader} 相同的格式
 */
public class EphemerisFileWriter {

    private final List<String> bodies;

    public EphemerisFileWriter(List<String> bodies) {
        this.bodies = new ArrayList<>(bodies);
    }

    /**
     * 写出文件
     *
     * @param path 文件路径
     * @param samples 天体名 -> 采样点，各天体的采样时刻必须一致
     * @throws IOException 写入失败
     */
    public void write(Path path, Map<String, List<BodySample>> samples) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(out, samples);
        }
    }

    /**
     * 写出到流（流由调用方关闭）
     */
    public void write(OutputStream out, Map<String, List<BodySample>> samples) throws IOException {
        List<BodySample> reference = samples.get(bodies.get(0));
        if (reference == null) {
            throw new IllegalArgumentException("No samples for " + bodies.get(0));
        }
        int records = reference.size();
        for (String body : bodies) {
            List<BodySample> list = samples.get(body);
            if (list == null || list.size() != records) {
                throw new IllegalArgumentException("Sample count mismatch for " + body);
            }
        }

        int perRecord = 1 + bodies.size() * EphemerisStore.CHANNEL_COUNT;
        ByteBuffer buffer = ByteBuffer.allocate(perRecord * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int r = 0; r < records; r++) {
            buffer.clear();
            double jd = reference.get(r).getJulianDate();
            buffer.putDouble(jd);
            for (String body : bodies) {
                BodySample s = samples.get(body).get(r);
                if (s.getJulianDate() != jd) {
                    throw new IllegalArgumentException("Sample time mismatch for " + body + " at record " + r);
                }
                for (double v : s.toChannels()) {
                    buffer.putDouble(v);
                }
            }
            out.write(buffer.array(), 0, buffer.position());
        }
    }
}
