package orrery.eclipse;

import orrery.eclipse.model.LunarEclipseRecord;
import orrery.eclipse.model.LunarEclipseType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * 月食食表读取器
 *
 * 文件为无文件头的小端定长记录，每条 39 字节：
 * int 日期, float 食甚力学时(秒), int ΔT(秒), short 沙罗序号, byte 类型,
 * float 半影食分, float 本影食分, float 半影/部分/全食历时(分钟), short 食甚天顶纬度, short 天顶经度
 */
public class LunarEclipseCanonReader {

    private static final Logger logger = Logger.getLogger(LunarEclipseCanonReader.class.getName());

    /** 每条记录的字节数 */
    public static final int RECORD_SIZE = 39;

    /**
     * 读取食表文件
     *
     * @throws IOException 读取失败或记录损坏
     */
    public List<LunarEclipseRecord> read(Path path) throws IOException {
        return read(Files.readAllBytes(path), path.toString());
    }

    /**
     * 从流读取（流由调用方关闭）
     */
    public List<LunarEclipseRecord> read(InputStream in) throws IOException {
        return read(in.readAllBytes(), "stream");
    }

    private List<LunarEclipseRecord> read(byte[] bytes, String source) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int count = bytes.length / RECORD_SIZE;
        int trailingBytes = bytes.length - count * RECORD_SIZE;
        if (trailingBytes > 0) {
            logger.warning(source + ": ignoring " + trailingBytes + " trailing bytes (partial record)");
        }

        List<LunarEclipseRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(readRecord(buffer, source, i));
        }
        logger.info(String.format("%s: loaded %d lunar eclipses", source, count));
        return records;
    }

    private static LunarEclipseRecord readRecord(ByteBuffer buffer, String source, int index) throws IOException {
        int date = buffer.getInt();
        float td = buffer.getFloat();
        int deltaT = buffer.getInt();
        short saros = buffer.getShort();
        byte typeByte = buffer.get();
        float penMag = buffer.getFloat();
        float umbMag = buffer.getFloat();
        float penDur = buffer.getFloat();
        float parDur = buffer.getFloat();
        float totDur = buffer.getFloat();
        short zenithLat = buffer.getShort();
        short zenithLon = buffer.getShort();

        LunarEclipseType type;
        try {
            type = LunarEclipseType.fromCode(typeByte & 0x0f);
        } catch (IllegalArgumentException e) {
            throw new IOException(source + ": corrupt record " + index, e);
        }
        return LunarEclipseRecord.builder(date, type)
                .greatestEclipse(td, deltaT)
                .saros(saros)
                .magnitudes(penMag, umbMag)
                .durations(penDur, parDur, totDur)
                .zenith(zenithLat, zenithLon)
                .build();
    }

    /**
     * 把记录编码成同样的二进制格式
     */
    public static byte[] encode(List<LunarEclipseRecord> records) {
        ByteBuffer buffer = ByteBuffer.allocate(records.size() * RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        for (LunarEclipseRecord r : records) {
            buffer.putInt(r.getPackedDate())
                  .putFloat(r.getGreatestEclipseTd())
                  .putInt(r.getDeltaT())
                  .putShort(r.getSaros())
                  .put((byte) r.getType().getCode())
                  .putFloat(r.getPenumbralMagnitude())
                  .putFloat(r.getUmbralMagnitude())
                  .putFloat(r.getPenumbralDuration())
                  .putFloat(r.getPartialDuration())
                  .putFloat(r.getTotalDuration())
                  .putShort(r.getZenithLatitude())
                  .putShort(r.getZenithLongitude());
        }
        return buffer.array();
    }
}
