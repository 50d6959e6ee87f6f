package orrery.eclipse.model;

import orrery.geometry.JulianDates;

import org.orekit.utils.Constants;

import java.io.Serializable;

/**
 * 月食食表中的一条记录
 *
 * 日期按 year * 0x10000 + month * 0x100 + day 打包；时间字段以秒计，历时字段以分钟计。
 */
public class LunarEclipseRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int packedDate;
    private final float greatestEclipseTd;
    private final int deltaT;
    private final short saros;
    private final LunarEclipseType type;
    private final float penumbralMagnitude;
    private final float umbralMagnitude;
    private final float penumbralDuration;
    private final float partialDuration;
    private final float totalDuration;
    private final short zenithLatitude;
    private final short zenithLongitude;

    private LunarEclipseRecord(Builder builder) {
        this.packedDate = builder.packedDate;
        this.greatestEclipseTd = builder.greatestEclipseTd;
        this.deltaT = builder.deltaT;
        this.saros = builder.saros;
        this.type = builder.type;
        this.penumbralMagnitude = builder.penumbralMagnitude;
        this.umbralMagnitude = builder.umbralMagnitude;
        this.penumbralDuration = builder.penumbralDuration;
        this.partialDuration = builder.partialDuration;
        this.totalDuration = builder.totalDuration;
        this.zenithLatitude = builder.zenithLatitude;
        this.zenithLongitude = builder.zenithLongitude;
    }

    public static Builder builder(int packedDate, LunarEclipseType type) {
        return new Builder(packedDate, type);
    }

    /**
     * 打包日期
     */
    public static int packDate(int year, int month, int day) {
        return year * 0x10000 + month * 0x100 + day;
    }

    public int getYear() {
        return packedDate / 0x10000;
    }

    public int getMonth() {
        return (packedDate & 0xff00) / 0x100;
    }

    public int getDay() {
        return packedDate & 0xff;
    }

    /**
     * 食甚时刻（UT 儒略日）
     */
    public double getGreatestEclipseUt() {
        return JulianDates.fromCalendar(getYear(), getMonth(), getDay(), 0.0)
               + (greatestEclipseTd - deltaT) / Constants.JULIAN_DAY;
    }

    /**
     * 日-月-年，公元前年份加 " BC"
     */
    public String formatDate() {
        int year = getYear();
        return String.format("%02d-%02d-%04d", getDay(), getMonth(), Math.abs(year)) + (year < 0 ? " BC" : "");
    }

    // Getters
    public int getPackedDate() {
        return packedDate;
    }

    public float getGreatestEclipseTd() {
        return greatestEclipseTd;
    }

    public int getDeltaT() {
        return deltaT;
    }

    public short getSaros() {
        return saros;
    }

    public LunarEclipseType getType() {
        return type;
    }

    public float getPenumbralMagnitude() {
        return penumbralMagnitude;
    }

    public float getUmbralMagnitude() {
        return umbralMagnitude;
    }

    public float getPenumbralDuration() {
        return penumbralDuration;
    }

    public float getPartialDuration() {
        return partialDuration;
    }

    public float getTotalDuration() {
        return totalDuration;
    }

    public short getZenithLatitude() {
        return zenithLatitude;
    }

    public short getZenithLongitude() {
        return zenithLongitude;
    }

    @Override
    public String toString() {
        return "LunarEclipseRecord{" +
                "date=" + formatDate() +
                ", type=" + type +
                ", saros=" + saros +
                ", penMag=" + penumbralMagnitude +
                ", umbMag=" + umbralMagnitude +
                ", penDur=" + penumbralDuration +
                ", parDur=" + partialDuration +
                ", totDur=" + totalDuration +
                '}';
    }

    /**
     * 构建器
     */
    public static class Builder {
        private final int packedDate;
        private final LunarEclipseType type;
        private float greatestEclipseTd;
        private int deltaT;
        private short saros;
        private float penumbralMagnitude;
        private float umbralMagnitude;
        private float penumbralDuration;
        private float partialDuration;
        private float totalDuration;
        private short zenithLatitude;
        private short zenithLongitude;

        private Builder(int packedDate, LunarEclipseType type) {
            this.packedDate = packedDate;
            this.type = type;
        }

        public Builder greatestEclipse(float tdSeconds, int deltaTSeconds) {
            this.greatestEclipseTd = tdSeconds;
            this.deltaT = deltaTSeconds;
            return this;
        }

        public Builder saros(short saros) {
            this.saros = saros;
            return this;
        }

        public Builder magnitudes(float penumbral, float umbral) {
            this.penumbralMagnitude = penumbral;
            this.umbralMagnitude = umbral;
            return this;
        }

        public Builder durations(float penumbral, float partial, float total) {
            this.penumbralDuration = penumbral;
            this.partialDuration = partial;
            this.totalDuration = total;
            return this;
        }

        public Builder zenith(short latitude, short longitude) {
            this.zenithLatitude = latitude;
            this.zenithLongitude = longitude;
            return this;
        }

        public LunarEclipseRecord build() {
            return new LunarEclipseRecord(this);
        }
    }
}
