package superdarn.fov.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单波束观测记录
 *
 * 一次探测中沿某个波束所有距离门的拟合数据，以及计算斜距所需的雷达参数。
 * 干涉仪数据是否可用在构造时检查一次（{@link #hasInterferometerData()}）。
 */
public class RadarBeam {

    private final int stationId;
    private final Instant time;
    private final int beamNumber;
    private final int programId;              // 雷达程序号 cp
    private final double transmitFrequency;   // 发射频率（kHz）
    private final double firstLagRange;       // lagfr（微秒）
    private final double sampleSeparation;    // smsep（微秒）
    private final double integrationSeconds;  // inttsc（秒）
    private final double integrationMicros;   // inttus（微秒）
    private final int rangeGateCount;         // nrang
    private final boolean interferometerData; // xcf
    private final Double tdiff;               // 可选的tdiff覆盖值（微秒）
    private final Double tdiffError;
    private final List<BackscatterPoint> points;

    private RadarBeam(Builder builder) {
        this.stationId = builder.stationId;
        this.time = builder.time;
        this.beamNumber = builder.beamNumber;
        this.programId = builder.programId;
        this.transmitFrequency = builder.transmitFrequency;
        this.firstLagRange = builder.firstLagRange;
        this.sampleSeparation = builder.sampleSeparation;
        this.integrationSeconds = builder.integrationSeconds;
        this.integrationMicros = builder.integrationMicros;
        this.rangeGateCount = builder.rangeGateCount;
        this.interferometerData = builder.interferometerData;
        this.tdiff = builder.tdiff;
        this.tdiffError = builder.tdiffError;
        this.points = Collections.unmodifiableList(new ArrayList<>(builder.points));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前记录为模板创建构建器（用于替换tdiff等参数）
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.stationId = stationId;
        b.time = time;
        b.beamNumber = beamNumber;
        b.programId = programId;
        b.transmitFrequency = transmitFrequency;
        b.firstLagRange = firstLagRange;
        b.sampleSeparation = sampleSeparation;
        b.integrationSeconds = integrationSeconds;
        b.integrationMicros = integrationMicros;
        b.rangeGateCount = rangeGateCount;
        b.interferometerData = interferometerData;
        b.tdiff = tdiff;
        b.tdiffError = tdiffError;
        b.points = new ArrayList<>(points);
        return b;
    }

    public int getStationId() { return stationId; }
    public Instant getTime() { return time; }
    public int getBeamNumber() { return beamNumber; }
    public int getProgramId() { return programId; }
    public double getTransmitFrequency() { return transmitFrequency; }
    public double getFirstLagRange() { return firstLagRange; }
    public double getSampleSeparation() { return sampleSeparation; }
    public int getRangeGateCount() { return rangeGateCount; }
    public Double getTdiff() { return tdiff; }
    public Double getTdiffError() { return tdiffError; }
    public List<BackscatterPoint> getPoints() { return points; }

    /**
     * @return 单波束驻留时间
     */
    public Duration getIntegrationTime() {
        long nanos = Math.round(integrationSeconds * 1.0e9 + integrationMicros * 1.0e3);
        return Duration.ofNanos(nanos);
    }

    /**
     * @return 是否含有可用于计算仰角的干涉仪数据
     */
    public boolean hasInterferometerData() {
        return interferometerData && !points.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RadarBeam{stid=%d, time=%s, beam=%d, cp=%d, tfreq=%.0f, points=%d}",
            stationId, time, beamNumber, programId, transmitFrequency, points.size());
    }

    /**
     * 波束记录构建器
     */
    public static class Builder {
        private int stationId;
        private Instant time;
        private int beamNumber;
        private int programId;
        private double transmitFrequency;
        private double firstLagRange = 1200.0;
        private double sampleSeparation = 300.0;
        private double integrationSeconds = 3.0;
        private double integrationMicros = 0.0;
        private int rangeGateCount = 75;
        private boolean interferometerData = true;
        private Double tdiff;
        private Double tdiffError;
        private List<BackscatterPoint> points = new ArrayList<>();

        public Builder stationId(int stationId) { this.stationId = stationId; return this; }
        public Builder time(Instant time) { this.time = time; return this; }
        public Builder beamNumber(int beamNumber) { this.beamNumber = beamNumber; return this; }
        public Builder programId(int programId) { this.programId = programId; return this; }
        public Builder transmitFrequency(double kHz) { this.transmitFrequency = kHz; return this; }
        public Builder firstLagRange(double micros) { this.firstLagRange = micros; return this; }
        public Builder sampleSeparation(double micros) { this.sampleSeparation = micros; return this; }
        public Builder integrationTime(double seconds, double micros) {
            this.integrationSeconds = seconds;
            this.integrationMicros = micros;
            return this;
        }
        public Builder rangeGateCount(int rangeGateCount) { this.rangeGateCount = rangeGateCount; return this; }
        public Builder interferometerData(boolean xcf) { this.interferometerData = xcf; return this; }
        public Builder tdiff(Double tdiff) { this.tdiff = tdiff; return this; }
        public Builder tdiffError(Double tdiffError) { this.tdiffError = tdiffError; return this; }
        public Builder points(List<BackscatterPoint> points) { this.points = new ArrayList<>(points); return this; }
        public Builder addPoint(BackscatterPoint point) { this.points.add(point); return this; }

        public RadarBeam build() {
            if (time == null) {
                throw new IllegalArgumentException("beam time is required");
            }
            if (transmitFrequency <= 0.0) {
                throw new IllegalArgumentException("transmit frequency must be positive: " + transmitFrequency);
            }
            if (sampleSeparation <= 0.0) {
                throw new IllegalArgumentException("sample separation must be positive: " + sampleSeparation);
            }
            return new RadarBeam(this);
        }
    }
}
