package superdarn.fov;

import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 视场判定结果
 *
 * 按处理顺序保存所有判定后的波束，并记录被跳过的扫描/波束和处理统计。
 */
public class BackscatterResult {

    private final List<ResolvedBeam> beams;
    private final List<ProcessingIssue> issues;
    private final ProcessingStatistics statistics;

    public BackscatterResult() {
        this.beams = new ArrayList<>();
        this.issues = new ArrayList<>();
        this.statistics = new ProcessingStatistics();
    }

    /**
     * 添加一次扫描的判定结果
     */
    public void addScan(List<ResolvedBeam> scanBeams) {
        beams.addAll(scanBeams);
        statistics.incrementProcessedScans();
        for (ResolvedBeam b : scanBeams) {
            statistics.addPoints(b.getPoints().size());
        }
    }

    /**
     * 记录被跳过的数据
     */
    public void addIssue(Instant time, int beamNumber, String type, String message) {
        issues.add(new ProcessingIssue(time, beamNumber, type, message));
        statistics.incrementIssueCount();
    }

    /**
     * 按处理顺序排列的全部波束
     */
    public List<ResolvedBeam> getBeams() {
        return Collections.unmodifiableList(beams);
    }

    /**
     * 按波束号分组的波束，组内按时间排列
     */
    public Map<Integer, List<ResolvedBeam>> getBeamsByNumber() {
        Map<Integer, List<ResolvedBeam>> map = new TreeMap<>();
        for (ResolvedBeam b : beams) {
            map.computeIfAbsent(b.getBeamNumber(), k -> new ArrayList<>()).add(b);
        }
        return map;
    }

    public List<ProcessingIssue> getIssues() {
        return new ArrayList<>(issues);
    }

    public ProcessingStatistics getStatistics() {
        return statistics;
    }

    /**
     * 统计当前各视场标志的点数
     *
     * @return {前视场, 后视场, 未确定}
     */
    public int[] countFieldOfView() {
        int[] counts = new int[3];
        for (ResolvedBeam b : beams) {
            for (ResolvedPoint p : b.getPoints()) {
                if (p.getFovFlag() == 1) {
                    counts[0]++;
                } else if (p.getFovFlag() == -1) {
                    counts[1]++;
                } else {
                    counts[2]++;
                }
            }
        }
        return counts;
    }

    /**
     * 处理统计内部类
     */
    public static class ProcessingStatistics {
        private int beamsRead = 0;
        private int processedScans = 0;
        private int skippedScans = 0;
        private int skippedBeams = 0;
        private int totalPoints = 0;
        private int issueCount = 0;
        private long processingTimeMs = 0;

        public void incrementBeamsRead() { this.beamsRead++; }
        public void incrementProcessedScans() { this.processedScans++; }
        public void incrementSkippedScans() { this.skippedScans++; }
        public void incrementSkippedBeams() { this.skippedBeams++; }
        public void addPoints(int count) { this.totalPoints += count; }
        public void incrementIssueCount() { this.issueCount++; }
        public void setProcessingTimeMs(long time) { this.processingTimeMs = time; }

        public int getBeamsRead() { return beamsRead; }
        public int getProcessedScans() { return processedScans; }
        public int getSkippedScans() { return skippedScans; }
        public int getSkippedBeams() { return skippedBeams; }
        public int getTotalPoints() { return totalPoints; }
        public int getIssueCount() { return issueCount; }
        public long getProcessingTimeMs() { return processingTimeMs; }

        @Override
        public String toString() {
            return String.format("ProcessingStatistics{beams=%d, scans=%d, skippedScans=%d, skippedBeams=%d, "
                + "points=%d, issues=%d, time=%dms}", beamsRead, processedScans, skippedScans, skippedBeams,
                totalPoints, issueCount, processingTimeMs);
        }
    }

    /**
     * 被跳过数据的说明内部类
     */
    public static class ProcessingIssue {
        private final Instant time;
        private final int beamNumber;
        private final String type;
        private final String message;

        public ProcessingIssue(Instant time, int beamNumber, String type, String message) {
            this.time = time;
            this.beamNumber = beamNumber;
            this.type = type;
            this.message = message;
        }

        public Instant getTime() { return time; }
        public int getBeamNumber() { return beamNumber; }
        public String getType() { return type; }
        public String getMessage() { return message; }
    }
}
