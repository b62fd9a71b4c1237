package superdarn.fov;

import superdarn.fov.model.BackscatterPoint;
import superdarn.fov.model.RadarBeam;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 地面散射确认
 *
 * 上游拟合按速度/谱宽标记的地面散射需再通过两步检查：
 * 逐点检查功率和距离，再在距离门邻域内投票，孤立在电离层散射中的点不予确认。
 */
public class GroundScatterClassifier {

    private static final Logger logger = Logger.getLogger(GroundScatterClassifier.class.getName());

    // 仰角45°、虚高110 km 对应的最小斜距（km）
    private static final double MIN_GROUND_DISTANCE = 78.0;

    private final GroundScatterConfig config;

    public GroundScatterClassifier(GroundScatterConfig config) {
        this.config = config;
    }

    /**
     * 确认地面散射
     *
     * @param beam 波束
     * @param distances 各点到反射点的斜距（km），与观测点一一对应
     * @return 确认为地面散射的点索引
     */
    public Set<Integer> select(RadarBeam beam, double[] distances) {
        List<BackscatterPoint> points = beam.getPoints();
        if (distances.length != points.size()) {
            throw new IllegalArgumentException(String.format(
                "distance count %d does not match point count %d", distances.length, points.size()));
        }

        Set<Integer> candidates = new HashSet<>();
        for (int i = 0; i < points.size(); i++) {
            BackscatterPoint p = points.get(i);
            if (p.getRangeGate() <= config.getMaxRangeGate() && passesPointTest(p, distances[i])) {
                candidates.add(i);
            }
        }

        int[] gates = new int[points.size()];
        for (int i = 0; i < gates.length; i++) {
            gates[i] = points.get(i).getRangeGate();
        }

        Set<Integer> confirmed = new HashSet<>();
        for (int i : candidates) {
            WindowCount count = fractionInWindow(gates, candidates, i, config.getRangeGateBox(),
                0, beam.getRangeGateCount());
            if (count.getFraction() >= config.getMinFraction() && count.getTotal() >= config.getMinPoints()) {
                confirmed.add(i);
            } else {
                logger.fine(String.format("Isolated groundscatter at beam %d gate %d: %.2f of %d points",
                    beam.getBeamNumber(), gates[i], count.getFraction(), count.getTotal()));
            }
        }
        return confirmed;
    }

    /**
     * 逐点检查：上游标记为地面散射、两种功率非负、斜距大于78 km，
     * 近距离门还要求功率不超过上限
     */
    boolean passesPointTest(BackscatterPoint p, double distance) {
        if (p.getGroundScatterFlag() != 1 || !(p.getPowerLambda() >= 0.0)
                || !(p.getPowerSigma() >= 0.0) || !(distance > MIN_GROUND_DISTANCE)) {
            return false;
        }
        if (p.getRangeGate() < config.getMinRangeGate()) {
            return p.getPowerLambda() <= config.getMaxPower() && p.getPowerSigma() <= config.getMaxPower();
        }
        return true;
    }

    /**
     * 统计中心点邻域 [g-box, g+box) 内的点数及其中被接受的比例
     *
     * @param values 各点的取值（距离门）
     * @param accepted 被接受的点索引
     * @param central 中心点索引
     * @param box 邻域半宽
     * @param minValue 取值下限
     * @param maxValue 取值上限，窗口超过它时上界取 maxValue+1
     */
    public static WindowCount fractionInWindow(int[] values, Set<Integer> accepted, int central,
                                               int box, int minValue, int maxValue) {
        int low = Math.max(values[central] - box, minValue);
        int high = values[central] + box;
        if (high > maxValue) {
            high = maxValue + 1;
        }
        List<Integer> inside = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] >= low && values[i] < high) {
                inside.add(i);
            }
        }
        if (inside.isEmpty()) {
            return new WindowCount(0.0, 0);
        }
        long good = inside.stream().filter(accepted::contains).count();
        return new WindowCount((double) good / inside.size(), inside.size());
    }

    /**
     * 邻域统计结果
     */
    public static class WindowCount {
        private final double fraction;
        private final int total;

        public WindowCount(double fraction, int total) {
            this.fraction = fraction;
            this.total = total;
        }

        public double getFraction() { return fraction; }
        public int getTotal() { return total; }
    }
}
