package superdarn.fov;

import superdarn.fov.calculator.VirtualHeightModel;
import superdarn.fov.model.AltitudeBand;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.RadarGeometry;
import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;
import superdarn.helper.LineFit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 单次扫描的视场判定
 *
 * 在每个距离门窗口内，按传播路径（跳数+区域）和虚高分组，对前、后视场分别拟合
 * 仰角随距离门的直线。斜率不大于0、残差标准差和z分数都足够小的视场胜出。
 * 之后依 step 设置依次进行：单视场近距离门判定（step≥3）、单波束回归（step≥4）
 * 和方位连续性检查（step≥5）。
 *
 * 判定只依赖各点的前后视场传播解，重复运行结果不变。
 */
public class ScanFovResolver {

    private static final Logger logger = Logger.getLogger(ScanFovResolver.class.getName());

    static final double MAX_STD = 3.0;
    static final double MAX_SCORE = 3.0;
    static final double FOV_FRACTION = 2.0 / 3.0;
    static final int INCREASED_RANGE_GATE_BOX = 3;

    // 只有一个视场可能时，近于500 km的回波不考虑混叠
    static final double NEAR_DISTANCE = 500.0;

    private final FovConfig config;
    private final RadarGeometry geometry;
    private final AltitudeBandSelector bandSelector;

    public ScanFovResolver(FovConfig config, RadarGeometry geometry) {
        this(config, geometry, new AltitudeBandSelector());
    }

    public ScanFovResolver(FovConfig config, RadarGeometry geometry, AltitudeBandSelector bandSelector) {
        this.config = config;
        this.geometry = geometry;
        this.bandSelector = bandSelector;
    }

    /**
     * 近距离门界限：斜距500 km对应的距离门
     */
    public static double nearRangeGate(double firstLagRange, double sampleSeparation) {
        return VirtualHeightModel.rangeGateAt(NEAR_DISTANCE, sampleSeparation, firstLagRange);
    }

    /**
     * 判定一次扫描中所有点的视场，结果写回各 {@link ResolvedPoint}
     *
     * @param scan 同一扫描的波束
     */
    public void resolve(List<ResolvedBeam> scan) {
        if (scan.isEmpty()) {
            return;
        }
        double nearRg = nearRangeGate(scan.get(0).getBeam().getFirstLagRange(),
            scan.get(0).getBeam().getSampleSeparation());

        PointState[][] states = new PointState[scan.size()][];
        for (int bi = 0; bi < scan.size(); bi++) {
            int n = scan.get(bi).getPoints().size();
            states[bi] = new PointState[n];
            for (int si = 0; si < n; si++) {
                states[bi][si] = new PointState();
            }
        }

        scoreScanWindows(scan, states);
        if (config.getStep() >= 3) {
            assignRemaining(scan, states, nearRg);
        } else {
            logger.info("Not testing backscatter left unassigned by the scan evaluation");
        }
        if (config.getStep() >= 5) {
            checkAzimuthalContinuity(scan, states, nearRg);
        } else {
            logger.info("Not testing backscatter assignments with azimuthal continuity");
        }

        for (int bi = 0; bi < scan.size(); bi++) {
            List<ResolvedPoint> points = scan.get(bi).getPoints();
            for (int si = 0; si < points.size(); si++) {
                points.get(si).assign(states[bi][si].flag, states[bi][si].past);
            }
        }
    }

    private int maxGateLimit() {
        return Math.min(geometry.getMaxGate(), config.getLargestRangeGateMax());
    }

    /**
     * 跨波束的距离门窗口回归
     */
    private void scoreScanWindows(List<ResolvedBeam> scan, PointState[][] states) {
        double minInc = 0.5 * config.getMinRangeGateBox();
        int minRg = (int) minInc;
        int maxRg = (int) Math.ceil(maxGateLimit() - minInc);

        for (int r = minRg; r <= maxRg; r++) {
            int ilim = config.limitIndex(r);
            if (ilim < 0) {
                logger.info(String.format("Range gate [%d] is above the allowed maximum [%d]",
                    r, config.getLargestRangeGateMax()));
                continue;
            }
            int box = config.getRangeGateBox(ilim);
            int width = box / 2;
            int rmin = Math.max(r - width, 0);
            int rmax = r + width + box % 2;
            if (rmax > geometry.getMaxGate()) {
                rmax = maxGateLimit();
            }

            List<WindowEntry> window = new ArrayList<>();
            int goodPaths = 0;
            for (int bi = 0; bi < scan.size(); bi++) {
                ResolvedBeam beam = scan.get(bi);
                for (int ir = rmin; ir < rmax; ir++) {
                    int si = beam.indexOfGate(ir);
                    if (si < 0) {
                        continue;
                    }
                    ResolvedPoint point = beam.getPoints().get(si);
                    if (!point.hasAnyElevation()) {
                        continue;
                    }
                    window.add(new WindowEntry(bi, si, ir, point));
                    if (point.getFront().isGoodPath() || point.getBack().isGoodPath()) {
                        goodPaths++;
                    }
                }
            }
            if (goodPaths < config.getMinPoints()) {
                continue;
            }

            Set<String> paths = new TreeSet<>();
            for (WindowEntry e : window) {
                for (FieldOfView fov : FieldOfView.values()) {
                    PropagationSolution s = e.point.getSolution(fov);
                    if (s.isGoodPath()) {
                        paths.add(s.pathKey());
                    }
                }
            }

            for (String path : paths) {
                for (FieldOfView fov : FieldOfView.values()) {
                    scorePath(path, fov, window, states, r, ilim);
                }
            }
        }
    }

    private void scorePath(String path, FieldOfView fov, List<WindowEntry> window,
                           PointState[][] states, int r, int ilim) {
        List<WindowEntry> onPath = new ArrayList<>();
        for (WindowEntry e : window) {
            PropagationSolution s = e.point.getSolution(fov);
            if (s.isGoodPath() && s.pathKey().equals(path)) {
                onPath.add(e);
            }
        }
        if (onPath.size() < config.getMinPoints()) {
            logger.info(String.format("Insufficient points to determine virtual height limits in the %s "
                + "field-of-view for propagation path [%s] at range gate [%d]", fov, path, r));
            return;
        }

        String region = onPath.get(0).point.getSolution(fov).getRegion();
        double[] heights = new double[onPath.size()];
        for (int i = 0; i < heights.length; i++) {
            heights[i] = onPath.get(i).point.getSolution(fov).getVirtualHeight();
        }
        List<AltitudeBand> bands = bandSelector.select(heights,
            config.getRegions().getMin(region), config.getRegions().getMax(region),
            config.getVirtualHeightBox(ilim), config.getMinPoints());

        for (AltitudeBand band : bands) {
            List<WindowEntry> members = new ArrayList<>();
            Set<Integer> beams = new HashSet<>();
            for (WindowEntry e : onPath) {
                if (band.contains(e.point.getSolution(fov).getVirtualHeight())) {
                    members.add(e);
                    beams.add(e.beamIndex);
                }
            }
            if (beams.size() < config.getMinPoints()) {
                logger.info(String.format("Insufficient beams to evaluate %s field-of-view between "
                    + "[%.0f-%.0f km] at range gate %d", fov, band.getMin(), band.getMax(), r));
                continue;
            }

            double[] gates = new double[members.size()];
            double[] elevations = new double[members.size()];
            for (int i = 0; i < members.size(); i++) {
                gates[i] = members.get(i).rangeGate;
                elevations[i] = members.get(i).point.getSolution(fov).getElevation();
            }

            TrendScore trend = TrendScore.of(gates, elevations);
            if (trend == null || trend.std > MAX_STD) {
                continue;
            }
            for (int i = 0; i < members.size(); i++) {
                WindowEntry e = members.get(i);
                states[e.beamIndex][e.pointIndex].offer(fov, trend.std, trend.scores[i], trend.slope);
            }
        }
    }

    /**
     * 扫描窗口未能判定的点：单视场近距离门判定，其次单波束回归
     */
    private void assignRemaining(List<ResolvedBeam> scan, PointState[][] states, double nearRg) {
        for (int bi = 0; bi < scan.size(); bi++) {
            List<ResolvedPoint> points = scan.get(bi).getPoints();
            for (int si = 0; si < points.size(); si++) {
                ResolvedPoint point = points.get(si);
                PointState state = states[bi][si];
                if (!point.hasAnyElevation() || state.flag != 0) {
                    continue;
                }
                int rg = point.getRangeGate();
                boolean frontOnly = point.getFront().hasElevation() && !point.getBack().hasElevation();
                boolean backOnly = !point.getFront().hasElevation() && point.getBack().hasElevation();

                if (backOnly && rg < nearRg) {
                    state.force(FieldOfView.BACK);
                } else if (frontOnly && rg < nearRg) {
                    state.force(FieldOfView.FRONT);
                } else if (config.getStep() >= 4) {
                    scoreSingleBeam(scan.get(bi), points, si, state);
                }
            }
        }
        if (config.getStep() < 4) {
            logger.info("Not assigning backscatter by testing the single beam variations");
        }
    }

    private void scoreSingleBeam(ResolvedBeam beam, List<ResolvedPoint> points, int si, PointState state) {
        int rg = points.get(si).getRangeGate();
        int ilim = config.limitIndex(rg);
        if (ilim < 0) {
            logger.info(String.format("No guidelines provided for range gate [%d]", rg));
            return;
        }
        double rgHalf = 0.5 * (config.getRangeGateBox(ilim) + INCREASED_RANGE_GATE_BOX);
        int irgHalf = (int) Math.floor(rgHalf);
        int minSi = Math.max(si - irgHalf, 0);
        int maxSi = si + irgHalf < geometry.getMaxGate() ? si + irgHalf : maxGateLimit() - 1;
        maxSi = Math.min(maxSi, points.size());

        for (FieldOfView fov : FieldOfView.values()) {
            PropagationSolution target = points.get(si).getSolution(fov);
            if (!target.isGoodPath()) {
                continue;
            }
            List<Integer> test = new ArrayList<>();
            for (int rsi = minSi; rsi < maxSi; rsi++) {
                PropagationSolution s = points.get(rsi).getSolution(fov);
                if (s.isGoodPath() && s.pathKey().equals(target.pathKey())
                        && Math.abs(rg - points.get(rsi).getRangeGate()) <= rgHalf) {
                    test.add(rsi);
                }
            }
            if (test.size() < config.getMinPoints() || !test.contains(si)) {
                logger.info(String.format("Not enough points to do single-beam test for the %s field-of-view "
                    + "for hop [%s] beam [%d] range gate [%d]", fov, target.pathKey(), beam.getBeamNumber(), rg));
                continue;
            }

            double[] gates = new double[test.size()];
            double[] elevations = new double[test.size()];
            for (int i = 0; i < test.size(); i++) {
                gates[i] = points.get(test.get(i)).getRangeGate();
                elevations[i] = points.get(test.get(i)).getSolution(fov).getElevation();
            }
            TrendScore trend = TrendScore.of(gates, elevations);
            if (trend == null || trend.std > MAX_STD) {
                continue;
            }
            state.offer(fov, trend.std, trend.scores[test.indexOf(si)], trend.slope);
        }
    }

    /**
     * 方位连续性：邻近波束中某一视场占2/3以上时，少数视场的点记为离群
     */
    private void checkAzimuthalContinuity(List<ResolvedBeam> scan, PointState[][] states, double nearRg) {
        double minInc = 0.5 * config.getMinRangeGateBox();
        int minRg = (int) minInc;
        int maxRg = (int) Math.ceil(maxGateLimit() - minInc);
        int bwidth = (int) (config.getMinPoints() * 0.75);

        for (int r = minRg; r <= maxRg; r++) {
            int ilim = config.limitIndex(r);
            if (ilim < 0) {
                continue;
            }
            int box = config.getRangeGateBox(ilim);
            int width = (box + INCREASED_RANGE_GATE_BOX) / 2;
            int rmin = Math.max(r - width, 0);
            int rmax = r + width + box % 2;
            if (rmax > geometry.getMaxGate()) {
                rmax = geometry.getMaxGate() + 1;
            }

            Map<String, List<WindowEntry>> byPath = new LinkedHashMap<>();
            for (int bi = 0; bi < scan.size(); bi++) {
                ResolvedBeam beam = scan.get(bi);
                for (int ir = rmin; ir < rmax; ir++) {
                    int si = beam.indexOfGate(ir);
                    if (si < 0 || states[bi][si].flag == 0) {
                        continue;
                    }
                    ResolvedPoint point = beam.getPoints().get(si);
                    PropagationSolution s = point.getSolution(FieldOfView.fromFlag(states[bi][si].flag));
                    if (s.isGoodPath() && s.getHop() <= config.getMaxHop()) {
                        byPath.computeIfAbsent(s.pathKey(), k -> new ArrayList<>())
                            .add(new WindowEntry(bi, si, ir, point));
                    }
                }
            }

            for (List<WindowEntry> group : byPath.values()) {
                if (group.size() <= config.getMinPoints()) {
                    continue;
                }
                Set<Integer> beamIndices = new LinkedHashSet<>();
                for (WindowEntry e : group) {
                    beamIndices.add(e.beamIndex);
                }
                for (int bi : beamIndices) {
                    int bmnum = scan.get(bi).getBeamNumber();
                    int bmin = bmnum >= config.getMinPoints() ? bmnum - bwidth : 0;
                    int bmax = bmnum <= geometry.getMaxBeam() - bwidth ? bmnum + bwidth : geometry.getMaxBeam();

                    List<WindowEntry> inBeams = new ArrayList<>();
                    for (WindowEntry e : group) {
                        int b = scan.get(e.beamIndex).getBeamNumber();
                        if (b >= bmin && b < bmax) {
                            inBeams.add(e);
                        }
                    }
                    tally(inBeams, states, nearRg);
                }
            }
        }

        for (int bi = 0; bi < scan.size(); bi++) {
            for (int si = 0; si < states[bi].length; si++) {
                PointState state = states[bi][si];
                if (state.demote()) {
                    logger.info(String.format("Field-of-view is not consistent with the observed structure "
                        + "at beam [%d] range gate [%d]", scan.get(bi).getBeamNumber(),
                        scan.get(bi).getPoints().get(si).getRangeGate()));
                }
            }
        }
    }

    private void tally(List<WindowEntry> entries, PointState[][] states, double nearRg) {
        int fn = 0;
        int bn = 0;
        if (entries.size() > config.getMinPoints()) {
            for (WindowEntry e : entries) {
                int flag = states[e.beamIndex][e.pointIndex].flag;
                if (flag == 1) {
                    fn++;
                } else if (flag == -1) {
                    bn++;
                }
            }
        }
        int badFov = majorityOutlier(fn, bn);

        for (WindowEntry e : entries) {
            PointState state = states[e.beamIndex][e.pointIndex];
            if (badFov == 0) {
                state.mix++;
            } else if (state.flag != badFov) {
                state.in++;
            } else {
                FieldOfView other = FieldOfView.fromFlag(-state.flag);
                boolean onlyOne = !e.point.getSolution(other).hasElevation() && e.rangeGate < nearRg;
                if (!onlyOne) {
                    state.out++;
                }
            }
        }
    }

    /**
     * @return 少数视场的标志，无明显多数时为0
     */
    static int majorityOutlier(int fn, int bn) {
        if (fn + bn <= 0) {
            return 0;
        }
        double ffrac = (double) fn / (fn + bn);
        if (ffrac >= FOV_FRACTION && bn > 0) {
            return -1;
        }
        if (1.0 - ffrac >= FOV_FRACTION && fn > 0) {
            return 1;
        }
        return 0;
    }

    /**
     * 窗口中的一个点
     */
    private static class WindowEntry {
        final int beamIndex;
        final int pointIndex;
        final int rangeGate;
        final ResolvedPoint point;

        WindowEntry(int beamIndex, int pointIndex, int rangeGate, ResolvedPoint point) {
            this.beamIndex = beamIndex;
            this.pointIndex = pointIndex;
            this.rangeGate = rangeGate;
            this.point = point;
        }
    }

    /**
     * 每个点在判定过程中的最佳得分和连续性计数
     */
    private static class PointState {
        int flag = 0;
        int past = 0;
        double std = MAX_STD + 100.0;
        double score = MAX_SCORE + 100.0;
        double slope = 0.01;
        int in = 0;
        int out = 0;
        int mix = 0;

        void offer(FieldOfView fov, double newStd, double newScore, double newSlope) {
            if (newScore <= MAX_SCORE && newStd <= MAX_STD && newScore < score && newStd < std) {
                if (flag != fov.getFlag()) {
                    past = flag;
                }
                flag = fov.getFlag();
                std = newStd;
                score = newScore;
                slope = newSlope;
            }
        }

        void force(FieldOfView fov) {
            flag = fov.getFlag();
            std = 0.0;
            score = 0.0;
            slope = 0.0;
        }

        boolean demote() {
            if (out > 0 && in < out + mix) {
                flag = out > mix && out > in ? past : 0;
                past = 0;
                return true;
            }
            return false;
        }
    }

    /**
     * 仰角-距离门直线拟合的评价：斜率、残差标准差和每点z分数
     */
    static class TrendScore {
        final double slope;
        final double std;
        final double[] scores;

        private TrendScore(double slope, double std, double[] scores) {
            this.slope = slope;
            this.std = std;
            this.scores = scores;
        }

        /**
         * @return 斜率为正或无法计算时返回null
         */
        static TrendScore of(double[] gates, double[] elevations) {
            LineFit fit = LineFit.fit(gates, elevations).orElseGet(() -> LineFit.flat(elevations));
            if (Double.isNaN(fit.getSlope()) || fit.getSlope() > 0.0) {
                return null;
            }
            double[] dev = fit.residuals(gates, elevations);
            double std = LineFit.populationStd(dev);
            if (Double.isNaN(std)) {
                return null;
            }
            return new TrendScore(fit.getSlope(), std, LineFit.absoluteZScores(dev));
        }
    }
}
