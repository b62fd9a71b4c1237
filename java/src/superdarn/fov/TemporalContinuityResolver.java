package superdarn.fov;

import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/**
 * 时间连续性检查
 *
 * 对每个波束号，沿时间滑动宽度为 utBox 的窗口，在（距离门窗口, 传播路径）分组内
 * 统计前后视场的点数。某一视场占2/3以上时少数视场的点记为离群，
 * 离群次数占优的点恢复为历史视场或改为未确定。
 * 窗口必须完整（之后还有超出窗口的观测）才会被评估。
 */
public class TemporalContinuityResolver {

    private static final Logger logger = Logger.getLogger(TemporalContinuityResolver.class.getName());

    private final FovConfig config;
    private final List<Restriction> restrictions;

    public TemporalContinuityResolver(FovConfig config) {
        this(config, Collections.<Restriction>emptyList());
    }

    public TemporalContinuityResolver(FovConfig config, List<Restriction> restrictions) {
        this.config = config;
        this.restrictions = new ArrayList<>(restrictions);
    }

    /**
     * 检查并修正视场标志，结果写回各 {@link ResolvedPoint}
     *
     * @param beams 一段时间内的全部波束（可包含多个波束号）
     */
    public void resolve(List<ResolvedBeam> beams) {
        if (beams.isEmpty()) {
            return;
        }
        if (config.getStep() < 6) {
            logger.info("Not testing backscatter assignments with temporal continuity");
            return;
        }
        double nearRg = ScanFovResolver.nearRangeGate(beams.get(0).getBeam().getFirstLagRange(),
            beams.get(0).getBeam().getSampleSeparation());

        Map<Integer, List<ResolvedBeam>> byBeam = new TreeMap<>();
        for (ResolvedBeam b : beams) {
            byBeam.computeIfAbsent(b.getBeamNumber(), k -> new ArrayList<>()).add(b);
        }
        for (Map.Entry<Integer, List<ResolvedBeam>> entry : byBeam.entrySet()) {
            List<ResolvedBeam> series = entry.getValue();
            series.sort(Comparator.comparing(ResolvedBeam::getTime));
            resolveBeam(entry.getKey(), series, nearRg);
        }
    }

    private void resolveBeam(int beamNumber, List<ResolvedBeam> series, double nearRg) {
        Duration utBox = config.getUtBox();
        Map<ResolvedPoint, Tally> tallies = new IdentityHashMap<>();

        int bis = 0;
        for (int i = 0; i < series.size(); i++) {
            while (bis < i && !Duration.between(series.get(bis).getTime(), series.get(i).getTime())
                    .minus(utBox).isNegative()) {
                ResolvedBeam start = series.get(bis);
                List<ResolvedBeam> window = new ArrayList<>();
                for (int j = bis; j < i; j++) {
                    ResolvedBeam b = series.get(j);
                    if (b.getBeam().getProgramId() == start.getBeam().getProgramId()
                            && Duration.between(start.getTime(), b.getTime()).compareTo(utBox) < 0) {
                        window.add(b);
                    }
                }
                evaluateWindow(beamNumber, window, tallies, nearRg);
                bis++;
            }
        }

        for (ResolvedBeam b : series) {
            for (ResolvedPoint p : b.getPoints()) {
                Tally t = tallies.get(p);
                if (t == null || t.out <= 0 || t.in >= t.out + t.mix) {
                    continue;
                }
                int past = p.getPastFov();
                int flag = t.out > t.mix && t.out > t.in ? past : 0;
                if (past != 0) {
                    p.reinstate(flag, FieldOfView.fromFlag(past));
                } else {
                    p.assign(0, 0);
                }
                logger.info(String.format("Field-of-view is not consistent with the temporal structure "
                    + "at beam [%d] time [%s] range gate [%d]", beamNumber, b.getTime(), p.getRangeGate()));
            }
        }
    }

    private void evaluateWindow(int beamNumber, List<ResolvedBeam> window,
                                Map<ResolvedPoint, Tally> tallies, double nearRg) {
        List<ResolvedPoint> points = new ArrayList<>();
        for (ResolvedBeam b : window) {
            points.addAll(b.getPoints());
        }
        if (points.isEmpty()) {
            return;
        }

        int rangeMin = Integer.MAX_VALUE;
        int rangeMax = Integer.MIN_VALUE;
        for (ResolvedPoint p : points) {
            rangeMin = Math.min(rangeMin, p.getRangeGate());
            rangeMax = Math.max(rangeMax, p.getRangeGate());
        }
        rangeMax = Math.min(rangeMax, config.getLargestRangeGateMax());

        for (int r = rangeMin; r <= rangeMax; r++) {
            int ilim = config.limitIndex(r);
            if (ilim < 0) {
                continue;
            }
            int frgBox = config.getRangeGateBox(ilim) + ScanFovResolver.INCREASED_RANGE_GATE_BOX;
            int rhalf = frgBox / 2;
            int rmin = r - rhalf;
            int rmax = r + rhalf;
            if (frgBox % 2 == 0) {
                rmax -= 1;
            }
            double maxPoints = (double) window.size() * frgBox;

            Map<String, List<ResolvedPoint>> byPath = new LinkedHashMap<>();
            for (ResolvedPoint p : points) {
                if (p.getRangeGate() < rmin || p.getRangeGate() > rmax) {
                    continue;
                }
                if (Double.isNaN(p.getHop()) || p.getRegion().isEmpty()) {
                    continue;
                }
                byPath.computeIfAbsent(pathKey(p), k -> new ArrayList<>()).add(p);
            }

            for (Map.Entry<String, List<ResolvedPoint>> entry : byPath.entrySet()) {
                List<ResolvedPoint> group = entry.getValue();
                if (group.size() / maxPoints >= config.getMinTemporalFraction()) {
                    for (Restriction restriction : restrictions) {
                        group = restriction.apply(group);
                        if (group.size() / maxPoints < config.getMinTemporalFraction()) {
                            break;
                        }
                    }
                }

                double ratio = group.size() / maxPoints;
                if (ratio < config.getMinTemporalFraction()) {
                    logger.info(String.format("Unable to evaluate beam [%d] at [%s] gate [%d], insufficient "
                        + "backscatter [%d < %.0f] at hop [%s]", beamNumber, window.get(0).getTime(), r,
                        group.size(), maxPoints * config.getMinTemporalFraction(), entry.getKey()));
                } else if (ratio > 1.0) {
                    logger.severe(String.format("Maximum number of points exceeded for beam [%d] between range "
                        + "gates [%d-%d] at [%s]: %d > %.0f", beamNumber, rmin, rmax,
                        window.get(0).getTime(), group.size(), maxPoints));
                } else {
                    tally(group, tallies, nearRg);
                }
            }
        }
    }

    private static void tally(List<ResolvedPoint> group, Map<ResolvedPoint, Tally> tallies, double nearRg) {
        int fn = 0;
        int bn = 0;
        for (ResolvedPoint p : group) {
            if (p.getFovFlag() == 1) {
                fn++;
            } else if (p.getFovFlag() == -1) {
                bn++;
            }
        }
        int badFov = ScanFovResolver.majorityOutlier(fn, bn);

        for (ResolvedPoint p : group) {
            int flag = p.getFovFlag();
            Tally t = tallies.computeIfAbsent(p, k -> new Tally());
            if (badFov == 0) {
                if (Math.abs(flag) == 1) {
                    t.mix++;
                }
            } else if (flag == badFov) {
                if (!isOnlyFov(p, nearRg)) {
                    t.out++;
                }
            } else if (flag == -badFov) {
                t.in++;
            }
        }
    }

    /**
     * 近距离门且另一视场没有仰角
     */
    private static boolean isOnlyFov(ResolvedPoint p, double nearRg) {
        FieldOfView other = p.getFovFlag() == -1 ? FieldOfView.FRONT : FieldOfView.BACK;
        return p.getRangeGate() < nearRg && !p.getSolution(other).hasElevation();
    }

    private static String pathKey(ResolvedPoint p) {
        return String.format(Locale.ROOT, "%.1f%s", p.getHop(), p.getRegion());
    }

    private static class Tally {
        int in;
        int out;
        int mix;
    }

    /**
     * 附加的属性限制：只保留属性值在 [min, max) 内的点
     */
    public static class Restriction {
        private final String name;
        private final ToDoubleFunction<ResolvedPoint> attribute;
        private final double min;
        private final double max;

        public Restriction(String name, ToDoubleFunction<ResolvedPoint> attribute, double min, double max) {
            if (!(min < max)) {
                throw new IllegalArgumentException(String.format(
                    "restriction %s needs min < max: [%f, %f]", name, min, max));
            }
            this.name = name;
            this.attribute = attribute;
            this.min = min;
            this.max = max;
        }

        /**
         * 虚高限制
         */
        public static Restriction virtualHeight(double min, double max) {
            return new Restriction("vheight", ResolvedPoint::getVirtualHeight, min, max);
        }

        List<ResolvedPoint> apply(List<ResolvedPoint> points) {
            List<ResolvedPoint> kept = new ArrayList<>();
            for (ResolvedPoint p : points) {
                double v = attribute.applyAsDouble(p);
                if (v >= min && v < max) {
                    kept.add(p);
                }
            }
            return kept;
        }

        public String getName() { return name; }

        @Override
        public String toString() {
            return String.format("Restriction{%s in [%.1f, %.1f)}", name, min, max);
        }
    }
}
