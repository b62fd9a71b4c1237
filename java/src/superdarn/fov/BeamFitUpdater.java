package superdarn.fov;

import superdarn.fov.calculator.ElevationModel;
import superdarn.fov.calculator.ElevationResult;
import superdarn.fov.calculator.HeightResult;
import superdarn.fov.calculator.PropagationValidator;
import superdarn.fov.calculator.VirtualHeightModel;
import superdarn.fov.model.BackscatterPoint;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.PropagationSolution;
import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.RadarGeometry;
import superdarn.fov.model.ResolvedPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 单波束传播路径计算
 *
 * 对波束中每个点分别在前、后视场假设下计算仰角、虚高、跳数和电离层区域：
 * <ol>
 *   <li>确认地面散射（1跳，斜距减半），未确认的上游地面散射标记为-1；</li>
 *   <li>虚高过低时改用多一个2π周期的仰角，仍过低则放弃该视场；</li>
 *   <li>虚高过高时逐次增加跳数；</li>
 *   <li>传播路径不合理时用多一个周期的仰角重新尝试。</li>
 * </ol>
 */
public class BeamFitUpdater {

    private static final Logger logger = Logger.getLogger(BeamFitUpdater.class.getName());

    private static final double IONOSPHERIC_HOP = 0.5;
    private static final double GROUND_HOP = 1.0;

    private final FovConfig config;
    private final PropagationValidator validator;

    public BeamFitUpdater(FovConfig config) {
        this.config = config;
        this.validator = new PropagationValidator(config.getRegions());
    }

    /**
     * 计算波束中各点的前后视场传播解
     *
     * @param beam 波束
     * @param geometry 雷达几何参数
     * @param earthRadius 雷达处地球半径（km）
     * @param tdiff 延迟（微秒）
     * @param tdiffError 延迟误差（微秒），未知时为NaN
     * @return 与观测点一一对应的结果，视场尚未确定
     */
    public List<ResolvedPoint> update(RadarBeam beam, RadarGeometry geometry, double earthRadius,
                                      double tdiff, double tdiffError) {
        List<BackscatterPoint> points = beam.getPoints();
        int n = points.size();

        double[] dlist = new double[n];
        double[] hop0 = new double[n];
        double[] dist0 = new double[n];
        int[] gflg = new int[n];
        for (int i = 0; i < n; i++) {
            dlist[i] = VirtualHeightModel.slantDistance(points.get(i).getRangeGate(),
                beam.getSampleSeparation(), beam.getFirstLagRange(), IONOSPHERIC_HOP);
            hop0[i] = IONOSPHERIC_HOP;
            dist0[i] = dlist[i];
            gflg[i] = points.get(i).getGroundScatterFlag();
        }

        GroundScatterClassifier classifier = new GroundScatterClassifier(
            config.getGroundScatter().withMaxRangeGate(geometry.getMaxGate()));
        Set<Integer> ground = classifier.select(beam, dlist);

        for (int i = 0; i < n; i++) {
            BackscatterPoint p = points.get(i);
            if (gflg[i] == 1) {
                if (ground.contains(i)) {
                    hop0[i] = GROUND_HOP;
                    dist0[i] *= 0.5;
                } else {
                    gflg[i] = -1;
                    if (config.isStrictGroundScatter()) {
                        hop0[i] = Double.NaN;
                        dist0[i] = Double.NaN;
                    }
                }
            }
            if (p.getPowerLambda() < 0.0 || p.getPowerSigma() < 0.0) {
                hop0[i] = Double.NaN;
                dist0[i] = Double.NaN;
            }
        }

        ElevationModel elevationModel = new ElevationModel(geometry);
        VirtualHeightModel heightModel = new VirtualHeightModel(earthRadius);

        List<ResolvedPoint> resolved = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            BackscatterPoint p = points.get(i);
            PropagationSolution front = solve(p, beam, FieldOfView.FRONT, elevationModel, heightModel,
                tdiff, tdiffError, dlist[i], hop0[i], dist0[i], gflg[i]);
            PropagationSolution back = solve(p, beam, FieldOfView.BACK, elevationModel, heightModel,
                tdiff, tdiffError, dlist[i], hop0[i], dist0[i], gflg[i]);
            resolved.add(new ResolvedPoint(p, gflg[i], front, back));
        }
        return resolved;
    }

    private PropagationSolution solve(BackscatterPoint p, RadarBeam beam, FieldOfView fov,
                                      ElevationModel elevationModel, VirtualHeightModel heightModel,
                                      double tdiff, double tdiffError, double halfHopDistance,
                                      double hop, double distance, int gflg) {
        double vmin = config.getRegions().getLowestMin();
        double vmax = config.getRegions().getHighestMax();

        ElevationResult direct = elevationModel.calculate(p.getPhi0(), p.getPhi0Error(),
            beam.getBeamNumber(), beam.getTransmitFrequency(), tdiff, tdiffError,
            config.getGeometryErrors(), 0, fov);
        ElevationResult aliased = elevationModel.calculate(p.getPhi0(), p.getPhi0Error(),
            beam.getBeamNumber(), beam.getTransmitFrequency(), tdiff, Double.NaN,
            config.getGeometryErrors(), 1, fov);

        HeightResult directHeight = heightModel.virtualHeightWithError(distance, 0.0,
            direct.getElevation(), direct.getElevationError());
        HeightResult aliasedHeight = heightModel.virtualHeightWithError(distance, 0.0,
            aliased.getElevation(), aliased.getElevationError());

        double elv = direct.getElevation();
        double elvErr = direct.getElevationError();
        double vh = directHeight.getHeight();
        double vhErr = directHeight.getError();

        if (!Double.isNaN(vh) && vh < vmin) {
            if (aliasedHeight.getHeight() >= vmin) {
                elv = aliased.getElevation();
                elvErr = aliased.getElevationError();
                vh = aliasedHeight.getHeight();
                vhErr = aliasedHeight.getError();
            } else {
                elv = Double.NaN;
                vh = Double.NaN;
            }
        }
        if (Double.isNaN(vh)) {
            return new PropagationSolution(elv, elvErr, vh, vhErr, hop, "", distance);
        }

        double dd = halfHopDistance * 0.5 / hop;
        while (vh > vmax && hop <= config.getMaxHop()) {
            hop += 1.0;
            dd = halfHopDistance * 0.5 / hop;
            HeightResult h = heightModel.virtualHeightWithError(dd, 0.0, elv, elvErr);
            vh = h.getHeight();
            vhErr = h.getError();
        }

        boolean realistic = true;
        if (config.isPropagationTest()) {
            realistic = validator.isRealistic(hop, vh, dd);
        }

        if (!realistic) {
            // 多一个2π周期的仰角
            elv = aliased.getElevation();
            elvErr = aliased.getElevationError();
            vh = aliasedHeight.getHeight();
            vhErr = aliasedHeight.getError();
            hop = gflg == 1 ? GROUND_HOP : IONOSPHERIC_HOP;
            dd = halfHopDistance * 0.5 / hop;
            while (vh > vmax && hop <= config.getMaxHop()) {
                hop += 1.0;
                dd = halfHopDistance * 0.5 / hop;
                HeightResult h = heightModel.virtualHeightWithError(dd, 0.0, elv, elvErr);
                vh = h.getHeight();
                vhErr = h.getError();
            }
            if (vh >= vmin) {
                realistic = validator.isRealistic(hop, vh, dd);
            }
        }

        if (hop <= config.getMaxHop() && realistic) {
            return new PropagationSolution(elv, elvErr, vh, vhErr, hop, validator.assignRegion(vh), dd);
        }
        logger.fine(String.format("No realistic %s path for beam %d gate %d",
            fov, beam.getBeamNumber(), p.getRangeGate()));
        return new PropagationSolution(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
            Double.NaN, "", dd);
    }
}
