package superdarn.fov.calculator;

import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;
import superdarn.fov.model.FieldOfView;
import superdarn.fov.model.GeometryErrors;
import superdarn.fov.model.RadarGeometry;

import java.util.logging.Logger;

/**
 * 干涉仪仰角模型
 *
 * 由主阵与干涉仪阵之间的相位差计算仰角。相位差先扣除电缆延迟（tdiff）引起的相移，
 * 再按视场方向和相位模糊折叠到几何允许的 [χmin, χmax] 区间内，最后解干涉仪三角形。
 * alias=1 时允许区间向下扩展一个 2π 周期。
 *
 * 所有方法为纯函数：无法解算的点返回NaN并记录日志，不抛出异常。
 */
public class ElevationModel {

    private static final Logger logger = Logger.getLogger(ElevationModel.class.getName());

    // 相位折叠的最大迭代次数
    private static final int MAX_FOLD_ITERATIONS = 64;
    private static final double TWO_PI = 2.0 * FastMath.PI;

    private final RadarGeometry geometry;
    private final double antennaSeparation;
    private final double phaseSign;
    private final double elevationCorrection;
    private final double correctionCoefficient;
    private final double correctionRoot;

    public ElevationModel(RadarGeometry geometry) {
        this.geometry = geometry;
        this.antennaSeparation = geometry.getAntennaSeparation();
        this.phaseSign = geometry.getPhaseSign();
        this.elevationCorrection = geometry.getElevationCorrection();
        this.correctionCoefficient = phaseSign * geometry.getPhaseDifference() / antennaSeparation;
        double zRatio = geometry.getInterferometer().getZ() / antennaSeparation;
        this.correctionRoot = FastMath.sqrt(1.0 - zRatio * zRatio);
    }

    /**
     * 波数 k = 2πf/c
     *
     * @param tfreq 发射频率（kHz）
     * @return 波数（rad/m）
     */
    public static double wavenumber(double tfreq) {
        return TWO_PI * tfreq * 1.0e3 / Constants.SPEED_OF_LIGHT;
    }

    /**
     * 电缆延迟引起的相移 Δχ = -π·f·tdiff·2e-3
     *
     * @param tfreq 发射频率（kHz）
     * @param tdiff 延迟（微秒）
     */
    public static double cablePhaseOffset(double tfreq, double tdiff) {
        return -FastMath.PI * tfreq * tdiff * 2.0e-3;
    }

    /**
     * 计算仰角及误差
     *
     * @param phi0 相位差（弧度）
     * @param phi0Error 相位差误差（弧度）
     * @param beamNumber 波束号
     * @param tfreq 发射频率（kHz）
     * @param tdiff 延迟（微秒）
     * @param tdiffError 延迟误差（微秒）
     * @param errors 几何误差
     * @param alias 允许区间扩展的周期数（0或1）
     * @param fov 视场假设
     * @return 仰角（度）、误差（度）和相位模糊整数，无法解算时为NaN
     */
    public ElevationResult calculate(double phi0, double phi0Error, double beamNumber,
                                     double tfreq, double tdiff, double tdiffError,
                                     GeometryErrors errors, int alias, FieldOfView fov) {
        if (Double.isNaN(phi0) || (phi0 == 0.0 && phi0Error == 0.0)) {
            return ElevationResult.unresolved();
        }

        double bmaz = geometry.beamToAzimuth(beamNumber);
        double offset = FastMath.toRadians(bmaz - geometry.getBoresite());
        double cosPhi = FastMath.cos(offset);
        double k = wavenumber(tfreq);

        double[] folded = foldPhase(phi0, fov.getFlag(), cosPhi, k, tfreq, tdiff, alias);
        if (folded == null) {
            logger.severe(String.format(
                "Cannot fold phase lag %.4f for beam %.0f into the admissible window (tfreq=%.0f kHz, tdiff=%.4f)",
                phi0, beamNumber, tfreq, tdiff));
            return ElevationResult.unresolved();
        }

        double cosTheta = folded[0] / (k * antennaSeparation);
        double sin2Delta = cosPhi * cosPhi - cosTheta * cosTheta;
        if (!(sin2Delta >= 0.0)) {
            return ElevationResult.unresolved();
        }
        double sinDelta = FastMath.sqrt(sin2Delta);
        if (sinDelta > 1.0) {
            return ElevationResult.unresolved();
        }
        double elevation = FastMath.toDegrees(FastMath.asin(sinDelta) + elevationCorrection);

        // 误差传播
        double asinDer = 1.0 / FastMath.sqrt(sin2Delta - sin2Delta * sin2Delta);
        double ix = geometry.getInterferometer().getX();
        double iy = geometry.getInterferometer().getY();
        double iz = geometry.getInterferometer().getZ();

        double termBmaz = 0.0;
        double termBore = 0.0;
        double sinPhi = FastMath.sin(offset);
        if (errors.getBeamAzimuthError() > 0.0) {
            double t = -bmaz * sinPhi * cosPhi * asinDer;
            termBmaz = square(errors.getBeamAzimuthError()) * t * t;
        }
        if (errors.getBoresiteError() > 0.0) {
            double t = geometry.getBoresite() * sinPhi * cosPhi * asinDer;
            termBore = square(errors.getBoresiteError()) * t * t;
        }

        double termX = 0.0;
        double termY = 0.0;
        if (errors.getInterferometerXError() > 0.0 || errors.getInterferometerYError() > 0.0) {
            double t = cosTheta * cosTheta * asinDer
                + correctionCoefficient * iz / (antennaSeparation * antennaSeparation * correctionRoot);
            termX = square(errors.getInterferometerXError() * ix * t);
            termY = square(errors.getInterferometerYError() * iy * t);
        }
        double termZ = 0.0;
        if (errors.getInterferometerZError() > 0.0) {
            double t = cosTheta * cosTheta * asinDer * iz / (antennaSeparation * antennaSeparation)
                - correctionCoefficient * correctionRoot;
            termZ = square(errors.getInterferometerZError() * t);
        }

        double termTdiff = 0.0;
        if (!Double.isNaN(tdiffError) && tdiffError > 0.0) {
            double t = TWO_PI * tfreq * cosTheta / (1000.0 * antennaSeparation * k * asinDer);
            termTdiff = t * t * tdiffError * tdiffError;
        }
        double termPhi0 = 0.0;
        if (!Double.isNaN(phi0Error) && phi0Error > 0.0) {
            double t = cosTheta * asinDer / (k * antennaSeparation);
            termPhi0 = square(phi0Error * t);
        }

        double total = FastMath.sqrt(termPhi0 + termTdiff + termZ + termY + termX + termBore + termBmaz);
        double error = total == 0.0 ? Double.NaN : FastMath.toDegrees(total);
        return new ElevationResult(elevation, error, (int) folded[1]);
    }

    /**
     * 不计误差的仰角（弧度），用于tdiff标定的目标函数
     *
     * @param phi0 相位差（弧度）
     * @param phi0Error 相位差误差（弧度）
     * @param fovFlag 视场标志（1或-1），其它值返回NaN
     * @param cosPhi 波束相对视轴夹角的余弦
     * @param tfreq 发射频率（kHz）
     * @param tdiff 延迟（微秒）
     * @param alias 允许区间扩展的周期数
     * @return 仰角（弧度）或NaN
     */
    public double elevationRadians(double phi0, double phi0Error, int fovFlag, double cosPhi,
                                   double tfreq, double tdiff, int alias) {
        if (Math.abs(fovFlag) != 1 || Double.isNaN(phi0) || (phi0 == 0.0 && phi0Error == 0.0)) {
            return Double.NaN;
        }
        double k = wavenumber(tfreq);
        double[] folded = foldPhase(phi0, fovFlag, cosPhi, k, tfreq, tdiff, alias);
        if (folded == null) {
            logger.severe(String.format("Cannot fold phase lag %.4f into the admissible window", phi0));
            return Double.NaN;
        }
        double cosTheta = folded[0] / (k * antennaSeparation);
        double sin2Delta = cosPhi * cosPhi - cosTheta * cosTheta;
        if (!(sin2Delta >= 0.0)) {
            return Double.NaN;
        }
        double sinDelta = FastMath.sqrt(sin2Delta);
        return sinDelta <= 1.0 ? FastMath.asin(sinDelta) + elevationCorrection : Double.NaN;
    }

    /**
     * 将相位差折叠进允许区间
     *
     * @return {折叠后相位, 相位模糊整数}，无法折叠时返回null
     */
    private double[] foldPhase(double phi0, int fovFlag, double cosPhi, double k,
                               double tfreq, double tdiff, int alias) {
        double delChi = cablePhaseOffset(tfreq, tdiff);
        double chiMax = phaseSign * k * antennaSeparation * cosPhi;
        double chiMin = chiMax - (alias + 1.0) * phaseSign * TWO_PI;
        double upper = FastMath.max(chiMax, chiMin);

        double shifted = fovFlag * (phi0 - delChi);
        double phase = shifted - TWO_PI * FastMath.floor(shifted / TWO_PI);
        double ambiguity = -FastMath.floor(shifted / TWO_PI);

        int n = 0;
        while (phase > upper && n < MAX_FOLD_ITERATIONS) {
            phase += phaseSign * TWO_PI;
            ambiguity += phaseSign;
            n++;
        }
        while (FastMath.abs(phase) < FastMath.abs(chiMin) && n < MAX_FOLD_ITERATIONS) {
            phase += phaseSign * TWO_PI;
            ambiguity += phaseSign;
            n++;
        }
        if (phase > upper || n >= MAX_FOLD_ITERATIONS) {
            return null;
        }
        return new double[] {phase, ambiguity};
    }

    public RadarGeometry getGeometry() {
        return geometry;
    }

    private static double square(double x) {
        return x * x;
    }
}
