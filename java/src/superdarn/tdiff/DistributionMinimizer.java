package superdarn.tdiff;

import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.util.FastMath;

import java.util.logging.Logger;

/**
 * 周期性目标函数的全局极小搜索
 *
 * tdiff 每隔一个相位模糊周期产生混叠。先求初值附近的局部极小，再沿朝向初值的方向
 * 每次跨一个周期继续搜索，直到极小点越过初值，得到夹住初值的两个极小。
 * 初值位于两者之间时，在收窄的区间内用等间距网格查找更深或更近的极小。
 * 两个极小的函数值相差不超过 funcTol 时取离初值近的一个，否则取函数值低的一个。
 */
public class DistributionMinimizer {

    private static final Logger logger = Logger.getLogger(DistributionMinimizer.class.getName());

    static final int MAX_GRID_POINTS = 20000;

    private final double tdiffTolerance;
    private final double functionTolerance;
    private final int maxIterations;
    private final RigorousSimplex simplex;

    public DistributionMinimizer(double tdiffTolerance, double functionTolerance, int maxIterations) {
        this.tdiffTolerance = tdiffTolerance;
        this.functionTolerance = functionTolerance;
        this.maxIterations = maxIterations;
        this.simplex = new RigorousSimplex(tdiffTolerance, maxIterations);
    }

    /**
     * @param guess tdiff初值
     * @param objective 目标函数
     * @param period 混叠周期，NaN表示不做周期搜索
     */
    public SimplexResult minimize(double guess, UnivariateFunction objective, double period) {
        SimplexResult res1 = simplex.minimize(guess, objective);
        double tdiff1 = res1.getX();
        int mi1 = res1.getIterations();
        if (Double.isNaN(period) || Double.isNaN(tdiff1) || mi1 >= maxIterations) {
            return res1;
        }

        double sign = FastMath.signum(guess - tdiff1);
        double newSign = sign;
        int mi2 = mi1;
        double tdiff2 = tdiff1;
        SimplexResult res2 = res1;
        while (newSign == sign && mi2 < maxIterations && !Double.isNaN(tdiff2)) {
            res2 = simplex.minimize(tdiff1 + newSign * period, objective);
            tdiff2 = res2.getX();
            mi2 += res2.getIterations();
            if (!Double.isNaN(tdiff2)) {
                newSign = FastMath.signum(guess - tdiff2);
                if (newSign == sign) {
                    tdiff1 = tdiff2;
                    mi1 = mi2;
                    res1 = res2;
                }
            }
            if (sign == 0.0) {
                break;
            }
        }
        if (Double.isNaN(tdiff2) || mi2 >= maxIterations) {
            return res1.withX(tdiff1, mi1);
        }
        res1 = res1.withX(tdiff1, mi1);
        res2 = res2.withX(tdiff2, mi2);

        SimplexResult fromGrid = searchBracket(guess, objective, res1, res2);
        if (fromGrid != null) {
            if (fromGrid.getValue() < res1.getValue() - functionTolerance) {
                return fromGrid;
            }
            res1 = fromGrid;
        }
        return choose(guess, res1, res2);
    }

    /**
     * 在两个极小之间的区间内做网格搜索
     *
     * @return 更深的极小，或函数值相当但更接近初值的点；区间退化或无更好点时返回null
     */
    private SimplexResult searchBracket(double guess, UnivariateFunction objective,
                                        SimplexResult res1, SimplexResult res2) {
        SimplexResult left = res1.getX() < res2.getX() ? res1 : res2;
        SimplexResult right = left == res1 ? res2 : res1;
        double a = left.getX();
        double c = right.getX();
        double fa = left.getValue();
        double fc = right.getValue();

        if (!(a < guess && guess < c)) {
            return null;
        }
        double fb = objective.value(guess);
        while (fb >= fa && guess - a > tdiffTolerance) {
            a = guess - 0.5 * (guess - a);
            fa = objective.value(a);
        }
        while (fb >= fc && c - guess > tdiffTolerance) {
            c = guess + 0.5 * (c - guess);
            fc = objective.value(c);
        }
        if (!(a < guess && guess < c) || c - a <= tdiffTolerance) {
            logger.fine(String.format("Degenerate bracket [%.6f, %.6f] about %.6f", a, c, guess));
            return null;
        }

        double step = FastMath.max(0.1 * tdiffTolerance, (c - a) / MAX_GRID_POINTS);
        int count = (int) FastMath.ceil((c - a) / step);
        double ymin = Double.NaN;
        double xmin = Double.NaN;
        for (int i = 0; i < count; i++) {
            double x = a + i * step;
            double y = objective.value(x);
            if (!Double.isNaN(y) && (Double.isNaN(ymin) || y < ymin)) {
                ymin = y;
                xmin = x;
            }
        }
        if (Double.isNaN(ymin)) {
            return null;
        }

        int iterations = maxIterations - 1;
        if (FastMath.abs(res1.getValue() - ymin) <= functionTolerance) {
            if (FastMath.abs(res1.getX() - guess) > FastMath.abs(xmin - guess)) {
                return new SimplexResult(xmin, ymin, iterations, true, "found from grid");
            }
            return null;
        }
        if (ymin < res1.getValue()) {
            return new SimplexResult(xmin, ymin, iterations, true, "found from grid");
        }
        return null;
    }

    private SimplexResult choose(double guess, SimplexResult res1, SimplexResult res2) {
        if (FastMath.abs(res1.getValue() - res2.getValue()) <= functionTolerance) {
            double diff1 = FastMath.abs(res1.getX() - guess);
            double diff2 = FastMath.abs(res2.getX() - guess);
            if (FastMath.abs(diff1 - diff2) <= tdiffTolerance) {
                return res1.getValue() <= res2.getValue() ? res1 : res2;
            }
            return diff1 <= diff2 ? res1 : res2;
        }
        return res1.getValue() < res2.getValue() ? res1 : res2;
    }

    public double getTdiffTolerance() { return tdiffTolerance; }
    public double getFunctionTolerance() { return functionTolerance; }
    public int getMaxIterations() { return maxIterations; }
}
