package superdarn.fov.calculator;

/**
 * Chisham 虚高模型
 *
 * 由统计得到的斜距二次多项式，仅适用于电离层散射。
 */
public class ChishamVirtualHeightModel implements EmpiricalHeightModel {

    /**
     * 传播路径类型
     */
    public enum Type {
        E1(0.5, 108.974, 0.0191271, 6.68283e-5),     // 0.5跳 E 区
        F1(0.5, 384.416, -0.178640, 1.81405e-4),     // 0.5跳 F 区
        F3(1.5, 1098.28, -0.354557, 9.39961e-5);     // 1.5跳 F 区

        private final double hop;
        private final double a;
        private final double b;
        private final double c;

        Type(double hop, double a, double b, double c) {
            this.hop = hop;
            this.a = a;
            this.b = b;
            this.c = c;
        }

        public double getHop() {
            return hop;
        }

        double evaluate(double slantRange) {
            return a + b * slantRange + c * slantRange * slantRange;
        }
    }

    private final Type type;

    /**
     * 按斜距自动选择路径类型
     */
    public ChishamVirtualHeightModel() {
        this(null);
    }

    public ChishamVirtualHeightModel(Type type) {
        this.type = type;
    }

    /**
     * 斜距对应的路径类型
     */
    public static Type typeFor(double slantRange) {
        if (slantRange <= 787.5) {
            return Type.E1;
        }
        return slantRange <= 2137.5 ? Type.F1 : Type.F3;
    }

    /**
     * @param slantRange 总斜距（km）
     * @param hop 忽略；跳数由路径类型决定
     */
    @Override
    public double virtualHeight(double slantRange, double hop) {
        if (Double.isNaN(slantRange)) {
            return Double.NaN;
        }
        return resolveType(slantRange).evaluate(slantRange);
    }

    /**
     * @return 该斜距下模型使用的跳数
     */
    public double hopFor(double slantRange) {
        return resolveType(slantRange).getHop();
    }

    private Type resolveType(double slantRange) {
        return type == null ? typeFor(slantRange) : type;
    }
}
