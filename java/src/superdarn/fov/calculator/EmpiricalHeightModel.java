package superdarn.fov.calculator;

/**
 * 经验虚高模型，不使用仰角
 */
public interface EmpiricalHeightModel {

    /**
     * @param slantRange 总斜距（km）
     * @param hop 跳数
     * @return 虚高（km），模型不适用时为NaN
     */
    double virtualHeight(double slantRange, double hop);
}
