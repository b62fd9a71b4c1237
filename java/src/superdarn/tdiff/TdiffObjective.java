package superdarn.tdiff;

import org.hipparchus.analysis.UnivariateFunction;

/**
 * tdiff 标定的目标函数：值越小表示回波分布越集中在参考位置附近
 */
public interface TdiffObjective extends UnivariateFunction {

    /**
     * 参考位置（纬度或虚高）
     */
    double getReference();

    /**
     * 返回参考位置替换后的目标函数，用于误差估计
     */
    TdiffObjective withReference(double reference);
}
