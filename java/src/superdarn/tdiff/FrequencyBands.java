package superdarn.tdiff;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * 雷达发射频段表
 *
 * 各频段的上下界由调用方提供（单位 kHz，闭区间）。
 */
public class FrequencyBands {

    private static final Logger logger = Logger.getLogger(FrequencyBands.class.getName());

    private final int[] bandNumbers;
    private final double[] minimums;
    private final double[] maximums;

    public FrequencyBands(int[] bandNumbers, double[] minimums, double[] maximums) {
        if (bandNumbers == null || minimums == null || maximums == null) {
            throw new IllegalArgumentException("Band tables are required");
        }
        if (bandNumbers.length != minimums.length || bandNumbers.length != maximums.length) {
            throw new IllegalArgumentException(String.format(
                "Band tables differ in length: %d numbers, %d minimums, %d maximums",
                bandNumbers.length, minimums.length, maximums.length));
        }
        for (int i = 0; i < minimums.length; i++) {
            if (minimums[i] > maximums[i]) {
                throw new IllegalArgumentException(String.format(
                    "Band %d has minimum %.0f above maximum %.0f", bandNumbers[i], minimums[i], maximums[i]));
            }
        }
        this.bandNumbers = bandNumbers.clone();
        this.minimums = minimums.clone();
        this.maximums = maximums.clone();
    }

    /**
     * 查找发射频率所在的频段
     *
     * @param tfreq 发射频率（kHz）
     * @return 频段号，不在任何频段内时返回-1
     */
    public int bandFor(double tfreq) {
        for (int i = 0; i < minimums.length; i++) {
            if (minimums[i] <= tfreq && tfreq <= maximums[i]) {
                return bandNumbers[i];
            }
        }
        logger.warning(String.format("No band for frequency %.0f kHz", tfreq));
        return -1;
    }

    /**
     * 频段中心频率（kHz，取整），未知频段返回-1
     */
    public int meanFrequency(int band) {
        int i = indexOf(band);
        if (i < 0) {
            logger.warning("Unknown transmission frequency band " + band);
            return -1;
        }
        return (int) ((maximums[i] + minimums[i]) / 2.0);
    }

    /**
     * 该频段下 tdiff 的混叠周期 1000/f（微秒），未知频段返回NaN
     */
    public double period(int band) {
        int mean = meanFrequency(band);
        return mean > 0 ? 1000.0 / mean : Double.NaN;
    }

    public boolean hasBand(int band) {
        return indexOf(band) >= 0;
    }

    public int size() {
        return bandNumbers.length;
    }

    private int indexOf(int band) {
        for (int i = 0; i < bandNumbers.length; i++) {
            if (bandNumbers[i] == band) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return String.format("FrequencyBands{bands=%s}", Arrays.toString(bandNumbers));
    }
}
