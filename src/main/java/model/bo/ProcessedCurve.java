package model.bo;

import java.util.Arrays;

/**
 * 投影后的一维曲线，按振镜步（bin）索引
 * bins 严格递增；value 为 NaN 表示该位置无数据；时间轴 = bin * timePerStep
 * 不可变，数组在构造与读取时都复制，同一实例可以交给多个监听者
 */
public final class ProcessedCurve {
    private final long sequence;
    private final long[] bins;
    private final double[] values;
    private final double timePerStep;

    public ProcessedCurve(long sequence, long[] bins, double[] values, double timePerStep) {
        if (bins.length != values.length) {
            throw new IllegalArgumentException("bins 与 values 长度不一致");
        }
        this.sequence = sequence;
        this.bins = bins.clone();
        this.values = values.clone();
        this.timePerStep = timePerStep;
    }

    public long getSequence() {
        return sequence;
    }

    public long[] getBins() {
        return bins.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public double getTimePerStep() {
        return timePerStep;
    }

    public int size() {
        return bins.length;
    }

    public double time(int i) {
        return bins[i] * timePerStep;
    }

    public double[] times() {
        double[] t = new double[bins.length];
        for (int i = 0; i < bins.length; i++) {
            t[i] = bins[i] * timePerStep;
        }
        return t;
    }

    /**
     * 指定 bin 上的值，不存在或无数据时返回 NaN
     */
    public double valueAtBin(long bin) {
        int idx = Arrays.binarySearch(bins, bin);
        return idx < 0 ? Double.NaN : values[idx];
    }

    public boolean isEmpty() {
        return bins.length == 0;
    }

    /**
     * 去掉无数据的位置
     */
    public ProcessedCurve dropMissing() {
        int kept = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                kept++;
            }
        }
        if (kept == values.length) {
            return this;
        }
        long[] newBins = new long[kept];
        double[] newValues = new double[kept];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                newBins[j] = bins[i];
                newValues[j] = values[i];
                j++;
            }
        }
        return new ProcessedCurve(sequence, newBins, newValues, timePerStep);
    }

    public double minTime() {
        return isEmpty() ? Double.NaN : time(0);
    }

    public double maxTime() {
        return isEmpty() ? Double.NaN : time(bins.length - 1);
    }
}
