package engine.stream;

import model.bo.ProcessedCurve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 最近 N 条曲线的滑动平均
 * 每次更新都从保留窗口重新计算；只保留窗口内所有曲线都有数据的 bin
 * 非线程安全，调用方持有聚合锁
 */
public class RunningAverage {

    private final Deque<ProcessedCurve> window = new ArrayDeque<>();
    private int windowSize;
    private ProcessedCurve average;

    public RunningAverage(int windowSize) {
        checkWindowSize(windowSize);
        this.windowSize = windowSize;
    }

    public ProcessedCurve add(ProcessedCurve curve) {
        window.addLast(curve);
        truncate();
        recompute();
        return average;
    }

    /**
     * 修改窗口并立即按新窗口重新计算
     */
    public ProcessedCurve setWindowSize(int windowSize) {
        checkWindowSize(windowSize);
        this.windowSize = windowSize;
        truncate();
        recompute();
        return average;
    }

    public void clear() {
        window.clear();
        average = null;
    }

    public ProcessedCurve getAverage() {
        return average;
    }

    public List<ProcessedCurve> getCurves() {
        return new ArrayList<>(window);
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int size() {
        return window.size();
    }

    private void truncate() {
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    private void recompute() {
        if (window.isEmpty()) {
            average = null;
            return;
        }
        ProcessedCurve first = window.peekFirst();
        ProcessedCurve last = window.peekLast();
        int n = window.size();

        long[] candidateBins = first.getBins();
        long[] bins = new long[candidateBins.length];
        double[] values = new double[candidateBins.length];
        int kept = 0;
        for (long bin : candidateBins) {
            double sum = 0;
            boolean complete = true;
            for (ProcessedCurve curve : window) {
                double v = curve.valueAtBin(bin);
                if (Double.isNaN(v)) {
                    complete = false;
                    break;
                }
                sum += v;
            }
            if (complete) {
                bins[kept] = bin;
                values[kept] = sum / n;
                kept++;
            }
        }
        long[] finalBins = new long[kept];
        double[] finalValues = new double[kept];
        System.arraycopy(bins, 0, finalBins, 0, kept);
        System.arraycopy(values, 0, finalValues, 0, kept);
        average = new ProcessedCurve(last.getSequence(), finalBins, finalValues, last.getTimePerStep());
    }

    private static void checkWindowSize(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("滑动平均窗口不能小于 1: " + windowSize);
        }
    }
}
