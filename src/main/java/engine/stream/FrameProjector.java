package engine.stream;

import model.bo.ProcessedCurve;
import model.bo.StreamFrame;

import java.util.Arrays;

/**
 * 把一帧原始数据投影成按振镜步索引的曲线
 * bin = round(振镜位置 / 位置步长)，覆盖 [minBin, maxBin] 的每一个整数
 * 暗场控制打开时，以暗场通道 (max+min)/2 为阈值区分泵浦开 / 关，值为两组均值之差
 */
public final class FrameProjector {

    private FrameProjector() {}

    public static ProcessedCurve project(StreamFrame frame, boolean darkControl,
                                         double positionStep, double timePerStep) {
        if (!(positionStep > 0)) {
            throw new IllegalArgumentException("振镜位置步长必须为正数: " + positionStep);
        }
        if (!(timePerStep > 0)) {
            throw new IllegalArgumentException("每步时间必须为正数: " + timePerStep);
        }
        double[] positions = frame.channel(StreamFrame.SHAKER_POSITION);
        double[] signal = frame.channel(StreamFrame.SIGNAL);
        int n = positions.length;
        if (n == 0) {
            return new ProcessedCurve(frame.getTag(), new long[0], new double[0], timePerStep);
        }

        long[] sampleBins = new long[n];
        long minBin = Long.MAX_VALUE;
        long maxBin = Long.MIN_VALUE;
        for (int i = 0; i < n; i++) {
            sampleBins[i] = Math.round(positions[i] / positionStep);
            minBin = Math.min(minBin, sampleBins[i]);
            maxBin = Math.max(maxBin, sampleBins[i]);
        }
        int width = (int) (maxBin - minBin + 1);

        double[] onSum = new double[width];
        int[] onCount = new int[width];
        double[] offSum = new double[width];
        int[] offCount = new int[width];

        boolean[] pumped = pumpMask(frame, darkControl);
        for (int i = 0; i < n; i++) {
            int idx = (int) (sampleBins[i] - minBin);
            if (pumped[i]) {
                onSum[idx] += signal[i];
                onCount[idx]++;
            } else {
                offSum[idx] += signal[i];
                offCount[idx]++;
            }
        }

        long[] bins = new long[width];
        double[] values = new double[width];
        for (int k = 0; k < width; k++) {
            bins[k] = minBin + k;
            if (darkControl) {
                values[k] = (onCount[k] > 0 && offCount[k] > 0)
                        ? onSum[k] / onCount[k] - offSum[k] / offCount[k]
                        : Double.NaN;
            } else {
                values[k] = onCount[k] > 0 ? onSum[k] / onCount[k] : Double.NaN;
            }
        }
        return new ProcessedCurve(frame.getTag(), bins, values, timePerStep);
    }

    private static boolean[] pumpMask(StreamFrame frame, boolean darkControl) {
        int n = frame.sampleCount();
        boolean[] pumped = new boolean[n];
        if (!darkControl) {
            Arrays.fill(pumped, true);
            return pumped;
        }
        double[] dc = frame.channel(StreamFrame.DARK_CONTROL);
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double v : dc) {
            max = Math.max(max, v);
            min = Math.min(min, v);
        }
        double threshold = (max + min) / 2;
        for (int i = 0; i < n; i++) {
            pumped[i] = dc[i] > threshold;
        }
        return pumped;
    }
}
