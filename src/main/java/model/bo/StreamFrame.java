package model.bo;

import lombok.Getter;

/**
 * 采集卡输出的一帧原始数据
 * 通道顺序固定：振镜位置、信号、暗场控制、参考
 * 数组在 生产者 -> 队列 -> 处理线程 之间移交所有权，移交后发送方不再修改
 */
@Getter
public final class StreamFrame {
    public static final int SHAKER_POSITION = 0;
    public static final int SIGNAL = 1;
    public static final int DARK_CONTROL = 2;
    public static final int REFERENCE = 3;
    public static final int CHANNEL_COUNT = 4;

    public static final long UNTAGGED = -1L;

    private final long tag;
    private final double[][] channels;

    public StreamFrame(long tag, double[][] channels) {
        if (channels.length != CHANNEL_COUNT) {
            throw new IllegalArgumentException("帧通道数必须为 " + CHANNEL_COUNT + "，实际 " + channels.length);
        }
        int n = channels[0].length;
        for (double[] channel : channels) {
            if (channel.length != n) {
                throw new IllegalArgumentException("各通道采样数不一致");
            }
        }
        this.tag = tag;
        this.channels = channels;
    }

    public static StreamFrame untagged(double[][] channels) {
        return new StreamFrame(UNTAGGED, channels);
    }

    public StreamFrame withTag(long newTag) {
        return new StreamFrame(newTag, channels);
    }

    public double[] channel(int index) {
        return channels[index];
    }

    public int sampleCount() {
        return channels[0].length;
    }
}
