package engine.stream;

import lombok.extern.slf4j.Slf4j;
import model.bo.StreamFrame;

import java.util.function.Consumer;

/**
 * 采集卡数据生产者，在独立线程上按硬件节拍连续产出帧
 * 每帧通过 onFrame 回调交出，回调必须立即返回
 */
@Slf4j
public abstract class StreamProducer implements Runnable {

    private final Consumer<StreamFrame> onFrame;
    private final Consumer<Exception> onError;
    private volatile boolean acquiring = false;

    protected StreamProducer(Consumer<StreamFrame> onFrame, Consumer<Exception> onError) {
        this.onFrame = onFrame;
        this.onError = onError;
    }

    /**
     * 采集一帧，阻塞直到数据就绪
     */
    protected abstract StreamFrame acquireFrame() throws Exception;

    @Override
    public void run() {
        acquiring = true;
        log.info("采集开始");
        long frames = 0;
        while (acquiring && !Thread.currentThread().isInterrupted()) {
            try {
                StreamFrame frame = acquireFrame();
                if (!acquiring) {
                    break;
                }
                onFrame.accept(frame);
                frames++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("采集失败: {}", e.getMessage(), e);
                onError.accept(e);
                break;
            }
        }
        acquiring = false;
        log.info("采集结束，共 {} 帧", frames);
    }

    /**
     * 请求停止，当前帧完成后退出循环
     */
    public void stopAcquisition() {
        acquiring = false;
    }

    /**
     * 在调用线程上同步采集 integration 帧并首尾拼接成一帧，不经过回调
     */
    public StreamFrame measureSingleShot(int integration) throws Exception {
        if (integration < 1) {
            throw new IllegalArgumentException("积分帧数必须为正数: " + integration);
        }
        StreamFrame first = acquireFrame();
        if (integration == 1) {
            return first;
        }
        int n = first.sampleCount();
        double[][] merged = new double[StreamFrame.CHANNEL_COUNT][n * integration];
        copyInto(first, merged, 0);
        for (int k = 1; k < integration; k++) {
            StreamFrame next = acquireFrame();
            copyInto(next, merged, k * n);
        }
        return StreamFrame.untagged(merged);
    }

    private static void copyInto(StreamFrame frame, double[][] target, int offset) {
        for (int c = 0; c < StreamFrame.CHANNEL_COUNT; c++) {
            System.arraycopy(frame.channel(c), 0, target[c], offset, frame.sampleCount());
        }
    }
}
