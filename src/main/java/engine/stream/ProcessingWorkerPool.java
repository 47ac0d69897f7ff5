package engine.stream;

import lombok.extern.slf4j.Slf4j;
import model.bo.ProcessedCurve;
import model.bo.StreamFrame;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 固定大小的帧处理线程池
 * 分发线程从有界队列取帧，空闲处理线程数由信号量限制，每个线程把帧投影成曲线
 * 拟合等额外任务通过 {@link #submit(Runnable)} 投递到同一组线程
 */
@Slf4j
public class ProcessingWorkerPool implements AutoCloseable {

    private static final long POLL_TIMEOUT_MS = 100;

    private final BlockingQueue<StreamFrame> queue;
    private final int size;
    private final Function<StreamFrame, ProcessedCurve> projection;
    private final Consumer<ProcessedCurve> onCurve;
    private final BiConsumer<StreamFrame, Exception> onFailure;

    private final Semaphore idleWorkers;
    private final ExecutorService workers;
    private final Thread dispatcher;
    private volatile boolean running = false;

    public ProcessingWorkerPool(BlockingQueue<StreamFrame> queue, int size,
                                Function<StreamFrame, ProcessedCurve> projection,
                                Consumer<ProcessedCurve> onCurve,
                                BiConsumer<StreamFrame, Exception> onFailure) {
        if (size < 1) {
            throw new IllegalArgumentException("处理线程数必须为正数: " + size);
        }
        this.queue = queue;
        this.size = size;
        this.projection = projection;
        this.onCurve = onCurve;
        this.onFailure = onFailure;
        this.idleWorkers = new Semaphore(size);

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "frame-processor-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = new Thread(this::dispatchLoop, "frame-dispatcher");
        this.dispatcher.setDaemon(true);
    }

    public void start() {
        running = true;
        dispatcher.start();
        log.info("帧处理线程池启动，大小 {}", size);
    }

    private void dispatchLoop() {
        while (running) {
            StreamFrame frame;
            try {
                frame = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (frame == null) {
                    continue;
                }
                idleWorkers.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                workers.execute(() -> process(frame));
            } catch (RejectedExecutionException e) {
                idleWorkers.release();
                log.debug("线程池已关闭，丢弃帧 {}", frame.getTag());
                break;
            }
        }
        log.debug("分发线程退出");
    }

    private void process(StreamFrame frame) {
        try {
            ProcessedCurve curve = projection.apply(frame);
            onCurve.accept(curve);
        } catch (Exception e) {
            log.warn("帧 {} 处理失败: {}", frame.getTag(), e.getMessage());
            onFailure.accept(frame, e);
        } finally {
            idleWorkers.release();
        }
    }

    /**
     * 在处理线程上执行额外任务，不占用分发名额
     * @return 线程池已关闭时返回 false，任务不会执行
     */
    public boolean submit(Runnable task) {
        try {
            workers.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("线程池已关闭，忽略任务");
            return false;
        }
    }

    public int getSize() {
        return size;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 停止分发并等待已分发的帧处理完成；队列中尚未取出的帧保留在队列里
     */
    @Override
    public void close() {
        running = false;
        try {
            // 分发线程在下一次轮询超时后自行退出，手里的帧不会丢
            dispatcher.join(TimeUnit.SECONDS.toMillis(5));
            if (dispatcher.isAlive()) {
                dispatcher.interrupt();
            }
            workers.shutdown();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("处理线程未在 5 秒内结束，强制关闭");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("帧处理线程池已关闭");
    }
}
