package service.acquisition;

import common.config.AcquisitionSettings;
import common.consts.ErrorCodes;
import common.consts.ScanTypeEnum;
import common.exception.BusinessException;
import common.exception.FitNotConvergedException;
import common.exception.ResourceBusyException;
import common.exception.ValidationException;
import engine.Tickable;
import engine.stream.AutocorrelationFitter;
import engine.stream.FrameProjector;
import engine.stream.ProcessingWorkerPool;
import engine.stream.RunningAverage;
import engine.stream.SequenceReorderBuffer;
import engine.stream.StreamProducer;
import engine.stream.StreamProducerFactory;
import lombok.extern.slf4j.Slf4j;
import model.bo.FitResult;
import model.bo.ProcessedCurve;
import model.bo.StreamFrame;
import model.entity.MovableStage;
import service.HardwareAccessLock;
import service.log.MeasurementErrorLog;
import service.sink.OutputSink;
import service.sink.OutputSinkFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

/**
 * 快速扫描流式采集协调器
 * 生产者线程 -> 有界队列 -> 处理线程池 -> 单写者聚合（滑动平均 / 拟合）
 * 停止是延迟的：stopStreamer 只置标志，由定时 tick 回收生产者线程并释放硬件锁
 */
@Slf4j
public class AcquisitionCoordinator implements Tickable, AutoCloseable {

    private static final Set<Integer> ALLOWED_GAINS = Set.of(1, 10, 100);
    private static final long PRODUCER_JOIN_TIMEOUT_MS = 2000;

    private final StreamProducerFactory producerFactory;
    private final HardwareAccessLock hardwareLock;
    private final MeasurementErrorLog errorLog;
    private final OutputSinkFactory sinkFactory;
    private final MovableStage delayStage;
    private final String defaultDataDir;
    private final IntSupplier cpuCount;
    private final AutocorrelationFitter fitter = new AutocorrelationFitter();
    private final List<AcquisitionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile AcquisitionSettings settings;

    // 生命周期，由 this 保护
    private volatile BlockingQueue<StreamFrame> queue;
    private volatile ProcessingWorkerPool pool;
    private StreamProducer producer;
    private Thread producerThread;
    private ScheduledExecutorService ticker;
    private long lastTickMs;
    private volatile boolean shouldStop = false;
    private volatile boolean streamerRunning = false;

    // 原始帧平均与序号，生产者回调写
    private final Object streamerLock = new Object();
    private double[][] streamerAverage;
    private long streamerAverageCount;
    private long nextSequence;
    private final AtomicLong droppedFrames = new AtomicLong();

    // 聚合，单写者
    private final Object aggregationLock = new Object();
    private final RunningAverage runningAverage;
    private final SequenceReorderBuffer<ProcessedCurve> reorderBuffer = new SequenceReorderBuffer<>(0);
    private volatile FitResult lastFit;

    // 拟合最多一个在途；在途期间只保留最新的平均曲线
    private final AtomicBoolean fitInFlight = new AtomicBoolean(false);
    private final AtomicReference<ProcessedCurve> pendingFit = new AtomicReference<>();

    public AcquisitionCoordinator(AcquisitionSettings settings, StreamProducerFactory producerFactory,
                                  HardwareAccessLock hardwareLock, MeasurementErrorLog errorLog,
                                  OutputSinkFactory sinkFactory, MovableStage delayStage,
                                  String defaultDataDir, IntSupplier cpuCount) {
        this.settings = settings;
        this.producerFactory = producerFactory;
        this.hardwareLock = hardwareLock;
        this.errorLog = errorLog;
        this.sinkFactory = sinkFactory;
        this.delayStage = delayStage;
        this.defaultDataDir = defaultDataDir;
        this.cpuCount = cpuCount;
        this.runningAverage = new RunningAverage(Math.max(1, settings.getAverageCount()));
        log.info("快速扫描协调器创建: {}", settings);
    }

    // ---------------------------------------------------------------- 生命周期

    public synchronized void startStreamer() {
        AcquisitionSettings s = settings;
        checkProcessorCount(s.getProcessorCount());
        hardwareLock.acquire(HardwareAccessLock.STREAMING);
        try {
            shouldStop = false;
            preparePipeline(s);
            long firstSequence;
            synchronized (streamerLock) {
                firstSequence = nextSequence;
            }
            synchronized (aggregationLock) {
                reorderBuffer.reset(firstSequence);
            }
            producer = producerFactory.create(s, this::onStreamerFrame, this::onStreamerError);
            producerThread = new Thread(producer, "stream-producer");
            producerThread.setDaemon(true);
            producerThread.start();
            streamerRunning = true;
            ensureTicker(s.getTickIntervalMs());
            log.info("流式采集已启动");
            log.debug("采集设置: {}", s);
        } catch (RuntimeException e) {
            hardwareLock.release(HardwareAccessLock.STREAMING);
            throw e;
        }
    }

    /**
     * 通知生产者停止并置停止标志，线程回收在下一次 tick 完成
     */
    public synchronized void stopStreamer() {
        if (!streamerRunning) {
            log.debug("采集未运行，忽略停止请求");
            return;
        }
        log.info("流式采集停止中...");
        producer.stopAcquisition();
        shouldStop = true;
    }

    @Override
    public void tick(long deltaMS, long nowMS) {
        if (!shouldStop) {
            return;
        }
        synchronized (this) {
            if (!shouldStop) {
                return;
            }
            log.debug("检测到停止标志，回收采集线程");
            if (!joinProducer()) {
                // 线程仍在运行，保留硬件锁，下一次 tick 再回收
                return;
            }
            shouldStop = false;
            streamerRunning = false;
            hardwareLock.release(HardwareAccessLock.STREAMING);
        }
        for (AcquisitionListener listener : listeners) {
            listener.onAcquisitionStopped();
        }
        log.info("流式采集已停止");
    }

    private void preparePipeline(AcquisitionSettings s) {
        if (queue == null || queue.remainingCapacity() + queue.size() != s.getQueueCapacity()) {
            closePool();
            queue = new ArrayBlockingQueue<>(s.getQueueCapacity());
        }
        if (pool == null || pool.getSize() != s.getProcessorCount()) {
            closePool();
            startPool(s.getProcessorCount());
        }
    }

    private void startPool(int size) {
        fitInFlight.set(false);
        pool = new ProcessingWorkerPool(queue, size, this::project, this::onProcessedCurve, this::onProjectionFailed);
        pool.start();
    }

    private void closePool() {
        if (pool != null) {
            pool.close();
            pool = null;
        }
    }

    /**
     * 等待生产者线程退出，超时后中断并再等一次
     * @return 线程已退出
     */
    private boolean joinProducer() {
        if (producerThread == null) {
            return true;
        }
        try {
            producerThread.join(PRODUCER_JOIN_TIMEOUT_MS);
            if (producerThread.isAlive()) {
                log.warn("采集线程未在 {} ms 内退出，发送中断", PRODUCER_JOIN_TIMEOUT_MS);
                producerThread.interrupt();
                producerThread.join(PRODUCER_JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (producerThread.isAlive()) {
            log.error("采集线程 {} 中断后仍未退出", producerThread.getName());
            return false;
        }
        producerThread = null;
        return true;
    }

    private void ensureTicker(long intervalMs) {
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "acquisition-ticker");
            t.setDaemon(true);
            return t;
        });
        lastTickMs = System.currentTimeMillis();
        ticker.scheduleAtFixedRate(this::safeTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void safeTick() {
        long now = System.currentTimeMillis();
        try {
            tick(now - lastTickMs, now);
        } catch (Exception e) {
            // 定时线程不能因异常退出
            log.error("采集生命周期检查异常", e);
        }
        lastTickMs = now;
    }

    @Override
    public synchronized void close() {
        if (streamerRunning) {
            producer.stopAcquisition();
            if (!joinProducer()) {
                log.error("关闭时采集线程仍在运行，强制释放硬件锁");
                producerThread = null;
            }
            streamerRunning = false;
            shouldStop = false;
            hardwareLock.release(HardwareAccessLock.STREAMING);
        }
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
        closePool();
        log.info("快速扫描协调器已关闭");
    }

    // ---------------------------------------------------------------- 数据流

    private void onStreamerFrame(StreamFrame frame) {
        boolean queued;
        synchronized (streamerLock) {
            updateStreamerAverage(frame);
            queued = queue.offer(frame.withTag(nextSequence));
            if (queued) {
                nextSequence++;
            }
        }
        if (!queued) {
            droppedFrames.incrementAndGet();
            log.warn("处理队列已满，丢弃一帧（累计 {}）", droppedFrames.get());
        }
        for (AcquisitionListener listener : listeners) {
            listener.onStreamerData(frame);
        }
    }

    private void updateStreamerAverage(StreamFrame frame) {
        int n = frame.sampleCount();
        if (streamerAverage == null || streamerAverage[0].length != n) {
            streamerAverage = new double[StreamFrame.CHANNEL_COUNT][];
            for (int c = 0; c < StreamFrame.CHANNEL_COUNT; c++) {
                streamerAverage[c] = frame.channel(c).clone();
            }
            streamerAverageCount = 1;
            return;
        }
        streamerAverageCount++;
        for (int c = 0; c < StreamFrame.CHANNEL_COUNT; c++) {
            double[] avg = streamerAverage[c];
            double[] x = frame.channel(c);
            for (int i = 0; i < n; i++) {
                avg[i] += (x[i] - avg[i]) / streamerAverageCount;
            }
        }
    }

    private void onStreamerError(Exception e) {
        errorLog.record(MeasurementErrorLog.ErrorType.ACQUISITION_FAILED, "acquisition",
                "采集卡异常，采集停止", e, false);
        shouldStop = true;
        for (AcquisitionListener listener : listeners) {
            listener.onError(e, false);
        }
    }

    private ProcessedCurve project(StreamFrame frame) {
        AcquisitionSettings s = settings;
        return FrameProjector.project(frame, s.isDarkControl(), s.getShakerPositionStep(), s.getShakerPsPerStep());
    }

    private void onProcessedCurve(ProcessedCurve curve) {
        for (AcquisitionListener listener : listeners) {
            listener.onProcessedCurve(curve);
        }
        List<ProcessedCurve> averages = new ArrayList<>();
        synchronized (aggregationLock) {
            List<ProcessedCurve> ready = settings.isOrderedAggregation()
                    ? reorderBuffer.accept(curve.getSequence(), curve)
                    : List.of(curve);
            for (ProcessedCurve c : ready) {
                ProcessedCurve average = aggregate(c);
                if (average != null) {
                    averages.add(average);
                }
            }
        }
        averages.forEach(this::publishAverage);
    }

    private void onProjectionFailed(StreamFrame frame, Exception e) {
        errorLog.record(MeasurementErrorLog.ErrorType.PROJECTION_FAILED, "acquisition",
                "帧 " + frame.getTag() + " 投影失败", e, true);
        List<ProcessedCurve> averages = new ArrayList<>();
        synchronized (aggregationLock) {
            if (settings.isOrderedAggregation()) {
                for (ProcessedCurve c : reorderBuffer.skip(frame.getTag())) {
                    ProcessedCurve average = aggregate(c);
                    if (average != null) {
                        averages.add(average);
                    }
                }
            }
        }
        for (AcquisitionListener listener : listeners) {
            listener.onError(e, true);
        }
        averages.forEach(this::publishAverage);
    }

    /**
     * 调用方持有 aggregationLock
     */
    private ProcessedCurve aggregate(ProcessedCurve curve) {
        if (curve.getTimePerStep() != settings.getShakerPsPerStep()) {
            // 时间标定已变化，旧标定下投影的曲线不再参与平均
            log.debug("丢弃旧时间标定下的曲线 {}", curve.getSequence());
            return null;
        }
        long t0 = System.nanoTime();
        ProcessedCurve average = runningAverage.add(curve);
        log.debug("平均计算耗时 {} ms", String.format("%.2f", (System.nanoTime() - t0) / 1e6));
        return average;
    }

    private void publishAverage(ProcessedCurve average) {
        for (AcquisitionListener listener : listeners) {
            listener.onNewAverage(average);
        }
        if (settings.isAutocorrelationFit()) {
            requestFit(average);
        }
    }

    /**
     * 拟合在途时只替换待拟合曲线，不再投递任务
     */
    private void requestFit(ProcessedCurve average) {
        pendingFit.set(average);
        ProcessingWorkerPool current = pool;
        if (current == null || !fitInFlight.compareAndSet(false, true)) {
            return;
        }
        if (!current.submit(this::drainFits)) {
            fitInFlight.set(false);
        }
    }

    private void drainFits() {
        try {
            ProcessedCurve next;
            while ((next = pendingFit.getAndSet(null)) != null) {
                fitAverage(next, settings.getExpectedPulseDuration());
            }
        } finally {
            fitInFlight.set(false);
        }
        // 退出循环与清除在途标志之间到达的曲线
        ProcessedCurve late = pendingFit.getAndSet(null);
        if (late != null) {
            requestFit(late);
        }
    }

    private void fitAverage(ProcessedCurve average, double expectedPulseDuration) {
        try {
            FitResult fit = fitter.fit(average, expectedPulseDuration);
            lastFit = fit;
            for (AcquisitionListener listener : listeners) {
                listener.onFitResult(fit);
            }
        } catch (FitNotConvergedException e) {
            log.warn("平均曲线 {} 拟合未收敛: {}", average.getSequence(), e.getMessage());
            errorLog.record(MeasurementErrorLog.ErrorType.FIT_NOT_CONVERGED, "acquisition",
                    e.getMessage(), e.getCause(), true);
            notifyRecoverable(e);
        } catch (RuntimeException e) {
            log.error("平均曲线 {} 拟合失败", average.getSequence(), e);
            errorLog.record(MeasurementErrorLog.ErrorType.FIT_FAILED, "acquisition",
                    "平均曲线 " + average.getSequence() + " 拟合失败: " + e.getMessage(), e, true);
            notifyRecoverable(e);
        }
    }

    private void notifyRecoverable(Exception e) {
        for (AcquisitionListener listener : listeners) {
            try {
                listener.onError(e, true);
            } catch (RuntimeException ex) {
                log.error("错误通知处理失败: listener={}", listener, ex);
            }
        }
    }

    // ---------------------------------------------------------------- 数据操作

    public void resetData() {
        long firstSequence;
        synchronized (streamerLock) {
            streamerAverage = null;
            streamerAverageCount = 0;
            firstSequence = nextSequence;
        }
        synchronized (aggregationLock) {
            runningAverage.clear();
            reorderBuffer.reset(firstSequence);
            lastFit = null;
        }
        pendingFit.set(null);
        log.info("采集数据已清空");
    }

    /**
     * 把当前数据快照写入 dir/name，目标已存在时覆盖
     * @return 写入的文件
     */
    public Path saveData(String name, String dir) {
        ProcessedCurve average;
        List<ProcessedCurve> curves;
        synchronized (aggregationLock) {
            average = runningAverage.getAverage();
            curves = runningAverage.getCurves();
        }
        if (average == null) {
            throw new BusinessException(ErrorCodes.NOTHING_TO_SAVE);
        }
        double[][] raw;
        synchronized (streamerLock) {
            raw = streamerAverage == null ? new double[0][] : copy(streamerAverage);
        }

        String fileName = name.endsWith(sinkFactory.extension()) ? name : name + sinkFactory.extension();
        Path target = Paths.get(dir != null ? dir : defaultDataDir).resolve(fileName);
        OutputSink sink;
        try {
            sink = sinkFactory.create(target);
        } catch (IOException e) {
            throw new BusinessException("创建输出文件失败: " + target, e);
        }

        sink.writeValue("raw/avg", raw);

        TreeSet<Long> allBins = new TreeSet<>();
        for (ProcessedCurve curve : curves) {
            for (long bin : curve.getBins()) {
                allBins.add(bin);
            }
        }
        double timePerStep = average.getTimePerStep();
        double[] allTime = new double[allBins.size()];
        double[][] allData = new double[curves.size()][allBins.size()];
        int j = 0;
        for (long bin : allBins) {
            allTime[j] = bin * timePerStep;
            for (int k = 0; k < curves.size(); k++) {
                allData[k][j] = curves.get(k).valueAtBin(bin);
            }
            j++;
        }
        sink.writeValue("all_data/data", allData);
        sink.writeValue("all_data/time_axis", allTime);
        sink.writeValue("avg/data", average.getValues());
        sink.writeValue("avg/time_axis", average.times());
        for (Map.Entry<String, Object> entry : settings.toSettingsMap().entrySet()) {
            sink.writeValue("settings/" + entry.getKey(), entry.getValue());
        }
        log.info("采集数据已保存: {} ({} 条曲线)", target, curves.size());
        return target;
    }

    private static double[][] copy(double[][] source) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

    /**
     * 在调用线程上同步采集一帧（integration 帧拼接），采集运行中不允许
     */
    public StreamFrame measureSingleShot(int integration) {
        if (streamerRunning) {
            throw new ResourceBusyException(ErrorCodes.STREAMER_RUNNING, HardwareAccessLock.STREAMING);
        }
        StreamProducer shot = producerFactory.create(settings, frame -> { }, e -> { });
        try {
            return shot.measureSingleShot(integration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("单次采集被中断", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new BusinessException("单次采集失败: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- 设置

    /**
     * 整体替换配置快照；先校验，校验失败不改变任何状态
     */
    public synchronized void reloadSettings(AcquisitionSettings next) {
        validate(next);
        AcquisitionSettings previous = settings;
        settings = next;

        if (next.getShakerPsPerStep() != previous.getShakerPsPerStep()) {
            log.info("时间标定变化 {} -> {}，清空平均历史", previous.getShakerPsPerStep(), next.getShakerPsPerStep());
            resetAverages();
        }
        if (next.getAverageCount() != previous.getAverageCount()) {
            ProcessedCurve average;
            synchronized (aggregationLock) {
                average = runningAverage.setWindowSize(next.getAverageCount());
            }
            log.debug("滑动平均窗口设为 {}", next.getAverageCount());
            if (average != null) {
                publishAverage(average);
            }
        }
        if (next.getProcessorCount() != previous.getProcessorCount() && streamerRunning) {
            // 采集中改变线程数：立即重建线程池，队列与其中的帧保留
            closePool();
            startPool(next.getProcessorCount());
        }
        log.debug("采集设置已更新: {}", next);
    }

    private void resetAverages() {
        long firstSequence;
        synchronized (streamerLock) {
            firstSequence = nextSequence;
        }
        synchronized (aggregationLock) {
            runningAverage.clear();
            reorderBuffer.reset(firstSequence);
            lastFit = null;
        }
        pendingFit.set(null);
    }

    private void validate(AcquisitionSettings s) {
        checkProcessorCount(s.getProcessorCount());
        if (s.getAverageCount() < 1) {
            throw new ValidationException(ErrorCodes.N_AVERAGES_INVALID + ": " + s.getAverageCount());
        }
        if (s.getSampleCount() < 1) {
            throw new ValidationException(ErrorCodes.N_SAMPLES_INVALID + ": " + s.getSampleCount());
        }
        if (s.getQueueCapacity() < 1) {
            throw new ValidationException(ErrorCodes.QUEUE_CAPACITY_INVALID + ": " + s.getQueueCapacity());
        }
        if (!ALLOWED_GAINS.contains(s.getShakerGain())) {
            throw new ValidationException(ErrorCodes.SHAKER_GAIN_INVALID + ": " + s.getShakerGain());
        }
        if (!(s.getShakerPsPerStep() > 0) || !Double.isFinite(s.getShakerPsPerStep())) {
            throw new ValidationException(ErrorCodes.TIME_PER_STEP_INVALID + ": " + s.getShakerPsPerStep());
        }
    }

    private void checkProcessorCount(int processorCount) {
        int cpus = cpuCount.getAsInt();
        if (processorCount < 1 || processorCount >= cpus) {
            throw new ValidationException(ErrorCodes.PROCESSOR_COUNT_INVALID + ": " + processorCount
                    + "（CPU 核数 " + cpus + "）");
        }
    }

    public void setNAverages(int n) {
        reloadSettings(settings.withAverageCount(n));
    }

    public void setDarkControl(boolean darkControl) {
        reloadSettings(settings.withDarkControl(darkControl));
    }

    public void setAutocorrelationFit(boolean enabled) {
        reloadSettings(settings.withAutocorrelationFit(enabled));
    }

    public void setProcessorCount(int processorCount) {
        reloadSettings(settings.withProcessorCount(processorCount));
    }

    public void setShakerGain(int gain) {
        reloadSettings(settings.withShakerGain(gain));
    }

    public void setSampleCount(int sampleCount) {
        reloadSettings(settings.withSampleCount(sampleCount));
    }

    /**
     * 写入新的时间标定（ps / 步），之后的帧按新标定投影
     */
    public void applyTimePerStep(double timePerStep) {
        reloadSettings(settings.withShakerPsPerStep(timePerStep));
    }

    // ---------------------------------------------------------------- 位移台

    public OptionalDouble getStagePosition() {
        return delayStage == null ? OptionalDouble.empty() : delayStage.position();
    }

    /**
     * 手动移动位移台；扫描、采集或标定占用硬件时拒绝
     */
    public void moveStage(double position) {
        if (delayStage == null) {
            throw new BusinessException(ErrorCodes.INSTRUMENT_NOT_FOUND + ": delay_stage");
        }
        hardwareLock.runExclusive(HardwareAccessLock.MANUAL, () -> delayStage.moveAbsolute(position));
    }

    // ---------------------------------------------------------------- 查询

    public void addListener(AcquisitionListener listener) {
        listeners.add(listener);
    }

    public AcquisitionSettings getSettings() {
        return settings;
    }

    public boolean isStreamerRunning() {
        return streamerRunning;
    }

    public boolean isStopRequested() {
        return shouldStop;
    }

    public ProcessedCurve getAverage() {
        synchronized (aggregationLock) {
            return runningAverage.getAverage();
        }
    }

    public int getAveragedCurveCount() {
        synchronized (aggregationLock) {
            return runningAverage.size();
        }
    }

    public FitResult getLastFit() {
        return lastFit;
    }

    public MovableStage getDelayStage() {
        return delayStage;
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("type", ScanTypeEnum.FAST_SCAN.getTag());
        status.put("running", streamerRunning);
        status.put("stopRequested", shouldStop);
        synchronized (streamerLock) {
            status.put("framesQueued", nextSequence);
            status.put("streamerAverageCount", streamerAverageCount);
        }
        status.put("droppedFrames", droppedFrames.get());
        status.put("averagedCurves", getAveragedCurveCount());
        status.put("lastFit", lastFit);
        status.put("settings", settings.toSettingsMap());
        return status;
    }
}
