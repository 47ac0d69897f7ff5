package engine;

import common.consts.WorkerEventTypeEnum;
import common.consts.WorkerStateEnum;
import lombok.extern.slf4j.Slf4j;
import model.entity.Instrument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 嵌套参数扫描执行器
 * 按里程表顺序遍历扫描计划，只对下标发生变化的维度调用设置方法，然后调用扫描类型的 {@link #measure()}
 * 所有通知在独立的通知线程上按发布顺序投递，终止通知（FINISHED / ERROR）一定是最后一条
 */
@Slf4j
public abstract class SweepWorker implements Runnable {

    private final String workerId = UUID.randomUUID().toString().substring(0, 8);
    private final SweepPlan plan;
    private final Map<String, Instrument> instruments;
    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();
    // run 开始时创建，未运行的工作线程不持有通知线程池
    private volatile ExecutorService notifier;

    private volatile WorkerStateEnum state = WorkerStateEnum.LOADING;
    private volatile boolean shouldStop = false;

    // 上一次实际下发到仪器的下标，-1 表示尚未设置
    private final int[] appliedIndexes;
    private int[] currentIndexes;

    private int stepsPerPoint = 1;
    private volatile long currentStep = 0;
    private volatile long totalSteps = 1;

    /**
     * @param plan        扫描计划
     * @param instruments 本次扫描使用的基础仪器（角色名 -> 仪器），强制停止时逐个断开
     */
    protected SweepWorker(SweepPlan plan, Map<String, Instrument> instruments) {
        this.plan = plan;
        Map<String, Instrument> owned = new LinkedHashMap<>(instruments);
        for (ParameterIteration dimension : plan.getDimensions()) {
            Instrument instrument = dimension.getInstrument();
            if (!owned.containsValue(instrument)) {
                owned.put(instrument.getName(), instrument);
            }
        }
        this.instruments = Collections.unmodifiableMap(owned);
        this.appliedIndexes = new int[plan.dimensionCount()];
        Arrays.fill(appliedIndexes, -1);
        this.currentIndexes = new int[plan.dimensionCount()];
    }

    /**
     * 单个坐标组上的测量动作，由扫描类型实现
     */
    protected abstract void measure() throws Exception;

    /**
     * 完成时随 FINISHED 通知发出的结果，子类可追加内容
     */
    protected Map<String, Object> buildResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("workerId", workerId);
        result.put("steps", currentStep);
        result.put("totalSteps", totalSteps);
        result.put("stopped", shouldStop);
        return result;
    }

    @Override
    public final void run() {
        notifier = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sweep-notifier-" + workerId);
            t.setDaemon(true);
            return t;
        });
        try {
            setState(WorkerStateEnum.LOADING);
            initializeProgressCounter();
            setState(WorkerStateEnum.IDLE);
            log.info("扫描 [{}] 开始: {} 个维度, {} 个坐标组, 共 {} 步",
                    workerId, plan.dimensionCount(), plan.coordinateCount(), totalSteps);

            Iterator<int[]> coordinates = plan.coordinates();
            while (coordinates.hasNext()) {
                if (shouldStop) {
                    log.warn("扫描 [{}] 收到停止请求，在第 {} 步结束", workerId, currentStep);
                    break;
                }
                int[] indexes = coordinates.next();
                setParameters(indexes);
                setState(WorkerStateEnum.RUNNING);
                measure();
            }

            setState(WorkerStateEnum.COMPLETE);
            publish(WorkerEventTypeEnum.FINISHED, buildResult());
            log.info("扫描 [{}] 完成", workerId);
        } catch (Exception e) {
            log.error("扫描 [{}] 失败: {}", workerId, e.getMessage(), e);
            if (!state.isTerminal()) {
                setState(WorkerStateEnum.FAILED);
            }
            publish(WorkerEventTypeEnum.ERROR, e);
        } finally {
            notifier.shutdown();
        }
    }

    /**
     * 协作式停止：当前坐标组测量完成后不再开始下一组
     */
    public void requestStop() {
        log.info("扫描 [{}] 请求停止", workerId);
        shouldStop = true;
    }

    /**
     * 强制停止：置停止标志并断开所有仪器
     * 不支持断开的仪器跳过，单个仪器断开失败不影响其余仪器
     */
    public void hardStop() {
        log.warn("扫描 [{}] 强制停止，断开 {} 台仪器", workerId, instruments.size());
        shouldStop = true;
        for (Map.Entry<String, Instrument> entry : instruments.entrySet()) {
            try {
                entry.getValue().disconnect();
                log.info("仪器 [{}] 已断开", entry.getKey());
            } catch (UnsupportedOperationException e) {
                log.debug("仪器 [{}] 不支持断开，跳过", entry.getKey());
            } catch (Exception e) {
                log.error("断开仪器 [{}] 失败: {}", entry.getKey(), e.getMessage(), e);
            }
        }
    }

    public void addListener(WorkerEventListener listener) {
        listeners.add(listener);
    }

    private void initializeProgressCounter() {
        currentStep = 0;
        totalSteps = stepsPerPoint * plan.coordinateCount();
    }

    private void setParameters(int[] indexes) {
        setState(WorkerStateEnum.CHANGING_PARAMETERS);
        for (int i = 0; i < indexes.length; i++) {
            if (indexes[i] == appliedIndexes[i]) {
                continue;
            }
            ParameterIteration dimension = plan.dimension(i);
            double value = dimension.valueAt(indexes[i]);
            log.debug("设置 {} = {}{}", dimension.getName(), value, dimension.getUnit());
            dimension.getSetter().apply(value);
            appliedIndexes[i] = indexes[i];
        }
        currentIndexes = indexes;
    }

    /**
     * 完成一个测量步，发布进度百分比
     */
    protected void incrementProgress() {
        currentStep++;
        publish(WorkerEventTypeEnum.PROGRESS_CHANGED, getProgress());
    }

    protected void publishData(Map<String, Object> sample) {
        publish(WorkerEventTypeEnum.NEW_DATA, sample);
    }

    private void setState(WorkerStateEnum target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("非法状态切换: " + state + " -> " + target);
        }
        state = target;
        publish(WorkerEventTypeEnum.STATE_CHANGED, target);
    }

    private void publish(WorkerEventTypeEnum type, Object data) {
        WorkerEvent event = new WorkerEvent(workerId, type, data);
        notifier.execute(() -> {
            for (WorkerEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (Exception e) {
                    log.error("扫描通知处理失败: type={}, listener={}", type, listener, e);
                }
            }
        });
    }

    /**
     * 每个坐标组包含的测量步数，必须在 run 之前设置
     */
    protected void setStepsPerPoint(int stepsPerPoint) {
        if (stepsPerPoint <= 0) {
            throw new IllegalArgumentException("每个坐标组的步数必须为正数: " + stepsPerPoint);
        }
        this.stepsPerPoint = stepsPerPoint;
    }

    /**
     * 当前坐标组的分组名
     */
    protected String currentLabel() {
        return plan.label(currentIndexes);
    }

    protected int[] currentIndexes() {
        return currentIndexes.clone();
    }

    public String getWorkerId() {
        return workerId;
    }

    public WorkerStateEnum getState() {
        return state;
    }

    public long getCurrentStep() {
        return currentStep;
    }

    public long getTotalSteps() {
        return totalSteps;
    }

    public double getProgress() {
        return totalSteps == 0 ? 0.0 : 100.0 * currentStep / totalSteps;
    }

    /**
     * 通知线程池是否已创建且尚未关闭
     */
    public boolean hasActiveNotifier() {
        ExecutorService current = notifier;
        return current != null && !current.isShutdown();
    }

    public boolean isStopRequested() {
        return shouldStop;
    }

    public List<String> getInstrumentNames() {
        return new ArrayList<>(instruments.keySet());
    }
}
