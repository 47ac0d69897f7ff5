package engine;

import common.consts.WorkerEventTypeEnum;
import common.consts.WorkerStateEnum;
import model.entity.BaseInstrument;
import model.entity.Instrument;
import model.entity.SimulatedDelayStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 扫描执行器测试
 * 覆盖状态机、设置方法去重、进度、协作式停止与强制停止
 */
@DisplayName("扫描执行器测试")
@Timeout(30)
class SweepWorkerTest {

    /**
     * 记录每次测量时的坐标组
     */
    static class RecordingWorker extends SweepWorker {
        final List<int[]> measured = new ArrayList<>();
        Runnable afterMeasure;

        RecordingWorker(SweepPlan plan, Map<String, Instrument> instruments, int stepsPerPoint) {
            super(plan, instruments);
            setStepsPerPoint(stepsPerPoint);
        }

        @Override
        protected void measure() {
            measured.add(currentIndexes());
            incrementProgress();
            if (afterMeasure != null) {
                afterMeasure.run();
            }
        }
    }

    private final List<WorkerEvent> events = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminal = new CountDownLatch(1);

    private void runAndWait(SweepWorker worker) throws InterruptedException {
        worker.addListener(event -> {
            events.add(event);
            if (event.getType().isTerminal()) {
                terminal.countDown();
            }
        });
        worker.run();
        assertTrue(terminal.await(5, TimeUnit.SECONDS), "应收到终止通知");
    }

    private static ParameterIteration dimension(String name, Instrument instrument, List<Double> applied,
                                                List<Double> values) {
        return new ParameterIteration(name, "u", instrument, "custom", applied::add, values);
    }

    private List<WorkerStateEnum> states() {
        return events.stream()
                .filter(e -> e.getType() == WorkerEventTypeEnum.STATE_CHANGED)
                .map(e -> (WorkerStateEnum) e.getData())
                .collect(Collectors.toList());
    }

    /**
     * 测试1: 设置方法只在下标变化时调用
     */
    @Test
    @DisplayName("未变化的维度不重复下发")
    void testSetterMemoization() throws InterruptedException {
        SimulatedDelayStage stage = new SimulatedDelayStage("stage");
        List<Double> outer = new ArrayList<>();
        List<Double> inner = new ArrayList<>();
        SweepPlan plan = new SweepPlan(List.of(
                dimension("A", stage, outer, List.of(1.0, 2.0)),
                dimension("B", stage, inner, List.of(10.0, 20.0, 30.0))));

        RecordingWorker worker = new RecordingWorker(plan, Map.of(), 1);
        runAndWait(worker);

        assertEquals(List.of(1.0, 2.0), outer, "外层维度每个值只下发一次");
        assertEquals(List.of(10.0, 20.0, 30.0, 10.0, 20.0, 30.0), inner);
        assertEquals(6, worker.measured.size());
        assertArrayEquals(new int[]{1, 0}, worker.measured.get(3));
    }

    /**
     * 测试2: 进度总数 = 每点步数 × 坐标组数
     */
    @Test
    @DisplayName("进度计数与百分比")
    void testProgress() throws InterruptedException {
        SimulatedDelayStage stage = new SimulatedDelayStage("stage");
        SweepPlan plan = new SweepPlan(List.of(
                dimension("A", stage, new ArrayList<>(), List.of(1.0, 2.0, 3.0))));
        RecordingWorker worker = new RecordingWorker(plan, Map.of(), 4);
        runAndWait(worker);

        assertEquals(12, worker.getTotalSteps());
        assertEquals(3, worker.getCurrentStep(), "测试子类每个坐标组只推进一步");
        assertEquals(25.0, worker.getProgress(), 1e-9);
        List<Double> progress = events.stream()
                .filter(e -> e.getType() == WorkerEventTypeEnum.PROGRESS_CHANGED)
                .map(e -> (Double) e.getData())
                .collect(Collectors.toList());
        assertEquals(List.of(100.0 / 12, 200.0 / 12, 300.0 / 12), progress);
    }

    /**
     * 测试3: 状态顺序，终止通知最后
     */
    @Test
    @DisplayName("状态机顺序与 FINISHED 通知")
    void testStateSequence() throws InterruptedException {
        RecordingWorker worker = new RecordingWorker(SweepPlan.empty(), Map.of(), 1);
        runAndWait(worker);

        assertEquals(List.of(WorkerStateEnum.LOADING, WorkerStateEnum.IDLE,
                WorkerStateEnum.CHANGING_PARAMETERS, WorkerStateEnum.RUNNING, WorkerStateEnum.COMPLETE), states());
        assertEquals(1, worker.measured.size(), "空计划执行一次测量");
        WorkerEvent last = events.get(events.size() - 1);
        assertEquals(WorkerEventTypeEnum.FINISHED, last.getType());
        assertEquals(WorkerStateEnum.COMPLETE, worker.getState());

        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).getSequence() > events.get(i - 1).getSequence(), "通知按发布顺序投递");
        }
    }

    /**
     * 测试4: 协作式停止
     */
    @Test
    @DisplayName("停止请求在下一个坐标组前生效")
    void testCooperativeStop() throws InterruptedException {
        SimulatedDelayStage stage = new SimulatedDelayStage("stage");
        SweepPlan plan = new SweepPlan(List.of(
                dimension("A", stage, new ArrayList<>(), List.of(1.0, 2.0, 3.0, 4.0, 5.0))));
        RecordingWorker worker = new RecordingWorker(plan, Map.of(), 1);
        worker.afterMeasure = () -> {
            if (worker.measured.size() == 2) {
                worker.requestStop();
            }
        };
        runAndWait(worker);

        assertEquals(2, worker.measured.size());
        assertEquals(WorkerStateEnum.COMPLETE, worker.getState());
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) events.get(events.size() - 1).getData();
        assertEquals(Boolean.TRUE, result.get("stopped"));
    }

    /**
     * 测试5: 测量异常导致 FAILED，ERROR 携带原因
     */
    @Test
    @DisplayName("测量异常进入 FAILED 并发布 ERROR")
    void testFailure() throws InterruptedException {
        SimulatedDelayStage stage = new SimulatedDelayStage("stage");
        SweepPlan plan = new SweepPlan(List.of(
                dimension("A", stage, new ArrayList<>(), List.of(1.0, 2.0, 3.0))));
        RecordingWorker worker = new RecordingWorker(plan, Map.of(), 1);
        worker.afterMeasure = () -> {
            if (worker.measured.size() == 2) {
                throw new IllegalStateException("锁相放大器超时");
            }
        };
        runAndWait(worker);

        assertEquals(WorkerStateEnum.FAILED, worker.getState());
        List<WorkerStateEnum> states = states();
        assertEquals(WorkerStateEnum.FAILED, states.get(states.size() - 1));
        WorkerEvent last = events.get(events.size() - 1);
        assertEquals(WorkerEventTypeEnum.ERROR, last.getType());
        assertEquals("锁相放大器超时", ((Throwable) last.getData()).getMessage());
        assertTrue(events.stream().noneMatch(e -> e.getType() == WorkerEventTypeEnum.FINISHED));
    }

    /**
     * 测试6: 强制停止逐个断开，单个失败不影响其余
     */
    @Test
    @DisplayName("强制停止断开所有仪器")
    void testHardStop() {
        SimulatedDelayStage first = new SimulatedDelayStage("first");
        SimulatedDelayStage last = new SimulatedDelayStage("last");
        BaseInstrument broken = new BaseInstrument("broken") {
            {
                registerSetter("noop", v -> { });
            }

            @Override
            protected void onDisconnect() {
                throw new IllegalStateException("串口无响应");
            }
        };
        BaseInstrument unsupported = new BaseInstrument("unsupported") {
            {
                registerSetter("noop", v -> { });
            }

            @Override
            public synchronized void disconnect() {
                throw new UnsupportedOperationException();
            }
        };
        first.connect();
        broken.connect();
        last.connect();

        Map<String, Instrument> instruments = new LinkedHashMap<>();
        instruments.put("first", first);
        instruments.put("broken", broken);
        instruments.put("unsupported", unsupported);
        instruments.put("last", last);
        RecordingWorker worker = new RecordingWorker(SweepPlan.empty(), instruments, 1);

        assertDoesNotThrow(worker::hardStop);
        assertFalse(first.isConnected());
        assertFalse(last.isConnected(), "前面的仪器断开失败不影响后面的仪器");
        assertTrue(worker.isStopRequested());
    }

    @Test
    @DisplayName("扫描维度引用的仪器也归工作线程管理")
    void testPlanInstrumentsOwned() {
        SimulatedDelayStage stage = new SimulatedDelayStage("heater");
        SweepPlan plan = new SweepPlan(List.of(dimension("T", stage, new ArrayList<>(), List.of(1.0))));
        RecordingWorker worker = new RecordingWorker(plan, Map.of(), 1);
        assertEquals(List.of("heater"), worker.getInstrumentNames());
    }

    @Test
    @DisplayName("通知线程池在运行时创建、结束时关闭")
    void testNotifierLifecycle() throws InterruptedException {
        RecordingWorker worker = new RecordingWorker(SweepPlan.empty(), Map.of(), 1);
        assertFalse(worker.hasActiveNotifier(), "未运行的工作线程不持有通知线程池");

        runAndWait(worker);
        assertFalse(worker.hasActiveNotifier(), "运行结束后通知线程池已关闭");
    }
}
