package engine;

import common.config.JacksonConfig;
import common.consts.WorkerEventTypeEnum;
import common.consts.WorkerStateEnum;
import model.entity.BaseInstrument;
import model.entity.MovableStage;
import model.entity.SimulatedDelayStage;
import model.entity.SimulatedLockInAmplifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import service.sink.JsonOutputSinkFactory;
import service.sink.OutputSink;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("步进扫描测试")
@Timeout(30)
class StepScanWorkerTest {

    @TempDir
    Path tempDir;

    private OutputSink sink;
    private SimulatedDelayStage stage;
    private SimulatedLockInAmplifier lockIn;
    private final List<WorkerEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        sink = new JsonOutputSinkFactory(new JacksonConfig().objectMapper()).create(tempDir.resolve("scan.json"));
        stage = new SimulatedDelayStage("delay_stage");
        lockIn = new SimulatedLockInAmplifier("lockin", stage);
    }

    private void runAndWait(SweepWorker worker) throws InterruptedException {
        CountDownLatch terminal = new CountDownLatch(1);
        worker.addListener(event -> {
            events.add(event);
            if (event.getType().isTerminal()) {
                terminal.countDown();
            }
        });
        worker.run();
        assertTrue(terminal.await(5, TimeUnit.SECONDS), "应收到终止通知");
    }

    /**
     * 测试1: 每个坐标组、每次平均各写一张表
     */
    @Test
    @DisplayName("按坐标组与平均次数分表写入")
    void testTablesPerAverage() throws InterruptedException {
        SimulatedDelayStage heater = new SimulatedDelayStage("heater");
        SweepPlan plan = new SweepPlan(List.of(new ParameterIteration("temperature", "K", heater,
                "move_absolute", heater::moveAbsolute, List.of(10.0, 20.0))));
        StepScanSettings settings = new StepScanSettings(2, List.of(0.5, 1.5, 2.5), 0.0, List.of("X", "Y"));
        StepScanWorker worker = new StepScanWorker(plan, stage, lockIn, sink, settings);
        runAndWait(worker);

        assertEquals(WorkerStateEnum.COMPLETE, worker.getState());
        assertEquals(List.of("10.0K", "20.0K"), sink.children("raw_data"));
        assertEquals(List.of("avg0000", "avg0001"), sink.children("raw_data/10.0K"));
        assertEquals(12, worker.getTotalSteps(), "2 个坐标组 × 3 个位置 × 2 次平均");
        assertEquals(12, worker.getCurrentStep());
        assertEquals(100.0, worker.getProgress(), 1e-9);
        assertEquals(12, stage.getMoveCount());
        assertFalse(lockIn.isConnected(), "每次平均结束后断开锁相放大器");

        @SuppressWarnings("unchecked")
        Map<String, Object> table = (Map<String, Object>) sink.read("raw_data/20.0K/avg0001");
        assertEquals(List.of(0.5, 1.5, 2.5), table.get("index"));
        @SuppressWarnings("unchecked")
        Map<String, List<Double>> columns = (Map<String, List<Double>>) table.get("columns");
        assertEquals(List.of("X", "Y", StepScanWorker.POS_COLUMN, StepScanWorker.REAL_POS_COLUMN),
                new ArrayList<>(columns.keySet()));
        assertEquals(3, columns.get("X").size());
        assertEquals(Math.exp(-0.5 / 1.5), columns.get("X").get(0), 1e-9);

        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) events.get(events.size() - 1).getData();
        @SuppressWarnings("unchecked")
        List<String> tables = (List<String>) result.get("tables");
        assertEquals(4, tables.size());
        assertEquals(sink.getPath().toString(), result.get("file"));
    }

    /**
     * 测试2: 时间零点叠加到名义位置
     */
    @Test
    @DisplayName("位移台目标位置包含时间零点")
    void testTimeZeroOffset() throws InterruptedException {
        StepScanSettings settings = new StepScanSettings(1, List.of(-1.0, 0.0), 3.0, List.of("R"));
        runAndWait(new StepScanWorker(SweepPlan.empty(), stage, lockIn, sink, settings));

        @SuppressWarnings("unchecked")
        Map<String, Object> table = (Map<String, Object>) sink.read("raw_data/single/avg0000");
        assertEquals(List.of(2.0, 3.0), table.get("index"));
        assertEquals(3.0, stage.position().getAsDouble(), 1e-12);

        long samples = events.stream().filter(e -> e.getType() == WorkerEventTypeEnum.NEW_DATA).count();
        assertEquals(2, samples);
    }

    /**
     * 测试3: 不支持读回的位移台使用名义位置
     */
    @Test
    @DisplayName("读回失败时实际位置取名义位置")
    void testReadBackFallback() throws InterruptedException {
        List<Double> moves = new ArrayList<>();
        MovableStage blind = new BlindStage("blind", moves);
        StepScanSettings settings = new StepScanSettings(1, List.of(1.0, 2.0), 0.0, List.of("X"));
        runAndWait(new StepScanWorker(SweepPlan.empty(), blind, lockIn, sink, settings));

        assertEquals(List.of(1.0, 2.0), moves);
        @SuppressWarnings("unchecked")
        Map<String, Object> table = (Map<String, Object>) sink.read("raw_data/single/avg0000");
        @SuppressWarnings("unchecked")
        Map<String, List<Double>> columns = (Map<String, List<Double>>) table.get("columns");
        assertEquals(List.of(1.0, 2.0), columns.get(StepScanWorker.REAL_POS_COLUMN));
    }

    /**
     * 测试4: 未知通道导致扫描失败
     */
    @Test
    @DisplayName("锁相通道错误时扫描失败且锁相放大器已断开")
    void testUnknownChannel() throws InterruptedException {
        StepScanSettings settings = new StepScanSettings(1, List.of(1.0), 0.0, List.of("Z"));
        StepScanWorker worker = new StepScanWorker(SweepPlan.empty(), stage, lockIn, sink, settings);
        runAndWait(worker);

        assertEquals(WorkerStateEnum.FAILED, worker.getState());
        assertEquals(WorkerEventTypeEnum.ERROR, events.get(events.size() - 1).getType());
        assertFalse(lockIn.isConnected());
        assertFalse(sink.exists("raw_data/single/avg0000"));
    }

    static class BlindStage extends BaseInstrument implements MovableStage {
        private final List<Double> moves;

        BlindStage(String name, List<Double> moves) {
            super(name);
            this.moves = moves;
            registerSetter("move_absolute", this::moveAbsolute);
        }

        @Override
        public void moveAbsolute(double position) {
            moves.add(position);
        }

        @Override
        public OptionalDouble position() {
            return OptionalDouble.empty();
        }
    }
}
