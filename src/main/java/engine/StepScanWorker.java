package engine;

import common.consts.InstrumentRoleEnum;
import lombok.extern.slf4j.Slf4j;
import model.entity.ChannelReader;
import model.entity.Instrument;
import model.entity.MovableStage;
import service.sink.OutputSink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 步进延迟扫描
 * 每个坐标组上：逐次平均，逐个位移台位置读取锁相通道，整条扫描写成一张表
 */
@Slf4j
public class StepScanWorker extends SweepWorker {

    public static final String POS_COLUMN = "pos";
    public static final String REAL_POS_COLUMN = "real_pos";

    private final MovableStage delayStage;
    private final ChannelReader lockIn;
    private final OutputSink sink;
    private final StepScanSettings settings;
    private final List<String> writtenTables = new ArrayList<>();

    public StepScanWorker(SweepPlan plan, MovableStage delayStage, ChannelReader lockIn,
                          OutputSink sink, StepScanSettings settings) {
        super(plan, roles(delayStage, lockIn));
        this.delayStage = delayStage;
        this.lockIn = lockIn;
        this.sink = sink;
        this.settings = settings;
        setStepsPerPoint(settings.getStagePositions().size() * settings.getAverages());
    }

    private static Map<String, Instrument> roles(MovableStage delayStage, ChannelReader lockIn) {
        Map<String, Instrument> roles = new LinkedHashMap<>();
        roles.put(InstrumentRoleEnum.DELAY_STAGE.getRoleName(), delayStage);
        roles.put(InstrumentRoleEnum.LOCK_IN.getRoleName(), lockIn);
        return roles;
    }

    @Override
    protected void measure() {
        String group = "raw_data/" + currentLabel();
        sink.createGroup(group);

        for (int avg = 0; avg < settings.getAverages(); avg++) {
            String table = group + "/" + String.format("avg%04d", avg);
            lockIn.connect();
            try {
                scanOnce(table, avg);
            } finally {
                lockIn.disconnect();
            }
        }
    }

    private void scanOnce(String table, int avg) {
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        for (String channel : settings.getChannels()) {
            columns.put(channel, new ArrayList<>());
        }
        List<Double> positions = new ArrayList<>();
        List<Double> realPositions = new ArrayList<>();

        for (double stagePosition : settings.getStagePositions()) {
            double target = stagePosition + settings.getTimeZero();
            delayStage.moveAbsolute(target);
            double realPosition = readBack(target);

            Map<String, Double> values = lockIn.measure(settings.getChannels());
            for (String channel : settings.getChannels()) {
                columns.get(channel).add(values.get(channel));
            }
            positions.add(target);
            realPositions.add(realPosition);

            Map<String, Object> sample = new LinkedHashMap<>(values);
            sample.put(POS_COLUMN, target);
            sample.put(REAL_POS_COLUMN, realPosition);
            sample.put("avg", avg);
            sample.put("table", table);
            publishData(sample);
            incrementProgress();
        }

        columns.put(POS_COLUMN, positions);
        columns.put(REAL_POS_COLUMN, realPositions);
        sink.writeTable(table, columns, positions);
        writtenTables.add(table);
        log.info("写入 {} ({} 个位置)", table, positions.size());
    }

    /**
     * 读回实际位置；设备不支持读回时使用名义位置
     */
    private double readBack(double nominal) {
        try {
            OptionalDouble position = delayStage.position();
            if (position.isPresent()) {
                return position.getAsDouble();
            }
        } catch (UnsupportedOperationException e) {
            log.debug("位移台 [{}] 不支持读回位置", delayStage.getName());
        }
        return nominal;
    }

    @Override
    protected Map<String, Object> buildResult() {
        Map<String, Object> result = super.buildResult();
        result.put("tables", new ArrayList<>(writtenTables));
        result.put("file", sink.getPath().toString());
        return result;
    }
}
