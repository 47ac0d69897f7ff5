package service.experiment;

import common.consts.ErrorCodes;
import common.consts.InstrumentRoleEnum;
import common.consts.ScanTypeEnum;
import common.consts.WorkerEventTypeEnum;
import common.exception.BusinessException;
import common.exception.MeasurementFailedException;
import common.exception.NameCollisionException;
import common.exception.RequirementException;
import common.exception.ValidationException;
import common.util.MathUtil;
import engine.ParameterIteration;
import engine.SweepPlan;
import engine.SweepWorker;
import engine.WorkerEvent;
import engine.WorkerEventListener;
import lombok.extern.slf4j.Slf4j;
import model.bo.InstrumentRegistry;
import model.entity.Instrument;
import model.entity.ParameterSetter;
import service.HardwareAccessLock;
import service.log.MeasurementErrorLog;
import service.log.MeasurementEventLog;
import service.sink.OutputSink;
import service.sink.OutputSinkFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 实验协调器
 * 持有仪器表与扫描计划，负责前置检查、创建输出文件、启动扫描工作线程并转发其通知
 * 具体扫描类型提供必需的仪器角色与工作线程
 */
@Slf4j
public abstract class ExperimentCoordinator {

    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH-mm-ss");

    private final InstrumentRegistry registry = new InstrumentRegistry();
    private final List<ParameterIteration> iterations = new ArrayList<>();
    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();

    private final HardwareAccessLock hardwareLock;
    private final OutputSinkFactory sinkFactory;
    private final MeasurementEventLog eventLog;
    private final MeasurementErrorLog errorLog;
    private final String defaultDataDir;

    private volatile String measurementName;
    private volatile OutputSink outputSink;
    private volatile SweepWorker currentWorker;

    protected ExperimentCoordinator(HardwareAccessLock hardwareLock, OutputSinkFactory sinkFactory,
                                    MeasurementEventLog eventLog, MeasurementErrorLog errorLog,
                                    String defaultDataDir) {
        this.hardwareLock = hardwareLock;
        this.sinkFactory = sinkFactory;
        this.eventLog = eventLog;
        this.errorLog = errorLog;
        this.defaultDataDir = defaultDataDir;
        this.measurementName = "unknown measurement " + LocalDateTime.now().format(NAME_FORMAT);
    }

    protected abstract ScanTypeEnum scanType();

    /**
     * 该扫描类型必需的仪器角色，按能力匹配
     */
    protected abstract List<InstrumentRoleEnum> requiredRoles();

    protected abstract SweepWorker createWorker(SweepPlan plan, Map<InstrumentRoleEnum, Instrument> roles,
                                                OutputSink sink);

    /**
     * 扫描类型自身的设置，写入输出文件并用于状态查询
     */
    protected abstract Map<String, Object> measurementSettings();

    // ---------------------------------------------------------------- 仪器

    public Instrument addInstrument(String name, Instrument instrument) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ErrorCodes.INSTRUMENT_NAME_BLANK);
        }
        if (instrument == null) {
            throw new ValidationException(ErrorCodes.INSTRUMENT_NULL);
        }
        if (instrument.setterNames().isEmpty()) {
            throw new ValidationException(ErrorCodes.INSTRUMENT_NO_SETTER + ": " + name);
        }
        synchronized (registry) {
            if (registry.contains(name)) {
                throw new ValidationException(ErrorCodes.INSTRUMENT_NAME_TAKEN + ": " + name);
            }
            registry.register(name, instrument);
        }
        log.info("添加仪器 {} -> {}", name, instrument);
        return instrument;
    }

    public Instrument getInstrument(String name) {
        Instrument instrument = registry.get(name);
        if (instrument == null) {
            throw new ValidationException(ErrorCodes.INSTRUMENT_NOT_FOUND + ": " + name);
        }
        return instrument;
    }

    /**
     * 连接指定仪器，不指定时连接全部；硬件被占用时拒绝
     */
    public void connectAll(String... names) {
        hardwareLock.runExclusive(HardwareAccessLock.MANUAL, () -> {
            for (String name : targets(names)) {
                log.info("连接仪器 {}", name);
                getInstrument(name).connect();
            }
        });
    }

    public void disconnectAll(String... names) {
        hardwareLock.runExclusive(HardwareAccessLock.MANUAL, () -> disconnect(targets(names)));
    }

    private void disconnect(Collection<String> names) {
        for (String name : names) {
            log.info("断开仪器 {}", name);
            getInstrument(name).disconnect();
        }
    }

    /**
     * 断开并移除全部仪器，引用这些仪器的扫描维度一并清空
     */
    public synchronized void clearInstruments() {
        hardwareLock.runExclusive(HardwareAccessLock.MANUAL, () -> {
            disconnect(registry.names());
            for (String name : registry.names()) {
                log.info("移除仪器 {}", name);
            }
            registry.clear();
            clearParameterIterations();
        });
    }

    public Map<String, Object> describeSetup() {
        Map<String, Object> setup = new LinkedHashMap<>();
        for (Map.Entry<String, Instrument> entry : registry.asMap().entrySet()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", entry.getValue().getClass().getSimpleName());
            item.put("connected", entry.getValue().isConnected());
            item.put("setters", entry.getValue().setterNames());
            setup.put(entry.getKey(), item);
        }
        return setup;
    }

    private Collection<String> targets(String... names) {
        return names == null || names.length == 0 ? registry.names() : Arrays.asList(names);
    }

    // ---------------------------------------------------------------- 扫描计划

    /**
     * 追加一个扫描维度；任一校验失败都不改变现有计划
     */
    public ParameterIteration addParameterIteration(String name, String unit, String instrumentName,
                                                    String method, List<Double> values) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ErrorCodes.ITERATION_NAME_BLANK);
        }
        if (unit == null || unit.isBlank()) {
            throw new ValidationException(ErrorCodes.ITERATION_UNIT_NULL);
        }
        Instrument instrument = getInstrument(instrumentName);
        ParameterSetter setter = instrument.setter(method).orElseThrow(() ->
                new ValidationException(ErrorCodes.METHOD_NOT_FOUND + ": " + instrumentName + "." + method));
        if (values == null || values.isEmpty()) {
            throw new ValidationException(ErrorCodes.VALUES_EMPTY);
        }
        if (!MathUtil.allFinite(values)) {
            throw new ValidationException(ErrorCodes.VALUES_NOT_FINITE);
        }
        ParameterIteration iteration = new ParameterIteration(name, unit, instrument, method, setter, values);
        synchronized (iterations) {
            iterations.add(iteration);
        }
        log.info("添加扫描维度: {} 取值 {}", iteration, values);
        return iteration;
    }

    public void clearParameterIterations() {
        synchronized (iterations) {
            iterations.clear();
        }
    }

    public SweepPlan currentPlan() {
        synchronized (iterations) {
            return new SweepPlan(iterations);
        }
    }

    // ---------------------------------------------------------------- 前置条件

    /**
     * 检查必需角色与输出文件，在接触任何硬件之前调用
     * @return 角色 -> 匹配到的仪器
     */
    public Map<InstrumentRoleEnum, Instrument> checkRequirements() {
        Map<InstrumentRoleEnum, Instrument> resolved = new EnumMap<>(InstrumentRoleEnum.class);
        List<String> used = new ArrayList<>();
        List<InstrumentRoleEnum> missing = new ArrayList<>();
        for (InstrumentRoleEnum role : requiredRoles()) {
            String name = registry.findByRole(role, used);
            if (name == null) {
                missing.add(role);
            } else {
                log.info("仪器 {} 作为 {}", name, role.getRoleName());
                used.add(name);
                resolved.put(role, registry.get(name));
            }
        }
        if (!missing.isEmpty()) {
            log.error("缺少必需的仪器角色: {}", missing);
            throw new RequirementException("缺少必需的仪器角色: " + missing, missing);
        }
        OutputSink sink = outputSink;
        if (sink == null) {
            throw new RequirementException(ErrorCodes.NO_OUTPUT_FILE);
        }
        if (!Files.isRegularFile(sink.getPath())) {
            throw new RequirementException(ErrorCodes.OUTPUT_FILE_MISSING + ": " + sink.getPath());
        }
        return resolved;
    }

    // ---------------------------------------------------------------- 执行

    /**
     * 启动扫描并阻塞到终止通知
     * @return 工作线程的结果
     * @throws MeasurementFailedException 工作线程以 failed 结束
     */
    public Map<String, Object> startMeasurement() {
        CompletableFuture<Map<String, Object>> run = launchMeasurement();
        log.debug("主线程等待扫描结束...");
        try {
            return run.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MeasurementFailedException) {
                throw (MeasurementFailedException) e.getCause();
            }
            throw new MeasurementFailedException("扫描异常结束", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MeasurementFailedException("等待扫描结束时被中断", e);
        }
    }

    /**
     * 启动扫描，不等待结束
     */
    public synchronized CompletableFuture<Map<String, Object>> launchMeasurement() {
        Map<InstrumentRoleEnum, Instrument> roles = checkRequirements();
        hardwareLock.acquire(HardwareAccessLock.SWEEP);
        try {
            SweepWorker worker = createWorker(currentPlan(), roles, outputSink);
            CompletableFuture<Map<String, Object>> run = new CompletableFuture<>();
            worker.addListener(event -> onWorkerEvent(event, run));

            ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "sweep-" + worker.getWorkerId());
                t.setDaemon(true);
                return t;
            });
            currentWorker = worker;
            executor.execute(worker);
            executor.shutdown();
            log.info("测量 [{}] 已启动，工作线程 {}", measurementName, worker.getWorkerId());
            return run;
        } catch (RuntimeException e) {
            hardwareLock.release(HardwareAccessLock.SWEEP);
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private void onWorkerEvent(WorkerEvent event, CompletableFuture<Map<String, Object>> run) {
        eventLog.record(event);
        for (WorkerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("测量通知转发失败: {}", event.getType(), e);
            }
        }
        if (event.getType() == WorkerEventTypeEnum.FINISHED) {
            log.info("测量 [{}] 完成", measurementName);
            hardwareLock.release(HardwareAccessLock.SWEEP);
            run.complete((Map<String, Object>) event.getData());
        } else if (event.getType() == WorkerEventTypeEnum.ERROR) {
            Throwable cause = (Throwable) event.getData();
            errorLog.record(MeasurementErrorLog.ErrorType.MEASUREMENT_FAILED, event.getWorkerId(),
                    "测量 [" + measurementName + "] 失败", cause, false);
            hardwareLock.release(HardwareAccessLock.SWEEP);
            run.completeExceptionally(new MeasurementFailedException(
                    "测量 [" + measurementName + "] 失败: " + cause.getMessage(), cause));
        }
    }

    public void stopMeasurement() {
        runningWorker().requestStop();
    }

    public void killMeasurement() {
        runningWorker().hardStop();
    }

    private SweepWorker runningWorker() {
        SweepWorker worker = currentWorker;
        if (worker == null || worker.getState().isTerminal()) {
            throw new BusinessException(ErrorCodes.NO_MEASUREMENT_RUNNING);
        }
        return worker;
    }

    public void addListener(WorkerEventListener listener) {
        listeners.add(listener);
    }

    // ---------------------------------------------------------------- 输出文件

    /**
     * 创建 dir/name 输出文件，写入四个顶层分组、每台仪器的参数快照与元数据
     * @param dir     为 null 时使用 femtoscan.paths.data-dir
     * @param replace 为 false 且目标已存在时抛出 {@link NameCollisionException}
     */
    public synchronized OutputSink createFile(String name, String dir, boolean replace) {
        if (name != null && !name.isBlank()) {
            measurementName = name;
        }
        Path target = Paths.get(dir != null ? dir : defaultDataDir)
                .resolve(measurementName + sinkFactory.extension());
        if (Files.exists(target) && !replace) {
            throw new NameCollisionException(ErrorCodes.FILE_NAME_TAKEN + ": " + target, target);
        }
        OutputSink sink;
        try {
            sink = sinkFactory.create(target);
        } catch (IOException e) {
            throw new BusinessException("创建输出文件失败: " + target, e);
        }
        sink.createGroup("raw_data");
        sink.createGroup("settings");
        sink.createGroup("axes");
        sink.createGroup("metadata");

        for (Map.Entry<String, Instrument> entry : registry.asMap().entrySet()) {
            writeInstrumentSettings(sink, entry.getKey(), entry.getValue());
        }
        sink.writeValue("metadata/date", LocalDateTime.now().toString());
        sink.writeValue("metadata/type", scanType().getTag());
        sink.writeValue("metadata/measurement_settings", measurementSettings());

        outputSink = sink;
        log.info("输出文件 {} 初始化完成", target);
        return sink;
    }

    private void writeInstrumentSettings(OutputSink sink, String name, Instrument instrument) {
        String group = "settings/" + name;
        sink.createGroup(group);
        for (String setting : instrument.settingNames()) {
            try {
                sink.writeValue(group + "/" + setting, instrument.readSetting(setting));
            } catch (UnsupportedOperationException e) {
                log.warn("仪器 {} 的参数 {} 不可读", name, setting);
            } catch (Exception e) {
                log.error("写入仪器 {} 的参数 {} 失败: {}", name, setting, e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------- 查询

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", measurementName);
        status.put("type", scanType().getTag());
        OutputSink sink = outputSink;
        status.put("file", sink == null ? null : sink.getPath().toString());
        SweepWorker worker = currentWorker;
        if (worker != null) {
            status.put("workerId", worker.getWorkerId());
            status.put("state", worker.getState().getCode());
            status.put("progress", worker.getProgress());
            status.put("currentStep", worker.getCurrentStep());
            status.put("totalSteps", worker.getTotalSteps());
        }
        status.put("hardwareOwner", hardwareLock.getOwner());
        status.put("dimensions", currentPlan().dimensionCount());
        status.put("settings", measurementSettings());
        return status;
    }

    public String getMeasurementName() {
        return measurementName;
    }

    public OutputSink getOutputSink() {
        return outputSink;
    }

    public SweepWorker getCurrentWorker() {
        return currentWorker;
    }
}
