package common.config;

import engine.stream.AutocorrelationFitter;
import engine.stream.SimulatedStreamProducer;
import engine.stream.StreamProducerFactory;
import lombok.extern.slf4j.Slf4j;
import model.entity.ChannelReader;
import model.entity.MovableStage;
import model.entity.SimulatedDelayStage;
import model.entity.SimulatedLockInAmplifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import service.HardwareAccessLock;
import service.acquisition.AcquisitionCoordinator;
import service.calibration.ShakerCalibrationService;
import service.experiment.StepScanCoordinator;
import service.log.MeasurementErrorLog;
import service.log.MeasurementEventLog;
import service.sink.OutputSinkFactory;

import java.util.Random;

/**
 * 测量链路装配：仪器、采集卡、两个协调器与标定服务
 * 真实硬件部署时关闭 femtoscan.fast-scan.simulate，并自行提供 MovableStage / ChannelReader / StreamProducerFactory
 */
@Slf4j
@Configuration
public class MeasurementSetupConfig {

    @Bean
    public StepScanCoordinator stepScanCoordinator(ExperimentProperties properties, HardwareAccessLock hardwareLock,
                                                   OutputSinkFactory sinkFactory, MeasurementEventLog eventLog,
                                                   MeasurementErrorLog errorLog, MovableStage delayStage,
                                                   ChannelReader lockIn) {
        StepScanCoordinator coordinator = new StepScanCoordinator(properties, hardwareLock, sinkFactory,
                eventLog, errorLog);
        coordinator.addInstrument(delayStage.getName(), delayStage);
        coordinator.addInstrument(lockIn.getName(), lockIn);
        return coordinator;
    }

    @Bean(destroyMethod = "close")
    public AcquisitionCoordinator acquisitionCoordinator(FastScanProperties fastScan, ExperimentProperties properties,
                                                         StreamProducerFactory producerFactory,
                                                         HardwareAccessLock hardwareLock,
                                                         MeasurementErrorLog errorLog,
                                                         OutputSinkFactory sinkFactory, MovableStage delayStage) {
        return new AcquisitionCoordinator(fastScan.snapshot(), producerFactory, hardwareLock, errorLog,
                sinkFactory, delayStage, properties.getPaths().getDataDir(),
                () -> Runtime.getRuntime().availableProcessors());
    }

    @Bean
    public ShakerCalibrationService shakerCalibrationService(AcquisitionCoordinator acquisition,
                                                             HardwareAccessLock hardwareLock) {
        return new ShakerCalibrationService(acquisition, hardwareLock, new AutocorrelationFitter());
    }

    /**
     * 模拟硬件
     */
    @Configuration
    @ConditionalOnProperty(prefix = "femtoscan.fast-scan", name = "simulate", havingValue = "true",
            matchIfMissing = true)
    static class SimulatedHardware {

        @Bean
        public SimulatedDelayStage delayStage() {
            log.info("使用模拟延迟位移台");
            return new SimulatedDelayStage("delay_stage");
        }

        @Bean
        public SimulatedLockInAmplifier lockIn(SimulatedDelayStage delayStage) {
            log.info("使用模拟锁相放大器");
            return new SimulatedLockInAmplifier("lockin", delayStage);
        }

        @Bean
        public StreamProducerFactory simulatedProducerFactory(SimulationProperties simulation,
                                                              SimulatedDelayStage delayStage) {
            log.info("使用模拟采集卡: {}", simulation);
            Random random = new Random();
            return (settings, onFrame, onError) ->
                    new SimulatedStreamProducer(settings, simulation, delayStage, random, onFrame, onError);
        }
    }
}
