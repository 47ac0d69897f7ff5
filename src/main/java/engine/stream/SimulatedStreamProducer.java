package engine.stream;

import common.config.AcquisitionSettings;
import common.config.SimulationProperties;
import common.util.MathUtil;
import model.bo.StreamFrame;
import model.entity.MovableStage;
import org.apache.commons.math3.util.FastMath;

import java.util.OptionalDouble;
import java.util.Random;
import java.util.function.Consumer;

/**
 * 模拟采集卡
 * 振镜做正弦摆动，信号为 sech² 自相关峰，峰位置随延迟位移台移动
 * 暗场控制逐点交替泵浦开 / 关，关时只有基线
 */
public class SimulatedStreamProducer extends StreamProducer {

    static final double PUMP_ON_LEVEL = 5.0;
    static final double PUMP_OFF_LEVEL = 0.0;

    private final AcquisitionSettings settings;
    private final SimulationProperties simulation;
    private final MovableStage stage;
    private final Random random;

    public SimulatedStreamProducer(AcquisitionSettings settings, SimulationProperties simulation, MovableStage stage,
                                   Random random, Consumer<StreamFrame> onFrame, Consumer<Exception> onError) {
        super(onFrame, onError);
        this.settings = settings;
        this.simulation = simulation;
        this.stage = stage;
        this.random = random;
    }

    @Override
    protected StreamFrame acquireFrame() throws InterruptedException {
        if (simulation.getFrameIntervalMs() > 0) {
            Thread.sleep(simulation.getFrameIntervalMs());
        }
        int n = settings.getSampleCount();
        double[][] channels = new double[StreamFrame.CHANNEL_COUNT][n];

        double pulseCenter = simulation.getCenterPosition() + stagePosition() * simulation.getPsPerPosition();
        double positionStep = settings.getShakerPositionStep();
        int period = Math.max(2, simulation.getSamplesPerPeriod());

        for (int i = 0; i < n; i++) {
            double steps = simulation.getShakerAmplitude() * FastMath.sin(2 * FastMath.PI * i / period);
            double shakerPosition = steps * positionStep;
            double delay = (shakerPosition / positionStep) * settings.getShakerPsPerStep();

            boolean pumped = !settings.isDarkControl() || i % 2 == 0;
            double signal = simulation.getOffset();
            if (pumped) {
                double sech = MathUtil.sech(AutocorrelationFitter.SECH2_FWHM_FACTOR
                        * (delay - pulseCenter) / simulation.getFwhm());
                signal += simulation.getAmplitude() * sech * sech;
            }
            if (simulation.getNoise() > 0) {
                signal += random.nextGaussian() * simulation.getNoise();
            }

            channels[StreamFrame.SHAKER_POSITION][i] = shakerPosition;
            channels[StreamFrame.SIGNAL][i] = signal;
            channels[StreamFrame.DARK_CONTROL][i] = pumped ? PUMP_ON_LEVEL : PUMP_OFF_LEVEL;
            channels[StreamFrame.REFERENCE][i] = 1.0;
        }
        return StreamFrame.untagged(channels);
    }

    private double stagePosition() {
        if (stage == null) {
            return 0.0;
        }
        OptionalDouble position = stage.position();
        return position.isPresent() ? position.getAsDouble() : 0.0;
    }
}
