package service;

import common.consts.ErrorCodes;
import common.exception.ResourceBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 硬件互斥锁：参数扫描、流式采集、振镜标定、手动操作同一时间只允许一个持有
 * 获取失败立即抛出，不等待
 */
@Slf4j
@Component
public class HardwareAccessLock {

    public static final String SWEEP = "sweep";
    public static final String STREAMING = "streaming";
    public static final String CALIBRATION = "calibration";
    public static final String MANUAL = "manual";

    private final AtomicReference<String> owner = new AtomicReference<>();

    public void acquire(String requester) {
        if (!owner.compareAndSet(null, requester)) {
            String holder = owner.get();
            log.warn("{} 请求硬件被拒绝，当前持有者: {}", requester, holder);
            throw new ResourceBusyException(ErrorCodes.HARDWARE_BUSY + ": " + holder, holder);
        }
        log.debug("硬件锁由 {} 持有", requester);
    }

    /**
     * 只有持有者才能释放，返回是否真正释放
     */
    public boolean release(String requester) {
        boolean released = owner.compareAndSet(requester, null);
        if (released) {
            log.debug("硬件锁由 {} 释放", requester);
        }
        return released;
    }

    /**
     * 持锁执行一次性的硬件操作，结束后释放
     */
    public void runExclusive(String requester, Runnable action) {
        acquire(requester);
        try {
            action.run();
        } finally {
            release(requester);
        }
    }

    public String getOwner() {
        return owner.get();
    }

    public boolean isHeld() {
        return owner.get() != null;
    }
}
