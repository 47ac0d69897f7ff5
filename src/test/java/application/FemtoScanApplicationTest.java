package application;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import service.HardwareAccessLock;
import service.experiment.StepScanCoordinator;
import service.log.MeasurementErrorLog;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 控制接口集成测试
 * 启动完整 Spring 上下文与模拟硬件，经 HTTP 接口跑通一次步进扫描
 */
@SpringBootTest(classes = FemtoScanApplication.class)
@AutoConfigureMockMvc
@DisplayName("控制接口集成测试")
@Timeout(60)
class FemtoScanApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StepScanCoordinator stepScan;

    @Autowired
    private HardwareAccessLock hardwareLock;

    @Autowired
    private MeasurementErrorLog errorLog;

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    /**
     * 测试1: 模拟仪器已注册
     */
    @Test
    @DisplayName("启动后模拟位移台与锁相放大器已注册")
    void testInstrumentsRegistered() throws Exception {
        mockMvc.perform(get("/experiment/instruments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(Result.OK))
                .andExpect(jsonPath("$.data", hasKey("delay_stage")))
                .andExpect(jsonPath("$.data", hasKey("lockin")));
    }

    /**
     * 测试2: 设置 -> 建文件 -> 启动 -> 等待完成
     */
    @Test
    @DisplayName("经控制接口完成一次步进扫描")
    void testStepScanOverHttp() throws Exception {
        mockMvc.perform(post("/experiment/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("averages", 1, "stagePositions", List.of(0.0, 0.5, 1.0), "timeZero", 0.0))))
                .andExpect(jsonPath("$.code").value(Result.OK))
                .andExpect(jsonPath("$.data.averages").value(1));

        mockMvc.perform(post("/experiment/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "http-scan-" + System.currentTimeMillis(), "replace", true))))
                .andExpect(jsonPath("$.code").value(Result.OK));

        mockMvc.perform(post("/experiment/start"))
                .andExpect(jsonPath("$.code").value(Result.OK));

        long deadline = System.currentTimeMillis() + 20_000;
        while (!stepScan.getCurrentWorker().getState().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals("complete", stepScan.getStatus().get("state"));
        assertEquals(3L, stepScan.getCurrentWorker().getCurrentStep());
        assertTrue(stepScan.getOutputSink().exists("raw_data/single/avg0000"));

        // 锁在完成通知中释放，稍后可见
        deadline = System.currentTimeMillis() + 5_000;
        while (hardwareLock.isHeld() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(hardwareLock.isHeld());

        mockMvc.perform(get("/experiment/events").param("since", "0"))
                .andExpect(jsonPath("$.code").value(Result.OK));
    }

    @Test
    @DisplayName("非法请求返回 400 并记入错误日志")
    void testRejectedRequests() throws Exception {
        int before = errorLog.listAll().size();

        mockMvc.perform(post("/acquisition/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("averageCount", 0))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(Result.BAD_REQUEST));

        mockMvc.perform(post("/experiment/iterations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "T", "unit", "K", "instrument", "cryostat",
                                "method", "temperature", "values", List.of(1.0)))))
                .andExpect(jsonPath("$.code").value(Result.BAD_REQUEST));

        assertTrue(errorLog.listAll().size() >= before + 2);
        mockMvc.perform(get("/errors/all"))
                .andExpect(jsonPath("$.code").value(Result.OK));
    }

    @Test
    @DisplayName("硬件被占用时返回 409")
    void testBusy() throws Exception {
        mockMvc.perform(post("/experiment/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "busy-" + System.currentTimeMillis()))))
                .andExpect(jsonPath("$.code").value(Result.OK));

        hardwareLock.acquire(HardwareAccessLock.CALIBRATION);
        try {
            mockMvc.perform(post("/experiment/start"))
                    .andExpect(jsonPath("$.code").value(Result.BUSY));
        } finally {
            hardwareLock.release(HardwareAccessLock.CALIBRATION);
        }
    }

    @Test
    @DisplayName("位移台位置经接口读写")
    void testStage() throws Exception {
        mockMvc.perform(post("/acquisition/stage").param("position", "0.75"))
                .andExpect(jsonPath("$.code").value(Result.OK));
        mockMvc.perform(get("/acquisition/stage"))
                .andExpect(jsonPath("$.data").value(0.75));
    }
}
