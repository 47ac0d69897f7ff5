package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 仪器错误
    public static final String INSTRUMENT_NOT_FOUND = "指定的仪器不存在";
    public static final String INSTRUMENT_NAME_BLANK = "仪器名称不能为空";
    public static final String INSTRUMENT_NAME_TAKEN = "仪器名称已被占用";
    public static final String INSTRUMENT_NULL = "仪器实例不能为空";
    public static final String INSTRUMENT_NO_SETTER = "仪器未提供任何可设置参数，不满足 connect/disconnect/setter 能力要求";

    // 扫描计划参数错误
    public static final String ITERATION_NAME_BLANK = "扫描维度名称不能为空";
    public static final String ITERATION_UNIT_NULL = "扫描维度单位不能为空";
    public static final String METHOD_NOT_FOUND = "仪器上不存在该设置方法";
    public static final String VALUES_EMPTY = "扫描取值序列不能为空";
    public static final String VALUES_NOT_FINITE = "扫描取值必须为有限数值";

    // 步进扫描设置
    public static final String AVERAGES_INVALID = "平均次数必须为正整数";
    public static final String STAGE_POSITIONS_EMPTY = "位移台位置序列不能为空";
    public static final String STAGE_POSITIONS_NOT_INCREASING = "位移台位置序列必须单调递增";
    public static final String TIME_ZERO_INVALID = "时间零点必须为有限数值";

    // 前置条件
    public static final String NO_OUTPUT_FILE = "未为本次测量指定输出文件";
    public static final String OUTPUT_FILE_MISSING = "输出文件不存在";
    public static final String FILE_NAME_TAKEN = "文件名已存在，请更换";
    public static final String NO_MEASUREMENT_RUNNING = "当前没有正在运行的测量";

    // 硬件互斥
    public static final String HARDWARE_BUSY = "硬件正被其他测量链路占用";
    public static final String STREAMER_RUNNING = "流式采集运行中，禁止执行振镜标定";

    // 快速扫描配置
    public static final String PROCESSOR_COUNT_INVALID = "处理进程数必须为正整数且小于 CPU 核数";
    public static final String N_AVERAGES_INVALID = "滑动平均窗口不能小于 1";
    public static final String N_SAMPLES_INVALID = "单帧采样数不能小于 1";
    public static final String SHAKER_GAIN_INVALID = "振镜增益只能为 1、10 或 100";
    public static final String QUEUE_CAPACITY_INVALID = "采集队列容量必须为正整数";
    public static final String TIME_PER_STEP_INVALID = "每步时间常数必须为正数";
    public static final String CALIBRATION_ITERATIONS_INVALID = "标定迭代次数至少为 4";
    public static final String NO_CALIBRATION_RESULT = "尚未执行振镜标定";
    public static final String NOTHING_TO_SAVE = "尚无可保存的平均数据";

    // 拟合
    public static final String FIT_NOT_CONVERGED = "自相关峰拟合未收敛";
}
