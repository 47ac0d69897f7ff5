package model.dto.request;

import lombok.Data;

import java.util.List;

@Data
public class ParameterIterationReq {
    private String name;         // 维度名称，例如 temperature
    private String unit;         // 单位，拼进输出分组名
    private String instrument;   // 已登记的仪器名
    private String method;       // 仪器上的设置方法名
    private List<Double> values; // 按扫描顺序排列的取值
}
