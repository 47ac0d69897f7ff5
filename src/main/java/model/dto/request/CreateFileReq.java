package model.dto.request;

import lombok.Data;

@Data
public class CreateFileReq {
    private String name;             // 测量名，空则沿用当前名称
    private String dir;              // 目录，空则使用 femtoscan.paths.data-dir
    private boolean replace = false; // 目标已存在时是否覆盖
}
