package model.dto.request;

import lombok.Data;

@Data
public class SaveDataReq {
    private String name;
    private String dir;
}
