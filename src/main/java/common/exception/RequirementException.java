package common.exception;

import common.consts.InstrumentRoleEnum;

import java.util.Collections;
import java.util.List;

/**
 * 缺少必需的仪器角色或输出文件，在接触任何硬件之前抛出
 */
public class RequirementException extends BusinessException {
    private final List<InstrumentRoleEnum> missingRoles;

    public RequirementException(String message) {
        this(message, Collections.emptyList());
    }

    public RequirementException(String message, List<InstrumentRoleEnum> missingRoles) {
        super(message);
        this.missingRoles = List.copyOf(missingRoles);
    }

    public List<InstrumentRoleEnum> getMissingRoles() {
        return missingRoles;
    }
}
