package org.dxworks.cobolsim.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.cobolsim.model.PicType;

/**
 * Why a run stopped before completing, and the token that continues it.
 * Fields that do not apply to the kind are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Suspension {
    public final SuspensionKind kind;
    public final ResumeToken token;
    public final int line;
    public final String variableName;
    public final PicType type;
    public final Integer length;
    public final String mapName;
    public final String mapsetName;

    private Suspension(SuspensionKind kind, ResumeToken token, int line, String variableName, PicType type,
                       Integer length, String mapName, String mapsetName) {
        this.kind = kind;
        this.token = token;
        this.line = line;
        this.variableName = variableName;
        this.type = type;
        this.length = length;
        this.mapName = mapName;
        this.mapsetName = mapsetName;
    }

    static Suspension accept(ResumeToken token, int line, VariableCell target) {
        return new Suspension(SuspensionKind.ACCEPT, token, line, target.name, target.type, target.length, null, null);
    }

    static Suspension receiveMap(ResumeToken token, int line, String mapName, String mapsetName) {
        return new Suspension(SuspensionKind.RECEIVE_MAP, token, line, null, null, null, mapName, mapsetName);
    }

    static Suspension debug(ResumeToken token, int line) {
        return new Suspension(SuspensionKind.DEBUG, token, line, null, null, null, null, null);
    }
}
