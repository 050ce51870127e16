package org.proofloop.hpg;

import com.google.gson.annotations.SerializedName;
import org.proofloop.parse.NodeRole;

public enum NodeType {
    @SerializedName("Statement")
    STATEMENT,
    @SerializedName("Function")
    FUNCTION,
    @SerializedName("Contract")
    CONTRACT;

    static NodeType of(NodeRole role) {
        switch (role) {
            case CONTRACT:
                return CONTRACT;
            case FUNCTION:
                return FUNCTION;
            default:
                return STATEMENT;
        }
    }
}
