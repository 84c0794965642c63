package org.example.remotefn.common.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.remotefn.common.enumeration.ResponseCode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 服务端处理完后，把结果列（或者错误）装在这里面发回来
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class WireResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private long requestId;

    /**
     * 状态码，见 {@link ResponseCode}
     */
    private Integer code;

    private String message;

    /**
     * 成功时的结果，只有一列
     */
    private ColumnPage result;

    /**
     * 失败时的错误描述
     */
    private List<RemoteError> errors = new ArrayList<>();

    public static WireResponse success(long requestId, ColumnPage result) {
        WireResponse response = new WireResponse();
        response.setRequestId(requestId);
        response.setCode(ResponseCode.SUCCESS.getCode());
        response.setMessage(ResponseCode.SUCCESS.getMessage());
        response.setResult(result);
        return response;
    }

    public static WireResponse fail(long requestId, ResponseCode responseCode, String errorMessage) {
        WireResponse response = new WireResponse();
        response.setRequestId(requestId);
        response.setCode(responseCode.getCode());
        response.setMessage(responseCode.getMessage());
        response.getErrors().add(RemoteError.forCall(errorMessage));
        return response;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == ResponseCode.SUCCESS.getCode();
    }

    /**
     * 第一条错误的文字，没有错误时退回到状态描述
     */
    @JsonIgnore
    public String getErrorMessage() {
        if (errors != null) {
            for (RemoteError error : errors) {
                if (error != null && error.getMessage() != null) {
                    return error.getMessage();
                }
            }
        }
        return message;
    }
}
