package com.bit.staking.result;


import com.bit.staking.staking.StakingError;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import java.io.Serializable;

/**
 *   接口返回数据格式，质押引擎的所有操作也以此作为结果类型
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;
    public static final Integer SC_BAD_REQUEST_400 = 400;


    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码，失败时为 StakingError 的错误码
     */
    private Integer code = 0;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public Result() {
    }

    public static<T> Result<T> ok() {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        return r;
    }

    public static<T> Result<T> ok(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<T>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    /**
     * 质押错误：错误码取自枚举，消息为 [描述]：上下文
     */
    public static<T> Result<T> error(StakingError error, String detail) {
        return error(error.getCode(), "[" + error.getDesc() + "]：" + detail);
    }

    /**
     * 失败结果换一个数据类型向上传递（数据丢弃）
     */
    public <U> Result<U> propagate() {
        Result<U> r = new Result<U>();
        r.setSuccess(this.success);
        r.setCode(this.code);
        r.setMessage(this.message);
        r.setTimestamp(this.timestamp);
        return r;
    }

    /**
     * 失败时对应的质押错误类型，成功或非质押错误返回null
     */
    @JsonIgnore
    public StakingError getError() {
        return success ? null : StakingError.getByCode(code);
    }

}
