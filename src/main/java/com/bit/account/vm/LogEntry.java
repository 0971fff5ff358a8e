package com.bit.account.vm;

import com.bit.account.common.Address;
import lombok.Getter;
import lombok.ToString;

/**
 * 事件日志条目，随状态快照一起回滚
 */
@Getter
@ToString
public class LogEntry {

    private final Address emitter;

    private final Object event;

    public LogEntry(Address emitter, Object event) {
        this.emitter = emitter;
        this.event = event;
    }
}
