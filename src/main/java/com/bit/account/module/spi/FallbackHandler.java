package com.bit.account.module.spi;

import com.bit.account.vm.CallTarget;

/**
 * 回退处理器：账户未实现的选择器被转发到这里
 * 调用数据末尾追加20字节原始调用方地址
 */
public interface FallbackHandler extends Module, CallTarget {
}
