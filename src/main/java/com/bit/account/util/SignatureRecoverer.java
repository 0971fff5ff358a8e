package com.bit.account.util;

import com.bit.account.common.Address;
import com.bit.account.common.Hash32;

/**
 * 签名恢复原语
 */
public interface SignatureRecoverer {

    /**
     * @throws com.bit.account.exception.AccountException MALFORMED_SIGNATURE 签名格式错误
     */
    Address recover(Hash32 hash, byte[] signature);
}
