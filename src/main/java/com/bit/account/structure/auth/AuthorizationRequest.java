package com.bit.account.structure.auth;

import com.bit.account.common.Hash32;
import com.bit.account.util.ByteUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 授权请求：(挑战值, 授权材料)，预校验钩子可整体改写
 */
@Getter
@ToString
@EqualsAndHashCode
public class AuthorizationRequest {

    private final Hash32 challenge;

    private final byte[] signature;

    public AuthorizationRequest(Hash32 challenge, byte[] signature) {
        this.challenge = challenge;
        this.signature = ByteUtils.nullToEmpty(signature);
    }
}
