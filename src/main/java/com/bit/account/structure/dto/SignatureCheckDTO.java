package com.bit.account.structure.dto;

import lombok.Data;

/**
 * 直接签名校验请求，字段均为0x前缀十六进制
 */
@Data
public class SignatureCheckDTO {
    private String account;
    private String sender;
    private String hash;
    private String signature;
}
