package com.bit.account.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "smart-account")
public class SmartAccountProperties {
    // 协调者地址（ERC-4337 EntryPoint v0.7）
    private String entryPoint = "0x0000000071727De22E5E9d8BAf0edAc6f37da032";
    // 账户标识 vendor.variant.version
    private String accountId = "bit.smart-account.1.0.0";
    private Signature signature = new Signature();
    private Registry registry = new Registry();

    @Data
    public static class Signature {
        private long cacheSize = 10_000;//签名者恢复缓存条数
        private long cacheTtlMinutes = 10;
    }

    @Data
    public static class Registry {
        // 0 表示不启用证明闸门
        private int threshold = 0;
        private List<String> attesters = new ArrayList<>();
    }
}
