package com.bit.account;

import com.bit.account.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.account")
public class SmartAccountApplication {
    public static void main(String[] args) {
        SpringApplication.run(SmartAccountApplication.class, args);

        long start = System.currentTimeMillis();
        Secp256k1Signer.toAddress(new ECKey());
        log.info("预热耗时{}ms", System.currentTimeMillis() - start);
    }
    //二进制统一大端
    //validationData 零值表示成功，1表示签名失败
}
