package com.bit.account.api;

import com.bit.account.result.Result;
import com.bit.account.service.SmartAccountService;
import com.bit.account.structure.dto.AccountDTO;
import com.bit.account.structure.dto.SignatureCheckDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/account")
public class SmartAccountApi {

    @Autowired
    private SmartAccountService smartAccountService;

    //在指定地址上创建模拟账户
    @PostMapping("/create")
    public Result<AccountDTO> createAccount(@RequestParam String address) {
        return smartAccountService.createAccount(address);
    }

    // 账户详情：已安装验证器、执行器、钩子
    @GetMapping("/detail")
    public Result<AccountDTO> getAccountDetail(@RequestParam String address) {
        return smartAccountService.getAccountDetail(address);
    }

    @GetMapping("/accountId")
    public Result<String> accountId(@RequestParam String address) {
        return smartAccountService.accountId(address);
    }

    @GetMapping("/supportsModule")
    public Result<Boolean> supportsModule(@RequestParam String address, @RequestParam long moduleTypeId) {
        return smartAccountService.supportsModule(address, moduleTypeId);
    }

    // mode 为32字节十六进制
    @GetMapping("/supportsExecutionMode")
    public Result<Boolean> supportsExecutionMode(@RequestParam String address, @RequestParam String mode) {
        return smartAccountService.supportsExecutionMode(address, mode);
    }

    @GetMapping("/isModuleInstalled")
    public Result<Boolean> isModuleInstalled(@RequestParam String address,
                                             @RequestParam long moduleTypeId,
                                             @RequestParam String module,
                                             @RequestParam(required = false) String context) {
        return smartAccountService.isModuleInstalled(address, moduleTypeId, module, context);
    }

    // ERC-1271 签名校验，返回4字节结果
    @PostMapping("/isValidSignature")
    public Result<String> isValidSignature(@RequestBody SignatureCheckDTO request) {
        return smartAccountService.isValidSignature(request);
    }
}
