package com.bit.account.service;

import com.bit.account.result.Result;
import com.bit.account.structure.dto.AccountDTO;
import com.bit.account.structure.dto.SignatureCheckDTO;

public interface SmartAccountService {

    Result<AccountDTO> createAccount(String address);

    Result<AccountDTO> getAccountDetail(String address);

    Result<String> accountId(String address);

    Result<Boolean> supportsModule(String address, long moduleTypeId);

    Result<Boolean> supportsExecutionMode(String address, String mode);

    Result<Boolean> isModuleInstalled(String address, long moduleTypeId, String module, String context);

    Result<String> isValidSignature(SignatureCheckDTO request);
}
