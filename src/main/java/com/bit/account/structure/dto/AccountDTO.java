package com.bit.account.structure.dto;

import lombok.Data;

import java.util.List;

@Data
public class AccountDTO {
    private String address;

    private String accountId;

    private boolean initialized;

    private List<String> validators;

    private List<String> executors;

    private String hook;

    //初始化时记录的委托实现
    private String delegate;
}
